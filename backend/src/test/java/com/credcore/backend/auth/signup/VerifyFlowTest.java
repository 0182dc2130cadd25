package com.credcore.backend.auth.signup;

import static com.credcore.backend.auth.support.AuthFlowSupport.lastConfirmationToken;
import static com.credcore.backend.auth.support.AuthFlowSupport.lastSmsCode;
import static com.credcore.backend.auth.support.AuthFlowSupport.signupOk;
import static com.credcore.backend.auth.support.AuthFlowSupport.smsCount;
import static com.credcore.backend.auth.support.AuthHttpSupport.expectErrorWithCode;
import static com.credcore.backend.auth.support.AuthHttpSupport.jsonPost;
import static com.credcore.backend.auth.support.AuthHttpSupport.performJson;
import static com.credcore.backend.auth.support.AuthHttpSupport.performSmsOtp;
import static com.credcore.backend.auth.support.AuthHttpSupport.performVerifyEmail;
import static com.credcore.backend.auth.support.AuthHttpSupport.performVerifySms;
import static com.credcore.backend.auth.support.AuthHttpSupport.readJson;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;

import com.credcore.backend.auth.AbstractAuthIntegrationTest;
import com.credcore.backend.auth.audit.AuditAction;
import com.credcore.backend.auth.config.AuthProperties;
import com.credcore.backend.auth.domain.User;
import com.credcore.backend.auth.domain.UserStatus;
import com.credcore.backend.auth.otp.domain.OtpChannel;
import com.credcore.backend.auth.token.support.TokenHashUtils;
import com.credcore.backend.global.ErrorCode;
import com.credcore.backend.infra.TestClockConfig;
import com.credcore.backend.security.AccessTokenClaims;
import com.credcore.backend.security.JwtService;
import com.fasterxml.jackson.databind.JsonNode;

import io.jsonwebtoken.Claims;

/**
 * POST /auth/verify
 *
 * - type=signup: 확인 메일의 링크 토큰
 * - type=sms: SMS 코드 (발급 시각 기준으로 재계산해서 비교)
 * - 등록한 모든 채널이 확인되면 같은 응답에 access grant(JWT + refresh)가 붙는다.
 */
@DisplayName("[Auth] 채널 확인 → access grant")
class VerifyFlowTest extends AbstractAuthIntegrationTest {

    @Autowired AuthProperties authProperties;
    @Autowired JdbcTemplate jdbcTemplate;

    @Nested
    @DisplayName("이메일 링크 (type=signup)")
    class EmailLink {

        @Test
        @DisplayName("유효한 토큰 → 200 ACTIVE + bearer access token + refresh token")
        void valid_token_grants_access() throws Exception {
            signupOk(mvc, EMAIL, null, PASSWORD);
            String token = lastConfirmationToken(javaMailSender, EMAIL);

            JsonNode body = readJson(performVerifyEmail(mvc, token).andExpect(status().isOk()).andReturn());

            assertThat(body.path("user").path("status").asText()).isEqualTo("ACTIVE");
            assertThat(body.path("tokenType").asText()).isEqualTo("bearer");
            assertThat(body.path("expiresIn").asLong()).isEqualTo(900);

            User user = userByEmail(EMAIL);
            Claims claims = AccessTokenClaims.parse(
                    body.path("accessToken").asText(), authProperties, TestClockConfig.TEST_CLOCK);
            assertThat(claims.getSubject()).isEqualTo(String.valueOf(user.getId()));
            assertThat(claims.get(JwtService.TENANT_CLAIM, String.class)).isEqualTo(user.getTenantId());
            assertThat(claims.getAudience()).isEqualTo(user.getAudience());

            String refresh = body.path("refreshToken").asText();
            assertThat(refreshTokenRepository.findByTokenHash(TokenHashUtils.sha256Hex(refresh)))
                    .hasValueSatisfying(rt -> assertThat(rt.getUserId()).isEqualTo(user.getId()));

            assertThat(user.getEmailConfirmationToken()).isNull();
            assertThat(user.getEmailConfirmedAt()).isNotNull();
            assertThat(user.getLastSignInAt()).isNotNull();
            assertThat(auditActionsOf(user)).containsExactly(
                    AuditAction.OTP_ISSUED, AuditAction.USER_CONFIRMED, AuditAction.LOGIN);
        }

        @Test
        @DisplayName("토큰은 한 번만 쓸 수 있다 → 두 번째는 400 OTP_INVALID")
        void token_is_single_use() throws Exception {
            signupOk(mvc, EMAIL, null, PASSWORD);
            String token = lastConfirmationToken(javaMailSender, EMAIL);
            performVerifyEmail(mvc, token).andExpect(status().isOk());

            expectErrorWithCode(performVerifyEmail(mvc, token), ErrorCode.OTP_INVALID);
        }

        @Test
        @DisplayName("모르는 토큰 → 400 OTP_INVALID")
        void unknown_token() throws Exception {
            expectErrorWithCode(performVerifyEmail(mvc, "no-such-token"), ErrorCode.OTP_INVALID);
        }

        @Test
        @DisplayName("발송 후 confirmation-ttl(1440분)이 지나면 400 OTP_EXPIRED")
        void expired_token() throws Exception {
            signupOk(mvc, EMAIL, null, PASSWORD);
            String token = lastConfirmationToken(javaMailSender, EMAIL);

            TestClockConfig.TEST_CLOCK.advance(Duration.ofMinutes(1440));

            expectErrorWithCode(performVerifyEmail(mvc, token), ErrorCode.OTP_EXPIRED);
            assertThat(userByEmail(EMAIL).getStatus()).isEqualTo(UserStatus.PENDING);
        }

        @Test
        @DisplayName("다른 테넌트의 토큰은 찾지 못한다 → 400 OTP_INVALID")
        void token_is_tenant_scoped() throws Exception {
            signupOk(mvc, EMAIL, null, PASSWORD);
            String token = lastConfirmationToken(javaMailSender, EMAIL);

            expectErrorWithCode(mvc.perform(jsonPost("/auth/verify", """
                            {"type":"signup","token":"%s"}
                            """.formatted(token))
                            .header("X-Tenant-Id", "11111111-1111-1111-1111-111111111111")),
                    ErrorCode.OTP_INVALID);
        }
    }

    @Nested
    @DisplayName("SMS 코드 (type=sms)")
    class SmsCode {

        @Test
        @DisplayName("맞는 코드 → 200 grant, 시크릿 발급 기록 소비")
        void valid_code_grants_access() throws Exception {
            signupOk(mvc, null, PHONE, PASSWORD);
            String code = lastSmsCode(smsSender, PHONE);

            JsonNode body = readJson(performVerifySms(mvc, "+" + PHONE, code).andExpect(status().isOk()).andReturn());

            assertThat(body.path("accessToken").asText()).isNotBlank();
            User user = userByPhone(PHONE);
            assertThat(user.getStatus()).isEqualTo(UserStatus.ACTIVE);
            assertThat(user.getPhoneConfirmedAt()).isNotNull();
            assertThat(secretOf(user, OtpChannel.PHONE).getConsumedAt()).isEqualTo(TestClockConfig.TEST_START_LOCAL);
            assertThat(secretOf(user, OtpChannel.PHONE).getLastIssuedAt()).isEqualTo(TestClockConfig.TEST_START_LOCAL);
            assertThat(auditActionsOf(user)).containsExactly(
                    AuditAction.OTP_ISSUED, AuditAction.USER_CONFIRMED, AuditAction.LOGIN);
        }

        @Test
        @DisplayName("코드를 소비해도 쿨다운은 발급 시각 기준 → 바로 재요청하면 429 OTP_COOLDOWN")
        void consumed_code_keeps_cooldown() throws Exception {
            signupOk(mvc, null, PHONE, PASSWORD);
            performVerifySms(mvc, PHONE, lastSmsCode(smsSender, PHONE)).andExpect(status().isOk());

            TestClockConfig.TEST_CLOCK.advanceSeconds(10);
            expectErrorWithCode(performSmsOtp(mvc, PHONE), ErrorCode.OTP_COOLDOWN);
            assertThat(smsCount(smsSender, PHONE)).isEqualTo(1);

            TestClockConfig.TEST_CLOCK.advanceSeconds(51);
            performSmsOtp(mvc, PHONE).andExpect(status().isOk());
        }

        @Test
        @DisplayName("TOTP 시간 창이 바뀌어도 발급 시각 기준 코드라 만료 전까지 유효")
        void code_survives_window_rollover() throws Exception {
            signupOk(mvc, null, PHONE, PASSWORD);
            String code = lastSmsCode(smsSender, PHONE);

            TestClockConfig.TEST_CLOCK.advanceSeconds(125);

            performVerifySms(mvc, PHONE, code).andExpect(status().isOk());
        }

        @Test
        @DisplayName("틀린 코드 → 400 OTP_INVALID, 상태 변화 없음")
        void wrong_code() throws Exception {
            signupOk(mvc, null, PHONE, PASSWORD);
            String code = lastSmsCode(smsSender, PHONE);
            String wrong = code.equals("000000") ? "000001" : "000000";

            expectErrorWithCode(performVerifySms(mvc, PHONE, wrong), ErrorCode.OTP_INVALID);

            User user = userByPhone(PHONE);
            assertThat(user.getStatus()).isEqualTo(UserStatus.PENDING);
            assertThat(secretOf(user, OtpChannel.PHONE).getLastIssuedAt()).isNotNull();

            // 틀린 시도 뒤에도 맞는 코드는 그대로 통한다.
            performVerifySms(mvc, PHONE, code).andExpect(status().isOk());
        }

        @Test
        @DisplayName("sms-expiry(300초)가 지나면 400 OTP_EXPIRED")
        void expired_code() throws Exception {
            signupOk(mvc, null, PHONE, PASSWORD);
            String code = lastSmsCode(smsSender, PHONE);

            TestClockConfig.TEST_CLOCK.advanceSeconds(300);

            expectErrorWithCode(performVerifySms(mvc, PHONE, code), ErrorCode.OTP_EXPIRED);
        }

        @Test
        @DisplayName("소비된 코드 재사용 → 400 OTP_NOT_FOUND")
        void consumed_code_cannot_be_reused() throws Exception {
            signupOk(mvc, null, PHONE, PASSWORD);
            String code = lastSmsCode(smsSender, PHONE);
            performVerifySms(mvc, PHONE, code).andExpect(status().isOk());

            expectErrorWithCode(performVerifySms(mvc, PHONE, code), ErrorCode.OTP_NOT_FOUND);
        }

        @Test
        @DisplayName("저장된 암호문이 변조됨 → 500 SECRET_CRYPTO_FAILURE")
        void tampered_secret_fails_closed() throws Exception {
            signupOk(mvc, null, PHONE, PASSWORD);
            String code = lastSmsCode(smsSender, PHONE);
            Long secretId = secretOf(userByPhone(PHONE), OtpChannel.PHONE).getId();

            jdbcTemplate.update("update otp_secrets set payload = ? where id = ?", new byte[64], secretId);

            expectErrorWithCode(performVerifySms(mvc, PHONE, code), ErrorCode.SECRET_CRYPTO_FAILURE);
        }

        @Test
        @DisplayName("모르는 키 버전으로 저장된 시크릿 → 500 SECRET_CRYPTO_FAILURE")
        void unknown_key_version_fails_closed() throws Exception {
            signupOk(mvc, null, PHONE, PASSWORD);
            String code = lastSmsCode(smsSender, PHONE);
            Long secretId = secretOf(userByPhone(PHONE), OtpChannel.PHONE).getId();

            jdbcTemplate.update("update otp_secrets set key_version = 2 where id = ?", secretId);

            expectErrorWithCode(performVerifySms(mvc, PHONE, code), ErrorCode.SECRET_CRYPTO_FAILURE);
        }

        @Test
        @DisplayName("가입되지 않은 번호 → 400 OTP_NOT_FOUND")
        void unknown_phone() throws Exception {
            expectErrorWithCode(performVerifySms(mvc, PHONE, "123456"), ErrorCode.OTP_NOT_FOUND);
        }

        @Test
        @DisplayName("이미 확인된 번호: 재발급 코드로 다시 grant, USER_CONFIRMED는 한 번만")
        void confirmed_phone_signs_in_again() throws Exception {
            signupOk(mvc, null, PHONE, PASSWORD);
            performVerifySms(mvc, PHONE, lastSmsCode(smsSender, PHONE)).andExpect(status().isOk());

            TestClockConfig.TEST_CLOCK.advanceSeconds(61);
            performSmsOtp(mvc, PHONE).andExpect(status().isOk());
            performVerifySms(mvc, PHONE, lastSmsCode(smsSender, PHONE)).andExpect(status().isOk());

            User user = userByPhone(PHONE);
            assertThat(auditActionsOf(user)).containsExactly(
                    AuditAction.OTP_ISSUED, AuditAction.USER_CONFIRMED, AuditAction.LOGIN,
                    AuditAction.OTP_ISSUED, AuditAction.LOGIN);
            assertThat(refreshTokenRepository.findByUserId(user.getId())).hasSize(2);
        }
    }

    @Test
    @DisplayName("두 채널 가입: 이메일만 확인하면 grant 없음, 전화번호까지 확인하면 grant")
    void grant_requires_every_registered_channel() throws Exception {
        signupOk(mvc, EMAIL, PHONE, PASSWORD);

        JsonNode afterEmail = readJson(performVerifyEmail(mvc, lastConfirmationToken(javaMailSender, EMAIL))
                .andExpect(status().isOk()).andReturn());
        assertThat(afterEmail.has("accessToken")).isFalse();
        assertThat(afterEmail.path("user").path("status").asText()).isEqualTo("PENDING");

        JsonNode afterPhone = readJson(performVerifySms(mvc, PHONE, lastSmsCode(smsSender, PHONE))
                .andExpect(status().isOk()).andReturn());
        assertThat(afterPhone.path("accessToken").asText()).isNotBlank();
        assertThat(afterPhone.path("user").path("status").asText()).isEqualTo("ACTIVE");
    }

    @Test
    @DisplayName("알 수 없는 type / token 누락 → 400 VALIDATION_ERROR")
    void unsupported_verify_type() throws Exception {
        expectErrorWithCode(performJson(mvc, "/auth/verify", """
                {"type":"recovery","token":"abc"}
                """), ErrorCode.VALIDATION_ERROR);
        expectErrorWithCode(performJson(mvc, "/auth/verify", """
                {"type":"sms","phone":"%s"}
                """.formatted(PHONE)), ErrorCode.VALIDATION_ERROR);
    }
}
