package com.credcore.backend.auth;

import static com.credcore.backend.auth.support.AuthFlowSupport.lastSmsCode;
import static com.credcore.backend.auth.support.AuthFlowSupport.signupOk;
import static com.credcore.backend.auth.support.AuthFlowSupport.smsCount;
import static com.credcore.backend.auth.support.AuthHttpSupport.expectErrorWithCode;
import static com.credcore.backend.auth.support.AuthHttpSupport.performSmsOtp;
import static com.credcore.backend.auth.support.AuthHttpSupport.performVerifySms;
import static com.credcore.backend.auth.support.AuthHttpSupport.readJson;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.servlet.MockMvc;

import com.credcore.backend.auth.audit.AuditLogEntryRepository;
import com.credcore.backend.auth.config.SignupProperties;
import com.credcore.backend.auth.identity.signup.service.SignupContext;
import com.credcore.backend.auth.identity.signup.service.SignupService;
import com.credcore.backend.auth.otp.repo.OtpSecretRepository;
import com.credcore.backend.auth.repo.UserRepository;
import com.credcore.backend.auth.token.repo.RefreshTokenRepository;
import com.credcore.backend.global.ApiException;
import com.credcore.backend.global.ErrorCode;
import com.credcore.backend.infra.AbstractMySqlIntegrationTest;
import com.credcore.backend.infra.TestClockConfig;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * 실제 MySQL(InnoDB)에서의 가입 흐름
 * - Flyway V1 + ddl-auto=validate로 스키마/매핑 일치 확인
 * - SELECT ... FOR UPDATE 직렬화가 MySQL 락으로도 동일하게 동작하는지 확인
 */
@DisplayName("[Auth] 가입 → SMS 확인 (MySQL)")
class MySqlSignupFlowIT extends AbstractMySqlIntegrationTest {

    private static final String PHONE = "821055556666";
    private static final String PASSWORD = "correct-horse-1";

    @Autowired MockMvc mvc;
    @Autowired SignupService signupService;
    @Autowired SignupProperties signupProperties;
    @Autowired UserRepository userRepository;
    @Autowired OtpSecretRepository otpSecretRepository;
    @Autowired AuditLogEntryRepository auditLogEntryRepository;
    @Autowired RefreshTokenRepository refreshTokenRepository;

    @BeforeEach
    void resetData() {
        auditLogEntryRepository.deleteAllInBatch();
        refreshTokenRepository.deleteAllInBatch();
        otpSecretRepository.deleteAllInBatch();
        userRepository.deleteAllInBatch();
    }

    @Test
    @DisplayName("전화번호 가입 → SMS 코드 확인 → grant")
    void phone_signup_then_verify() throws Exception {
        signupOk(mvc, null, PHONE, PASSWORD);
        String code = lastSmsCode(smsSender, PHONE);

        TestClockConfig.TEST_CLOCK.advanceSeconds(45);
        JsonNode body = readJson(performVerifySms(mvc, PHONE, code).andExpect(status().isOk()).andReturn());

        assertThat(body.path("accessToken").asText()).isNotBlank();
        assertThat(body.path("user").path("status").asText()).isEqualTo("ACTIVE");
        assertThat(refreshTokenRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("쿨다운 안 재요청 → 429 OTP_COOLDOWN")
    void cooldown_on_mysql() throws Exception {
        signupOk(mvc, null, PHONE, PASSWORD);

        expectErrorWithCode(performSmsOtp(mvc, PHONE), ErrorCode.OTP_COOLDOWN);
    }

    @Test
    @DisplayName("동시 재발급 4건 → 1건만 발급")
    void concurrent_reissue_is_serialized() throws Exception {
        signupOk(mvc, null, PHONE, PASSWORD);
        TestClockConfig.TEST_CLOCK.advanceSeconds(61);

        SignupContext ctx = new SignupContext(signupProperties.defaultTenantId(), signupProperties.defaultAudience());
        CountDownLatch start = new CountDownLatch(1);
        List<Throwable> failures = Collections.synchronizedList(new ArrayList<>());

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    try {
                        signupService.requestSmsOtp(ctx, PHONE, null, null);
                    } catch (RuntimeException e) {
                        failures.add(e);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(60, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(failures).hasSize(3)
                .allSatisfy(e -> assertThat(((ApiException) e).getCode()).isEqualTo(ErrorCode.OTP_COOLDOWN.name()));
        assertThat(smsCount(smsSender, PHONE)).isEqualTo(2);
    }
}
