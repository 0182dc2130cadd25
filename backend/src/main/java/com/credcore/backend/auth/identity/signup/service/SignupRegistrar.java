package com.credcore.backend.auth.identity.signup.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.credcore.backend.auth.config.SignupProperties;
import com.credcore.backend.auth.config.SmsProperties;
import com.credcore.backend.auth.domain.AuthProvider;
import com.credcore.backend.auth.domain.User;
import com.credcore.backend.auth.hook.EventHookDispatcher;
import com.credcore.backend.auth.hook.HookKind;
import com.credcore.backend.auth.identity.signup.support.EmailAddresses;
import com.credcore.backend.auth.otp.support.PhoneNumbers;
import com.credcore.backend.auth.repo.UserRepository;
import com.credcore.backend.global.ApiException;
import com.credcore.backend.global.ErrorCode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 가입 트랜잭션 (요청당 하나)
 *
 * 1) 입력 검증: 가입 허용 → 비밀번호 → 식별자 → 이메일 형식 → 전화번호 형식(정규화 후)
 * 2) (tenant, audience) 범위에서 이메일 → 전화번호 순으로 기존 사용자 조회
 *    - 없으면 신규 생성(VALIDATE 훅)
 *    - 요청한 채널이 이미 확인된 사용자면 ALREADY_REGISTERED
 *    - 요청 값과 다른 값이 이미 등록된 채널이면 ALREADY_REGISTERED (덮어쓰지 않는다)
 *    - 그 외에는 이어서 진행 + 메타데이터 병합
 * 3) 요청한 채널 중 미확인 채널을 이메일 → 전화번호 순서로 발급 준비(쿨다운 검사, 발급 기록)
 * 4) 모든 채널 준비가 끝난 뒤에만 발송. 한 채널이라도 막히면 어느 채널로도 보내지 않는다.
 *
 * 이 트랜잭션 안의 어떤 단계든 실패하면 사용자/시크릿/감사 로그가 모두 롤백된다.
 * 발급 시각은 초 단위로 자른다. DB 정밀도와 무관하게 검증 시 같은 코드를 재계산하기 위함.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignupRegistrar {

    private static final TypeReference<Map<String, Object>> META_TYPE = new TypeReference<>() {};

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final ChannelConfirmationDispatcher dispatcher;
    private final EventHookDispatcher hooks;
    private final ObjectMapper objectMapper;

    private final SignupProperties signupProps;
    private final SmsProperties smsProps;
    private final Clock clock;

    @Transactional
    public User register(SignupContext ctx, String rawEmail, String rawPhone, String password, Map<String, Object> data) {
        SignupInput in = validate(rawEmail, rawPhone, password);
        LocalDateTime now = now();

        User user = resolve(ctx, in).orElse(null);
        if (user == null) {
            user = createUser(ctx, in, data, now);
        } else {
            resume(ctx, user, in, data, now);
        }

        List<PreparedDelivery> prepared = new ArrayList<>(2);
        if (in.email() != null && !user.isEmailConfirmed()) {
            dispatcher.prepareEmail(ctx, user, now).ifPresent(prepared::add);
        }
        if (in.phone() != null && !user.isPhoneConfirmed()) {
            dispatcher.preparePhone(ctx, user, now).ifPresent(prepared::add);
        }
        dispatcher.deliver(ctx, user, prepared);
        return user;
    }

    /**
     * 이미 가입된 전화번호로 SMS 코드를 다시 발급한다.
     * @return 해당 전화번호의 사용자가 없으면 false (호출자가 가입 경로로 보낸다)
     */
    @Transactional
    public boolean issuePhoneCode(SignupContext ctx, String phone) {
        Optional<User> found = userRepository.findByTenantIdAndAudienceAndPhone(ctx.tenantId(), ctx.audience(), phone);
        if (found.isEmpty()) {
            return false;
        }
        User user = found.get();
        PreparedDelivery prepared = dispatcher.preparePhoneCode(ctx, user, now());
        if (smsProps.autoconfirm()) {
            log.info("SMS 자동 확인 모드, 코드 발송 생략: userId={}, tenant={}", user.getId(), ctx.tenantId());
        } else {
            dispatcher.deliver(ctx, user, List.of(prepared));
        }
        return true;
    }


    // ========= validate =========

    private SignupInput validate(String rawEmail, String rawPhone, String password) {
        if (signupProps.disabled()) {
            throw new ApiException(ErrorCode.SIGNUP_DISABLED);
        }
        if (password == null || password.isEmpty()) {
            throw new ApiException(ErrorCode.PASSWORD_REQUIRED);
        }
        if (password.length() < signupProps.passwordMinLength()) {
            throw new ApiException(ErrorCode.WEAK_PASSWORD,
                    "비밀번호는 최소 " + signupProps.passwordMinLength() + "자 이상이어야 합니다.");
        }

        String email = EmailAddresses.normalize(rawEmail);
        String phone = blankToNull(PhoneNumbers.normalize(rawPhone));

        if (email == null && phone == null) {
            throw new ApiException(ErrorCode.IDENTIFIER_REQUIRED);
        }
        if (email != null && !EmailAddresses.isValid(email)) {
            throw new ApiException(ErrorCode.INVALID_EMAIL_FORMAT);
        }
        if (phone != null && !PhoneNumbers.isValidE164(phone)) {
            throw new ApiException(ErrorCode.INVALID_PHONE_FORMAT);
        }

        AuthProvider provider = phone != null ? AuthProvider.PHONE : AuthProvider.EMAIL;
        return new SignupInput(email, phone, password, provider);
    }


    // ========= resolve / create / resume =========

    private Optional<User> resolve(SignupContext ctx, SignupInput in) {
        if (in.email() != null) {
            Optional<User> byEmail = userRepository.findByTenantIdAndAudienceAndEmail(ctx.tenantId(), ctx.audience(), in.email());
            if (byEmail.isPresent()) return byEmail;
        }
        if (in.phone() != null) {
            return userRepository.findByTenantIdAndAudienceAndPhone(ctx.tenantId(), ctx.audience(), in.phone());
        }
        return Optional.empty();
    }

    private User createUser(SignupContext ctx, SignupInput in, Map<String, Object> data, LocalDateTime now) {
        User user = User.createPending(
                ctx.tenantId(),
                ctx.audience(),
                in.email(),
                in.phone(),
                passwordEncoder.encode(in.password()),
                in.provider(),
                writeMeta(data),
                now);

        hooks.fire(HookKind.VALIDATE, user, ctx.tenantId());

        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            // 동시 가입: 조회와 insert 사이에 다른 요청이 같은 식별자를 선점했다.
            throw alreadyRegistered(in);
        }

        log.info("신규 가입: userId={}, tenant={}, provider={}", user.getId(), ctx.tenantId(), in.provider());
        return user;
    }

    private void resume(SignupContext ctx, User user, SignupInput in, Map<String, Object> data, LocalDateTime now) {
        if (in.email() != null && user.isEmailConfirmed()) {
            throw new ApiException(ErrorCode.EMAIL_ALREADY_REGISTERED);
        }
        if (in.phone() != null && user.isPhoneConfirmed()) {
            throw new ApiException(ErrorCode.PHONE_ALREADY_REGISTERED);
        }

        if (in.email() != null) {
            if (!user.hasEmail()) {
                ensureEmailFree(ctx, in.email());
                user.attachEmail(in.email(), now);
            } else if (!user.getEmail().equals(in.email())) {
                throw new ApiException(ErrorCode.EMAIL_ALREADY_REGISTERED, "이 계정에는 다른 이메일이 등록되어 있습니다.");
            }
        }
        if (in.phone() != null) {
            if (!user.hasPhone()) {
                ensurePhoneFree(ctx, in.phone());
                user.attachPhone(in.phone(), now);
            } else if (!user.getPhone().equals(in.phone())) {
                throw new ApiException(ErrorCode.PHONE_ALREADY_REGISTERED, "이 계정에는 다른 전화번호가 등록되어 있습니다.");
            }
        }

        if (data != null && !data.isEmpty()) {
            Map<String, Object> merged = readMeta(user.getUserMetaData());
            merged.putAll(data);
            user.replaceMetaData(writeMeta(merged), now);
        }

        log.info("가입 재개: userId={}, tenant={}", user.getId(), ctx.tenantId());
    }

    private void ensureEmailFree(SignupContext ctx, String email) {
        if (userRepository.findByTenantIdAndAudienceAndEmail(ctx.tenantId(), ctx.audience(), email).isPresent()) {
            throw new ApiException(ErrorCode.EMAIL_ALREADY_REGISTERED);
        }
    }

    private void ensurePhoneFree(SignupContext ctx, String phone) {
        if (userRepository.findByTenantIdAndAudienceAndPhone(ctx.tenantId(), ctx.audience(), phone).isPresent()) {
            throw new ApiException(ErrorCode.PHONE_ALREADY_REGISTERED);
        }
    }

    private ApiException alreadyRegistered(SignupInput in) {
        return in.email() != null
                ? new ApiException(ErrorCode.EMAIL_ALREADY_REGISTERED)
                : new ApiException(ErrorCode.PHONE_ALREADY_REGISTERED);
    }


    // ========= metadata =========

    private Map<String, Object> readMeta(String json) {
        if (json == null || json.isBlank()) return new LinkedHashMap<>();
        try {
            return new LinkedHashMap<>(objectMapper.readValue(json, META_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("stored user metadata is not valid JSON", e);
        }
    }

    private String writeMeta(Map<String, Object> data) {
        if (data == null || data.isEmpty()) return null;
        try {
            String json = objectMapper.writeValueAsString(data);
            if (json.length() > User.META_DATA_MAX) {
                throw new ApiException(ErrorCode.VALIDATION_ERROR, "사용자 메타데이터가 너무 큽니다.");
            }
            return json;
        } catch (JsonProcessingException e) {
            throw new ApiException(ErrorCode.VALIDATION_ERROR, "사용자 메타데이터를 직렬화할 수 없습니다.");
        }
    }


    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
    }

    private static String blankToNull(String s) {
        return (s == null || s.isEmpty()) ? null : s;
    }

    private record SignupInput(String email, String phone, String password, AuthProvider provider) {}
}
