package com.credcore.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.context.annotation.Import;

import com.credcore.backend.auth.config.AuthModuleConfig;

/*
================================================================================
[curl 시나리오] 가입 → 확인 → access grant
================================================================================
# 이메일 + 전화번호 가입 (확인 메일 + SMS 코드 발송) 200, user만 내려옴
curl -i -X POST "http://localhost:8080/auth/signup" \
  -H "Content-Type: application/json" \
  -H "X-Tenant-Id: 00000000-0000-0000-0000-000000000000" \
  -d '{"email":"anna@example.com","phone":"+821012345678","password":"correct-horse","data":{"nickname":"Anna"}}'

# 확인 메일 링크의 token으로 이메일 확인 200
curl -i -X POST "http://localhost:8080/auth/verify" \
  -H "Content-Type: application/json" \
  -d '{"type":"signup","token":"<메일 링크의 token>"}'

# SMS 코드 재요청 200 {} (쿨다운 안이면 429 + Retry-After)
curl -i -X POST "http://localhost:8080/auth/otp" \
  -H "Content-Type: application/json" \
  -d '{"type":"sms","phone":"+821012345678"}'

# SMS 코드 확인 200, 모든 채널이 확인되면 accessToken/refreshToken 포함
curl -i -X POST "http://localhost:8080/auth/verify" \
  -H "Content-Type: application/json" \
  -d '{"type":"sms","phone":"+821012345678","token":"123456"}'

- LoggingSmsSender는 코드를 로그에 남기지 않는다. 로컬에서는 app.sms.autoconfirm=true로 확인을 건너뛴다.

================================================================================
[DB 확인]
================================================================================
select * from users;
select id, user_id, tenant_id, channel, key_version, last_issued_at, version from otp_secrets;
select * from audit_log_entries order by id desc limit 20;
*/


/**
 * 엔트리포인트
 *
 * 설정 값 주입 흐름:
 *    (컨테이너 OS 환경변수) -> application.yml ${ENV:default} -> @ConfigurationProperties(@Validated)
 * - APP_CRYPTO_PASSPHRASE(32바이트), APP_AUTH_JWT_SECRET(32바이트 이상)이 없으면 부팅 실패(fail-fast)
 *
 * UserDetailsServiceAutoConfiguration 제외:
 * - 비밀번호 로그인 폼을 쓰지 않으므로 기본 인메모리 유저("Using generated security password")를 만들지 않는다.
 */
@Import(AuthModuleConfig.class)
@SpringBootApplication(exclude = {UserDetailsServiceAutoConfiguration.class})
public class BackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(BackendApplication.class, args);
    }
}
