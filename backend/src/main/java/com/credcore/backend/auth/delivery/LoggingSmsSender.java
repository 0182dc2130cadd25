package com.credcore.backend.auth.delivery;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * 개발/테스트용 SMS 발송기
 * - 실제로 보내지 않고 수신 번호 끝자리만 로그로 남긴다(본문에는 코드가 있으므로 남기지 않는다).
 * - 실제 사업자 연동 시 SmsSender 구현 빈으로 교체한다.
 */
@Slf4j
@Component
public class LoggingSmsSender implements SmsSender {

    @Override
    public void send(String phone, String body) {
        log.info("SMS 발송(로그 전용): to=***{}, length={}", tail(phone), body == null ? 0 : body.length());
    }

    private static String tail(String phone) {
        if (phone == null || phone.length() <= 4) return "";
        return phone.substring(phone.length() - 4);
    }
}
