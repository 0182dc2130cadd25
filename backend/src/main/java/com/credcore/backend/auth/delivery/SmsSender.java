package com.credcore.backend.auth.delivery;

/**
 * SMS 발송 계약
 * - 실제 사업자 연동은 이 인터페이스를 구현한 빈으로 교체한다.
 * - 실패는 아무 RuntimeException으로 던지면 된다(DeliveryGateway가 DeliveryException으로 감싼다).
 */
public interface SmsSender {

    void send(String phone, String body);
}
