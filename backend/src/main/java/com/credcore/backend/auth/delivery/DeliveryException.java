package com.credcore.backend.auth.delivery;

import com.credcore.backend.auth.otp.domain.OtpChannel;

import lombok.Getter;

/**
 * 외부 발송 실패 (HTTP를 모르는 도메인 예외)
 * - 발송기 예외, deadline 초과, 발송 풀 포화 모두 여기로 모인다.
 * - 오케스트레이터가 DELIVERY_FAILED(502)로 변환하고 트랜잭션을 롤백한다.
 */
@Getter
public class DeliveryException extends RuntimeException {

    private final OtpChannel channel;

    public DeliveryException(OtpChannel channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }
}
