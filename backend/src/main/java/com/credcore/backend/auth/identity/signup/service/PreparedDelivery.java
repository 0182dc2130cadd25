package com.credcore.backend.auth.identity.signup.service;

import com.credcore.backend.auth.delivery.DeliveryMessage;
import com.credcore.backend.auth.otp.domain.OtpChannel;

/**
 * 발급 기록까지 끝나고 외부 발송만 남은 한 채널
 *
 * - rollback: 이 채널의 발급 전 상태(확인 토큰, 발급 시각)로 되돌린다.
 */
record PreparedDelivery(
        OtpChannel channel,
        String destination,
        DeliveryMessage message,
        Runnable rollback
) {
}
