package com.credcore.backend.auth.delivery;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import com.credcore.backend.auth.config.DeliveryProperties;
import com.credcore.backend.auth.otp.domain.OtpChannel;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 채널별 외부 발송 진입점
 *
 * 계약:
 * - 성공하면 그냥 반환, 실패하면 DeliveryException 하나뿐이다.
 * - 발송은 전용 풀(deliveryExecutor)에서 돌고, 요청 스레드는 deadline까지만 기다린다.
 * - deadline 초과 = 실패. 이미 나간 호출은 취소/재시도하지 않는다(요청당 최대 1회 시도).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeliveryGateway {

    private final ConfirmationMailSender mailSender;
    private final SmsSender smsSender;
    private final AsyncTaskExecutor deliveryExecutor;
    private final DeliveryProperties props;

    public void send(OtpChannel channel, String destination, DeliveryMessage message) {
        send(channel, destination, message, props.timeout());
    }

    public void send(OtpChannel channel, String destination, DeliveryMessage message, Duration deadline) {
        Future<?> pending;
        try {
            pending = deliveryExecutor.submit(() -> dispatch(channel, destination, message));
        } catch (TaskRejectedException e) {
            throw fail(channel, "delivery pool saturated", e);
        }

        try {
            pending.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw fail(channel, "delivery exceeded deadline of " + deadline.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            throw fail(channel, "delivery failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw fail(channel, "interrupted while waiting for delivery", e);
        }
    }

    private void dispatch(OtpChannel channel, String destination, DeliveryMessage message) {
        switch (channel) {
            case EMAIL -> mailSender.send(destination, message.subject(), message.body());
            case PHONE -> smsSender.send(destination, message.body());
        }
    }

    private DeliveryException fail(OtpChannel channel, String reason, Throwable cause) {
        log.warn("발송 실패: channel={}, reason={}", channel, reason);
        return new DeliveryException(channel, reason, cause);
    }
}
