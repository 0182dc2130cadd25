package com.credcore.backend.auth.delivery;

/**
 * 채널에 넘길 메시지. SMS는 subject를 쓰지 않는다.
 * 코드/토큰 원문을 담고 있으므로 toString()에 본문을 남기지 않는다.
 */
public record DeliveryMessage(String subject, String body) {

    public static DeliveryMessage sms(String body) {
        return new DeliveryMessage(null, body);
    }

    public static DeliveryMessage mail(String subject, String body) {
        return new DeliveryMessage(subject, body);
    }

    @Override
    public String toString() {
        return "DeliveryMessage[subject=" + subject + ", body=<hidden>]";
    }
}
