package com.credcore.backend.auth.delivery;

import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

import com.credcore.backend.auth.config.MailerProperties;

import lombok.RequiredArgsConstructor;

/**
 * 가입 확인 메일 발송 어댑터
 *
 * - 비즈니스 서비스가 아닌 "외부 I/O 어댑터"
 * - 서비스(정책)는 JavaMailSender를 직접 쓰지 않고 DeliveryGateway → 이 클래스를 거친다.
 */
@Component
@RequiredArgsConstructor
public class ConfirmationMailSender {

    private final JavaMailSender mailSender;
    private final MailerProperties mailerProps;

    public void send(String toEmail, String subject, String body) {
        SimpleMailMessage msg = new SimpleMailMessage();
        msg.setTo(toEmail);
        msg.setFrom(mailerProps.from());
        msg.setSubject(subject);
        msg.setText(body);
        mailSender.send(msg);
    }
}
