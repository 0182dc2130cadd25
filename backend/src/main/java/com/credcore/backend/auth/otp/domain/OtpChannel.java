package com.credcore.backend.auth.otp.domain;

/**
 * 확인 채널. 채널마다 시크릿/쿨다운/발송 수단이 독립적이다.
 */
public enum OtpChannel {
    EMAIL,
    PHONE
}
