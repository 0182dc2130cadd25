package com.credcore.backend.auth.audit;

public enum AuditAction {
    USER_SIGNED_UP,
    USER_CONFIRMED,
    OTP_ISSUED,
    LOGIN
}
