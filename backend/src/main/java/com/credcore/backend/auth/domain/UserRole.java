package com.credcore.backend.auth.domain;

public enum UserRole {
    USER,
    ADMIN
}
