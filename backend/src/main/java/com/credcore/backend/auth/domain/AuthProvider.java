package com.credcore.backend.auth.domain;

// 가입 시 주 식별자. 전화번호가 함께 오면 PHONE이 우선한다.
public enum AuthProvider {
    EMAIL,
    PHONE
}
