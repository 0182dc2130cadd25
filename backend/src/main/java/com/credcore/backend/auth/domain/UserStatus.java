package com.credcore.backend.auth.domain;

/**
 * - PENDING: 등록한 채널 중 하나라도 아직 확인되지 않음
 * - ACTIVE: 모든 등록 채널 확인 완료(fully onboarded)
 */
public enum UserStatus {
    PENDING,
    ACTIVE
}
