package com.credcore.backend.auth.hook;

/**
 * - VALIDATE: 신규 사용자 insert 직전
 * - SIGNUP: 채널 확인 완료(자동 확인 포함)
 * - LOGIN: access grant 발급
 */
public enum HookKind {
    VALIDATE,
    SIGNUP,
    LOGIN
}
