package com.credcore.backend.auth.otp.support;

import java.util.regex.Pattern;

/**
 * 전화번호(E.164) 규칙
 *
 * - 첫 자리는 0이 아닌 숫자, 전체 2~15자리, 구분자/기호 없음
 * - 검증은 절대 예외를 던지지 않는다. (null/형식 불일치 → false)
 */
public final class PhoneNumbers {

    private PhoneNumbers() {}

    private static final Pattern E164 = Pattern.compile("^[1-9]\\d{1,14}$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static boolean isValidE164(String phone) {
        return phone != null && E164.matcher(phone).matches();
    }

    // 앞의 '+' 하나와 모든 공백 제거 (그 외 문자는 건드리지 않는다)
    public static String normalize(String phone) {
        if (phone == null) return null;
        String stripped = WHITESPACE.matcher(phone).replaceAll("");
        return stripped.startsWith("+") ? stripped.substring(1) : stripped;
    }
}
