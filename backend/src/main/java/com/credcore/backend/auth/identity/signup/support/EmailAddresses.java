package com.credcore.backend.auth.identity.signup.support;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 이메일 규칙
 * - 정규화: trim + 소문자
 * - 형식: local@domain.tld (공백/@ 중복 불가)
 */
public final class EmailAddresses {

    private EmailAddresses() {}

    public static final int MAX_LENGTH = 255;

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    public static String normalize(String email) {
        if (email == null) return null;
        String trimmed = email.trim();
        return trimmed.isEmpty() ? null : trimmed.toLowerCase(Locale.ROOT);
    }

    public static boolean isValid(String email) {
        return email != null
                && email.length() <= MAX_LENGTH
                && EMAIL.matcher(email).matches();
    }
}
