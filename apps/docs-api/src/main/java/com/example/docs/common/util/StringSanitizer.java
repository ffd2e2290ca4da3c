package com.example.docs.common.util;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.regex.Pattern;

public final class StringSanitizer {

    private static final Pattern SAFE_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_@.-]{1,128}$");
    private static final int DEFAULT_LOG_MAX_LENGTH = 64;

    private StringSanitizer() {}

    @NonNull
    public static String forLog(@Nullable String value) {
        return forLog(value, DEFAULT_LOG_MAX_LENGTH);
    }

    @NonNull
    public static String forLog(@Nullable String value, int maxLength) {
        if (value == null) {
            return "null";
        }
        String sanitized = stripControl(value);
        return sanitized.substring(0, Math.min(sanitized.length(), maxLength));
    }

    /**
     * Removes line breaks and tabs, then truncates to {@code maxLength} characters.
     */
    @Nullable
    public static String truncate(@Nullable String value, int maxLength) {
        if (value == null) {
            return null;
        }
        String sanitized = stripControl(value);
        return sanitized.length() > maxLength ? sanitized.substring(0, maxLength) : sanitized;
    }


    public static boolean isValidUserId(@Nullable String userId) {
        if (userId == null || userId.isBlank()) {
            return false;
        }
        return SAFE_ID_PATTERN.matcher(userId).matches();
    }

    private static String stripControl(String value) {
        return value
                .replace("\n", "")
                .replace("\r", "")
                .replace("\t", "");
    }
}
