package com.example.dashboard.common.util;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.regex.Pattern;

public final class StringSanitizer {

    private static final Pattern CONTROL_CHARACTERS = Pattern.compile("\\p{Cntrl}");
    private static final int DEFAULT_LOG_MAX_LENGTH = 64;
    private static final String ELLIPSIS = "...";

    private StringSanitizer() {}

    /**
     * Makes typed search text safe for a single log line.
     */
    @NonNull
    public static String forLog(@Nullable String value) {
        return forLog(value, DEFAULT_LOG_MAX_LENGTH);
    }

    /**
     * Drops control characters and cuts the text to {@code maxLength} characters, marking a
     * cut with a trailing {@code ...}.
     */
    @NonNull
    public static String forLog(@Nullable String value, int maxLength) {
        if (value == null) {
            return "null";
        }
        String sanitized = CONTROL_CHARACTERS.matcher(value).replaceAll("");
        if (sanitized.length() <= maxLength) {
            return sanitized;
        }
        return sanitized.substring(0, Math.max(0, maxLength)) + ELLIPSIS;
    }
}
