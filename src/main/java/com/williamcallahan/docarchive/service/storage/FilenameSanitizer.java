package com.williamcallahan.docarchive.service.storage;

import java.util.regex.Pattern;

/**
 * Makes arbitrary text safe to use as a single path segment.
 */
public final class FilenameSanitizer {
    private static final Pattern INVALID_CHARACTERS = Pattern.compile("[\\\\/:*?\"<>|\\p{Cntrl}]");
    private static final Pattern TRAILING_DOTS_AND_SPACES = Pattern.compile("[. ]+$");
    private static final int MAX_SEGMENT_LENGTH = 255;

    private FilenameSanitizer() {
    }

    /**
     * Replaces characters that are invalid in file names with {@code replacement}, drops trailing
     * dots and spaces and truncates to 255 characters.
     */
    public static String sanitize(String text, String replacement) {
        String sanitized = INVALID_CHARACTERS.matcher(text).replaceAll(replacement);
        sanitized = TRAILING_DOTS_AND_SPACES.matcher(sanitized).replaceAll("");
        if (sanitized.length() > MAX_SEGMENT_LENGTH) {
            sanitized = sanitized.substring(0, MAX_SEGMENT_LENGTH);
        }
        return sanitized;
    }
}
