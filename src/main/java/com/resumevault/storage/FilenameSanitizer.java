package com.resumevault.storage;

import java.util.regex.Pattern;

public final class FilenameSanitizer {

    private static final Pattern UNSAFE = Pattern.compile("[^a-zA-Z0-9._-]");

    /** Width of {@code blob_files.filename}. */
    public static final int MAX_STORED_LENGTH = 255;

    private FilenameSanitizer() {
    }

    /**
     * Replaces every character other than ASCII letters, digits, {@code .}, {@code _} and {@code -}
     * with an underscore.
     */
    public static String sanitize(String filename) {
        if (filename == null) {
            return null;
        }
        return UNSAFE.matcher(filename).replaceAll("_");
    }

    /**
     * Sanitizes and then shortens the name to at most {@code maxLength} characters, keeping the
     * extension when it fits.
     */
    public static String sanitize(String filename, int maxLength) {
        String safe = sanitize(filename);
        if (safe == null || safe.length() <= maxLength) {
            return safe;
        }
        int dot = safe.lastIndexOf('.');
        String extension = dot > 0 ? safe.substring(dot) : "";
        if (extension.length() >= maxLength) {
            return safe.substring(0, maxLength);
        }
        return safe.substring(0, maxLength - extension.length()) + extension;
    }
}
