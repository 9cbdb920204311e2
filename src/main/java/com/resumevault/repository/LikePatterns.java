package com.resumevault.repository;

/**
 * Builds {@code LIKE}/{@code ILIKE} patterns that treat user input literally.
 */
public final class LikePatterns {

    private LikePatterns() {
    }

    public static String containing(String fragment) {
        return "%" + escape(fragment) + "%";
    }

    static String escape(String fragment) {
        StringBuilder escaped = new StringBuilder(fragment.length());
        for (char c : fragment.toCharArray()) {
            if (c == '\\' || c == '%' || c == '_') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
