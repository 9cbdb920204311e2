package com.resumevault.service;

import com.resumevault.model.TagKind;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Canonical forms of tag names. Companies are title-cased with fixed exceptions, keywords are only trimmed.
 */
public final class TagNameNormalizer {

    /**
     * Forced to upper case wherever they appear.
     */
    static final Set<String> UPPERCASE_WORDS = Set.of(
        "LLC", "LLP", "USA", "US", "UK", "AI", "IT", "IBM", "HP", "AWS", "GE");

    /**
     * Forced to lower case unless first.
     */
    static final Set<String> LOWERCASE_WORDS = Set.of(
        "of", "the", "and", "a", "an", "in", "on", "at", "by", "for", "with", "to");

    private TagNameNormalizer() {
    }

    public static String normalize(TagKind kind, String name) {
        if (name == null) {
            return "";
        }
        return switch (kind) {
            case COMPANY -> titleCaseCompany(name.trim());
            case KEYWORD -> name.trim();
        };
    }

    /**
     * Words are split on single spaces so runs of spaces survive as empty words.
     */
    static String titleCaseCompany(String text) {
        if (text.isEmpty()) {
            return "";
        }
        String[] words = text.split(" ", -1);
        return IntStream.range(0, words.length)
            .mapToObj(i -> formatWord(words[i], i))
            .collect(Collectors.joining(" "));
    }

    private static String formatWord(String word, int index) {
        if (word.isEmpty()) {
            return word;
        }
        String upper = word.toUpperCase(Locale.ROOT);
        if (UPPERCASE_WORDS.contains(upper)) {
            return upper;
        }
        String lower = word.toLowerCase(Locale.ROOT);
        if (index > 0 && LOWERCASE_WORDS.contains(lower)) {
            return lower;
        }
        return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT);
    }
}
