package com.resumevault.service;

import com.resumevault.exception.ValidationException;

import java.util.UUID;
import java.util.regex.Pattern;

public final class ResumeIds {

    private static final Pattern CANONICAL_UUID =
        Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private ResumeIds() {
    }

    /**
     * Only the canonical 36-character form is accepted; {@link UUID#fromString} alone lets
     * shortened groups through.
     */
    public static UUID parse(String raw) {
        if (raw == null || !CANONICAL_UUID.matcher(raw).matches()) {
            throw new ValidationException("Invalid resume ID.");
        }
        return UUID.fromString(raw);
    }
}
