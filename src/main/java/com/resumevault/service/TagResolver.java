package com.resumevault.service;

import com.resumevault.model.Tag;
import com.resumevault.model.TagKind;

import java.util.Collection;
import java.util.List;

public interface TagResolver {

    /**
     * Find-or-create the canonical record for {@code name}. Idempotent and safe under concurrency.
     */
    Tag resolve(TagKind kind, String name);

    /**
     * Resolves every name in order. Any failure propagates.
     */
    List<Tag> resolveAll(TagKind kind, List<String> names);

    /**
     * Resolves every name in order, logging and skipping names that fail.
     */
    List<Tag> resolveBestEffort(TagKind kind, List<String> names, String logContext);

    /**
     * Existing records whose name contains any of the fragments, case-insensitively.
     */
    List<Tag> findMatching(TagKind kind, Collection<String> fragments);
}
