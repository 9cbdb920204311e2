package com.resumevault.model;

import java.util.UUID;

/**
 * Company or keyword reference record. Append-only: never renamed or removed.
 */
public record Tag(UUID id, TagKind kind, String name) {}
