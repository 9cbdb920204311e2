package com.resumevault.security;

import java.util.Objects;

/**
 * Authenticated caller as supplied by the identity provider.
 */
public record ResumePrincipal(String id, Role role) {

    public ResumePrincipal {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }
}
