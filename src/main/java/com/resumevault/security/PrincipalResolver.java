package com.resumevault.security;

import java.util.Optional;

/**
 * Seam to the external identity provider. Token issuance and verification live behind it.
 */
public interface PrincipalResolver {

    /**
     * @return the caller for a bearer token, or empty when the token is unknown
     */
    Optional<ResumePrincipal> resolve(String bearerToken);
}
