package com.resumevault.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Optional;

/**
 * Resolves static tokens listed under {@code app.security.tokens}.
 */
@Slf4j
@Component
public class ConfiguredTokenPrincipalResolver implements PrincipalResolver {

    private final List<SecurityProperties.Token> tokens;

    public ConfiguredTokenPrincipalResolver(SecurityProperties properties) {
        this.tokens = properties.tokens();
        if (tokens.isEmpty()) {
            log.warn("No API tokens configured under app.security.tokens; all write requests will be rejected");
        }
    }

    @Override
    public Optional<ResumePrincipal> resolve(String bearerToken) {
        if (bearerToken == null || bearerToken.isBlank()) {
            return Optional.empty();
        }
        byte[] presented = bearerToken.getBytes(StandardCharsets.UTF_8);
        return tokens.stream()
            .filter(t -> MessageDigest.isEqual(presented, t.token().getBytes(StandardCharsets.UTF_8)))
            .findFirst()
            .map(t -> new ResumePrincipal(t.principalId(), t.role()));
    }
}
