package com.teknorix.jobcatalog.auth;

import java.time.Instant;
import java.util.Set;

public record TokenClaims(
    String subject,
    String tokenId,
    Set<String> roles,
    Instant issuedAt,
    Instant expiresAt
) {
    public boolean hasRole(String role) {
        return roles != null && roles.contains(role);
    }
}
