package com.teknorix.jobcatalog.auth;

import java.time.Instant;

public record IssuedToken(String token, String tokenId, Instant issuedAt, Instant expiresAt) {}
