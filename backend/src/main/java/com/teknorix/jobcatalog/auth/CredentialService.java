package com.teknorix.jobcatalog.auth;

import com.teknorix.jobcatalog.config.CatalogProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Authenticates the configured administrator and issues HS256-signed JWTs valid for one
 * hour. Validation is stateless: signature, issuer, audience and lifetime are recomputed
 * from the token on every call, with no clock skew allowed.
 */
@Service
public class CredentialService {
    private static final Logger log = LoggerFactory.getLogger(CredentialService.class);
    public static final String ROLE_ADMINISTRATOR = "Administrator";
    public static final String ROLE_USER = "User";
    public static final String ROLES_CLAIM = "roles";
    public static final Duration TOKEN_LIFETIME = Duration.ofHours(1);
    private static final List<String> ISSUED_ROLES = List.of(ROLE_ADMINISTRATOR, ROLE_USER);

    private final String adminUsername;
    private final byte[] adminPassword;
    private final String issuer;
    private final String audience;
    private final SecretKey signingKey;
    private final JwtParser parser;
    private final Clock clock;

    public CredentialService(CatalogProperties properties, Clock clock) {
        CatalogProperties.Security security = properties.getSecurity();
        if (security.getAdminUsername() == null || security.getAdminUsername().isBlank()
            || security.getAdminPassword() == null || security.getAdminPassword().isEmpty()) {
            throw new IllegalStateException("catalog.security.admin-username and admin-password must be configured");
        }
        this.adminUsername = security.getAdminUsername();
        this.adminPassword = security.getAdminPassword().getBytes(StandardCharsets.UTF_8);
        this.issuer = security.getTokenIssuer();
        this.audience = security.getTokenAudience();
        this.signingKey = Keys.hmacShaKeyFor(security.requireSigningKeyBytes());
        this.clock = clock;
        this.parser = Jwts.parser()
            .verifyWith(signingKey)
            .requireIssuer(issuer)
            .requireAudience(audience)
            .clock(() -> Date.from(clock.instant()))
            .build();
    }

    /**
     * @throws InvalidCredentialsException when either value differs from the configured pair
     */
    public IssuedToken authenticate(String username, String password) {
        if (!matches(username, password)) {
            log.warn("Rejected login attempt");
            throw new InvalidCredentialsException();
        }
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(TOKEN_LIFETIME);
        String tokenId = UUID.randomUUID().toString();
        String token = Jwts.builder()
            .subject(username)
            .id(tokenId)
            .issuer(issuer)
            .audience().add(audience).and()
            .issuedAt(Date.from(issuedAt))
            .notBefore(Date.from(issuedAt))
            .expiration(Date.from(expiresAt))
            .claim(ROLES_CLAIM, ISSUED_ROLES)
            .signWith(signingKey, Jwts.SIG.HS256)
            .compact();
        log.info("Issued token {} for {} (expires {})", tokenId, username, expiresAt);
        return new IssuedToken(token, tokenId, issuedAt, expiresAt);
    }

    /**
     * @throws TokenRejectedException when any check fails; the cause is only logged
     */
    public TokenClaims validateToken(String token) {
        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token rejected: {}", e.getMessage());
            throw new TokenRejectedException();
        }

        Instant now = clock.instant();
        Instant issuedAt = claims.getIssuedAt() == null ? null : claims.getIssuedAt().toInstant();
        Instant expiresAt = claims.getExpiration() == null ? null : claims.getExpiration().toInstant();
        if (issuedAt == null || expiresAt == null || now.isBefore(issuedAt) || !now.isBefore(expiresAt)) {
            log.debug("Token {} rejected: outside its lifetime", claims.getId());
            throw new TokenRejectedException();
        }
        if (claims.getSubject() == null || claims.getSubject().isBlank()) {
            log.debug("Token {} rejected: no subject", claims.getId());
            throw new TokenRejectedException();
        }
        return new TokenClaims(claims.getSubject(), claims.getId(), readRoles(claims), issuedAt, expiresAt);
    }

    private boolean matches(String username, String password) {
        if (username == null || password == null) {
            return false;
        }
        boolean userMatches = MessageDigest.isEqual(
            adminUsername.getBytes(StandardCharsets.UTF_8),
            username.getBytes(StandardCharsets.UTF_8)
        );
        boolean passwordMatches = MessageDigest.isEqual(adminPassword, password.getBytes(StandardCharsets.UTF_8));
        return userMatches & passwordMatches;
    }

    private Set<String> readRoles(Claims claims) {
        Object raw = claims.get(ROLES_CLAIM);
        Set<String> roles = new LinkedHashSet<>();
        if (raw instanceof Collection<?>) {
            for (Object role : (Collection<?>) raw) {
                if (role != null) {
                    roles.add(role.toString());
                }
            }
        } else if (raw != null) {
            roles.add(raw.toString());
        }
        return Set.copyOf(roles);
    }
}
