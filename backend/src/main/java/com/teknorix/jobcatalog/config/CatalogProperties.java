package com.teknorix.jobcatalog.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.charset.StandardCharsets;

@ConfigurationProperties(prefix = "catalog")
public class CatalogProperties {
    private static final String DEFAULT_TOKEN_ISSUER = "job-catalog";
    private static final String DEFAULT_TOKEN_AUDIENCE = "job-catalog-clients";
    static final int MIN_SIGNING_KEY_BYTES = 32;

    private Api api = new Api();
    private Security security = new Security();

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Security getSecurity() {
        return security;
    }

    public void setSecurity(Security security) {
        this.security = security;
    }

    public static class Api {
        private int defaultPageSize = 10;

        public int getDefaultPageSize() {
            return Math.max(1, defaultPageSize);
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = Math.max(1, defaultPageSize);
        }
    }

    public static class Security {
        private String adminUsername;
        private String adminPassword;
        private String tokenSigningKey;
        private String tokenIssuer;
        private String tokenAudience;

        public String getAdminUsername() {
            return adminUsername;
        }

        public void setAdminUsername(String adminUsername) {
            this.adminUsername = adminUsername;
        }

        public String getAdminPassword() {
            return adminPassword;
        }

        public void setAdminPassword(String adminPassword) {
            this.adminPassword = adminPassword;
        }

        public String getTokenSigningKey() {
            return tokenSigningKey;
        }

        public void setTokenSigningKey(String tokenSigningKey) {
            this.tokenSigningKey = tokenSigningKey;
        }

        /**
         * HMAC-SHA256 needs at least 256 bits of key material.
         */
        public byte[] requireSigningKeyBytes() {
            if (tokenSigningKey == null || tokenSigningKey.isBlank()) {
                throw new IllegalStateException("catalog.security.token-signing-key is not configured");
            }
            byte[] bytes = tokenSigningKey.getBytes(StandardCharsets.UTF_8);
            if (bytes.length < MIN_SIGNING_KEY_BYTES) {
                throw new IllegalStateException(
                    "catalog.security.token-signing-key must be at least " + MIN_SIGNING_KEY_BYTES + " bytes"
                );
            }
            return bytes;
        }

        public String getTokenIssuer() {
            return normalizeOrDefault(tokenIssuer, DEFAULT_TOKEN_ISSUER);
        }

        public void setTokenIssuer(String tokenIssuer) {
            this.tokenIssuer = tokenIssuer;
        }

        public String getTokenAudience() {
            return normalizeOrDefault(tokenAudience, DEFAULT_TOKEN_AUDIENCE);
        }

        public void setTokenAudience(String tokenAudience) {
            this.tokenAudience = tokenAudience;
        }
    }

    static String normalizeOrDefault(String candidate, String fallback) {
        if (candidate == null || candidate.isBlank()) {
            return fallback;
        }
        return candidate.trim();
    }
}
