package com.teknorix.jobcatalog.auth;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Missing, malformed, forged, expired or under-privileged bearer token. The message is the
 * same in every case.
 */
@ResponseStatus(HttpStatus.UNAUTHORIZED)
public class TokenRejectedException extends RuntimeException {
    public TokenRejectedException() {
        super("Invalid or expired token.");
    }
}
