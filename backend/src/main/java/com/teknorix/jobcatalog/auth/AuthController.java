package com.teknorix.jobcatalog.auth;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {
    private final CredentialService credentialService;

    public AuthController(CredentialService credentialService) {
        this.credentialService = credentialService;
    }

    @PostMapping("/login")
    public TokenResponse login(@RequestBody(required = false) LoginRequest request) {
        if (request == null) {
            throw new InvalidCredentialsException();
        }
        IssuedToken issued = credentialService.authenticate(request.username(), request.password());
        return new TokenResponse(issued.token(), issued.expiresAt());
    }

    public record LoginRequest(String username, String password) {
    }

    public record TokenResponse(String token, Instant expires) {
    }
}
