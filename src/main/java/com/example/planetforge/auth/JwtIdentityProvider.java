package com.example.planetforge.auth;

import com.example.planetforge.error.UnauthenticatedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.stereotype.Component;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;

/**
 * HS256 bearer tokens signed with {@code app.auth.jwt-secret}; the subject claim is the user id.
 */
@Component
public class JwtIdentityProvider implements IdentityProvider {

    private static final Logger logger = LoggerFactory.getLogger(JwtIdentityProvider.class);

    static final String BEARER_PREFIX = "Bearer ";

    private final JwtDecoder decoder;

    public JwtIdentityProvider(@Value("${app.auth.jwt-secret}") String secret) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < 32) {
            throw new IllegalArgumentException("app.auth.jwt-secret must be at least 32 bytes for HS256");
        }
        SecretKeySpec key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        this.decoder = NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
    }

    @Override
    public String authenticate(String token) {
        String raw = stripBearer(token);
        if (raw == null || raw.isBlank()) {
            throw new UnauthenticatedException("Missing bearer token");
        }
        Jwt jwt;
        try {
            jwt = decoder.decode(raw);
        } catch (JwtException e) {
            logger.debug("Rejected bearer token: {}", e.getMessage());
            throw new UnauthenticatedException("Invalid bearer token", e);
        }
        String subject = jwt.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new UnauthenticatedException("Bearer token has no subject");
        }
        return subject;
    }

    static String stripBearer(String token) {
        if (token == null) {
            return null;
        }
        String t = token.trim();
        if (t.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return t.substring(BEARER_PREFIX.length()).trim();
        }
        return t;
    }
}
