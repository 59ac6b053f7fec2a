package com.example.planetforge.auth;

/**
 * Resolves a bearer token to a user id.
 */
public interface IdentityProvider {

    /**
     * @throws com.example.planetforge.error.UnauthenticatedException when the token is missing, malformed, expired or forged
     */
    String authenticate(String token);
}
