// file: src/main/java/io/eventchat/server/auth/JwtCredentialVerifier.java
package io.eventchat.server.auth;

import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

/**
 * HS256 bearer tokens whose {@code sub} claim is the numeric user id.
 * Expiry is enforced by the parser.
 */
public final class JwtCredentialVerifier implements CredentialVerifier {

    private final JwtParser parser;

    public JwtCredentialVerifier(String secret) {
        this(signingKey(secret));
    }

    public JwtCredentialVerifier(SecretKey key) {
        this.parser = Jwts.parser().verifyWith(key).build();
    }

    /** HMAC key from a UTF-8 secret; at least 32 bytes are needed for HS256. */
    public static SecretKey signingKey(String secret) {
        if (secret == null) throw new IllegalArgumentException("jwt secret must be set");
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < 32) {
            throw new IllegalArgumentException("jwt secret must be at least 32 bytes, got " + bytes.length);
        }
        return Keys.hmacShaKeyFor(bytes);
    }

    @Override
    public long verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthenticationException(AuthenticationException.REQUIRED);
        }
        String subject;
        try {
            subject = parser.parseSignedClaims(token).getPayload().getSubject();
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthenticationException(AuthenticationException.INVALID, e);
        }
        if (subject == null) {
            throw new AuthenticationException(AuthenticationException.REQUIRED);
        }
        try {
            return Long.parseLong(subject);
        } catch (NumberFormatException e) {
            throw new AuthenticationException(AuthenticationException.INVALID, e);
        }
    }
}
