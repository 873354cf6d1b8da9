package io.eventchat.server.auth;

import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import java.time.Instant;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

class JwtCredentialVerifierTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";
    private static final SecretKey KEY = JwtCredentialVerifier.signingKey(SECRET);

    private final JwtCredentialVerifier verifier = new JwtCredentialVerifier(SECRET);

    private static String token(String subject, Instant expiresAt, SecretKey key) {
        var b = Jwts.builder().expiration(Date.from(expiresAt)).signWith(key);
        if (subject != null) b.subject(subject);
        return b.compact();
    }

    private static Instant inAnHour() {
        return Instant.now().plusSeconds(3600);
    }

    @Test
    void valid_token_yields_numeric_subject() {
        assertEquals(42L, verifier.verify(token("42", inAnHour(), KEY)));
    }

    @Test
    void blank_token_is_required() {
        var e = assertThrows(AuthenticationException.class, () -> verifier.verify(" "));
        assertEquals(AuthenticationException.REQUIRED, e.getMessage());
        assertThrows(AuthenticationException.class, () -> verifier.verify(null));
    }

    @Test
    void expired_token_is_invalid() {
        String expired = token("42", Instant.now().minusSeconds(60), KEY);
        var e = assertThrows(AuthenticationException.class, () -> verifier.verify(expired));
        assertEquals(AuthenticationException.INVALID, e.getMessage());
    }

    @Test
    void token_signed_with_another_key_is_invalid() {
        SecretKey other = JwtCredentialVerifier.signingKey("fedcba9876543210fedcba9876543210");
        var e = assertThrows(AuthenticationException.class,
                () -> verifier.verify(token("42", inAnHour(), other)));
        assertEquals(AuthenticationException.INVALID, e.getMessage());
    }

    @Test
    void garbage_is_invalid() {
        var e = assertThrows(AuthenticationException.class, () -> verifier.verify("not.a.jwt"));
        assertEquals(AuthenticationException.INVALID, e.getMessage());
    }

    @Test
    void non_numeric_subject_is_invalid() {
        var e = assertThrows(AuthenticationException.class,
                () -> verifier.verify(token("alice", inAnHour(), KEY)));
        assertEquals(AuthenticationException.INVALID, e.getMessage());
    }

    @Test
    void missing_subject_means_authentication_required() {
        var e = assertThrows(AuthenticationException.class,
                () -> verifier.verify(token(null, inAnHour(), KEY)));
        assertEquals(AuthenticationException.REQUIRED, e.getMessage());
    }

    @Test
    void short_secret_is_rejected_up_front() {
        assertThrows(IllegalArgumentException.class, () -> new JwtCredentialVerifier("too-short"));
        assertThrows(IllegalArgumentException.class, () -> JwtCredentialVerifier.signingKey(null));
    }
}
