package io.eventchat.server.auth;

/**
 * Turns a caller-supplied credential into a participant id.
 */
public interface CredentialVerifier {

    /**
     * @param token raw credential, possibly null or blank
     * @return the participant id the credential was issued to
     * @throws AuthenticationException if the token is missing, malformed, expired or forged
     */
    long verify(String token);
}
