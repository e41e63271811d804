package com.commandhub.credentials;

import com.commandhub.ErrorCode;
import com.commandhub.HubException;

/**
 * Picks the credential for one call. Holds only the immutable process default,
 * so concurrent calls cannot observe each other's keys.
 */
public class CredentialResolver {

    private final Credential defaultCredential;

    public CredentialResolver(String defaultToken) {
        this.defaultCredential = defaultToken == null || defaultToken.isBlank()
            ? Credential.none()
            : Credential.defaultKey(defaultToken);
    }

    /**
     * @param callerToken          key supplied with the request, may be null or blank
     * @param requiresProjectScope whether the catalog entry needs a project id
     * @return the caller key when present, else the default, else {@link Credential#none()}
     *         for commands that may run unauthenticated
     */
    public Credential resolve(String callerToken, boolean requiresProjectScope) {
        if (callerToken != null && !callerToken.isBlank()) {
            return Credential.caller(callerToken);
        }
        if (defaultCredential.isPresent()) {
            return defaultCredential;
        }
        if (requiresProjectScope) {
            throw new HubException(ErrorCode.NO_CREDENTIAL_CONFIGURED,
                "No API key supplied and no default credential configured");
        }
        return Credential.none();
    }

    public boolean hasDefault() {
        return defaultCredential.isPresent();
    }
}
