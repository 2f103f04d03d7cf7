package fr.lapetina.multillm.domain.session;

import java.util.Optional;

/**
 * Supplies the credential to use for a provider.
 */
@FunctionalInterface
public interface CredentialSource {

    Optional<String> credentialFor(String provider);

    /**
     * Uses the same credential for every provider. A blank credential counts as none.
     */
    static CredentialSource fixed(String credential) {
        Optional<String> value = credential == null || credential.isBlank()
                ? Optional.empty()
                : Optional.of(credential);
        return provider -> value;
    }
}
