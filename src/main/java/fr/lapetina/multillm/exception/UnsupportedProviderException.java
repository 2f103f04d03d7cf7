package fr.lapetina.multillm.exception;

import fr.lapetina.multillm.domain.model.ErrorType;

/**
 * Thrown when no adapter is registered for a provider key.
 * This is a configuration fault and is never retried.
 */
public final class UnsupportedProviderException extends MultiLlmException {

    private final String provider;

    public UnsupportedProviderException(String provider) {
        super(ErrorType.UNSUPPORTED_PROVIDER, "Provider '" + provider + "' is not supported");
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
