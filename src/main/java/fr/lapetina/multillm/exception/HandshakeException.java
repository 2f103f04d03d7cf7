package fr.lapetina.multillm.exception;

import fr.lapetina.multillm.domain.model.ErrorType;

/**
 * Thrown when the handshake preceding a completion reports failure.
 * The completion request itself is never sent.
 */
public final class HandshakeException extends MultiLlmException {

    private final String provider;

    public HandshakeException(String provider, String handshakeMessage) {
        super(ErrorType.HANDSHAKE_ERROR, "Handshake failed: " + handshakeMessage);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
