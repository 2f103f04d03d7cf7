package fr.lapetina.multillm.domain.model;

import java.util.Objects;

/**
 * Outcome of one handshake attempt. Never mutated after creation.
 */
public record HandshakeResult(boolean success, String message, String handshakeId) {

    public HandshakeResult {
        Objects.requireNonNull(message, "Message is required");
        if (handshakeId == null) {
            handshakeId = "";
        }
    }

    public static HandshakeResult success(String message, String handshakeId) {
        return new HandshakeResult(true, message, handshakeId);
    }

    public static HandshakeResult failure(String message) {
        return new HandshakeResult(false, message, "");
    }
}
