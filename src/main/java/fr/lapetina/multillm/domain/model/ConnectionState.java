package fr.lapetina.multillm.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of one provider's connection state.
 *
 * The registry replaces the whole snapshot on every mutation, so a reader always
 * sees the connected flag, timestamp and message of the same update.
 */
public record ConnectionState(
        String provider,
        boolean connected,
        Instant lastHandshakeTime,
        String lastMessage
) {
    public ConnectionState {
        Objects.requireNonNull(provider, "Provider is required");
        if (lastMessage == null) {
            lastMessage = "";
        }
    }

    public static ConnectionState initial(String provider) {
        return new ConnectionState(provider, false, null, "");
    }

    public Optional<Instant> lastHandshake() {
        return Optional.ofNullable(lastHandshakeTime);
    }

    /**
     * Returns the state after an update. The handshake time only moves forward on success.
     */
    public ConnectionState update(boolean nowConnected, String message, Instant now) {
        return new ConnectionState(
                provider,
                nowConnected,
                nowConnected ? now : lastHandshakeTime,
                message
        );
    }
}
