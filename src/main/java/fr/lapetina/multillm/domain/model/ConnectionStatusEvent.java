package fr.lapetina.multillm.domain.model;

import java.time.Instant;

/**
 * Emitted once for every connection state mutation.
 */
public record ConnectionStatusEvent(
        String provider,
        boolean connected,
        String message,
        Instant timestamp
) {
}
