package fr.lapetina.multillm.infrastructure.connection;

import fr.lapetina.multillm.domain.model.HandshakeResult;

import java.util.concurrent.CompletableFuture;

/**
 * One lightweight verification exchange with a provider.
 *
 * Implementations report an unsuccessful answer as a failed {@link HandshakeResult};
 * the future only completes exceptionally on I/O failure or cancellation.
 * Cancelling the returned future abandons the exchange.
 */
@FunctionalInterface
public interface HandshakeProbe {

    CompletableFuture<HandshakeResult> probe(String credential);
}
