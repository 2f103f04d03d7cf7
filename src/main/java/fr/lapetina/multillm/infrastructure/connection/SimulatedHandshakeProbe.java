package fr.lapetina.multillm.infrastructure.connection;

import fr.lapetina.multillm.domain.model.HandshakeResult;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Handshake for providers without a wire-level probe.
 * Always succeeds after a short delay, without any network call.
 */
public final class SimulatedHandshakeProbe implements HandshakeProbe {

    static final String HANDSHAKE_MESSAGE = "hello";

    private final Duration delay;
    private final Clock clock;

    public SimulatedHandshakeProbe(Duration delay, Clock clock) {
        this.delay = delay;
        this.clock = clock;
    }

    public SimulatedHandshakeProbe() {
        this(Duration.ofMillis(100), Clock.systemUTC());
    }

    @Override
    public CompletableFuture<HandshakeResult> probe(String credential) {
        return CompletableFuture.supplyAsync(
                () -> HandshakeResult.success(
                        "Generic connection established for handshake: " + HANDSHAKE_MESSAGE,
                        HandshakeIds.next("gen_", clock)),
                CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS)
        );
    }
}
