package fr.lapetina.multillm.infrastructure.connection;

import fr.lapetina.multillm.domain.model.ConnectionState;
import fr.lapetina.multillm.domain.model.ConnectionStatusEvent;
import fr.lapetina.multillm.domain.model.HandshakeResult;
import fr.lapetina.multillm.exception.ValidationException;
import fr.lapetina.multillm.infrastructure.http.Futures;
import fr.lapetina.multillm.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Registry tracking whether each provider connection is currently usable.
 *
 * Thread-safe. One {@link ConnectionState} snapshot per normalized provider key,
 * replaced atomically on each mutation. Mutations and their listener notification
 * hold a per-provider lock; the lock is never held across a network call.
 */
public final class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<String, ConnectionState> states = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<String, HandshakeProbe> probes = new ConcurrentHashMap<>();
    private final List<Consumer<ConnectionStatusEvent>> listeners = new CopyOnWriteArrayList<>();

    private final HandshakeProbe fallbackProbe;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;

    public ConnectionRegistry(HandshakeProbe fallbackProbe, MetricsRegistry metricsRegistry, Clock clock) {
        this.fallbackProbe = fallbackProbe;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
    }

    public ConnectionRegistry(MetricsRegistry metricsRegistry) {
        this(new SimulatedHandshakeProbe(), metricsRegistry, Clock.systemUTC());
    }

    /**
     * Normalizes a provider identifier into a registry key.
     */
    public static String normalize(String provider) {
        if (provider == null) {
            throw new IllegalArgumentException("Provider is required");
        }
        return provider.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Registers the handshake probe used for a provider.
     * Providers without a probe use the fallback probe.
     */
    public void registerProbe(String provider, HandshakeProbe probe) {
        probes.put(normalize(provider), probe);
        log.debug("Handshake probe registered: provider={}", normalize(provider));
    }

    /**
     * Performs one handshake with a provider.
     *
     * <p>A blank credential fails immediately with {@link ValidationException} and changes
     * nothing. Otherwise the provider state is updated and listeners are notified exactly
     * once, whatever the outcome; transport failures become a failed result. Cancelling the
     * returned future cancels the exchange, and a cancelled exchange leaves the state untouched.
     */
    public CompletableFuture<HandshakeResult> performHandshake(String provider, String credential) {
        String key = normalize(provider);
        if (credential == null || credential.isBlank()) {
            log.warn("Handshake rejected, blank credential: provider={}", key);
            return CompletableFuture.failedFuture(
                    new ValidationException("A credential is required for provider: " + key));
        }

        log.info("Performing handshake: provider={}", key);

        CompletableFuture<HandshakeResult> exchange;
        try {
            exchange = probes.getOrDefault(key, fallbackProbe).probe(credential);
        } catch (RuntimeException e) {
            exchange = CompletableFuture.failedFuture(e);
        }

        PendingHandshake result = new PendingHandshake(lockFor(key));
        Futures.propagateCancellation(result, exchange);

        exchange.whenComplete((handshake, ex) -> {
            if (ex != null && Futures.isCancellation(ex)) {
                log.info("Handshake cancelled: provider={}", key);
                result.completeExceptionally(new CancellationException("Handshake cancelled for provider: " + key));
                return;
            }

            HandshakeResult outcome = handshake;
            if (ex != null) {
                Throwable cause = Futures.unwrap(ex);
                log.error("Handshake failed: provider={}, error={}", key, cause.getMessage());
                outcome = HandshakeResult.failure("Handshake failed: " + cause.getMessage());
            }

            if (!applyHandshake(key, outcome, result)) {
                log.info("Handshake result discarded after cancellation: provider={}", key);
                return;
            }
            result.complete(outcome);
        });

        return result;
    }

    private boolean applyHandshake(String key, HandshakeResult outcome, PendingHandshake caller) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            if (!caller.settle()) {
                return false;
            }
            ConnectionState updated = apply(key, outcome.success(), outcome.message());
            metricsRegistry.incrementHandshakeCount(key, outcome.success());
            log.info("Handshake completed: provider={}, success={}, handshakeId={}",
                    key, outcome.success(), outcome.handshakeId());
            notifyListeners(updated);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Updates a provider's state when connectivity is learned out-of-band.
     */
    public void updateStatus(String provider, String message, boolean connected) {
        String key = normalize(provider);
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            ConnectionState updated = apply(key, connected, message);
            log.info("Connection status updated: provider={}, connected={}, message={}", key, connected, message);
            notifyListeners(updated);
        } finally {
            lock.unlock();
        }
    }

    private ConnectionState apply(String key, boolean connected, String message) {
        Instant now = clock.instant();
        ConnectionState updated = states
                .getOrDefault(key, ConnectionState.initial(key))
                .update(connected, message, now);
        states.put(key, updated);
        metricsRegistry.setConnectedProviders(connectedCount());
        return updated;
    }

    /**
     * Returns whether the provider's last handshake or status update reported success.
     * Unknown providers are not connected.
     */
    public boolean isConnected(String provider) {
        ConnectionState state = states.get(normalize(provider));
        return state != null && state.connected();
    }

    public Optional<Instant> getLastHandshakeTime(String provider) {
        return getState(provider).flatMap(ConnectionState::lastHandshake);
    }

    public Optional<ConnectionState> getState(String provider) {
        return Optional.ofNullable(states.get(normalize(provider)));
    }

    /**
     * Gets a snapshot of all known provider states.
     */
    public List<ConnectionState> getAllStates() {
        return new ArrayList<>(states.values());
    }

    public int connectedCount() {
        return (int) states.values().stream().filter(ConnectionState::connected).count();
    }

    /**
     * Adds a listener for status changes. Listeners run synchronously, in registration order.
     */
    public void addListener(Consumer<ConnectionStatusEvent> listener) {
        listeners.add(listener);
    }

    /**
     * Removes a listener.
     */
    public void removeListener(Consumer<ConnectionStatusEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(ConnectionState state) {
        ConnectionStatusEvent event = new ConnectionStatusEvent(
                state.provider(), state.connected(), state.lastMessage(), clock.instant());
        for (Consumer<ConnectionStatusEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying connection listener", e);
            }
        }
    }

    private ReentrantLock lockFor(String key) {
        return locks.computeIfAbsent(key, k -> new ReentrantLock());
    }

    /**
     * Caller-facing handshake future. Cancellation and settlement both take the provider
     * lock, so once the outcome has been applied to the state the future can no longer be cancelled.
     */
    private static final class PendingHandshake extends CompletableFuture<HandshakeResult> {
        private final ReentrantLock lock;
        private boolean settled;

        PendingHandshake(ReentrantLock lock) {
            this.lock = lock;
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            lock.lock();
            try {
                return !settled && super.cancel(mayInterruptIfRunning);
            } finally {
                lock.unlock();
            }
        }

        /**
         * Marks the outcome as applied. Must hold the lock; false when already cancelled.
         */
        boolean settle() {
            if (isCancelled()) {
                return false;
            }
            settled = true;
            return true;
        }
    }
}
