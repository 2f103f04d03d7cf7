package fr.lapetina.multillm.infrastructure.metrics;

import fr.lapetina.multillm.domain.model.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Completion latency per provider
 * - Completion and handshake counters per provider and outcome
 * - Error counters by type
 * - Connected provider gauge
 * - Prometheus exposition when backed by a Prometheus registry
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final MeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> completionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> handshakeCounters = new ConcurrentHashMap<>();

    private final AtomicInteger connectedProviders = new AtomicInteger(0);

    public MetricsRegistry(String prefix, MeterRegistry registry) {
        this.prefix = prefix;
        this.registry = registry;

        Gauge.builder(prefix + "_connected_providers", connectedProviders, AtomicInteger::get)
                .description("Number of providers with a successful handshake")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry(String prefix) {
        this(prefix, createPrometheusRegistry());
    }

    public MetricsRegistry() {
        this("multillm");
    }

    private static PrometheusMeterRegistry createPrometheusRegistry() {
        PrometheusMeterRegistry prometheus = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        new JvmMemoryMetrics().bindTo(prometheus);
        new JvmThreadMetrics().bindTo(prometheus);
        return prometheus;
    }

    /**
     * Records the latency of a completed completion call.
     */
    public void recordCompletionLatency(String provider, Duration latency) {
        latencyTimers.computeIfAbsent(provider, k ->
                Timer.builder(prefix + "_completion_latency")
                        .description("Completion call latency")
                        .tag("provider", provider)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments the completion counter for a provider/outcome combination.
     */
    public void incrementCompletionCount(String provider, String outcome) {
        String key = provider + ":" + outcome;
        completionCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_completions_total")
                        .description("Total number of completion calls")
                        .tag("provider", provider)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Increments error counter.
     */
    public void incrementErrorCount(String provider, ErrorType errorType) {
        String key = provider + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of errors")
                        .tag("provider", provider)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Increments the handshake counter for a provider.
     */
    public void incrementHandshakeCount(String provider, boolean success) {
        String result = success ? "success" : "failure";
        String key = provider + ":" + result;
        handshakeCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_handshakes_total")
                        .description("Total number of handshakes")
                        .tag("provider", provider)
                        .tag("result", result)
                        .register(registry)
        ).increment();
    }

    /**
     * Updates the connected provider gauge.
     */
    public void setConnectedProviders(int value) {
        connectedProviders.set(value);
    }

    /**
     * Returns the Prometheus scrape output, or an empty string for other registries.
     */
    public String scrape() {
        if (registry instanceof PrometheusMeterRegistry prometheus) {
            return prometheus.scrape();
        }
        return "";
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
