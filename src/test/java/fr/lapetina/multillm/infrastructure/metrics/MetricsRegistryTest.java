package fr.lapetina.multillm.infrastructure.metrics;

import fr.lapetina.multillm.domain.model.ErrorType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    @Test
    @DisplayName("should count completions and errors per provider")
    void shouldCountPerProvider() {
        MetricsRegistry metrics = new MetricsRegistry("test", new SimpleMeterRegistry());

        metrics.incrementCompletionCount("openai", "success");
        metrics.incrementCompletionCount("openai", "success");
        metrics.incrementErrorCount("anthropic", ErrorType.TRANSPORT_ERROR);
        metrics.recordCompletionLatency("openai", Duration.ofMillis(120));

        assertThat(metrics.getRegistry().find("test_completions_total")
                .tags("provider", "openai", "outcome", "success").counter().count()).isEqualTo(2.0);
        assertThat(metrics.getRegistry().find("test_errors_total")
                .tags("provider", "anthropic", "type", "TRANSPORT_ERROR").counter().count()).isEqualTo(1.0);
        assertThat(metrics.getRegistry().find("test_completion_latency").timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("should expose the connected provider gauge")
    void shouldExposeConnectedGauge() {
        MetricsRegistry metrics = new MetricsRegistry("test", new SimpleMeterRegistry());

        metrics.setConnectedProviders(2);

        assertThat(metrics.getRegistry().find("test_connected_providers").gauge().value()).isEqualTo(2.0);
        assertThat(metrics.scrape()).isEmpty();
    }

    @Test
    @DisplayName("should scrape Prometheus text by default")
    void shouldScrapePrometheus() {
        try (MetricsRegistry metrics = new MetricsRegistry("multillm")) {
            metrics.incrementHandshakeCount("openai", true);

            assertThat(metrics.scrape())
                    .contains("multillm_handshakes_total")
                    .contains("provider=\"openai\"");
        }
    }
}
