package xyz.firestige.binder.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsRegistryTest {

    @Test
    void incrementCounter_accumulates() {
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        MicrometerMetricsRegistry metrics = new MicrometerMetricsRegistry(meters);

        metrics.incrementCounter(MetricsRegistry.DEPLOY_COMPLETED);
        metrics.incrementCounter(MetricsRegistry.DEPLOY_COMPLETED);
        metrics.incrementCounter(MetricsRegistry.DEPLOY_ABORTED);

        assertEquals(2.0, meters.get(MetricsRegistry.DEPLOY_COMPLETED).counter().count());
        assertEquals(1.0, meters.get(MetricsRegistry.DEPLOY_ABORTED).counter().count());
    }

    @Test
    void setGauge_keepsLatestValue() {
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        MicrometerMetricsRegistry metrics = new MicrometerMetricsRegistry(meters);

        metrics.setGauge(MetricsRegistry.DEPLOY_ENV_VARIABLES, 7);
        metrics.setGauge(MetricsRegistry.DEPLOY_ENV_VARIABLES, 3);

        assertEquals(3.0, meters.get(MetricsRegistry.DEPLOY_ENV_VARIABLES).gauge().value());
        assertEquals(1, meters.find(MetricsRegistry.DEPLOY_ENV_VARIABLES).gauges().size());
    }

    @Test
    void noopRegistry_acceptsEverything() {
        NoopMetricsRegistry metrics = new NoopMetricsRegistry();

        assertDoesNotThrow(() -> {
            metrics.incrementCounter("anything");
            metrics.setGauge("anything", 1.0);
        });
    }
}
