package xyz.firestige.binder.metrics;

/**
 * 无 MeterRegistry 时使用
 */
public class NoopMetricsRegistry implements MetricsRegistry {

    @Override
    public void incrementCounter(String name) {
    }

    @Override
    public void setGauge(String name, double value) {
    }
}
