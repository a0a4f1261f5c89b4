package xyz.firestige.binder.metrics;

public interface MetricsRegistry {

    String DEPLOY_COMPLETED = "binder.deploy.completed";
    String DEPLOY_ABORTED = "binder.deploy.aborted";
    String DEPLOY_ENV_VARIABLES = "binder.deploy.env.variables";

    void incrementCounter(String name);

    void setGauge(String name, double value);
}
