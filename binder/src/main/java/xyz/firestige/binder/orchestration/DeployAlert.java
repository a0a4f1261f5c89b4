package xyz.firestige.binder.orchestration;

import xyz.firestige.binder.exception.FailureInfo;

import java.time.LocalDateTime;

public final class DeployAlert {

    private final String stackName;
    private final String environment;
    private final DeployState failedStep;
    private final FailureInfo failureInfo;
    private final LocalDateTime occurredOn;

    public DeployAlert(String stackName, String environment, DeployState failedStep, FailureInfo failureInfo) {
        this.stackName = stackName;
        this.environment = environment;
        this.failedStep = failedStep;
        this.failureInfo = failureInfo;
        this.occurredOn = LocalDateTime.now();
    }

    public String getStackName() {
        return stackName;
    }

    public String getEnvironment() {
        return environment;
    }

    public DeployState getFailedStep() {
        return failedStep;
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }

    public LocalDateTime getOccurredOn() {
        return occurredOn;
    }

    public String getTitle() {
        return String.format("Deploy of %s to %s failed at %s", stackName, environment, failedStep);
    }

    @Override
    public String toString() {
        return "DeployAlert{" + getTitle() + ": " + failureInfo.getErrorMessage() + '}';
    }
}
