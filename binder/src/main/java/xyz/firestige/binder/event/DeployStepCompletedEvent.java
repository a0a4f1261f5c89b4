package xyz.firestige.binder.event;

import java.time.Duration;

/**
 * 单个部署步骤完成
 */
public class DeployStepCompletedEvent extends DeployEvent {

    private final String step;
    private final Duration duration;

    public DeployStepCompletedEvent(String stackName, String environment, String step, Duration duration) {
        super(stackName, environment);
        this.step = step;
        this.duration = duration;
        setMessage("步骤完成: " + step + ", 耗时 " + duration.toMillis() + "ms");
    }

    public String getStep() {
        return step;
    }

    public Duration getDuration() {
        return duration;
    }
}
