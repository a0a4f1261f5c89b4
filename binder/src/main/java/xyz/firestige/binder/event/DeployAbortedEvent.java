package xyz.firestige.binder.event;

import xyz.firestige.binder.exception.FailureInfo;

/**
 * 部署中止，携带失败信息
 */
public class DeployAbortedEvent extends DeployEvent {

    private final FailureInfo failureInfo;

    public DeployAbortedEvent(String stackName, String environment, FailureInfo failureInfo) {
        super(stackName, environment);
        this.failureInfo = failureInfo;
        setMessage("部署中止于 " + failureInfo.getFailedAt() + ": " + failureInfo.getErrorMessage());
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }
}
