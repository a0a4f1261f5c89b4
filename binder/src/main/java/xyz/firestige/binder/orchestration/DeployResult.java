package xyz.firestige.binder.orchestration;

import xyz.firestige.binder.exception.BinderException;
import xyz.firestige.binder.exception.FailureInfo;

import java.util.Optional;

/**
 * 部署结果
 * <p>
 * 成功时携带下发的 {@link FlushPayload}（预览模式下为未下发的预览内容），
 * 失败时携带 {@link FailureInfo} 和原始异常。
 */
public final class DeployResult {

    private final String stackName;
    private final String environment;
    private final DeployState state;
    private final boolean preview;
    private final FlushPayload payload;
    private final FailureInfo failureInfo;
    private final BinderException error;

    private DeployResult(String stackName, String environment, DeployState state, boolean preview,
                         FlushPayload payload, FailureInfo failureInfo, BinderException error) {
        this.stackName = stackName;
        this.environment = environment;
        this.state = state;
        this.preview = preview;
        this.payload = payload;
        this.failureInfo = failureInfo;
        this.error = error;
    }

    public static DeployResult success(String stackName, String environment, boolean preview, FlushPayload payload) {
        return new DeployResult(stackName, environment, DeployState.DONE, preview, payload, null, null);
    }

    public static DeployResult aborted(String stackName, String environment, boolean preview,
                                       FailureInfo failureInfo, BinderException error) {
        return new DeployResult(stackName, environment, DeployState.ABORTED, preview, null, failureInfo, error);
    }

    public boolean isSuccess() {
        return state == DeployState.DONE;
    }

    public String getStackName() {
        return stackName;
    }

    public String getEnvironment() {
        return environment;
    }

    public DeployState getState() {
        return state;
    }

    public boolean isPreview() {
        return preview;
    }

    public Optional<FlushPayload> getPayload() {
        return Optional.ofNullable(payload);
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }

    public Optional<BinderException> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return "DeployResult{" + stackName + "@" + environment + ", state=" + state
                + (failureInfo != null ? ", failure=" + failureInfo.getErrorMessage() : "") + '}';
    }
}
