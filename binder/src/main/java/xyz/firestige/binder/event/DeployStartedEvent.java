package xyz.firestige.binder.event;

public class DeployStartedEvent extends DeployEvent {

    private final boolean preview;

    public DeployStartedEvent(String stackName, String environment, boolean preview) {
        super(stackName, environment);
        this.preview = preview;
        setMessage(preview ? "预览开始" : "部署开始");
    }

    public boolean isPreview() {
        return preview;
    }
}
