package xyz.firestige.binder.event;

public class DeployCompletedEvent extends DeployEvent {

    private final boolean preview;
    private final int envVariables;
    private final int secretEnvVariables;

    public DeployCompletedEvent(String stackName, String environment, boolean preview,
                                int envVariables, int secretEnvVariables) {
        super(stackName, environment);
        this.preview = preview;
        this.envVariables = envVariables;
        this.secretEnvVariables = secretEnvVariables;
        setMessage("部署完成, 环境变量: " + envVariables + ", 密文变量: " + secretEnvVariables);
    }

    public boolean isPreview() {
        return preview;
    }

    public int getEnvVariables() {
        return envVariables;
    }

    public int getSecretEnvVariables() {
        return secretEnvVariables;
    }
}
