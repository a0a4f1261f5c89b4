package xyz.firestige.binder.compute;

import java.util.Objects;

/**
 * 计算处理器产出的一个工作负载环境变量
 */
public final class ComputeEnvVariable {

    private final String name;
    private final String value;
    private final boolean secret;
    private final String resourceType;
    private final String resourceName;
    private final String stackName;

    public ComputeEnvVariable(String name, String value, boolean secret,
                              String resourceType, String resourceName, String stackName) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = value;
        this.secret = secret;
        this.resourceType = resourceType;
        this.resourceName = resourceName;
        this.stackName = stackName;
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    public boolean isSecret() {
        return secret;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceName() {
        return resourceName;
    }

    public String getStackName() {
        return stackName;
    }

    @Override
    public String toString() {
        return "ComputeEnvVariable{" + name + "=" + (secret ? "***" : value)
                + ", source=" + resourceType + ":" + resourceName + "@" + stackName + '}';
    }
}
