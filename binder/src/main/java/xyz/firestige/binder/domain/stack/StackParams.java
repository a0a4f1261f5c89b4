package xyz.firestige.binder.domain.stack;

import java.util.Objects;

/**
 * 一次部署的身份：Stack 名、目标环境、版本，以及所属组织和项目
 * <p>
 * 作为密钥名、导出键、环境变量名等确定性命名的种子，重复部署时保持稳定。
 */
public final class StackParams {

    private final String stackName;
    private final String environment;
    private final String version;
    private final String organization;
    private final String project;

    public StackParams(String stackName, String environment, String version, String organization, String project) {
        this.stackName = Objects.requireNonNull(stackName, "stackName");
        this.environment = Objects.requireNonNull(environment, "environment");
        this.version = version;
        this.organization = organization;
        this.project = project;
    }

    public StackParams withStackName(String otherStack) {
        return new StackParams(otherStack, environment, version, organization, project);
    }

    public String getStackName() {
        return stackName;
    }

    public String getEnvironment() {
        return environment;
    }

    public String getVersion() {
        return version;
    }

    public String getOrganization() {
        return organization;
    }

    public String getProject() {
        return project;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StackParams)) return false;
        StackParams that = (StackParams) o;
        return stackName.equals(that.stackName) && environment.equals(that.environment)
                && Objects.equals(version, that.version) && Objects.equals(organization, that.organization)
                && Objects.equals(project, that.project);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stackName, environment, version, organization, project);
    }

    @Override
    public String toString() {
        return "StackParams{" + stackName + "@" + environment + (version != null ? ", version=" + version : "") + '}';
    }
}
