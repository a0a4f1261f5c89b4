package xyz.firestige.binder.orchestration;

import xyz.firestige.binder.compute.ResourceDependency;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 下发给工作负载的最终配置
 * <p>
 * 占位符已全部解析；secrets 中为明文，toString 只输出键名。
 */
public final class FlushPayload {

    private final String stackName;
    private final String environment;
    private final String workloadType;
    private final Map<String, String> env;
    private final Map<String, String> secrets;
    private final Map<String, Object> config;
    private final Map<String, Map<String, String>> resourceFields;
    private final List<ResourceDependency> dependencies;

    private FlushPayload(Builder builder) {
        this.stackName = builder.stackName;
        this.environment = builder.environment;
        this.workloadType = builder.workloadType;
        this.env = Collections.unmodifiableMap(new LinkedHashMap<>(builder.env));
        this.secrets = Collections.unmodifiableMap(new LinkedHashMap<>(builder.secrets));
        this.config = Collections.unmodifiableMap(new LinkedHashMap<>(builder.config));
        this.resourceFields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.resourceFields));
        this.dependencies = List.copyOf(builder.dependencies);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getStackName() {
        return stackName;
    }

    public String getEnvironment() {
        return environment;
    }

    public String getWorkloadType() {
        return workloadType;
    }

    public Map<String, String> getEnv() {
        return env;
    }

    public Map<String, String> getSecrets() {
        return secrets;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    /**
     * 本次部署注册的 resource 模板字段，按资源名分组
     */
    public Map<String, Map<String, String>> getResourceFields() {
        return resourceFields;
    }

    public List<ResourceDependency> getDependencies() {
        return dependencies;
    }

    @Override
    public String toString() {
        return "FlushPayload{stack=" + stackName + ", env=" + environment
                + ", type=" + workloadType
                + ", envVars=" + env
                + ", secrets=" + secrets.keySet() + "=***"
                + ", dependencies=" + dependencies.size() + '}';
    }

    public static class Builder {
        private String stackName;
        private String environment;
        private String workloadType;
        private Map<String, String> env = new LinkedHashMap<>();
        private Map<String, String> secrets = new LinkedHashMap<>();
        private Map<String, Object> config = new LinkedHashMap<>();
        private Map<String, Map<String, String>> resourceFields = new LinkedHashMap<>();
        private List<ResourceDependency> dependencies = List.of();

        public Builder stackName(String stackName) {
            this.stackName = stackName;
            return this;
        }

        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }

        public Builder workloadType(String workloadType) {
            this.workloadType = workloadType;
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = env;
            return this;
        }

        public Builder secrets(Map<String, String> secrets) {
            this.secrets = secrets;
            return this;
        }

        public Builder config(Map<String, Object> config) {
            this.config = config;
            return this;
        }

        public Builder resourceFields(Map<String, Map<String, String>> resourceFields) {
            this.resourceFields = resourceFields;
            return this;
        }

        public Builder dependencies(List<ResourceDependency> dependencies) {
            this.dependencies = dependencies;
            return this;
        }

        public FlushPayload build() {
            return new FlushPayload(this);
        }
    }
}
