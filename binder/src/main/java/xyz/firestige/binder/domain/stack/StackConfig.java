package xyz.firestige.binder.domain.stack;

import xyz.firestige.binder.domain.Copies;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 客户端 Stack 在某个环境下的配置（client.yaml 的 stacks.&lt;env&gt;）
 */
public class StackConfig {

    /**
     * 工作负载类型，由外部 WorkloadConfigurer 解释
     */
    private String type;

    private String parentStack;

    /**
     * 显式指定使用父 Stack 的哪个环境
     */
    private String parentEnv;

    /**
     * 使用的父 Stack 资源名
     */
    private List<String> uses = new ArrayList<>();

    private List<StackDependency> dependencies = new ArrayList<>();

    private Map<String, String> env = new LinkedHashMap<>();

    private Map<String, String> secrets = new LinkedHashMap<>();

    private Map<String, Object> config = new LinkedHashMap<>();

    public StackConfig copy() {
        StackConfig copy = new StackConfig();
        copy.type = type;
        copy.parentStack = parentStack;
        copy.parentEnv = parentEnv;
        copy.uses = new ArrayList<>(uses);
        dependencies.forEach(d -> copy.dependencies.add(d.copy()));
        copy.env = new LinkedHashMap<>(env);
        copy.secrets = new LinkedHashMap<>(secrets);
        copy.config = Copies.copyMap(config);
        return copy;
    }

    public boolean hasParent() {
        return parentStack != null && !parentStack.isBlank();
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getParentStack() {
        return parentStack;
    }

    public void setParentStack(String parentStack) {
        this.parentStack = parentStack;
    }

    public String getParentEnv() {
        return parentEnv;
    }

    public void setParentEnv(String parentEnv) {
        this.parentEnv = parentEnv;
    }

    public List<String> getUses() {
        return uses;
    }

    public void setUses(List<String> uses) {
        this.uses = uses != null ? new ArrayList<>(uses) : new ArrayList<>();
    }

    public List<StackDependency> getDependencies() {
        return dependencies;
    }

    public void setDependencies(List<StackDependency> dependencies) {
        this.dependencies = dependencies != null ? new ArrayList<>(dependencies) : new ArrayList<>();
    }

    public Map<String, String> getEnv() {
        return env;
    }

    public void setEnv(Map<String, String> env) {
        this.env = env != null ? new LinkedHashMap<>(env) : new LinkedHashMap<>();
    }

    public Map<String, String> getSecrets() {
        return secrets;
    }

    public void setSecrets(Map<String, String> secrets) {
        this.secrets = secrets != null ? new LinkedHashMap<>(secrets) : new LinkedHashMap<>();
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public void setConfig(Map<String, Object> config) {
        this.config = config != null ? new LinkedHashMap<>(config) : new LinkedHashMap<>();
    }
}
