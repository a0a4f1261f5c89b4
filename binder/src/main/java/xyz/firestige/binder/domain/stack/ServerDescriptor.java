package xyz.firestige.binder.domain.stack;

import xyz.firestige.binder.domain.resource.ResourceDescriptor;
import xyz.firestige.binder.domain.secrets.EnvironmentSecretsConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 基础设施侧描述（server.yaml）：按环境声明的资源和密钥暴露规则
 */
public class ServerDescriptor {

    private Map<String, List<ResourceDescriptor>> resources = new LinkedHashMap<>();

    private Map<String, EnvironmentSecretsConfig> secretsConfig = new LinkedHashMap<>();

    /**
     * 从另一个 Stack 继承 secretsConfig 和 secrets.yaml，为空时不继承
     */
    private String secretsInherit;

    public List<ResourceDescriptor> resourcesFor(String environment) {
        List<ResourceDescriptor> list = resources.get(environment);
        return list != null ? Collections.unmodifiableList(list) : Collections.emptyList();
    }

    public Optional<ResourceDescriptor> findResource(String environment, String name) {
        return resourcesFor(environment).stream()
                .filter(r -> name.equals(r.getName()))
                .findFirst();
    }

    public boolean inheritsSecrets() {
        return secretsInherit != null && !secretsInherit.isBlank();
    }

    public ServerDescriptor copy() {
        ServerDescriptor copy = new ServerDescriptor();
        resources.forEach((env, list) -> {
            List<ResourceDescriptor> copied = new ArrayList<>();
            list.forEach(r -> copied.add(r.copy()));
            copy.resources.put(env, copied);
        });
        secretsConfig.forEach((env, cfg) -> copy.secretsConfig.put(env, cfg.copy()));
        copy.secretsInherit = secretsInherit;
        return copy;
    }

    public Map<String, List<ResourceDescriptor>> getResources() {
        return resources;
    }

    public void setResources(Map<String, List<ResourceDescriptor>> resources) {
        this.resources = resources != null ? new LinkedHashMap<>(resources) : new LinkedHashMap<>();
    }

    public Map<String, EnvironmentSecretsConfig> getSecretsConfig() {
        return secretsConfig;
    }

    public void setSecretsConfig(Map<String, EnvironmentSecretsConfig> secretsConfig) {
        this.secretsConfig = secretsConfig != null ? new LinkedHashMap<>(secretsConfig) : new LinkedHashMap<>();
    }

    public String getSecretsInherit() {
        return secretsInherit;
    }

    public void setSecretsInherit(String secretsInherit) {
        this.secretsInherit = secretsInherit;
    }
}
