package xyz.firestige.binder.domain.stack;

import xyz.firestige.binder.domain.secrets.SecretsDescriptor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 可部署单元
 * <p>
 * 同时持有基础设施侧（server）、客户端侧（按环境的 {@link StackConfig}）和密钥描述。
 * 一次操作期间视为不可变，引擎只修改 {@link #copy()} 得到的副本。
 */
public class Stack {

    private String name;

    private SecretsDescriptor secrets = new SecretsDescriptor();

    private ServerDescriptor server = new ServerDescriptor();

    private Map<String, StackConfig> environments = new LinkedHashMap<>();

    public Stack() {
    }

    public Stack(String name) {
        this.name = name;
    }

    public Optional<StackConfig> configFor(String environment) {
        return Optional.ofNullable(environments.get(environment));
    }

    public Stack copy() {
        Stack copy = new Stack(name);
        copy.secrets = secrets.copy();
        copy.server = server.copy();
        environments.forEach((env, cfg) -> copy.environments.put(env, cfg.copy()));
        return copy;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public SecretsDescriptor getSecrets() {
        return secrets;
    }

    public void setSecrets(SecretsDescriptor secrets) {
        this.secrets = secrets != null ? secrets : new SecretsDescriptor();
    }

    public ServerDescriptor getServer() {
        return server;
    }

    public void setServer(ServerDescriptor server) {
        this.server = server != null ? server : new ServerDescriptor();
    }

    public Map<String, StackConfig> getEnvironments() {
        return environments;
    }

    public void setEnvironments(Map<String, StackConfig> environments) {
        this.environments = environments != null ? new LinkedHashMap<>(environments) : new LinkedHashMap<>();
    }
}
