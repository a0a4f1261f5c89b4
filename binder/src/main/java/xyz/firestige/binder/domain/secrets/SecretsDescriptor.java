package xyz.firestige.binder.domain.secrets;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 版本化的密钥描述文件（secrets.yaml）
 * <p>
 * v1.0 只有共享 {@code values}；v2.0 增加 {@code environments}。
 * 缺少 {@code environments} 的文档按空 map 处理，因此 v1.0 文档就是合法的 v2.0 文档。
 * 所有值均为密文，解密只在解析时临时进行。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"schemaVersion", "auth", "values", "environments"})
public class SecretsDescriptor {

    public static final String SCHEMA_V1 = "1.0";
    public static final String SCHEMA_V2 = "2.0";

    private String schemaVersion = SCHEMA_V1;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, AuthDescriptor> auth = new LinkedHashMap<>();

    private Map<String, String> values = new LinkedHashMap<>();

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, EnvironmentSecrets> environments = new LinkedHashMap<>();

    public Optional<String> getEnvironmentValue(String environment, String name) {
        EnvironmentSecrets env = environments.get(environment);
        if (env == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(env.getValues().get(name));
    }

    public boolean hasEnvironment(String environment) {
        return environment != null && environments.containsKey(environment);
    }

    @JsonIgnore
    public List<String> getEnvironmentNames() {
        return new ArrayList<>(environments.keySet());
    }

    /**
     * 仅当存在环境级密钥时视为 v2
     */
    @JsonIgnore
    public boolean isV2Schema() {
        return !environments.isEmpty();
    }

    public SecretsDescriptor copy() {
        SecretsDescriptor copy = new SecretsDescriptor();
        copy.schemaVersion = schemaVersion;
        copy.values = new LinkedHashMap<>(values);
        auth.forEach((k, v) -> copy.auth.put(k, v.copy()));
        environments.forEach((k, v) -> copy.environments.put(k, v.copy()));
        return copy;
    }

    public String getSchemaVersion() {
        return schemaVersion;
    }

    public void setSchemaVersion(String schemaVersion) {
        this.schemaVersion = schemaVersion;
    }

    public Map<String, AuthDescriptor> getAuth() {
        return auth;
    }

    public void setAuth(Map<String, AuthDescriptor> auth) {
        this.auth = auth != null ? new LinkedHashMap<>(auth) : new LinkedHashMap<>();
    }

    public Map<String, String> getValues() {
        return values;
    }

    public void setValues(Map<String, String> values) {
        this.values = values != null ? new LinkedHashMap<>(values) : new LinkedHashMap<>();
    }

    public Map<String, EnvironmentSecrets> getEnvironments() {
        return environments;
    }

    public void setEnvironments(Map<String, EnvironmentSecrets> environments) {
        this.environments = environments != null ? new LinkedHashMap<>(environments) : new LinkedHashMap<>();
    }
}
