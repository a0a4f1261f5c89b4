package xyz.firestige.binder.domain.secrets;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 父 Stack 按环境声明的密钥暴露规则（server.yaml 中的 {@code secretsConfig}）
 * <p>
 * {@code secrets} 的值为原始密钥名或 {@code ${secret:KEY}} 引用。
 */
public class EnvironmentSecretsConfig {

    @JsonProperty("mode")
    private String rawMode;

    private boolean inheritAll;

    private Map<String, String> secrets = new LinkedHashMap<>();

    public EnvironmentSecretsConfig() {
    }

    public EnvironmentSecretsConfig(SecretsConfigMode mode, boolean inheritAll, Map<String, String> secrets) {
        this.rawMode = mode != null ? mode.value() : null;
        this.inheritAll = inheritAll;
        setSecrets(secrets);
    }

    public EnvironmentSecretsConfig copy() {
        EnvironmentSecretsConfig copy = new EnvironmentSecretsConfig();
        copy.rawMode = rawMode;
        copy.inheritAll = inheritAll;
        copy.setSecrets(secrets);
        return copy;
    }

    /**
     * 解析后的模式，未知取值返回 null
     */
    public SecretsConfigMode mode() {
        return SecretsConfigMode.fromValue(rawMode);
    }

    public String getRawMode() {
        return rawMode;
    }

    public void setRawMode(String rawMode) {
        this.rawMode = rawMode;
    }

    public boolean isInheritAll() {
        return inheritAll;
    }

    public void setInheritAll(boolean inheritAll) {
        this.inheritAll = inheritAll;
    }

    public Map<String, String> getSecrets() {
        return secrets;
    }

    public void setSecrets(Map<String, String> secrets) {
        this.secrets = secrets != null ? new LinkedHashMap<>(secrets) : new LinkedHashMap<>();
    }
}
