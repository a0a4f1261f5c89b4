package xyz.firestige.binder.domain.secrets;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单个环境的加密密钥值
 */
public class EnvironmentSecrets {

    private Map<String, String> values = new LinkedHashMap<>();

    public EnvironmentSecrets() {
    }

    public EnvironmentSecrets(Map<String, String> values) {
        setValues(values);
    }

    public EnvironmentSecrets copy() {
        return new EnvironmentSecrets(values);
    }

    public Map<String, String> getValues() {
        return values;
    }

    public void setValues(Map<String, String> values) {
        this.values = values != null ? new LinkedHashMap<>(values) : new LinkedHashMap<>();
    }
}
