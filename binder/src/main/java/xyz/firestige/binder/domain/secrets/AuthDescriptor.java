package xyz.firestige.binder.domain.secrets;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 云厂商认证信息，例如 {@code type: gcp-service-account, config: {projectId, credentials}}
 */
public class AuthDescriptor {

    public static final String CREDENTIALS = "credentials";

    private String type;

    private Map<String, String> config = new LinkedHashMap<>();

    public AuthDescriptor() {
    }

    public AuthDescriptor(String type, Map<String, String> config) {
        this.type = type;
        setConfig(config);
    }

    public AuthDescriptor copy() {
        return new AuthDescriptor(type, config);
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public Map<String, String> getConfig() {
        return config;
    }

    public void setConfig(Map<String, String> config) {
        this.config = config != null ? new LinkedHashMap<>(config) : new LinkedHashMap<>();
    }
}
