package xyz.firestige.binder.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import xyz.firestige.binder.domain.stack.StackConfig;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * client.yaml：按环境的客户端配置
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientDescriptor {

    private String schemaVersion;

    private Map<String, StackConfig> stacks = new LinkedHashMap<>();

    public String getSchemaVersion() {
        return schemaVersion;
    }

    public void setSchemaVersion(String schemaVersion) {
        this.schemaVersion = schemaVersion;
    }

    public Map<String, StackConfig> getStacks() {
        return stacks;
    }

    public void setStacks(Map<String, StackConfig> stacks) {
        this.stacks = stacks != null ? new LinkedHashMap<>(stacks) : new LinkedHashMap<>();
    }
}
