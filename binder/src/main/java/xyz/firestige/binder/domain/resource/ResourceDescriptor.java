package xyz.firestige.binder.domain.resource;

import xyz.firestige.binder.domain.Copies;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 资源声明 {@code {type, name, config}}
 * <p>
 * {@code config} 保留声明时的原始结构，占位符解析完成后再由
 * {@link ResourceTypeRegistry} 按 {@code type} 解码为具体的 {@link ResourceConfig}。
 */
public class ResourceDescriptor {

    private String type;

    private String name;

    private Map<String, Object> config = new LinkedHashMap<>();

    public ResourceDescriptor() {
    }

    public ResourceDescriptor(String type, String name, Map<String, Object> config) {
        this.type = type;
        this.name = name;
        setConfig(config);
    }

    public ResourceDescriptor copy() {
        return new ResourceDescriptor(type, name, Copies.copyMap(config));
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public void setConfig(Map<String, Object> config) {
        this.config = config != null ? new LinkedHashMap<>(config) : new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return type + ":" + name;
    }
}
