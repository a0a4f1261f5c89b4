package xyz.firestige.binder.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 一次解析请求的数据包：所属 Stack、密钥解析使用的环境，以及附加属性
 */
public final class ResolutionContext {

    private final String stackName;
    private final String environment;
    private final Map<String, Object> attributes;

    private ResolutionContext(String stackName, String environment, Map<String, Object> attributes) {
        this.stackName = stackName;
        this.environment = environment;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static ResolutionContext of(String stackName, String environment) {
        return new ResolutionContext(stackName, environment, Collections.emptyMap());
    }

    public ResolutionContext withAttribute(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(attributes);
        copy.put(key, value);
        return new ResolutionContext(stackName, environment, copy);
    }

    public String getStackName() {
        return stackName;
    }

    /**
     * 密钥解析使用的环境（子 Stack 的环境或 parentEnv 覆盖值）
     */
    public String getEnvironment() {
        return environment;
    }

    public <T> Optional<T> getAttribute(String key, Class<T> type) {
        Object value = attributes.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }
}
