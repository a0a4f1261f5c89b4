package xyz.firestige.binder.domain.resource;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.binder.domain.resource.config.BucketConfig;
import xyz.firestige.binder.domain.resource.config.PostgresConfig;
import xyz.firestige.binder.domain.resource.config.RedisConfig;
import xyz.firestige.binder.domain.resource.config.S3BucketConfig;
import xyz.firestige.binder.exception.InvalidDescriptorException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 资源类型注册表：类型标签 → 配置类
 * <p>
 * 解码使用 Jackson {@code convertValue}，随后执行 Bean Validation。
 * 新增资源类型只需注册，无需修改引擎中的分支。
 */
public class ResourceTypeRegistry {

    private static final Logger log = LoggerFactory.getLogger(ResourceTypeRegistry.class);

    private final Map<String, Class<? extends ResourceConfig>> types = new LinkedHashMap<>();
    private final ObjectMapper objectMapper;
    private final Validator validator;

    public ResourceTypeRegistry(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    /**
     * 注册内置类型：bucket / s3-bucket / postgres / redis
     */
    public static ResourceTypeRegistry withDefaults(ObjectMapper objectMapper, Validator validator) {
        return new ResourceTypeRegistry(objectMapper, validator)
                .register(ResourceTypes.BUCKET, BucketConfig.class)
                .register(ResourceTypes.S3_BUCKET, S3BucketConfig.class)
                .register(ResourceTypes.POSTGRES, PostgresConfig.class)
                .register(ResourceTypes.REDIS, RedisConfig.class);
    }

    public ResourceTypeRegistry register(String type, Class<? extends ResourceConfig> configClass) {
        Class<? extends ResourceConfig> previous = types.putIfAbsent(type, configClass);
        if (previous != null && previous != configClass) {
            throw new IllegalStateException("resource type " + type + " already registered with " + previous.getName());
        }
        log.debug("注册资源类型: {} -> {}", type, configClass.getSimpleName());
        return this;
    }

    public boolean isRegistered(String type) {
        return types.containsKey(type);
    }

    public Set<String> registeredTypes() {
        return Collections.unmodifiableSet(types.keySet());
    }

    public ResourceConfig decode(ResourceDescriptor descriptor) {
        Class<? extends ResourceConfig> configClass = types.get(descriptor.getType());
        if (configClass == null) {
            throw new InvalidDescriptorException(String.format(
                    "unknown resource type %s for resource %s, registered types: %s",
                    descriptor.getType(), descriptor.getName(), types.keySet()));
        }
        ResourceConfig config;
        try {
            config = objectMapper.convertValue(descriptor.getConfig(), configClass);
        } catch (IllegalArgumentException e) {
            throw new InvalidDescriptorException(String.format(
                    "invalid config for resource %s: %s", descriptor, e.getMessage()), e);
        }
        Set<ConstraintViolation<ResourceConfig>> violations = validator.validate(config);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new InvalidDescriptorException(String.format(
                    "invalid config for resource %s: %s", descriptor, details));
        }
        return config;
    }

    public <T extends ResourceConfig> T decode(ResourceDescriptor descriptor, Class<T> expected) {
        ResourceConfig config = decode(descriptor);
        if (!expected.isInstance(config)) {
            throw new InvalidDescriptorException(String.format(
                    "resource %s decodes to %s, expected %s",
                    descriptor, config.getClass().getSimpleName(), expected.getSimpleName()));
        }
        return expected.cast(config);
    }
}
