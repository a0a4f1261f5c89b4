package xyz.firestige.binder.secrets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.binder.domain.secrets.EnvironmentSecretsConfig;
import xyz.firestige.binder.domain.secrets.SecretsConfigMode;
import xyz.firestige.binder.exception.InvalidDescriptorException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 按父 Stack 的 {@code secretsConfig} 过滤暴露给子环境的密钥
 * <p>
 * 操作的是密文，不做解密；映射值可为原始密钥名或 {@code ${secret:KEY}}。
 */
public class SecretResolver {

    private static final Logger log = LoggerFactory.getLogger(SecretResolver.class);

    public Map<String, String> resolve(Map<String, String> base, EnvironmentSecretsConfig config) {
        if (base == null) {
            throw new InvalidDescriptorException("base secrets must not be nil");
        }
        if (config == null) {
            return new LinkedHashMap<>(base);
        }
        SecretsConfigMode mode = config.mode();
        if (mode == null) {
            throw new InvalidDescriptorException("unknown secretsConfig mode: " + config.getRawMode());
        }
        Map<String, String> result;
        switch (mode) {
            case INCLUDE:
                result = include(base, config);
                break;
            case EXCLUDE:
                result = exclude(base, config);
                break;
            case OVERRIDE:
                result = override(base, config);
                break;
            default:
                throw new InvalidDescriptorException("unknown secretsConfig mode: " + config.getRawMode());
        }
        log.debug("secretsConfig 过滤完成, mode: {}, base: {}, result: {}", mode.value(), base.size(), result.size());
        return result;
    }

    private Map<String, String> include(Map<String, String> base, EnvironmentSecretsConfig config) {
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : config.getSecrets().entrySet()) {
            String source = SecretReferences.extractName(e.getValue());
            String value = base.get(source);
            if (value == null) {
                throw new InvalidDescriptorException(String.format(
                        "secretsConfig include references unknown secret %s (mapped as %s)", source, e.getKey()));
            }
            result.put(e.getKey(), value);
        }
        return result;
    }

    private Map<String, String> exclude(Map<String, String> base, EnvironmentSecretsConfig config) {
        if (!config.isInheritAll()) {
            throw new InvalidDescriptorException("secretsConfig exclude mode requires inheritAll: true");
        }
        Map<String, String> result = new LinkedHashMap<>(base);
        for (Map.Entry<String, String> e : config.getSecrets().entrySet()) {
            result.remove(e.getKey());
            result.remove(SecretReferences.extractName(e.getValue()));
        }
        return result;
    }

    private Map<String, String> override(Map<String, String> base, EnvironmentSecretsConfig config) {
        Map<String, String> result = new LinkedHashMap<>(base);
        for (Map.Entry<String, String> e : config.getSecrets().entrySet()) {
            String source = SecretReferences.extractName(e.getValue());
            String value = base.get(source);
            if (value == null) {
                throw new InvalidDescriptorException(String.format(
                        "secretsConfig override references unknown secret %s (mapped as %s)", source, e.getKey()));
            }
            result.put(e.getKey(), value);
        }
        return result;
    }

    /**
     * 校验配置，返回所有问题（为空表示合法）
     */
    public List<String> validate(EnvironmentSecretsConfig config) {
        if (config == null) {
            return Collections.emptyList();
        }
        List<String> problems = new ArrayList<>();
        if (config.mode() == null) {
            problems.add("invalid secretsConfig mode: " + config.getRawMode() + " (expected include, exclude or override)");
        } else if (config.mode() == SecretsConfigMode.EXCLUDE && !config.isInheritAll()) {
            problems.add("secretsConfig exclude mode requires inheritAll: true");
        }
        config.getSecrets().forEach((key, value) -> {
            if (value == null || value.isBlank()) {
                problems.add("secretsConfig entry " + key + " has empty value");
            }
        });
        return problems;
    }

    /**
     * 经过滤后子环境可见的密钥名
     */
    public List<String> availableSecrets(Map<String, String> base, EnvironmentSecretsConfig config) {
        return new ArrayList<>(resolve(base, config).keySet());
    }
}
