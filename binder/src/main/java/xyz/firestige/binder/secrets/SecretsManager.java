package xyz.firestige.binder.secrets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.binder.crypto.SecretCipher;
import xyz.firestige.binder.domain.secrets.EnvironmentSecrets;
import xyz.firestige.binder.domain.secrets.SecretsDescriptor;
import xyz.firestige.binder.exception.SecretNotFoundException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 密钥管理操作：添加、列出、删除、查看
 * <p>
 * 每次只加密受影响的那个值，其它密文保持不变。
 * 删除某环境最后一个值时移除整个环境条目。
 * 同一描述文件不允许并发编辑，由调用方串行化。
 */
public class SecretsManager {

    private static final Logger log = LoggerFactory.getLogger(SecretsManager.class);

    private final SecretCipher cipher;
    private final SecretsDescriptorRepository repository;

    public SecretsManager(SecretCipher cipher, SecretsDescriptorRepository repository) {
        this.cipher = cipher;
        this.repository = repository;
    }

    /**
     * @param environment 为空时写入共享 values
     */
    public void addSecret(SecretsDescriptor descriptor, String name, String plaintext, String environment) {
        requireName(name);
        String encrypted = cipher.encrypt(plaintext);
        if (isShared(environment)) {
            descriptor.getValues().put(name, encrypted);
        } else {
            descriptor.getEnvironments()
                    .computeIfAbsent(environment, e -> new EnvironmentSecrets())
                    .getValues().put(name, encrypted);
            descriptor.setSchemaVersion(SecretsDescriptor.SCHEMA_V2);
        }
        log.info("添加密钥: {}, 作用域: {}", name, scope(environment));
    }

    public List<String> listSecrets(SecretsDescriptor descriptor, String environment) {
        List<String> names;
        if (isShared(environment)) {
            names = new ArrayList<>(descriptor.getValues().keySet());
        } else {
            EnvironmentSecrets env = descriptor.getEnvironments().get(environment);
            names = env != null ? new ArrayList<>(env.getValues().keySet()) : new ArrayList<>();
        }
        Collections.sort(names);
        return names;
    }

    /**
     * @return 是否删除了值
     */
    public boolean deleteSecret(SecretsDescriptor descriptor, String name, String environment) {
        if (isShared(environment)) {
            boolean removed = descriptor.getValues().remove(name) != null;
            log.info("删除共享密钥: {}, 结果: {}", name, removed);
            return removed;
        }
        Map<String, EnvironmentSecrets> environments = descriptor.getEnvironments();
        EnvironmentSecrets env = environments.get(environment);
        if (env == null || env.getValues().remove(name) == null) {
            log.info("删除密钥: {}, 环境 {} 中不存在", name, environment);
            return false;
        }
        if (env.getValues().isEmpty()) {
            environments.remove(environment);
            log.info("环境 {} 已无密钥, 移除环境条目", environment);
        }
        log.info("删除密钥: {}, 环境: {}", name, environment);
        return true;
    }

    public String revealSecret(SecretsDescriptor descriptor, String name, String environment) {
        String encrypted;
        if (isShared(environment)) {
            encrypted = descriptor.getValues().get(name);
            if (encrypted == null) {
                throw new SecretNotFoundException(name, List.of(SecretNotFoundException.SHARED_SCOPE));
            }
        } else {
            encrypted = descriptor.getEnvironmentValue(environment, name)
                    .orElseThrow(() -> new SecretNotFoundException(name, List.of(environment)));
        }
        return cipher.decrypt(encrypted);
    }

    // ========== 文件级操作 ==========

    public void addSecret(Path file, String name, String plaintext, String environment) {
        SecretsDescriptor descriptor = repository.load(file);
        addSecret(descriptor, name, plaintext, environment);
        repository.save(file, descriptor);
    }

    public List<String> listSecrets(Path file, String environment) {
        return listSecrets(repository.load(file), environment);
    }

    public boolean deleteSecret(Path file, String name, String environment) {
        SecretsDescriptor descriptor = repository.load(file);
        boolean removed = deleteSecret(descriptor, name, environment);
        if (removed) {
            repository.save(file, descriptor);
        }
        return removed;
    }

    private static boolean isShared(String environment) {
        return environment == null || environment.isBlank();
    }

    private static String scope(String environment) {
        return isShared(environment) ? SecretNotFoundException.SHARED_SCOPE : environment;
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("secret name must not be blank");
        }
    }
}
