package xyz.firestige.binder.secrets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.binder.crypto.SecretCipher;
import xyz.firestige.binder.domain.secrets.EnvironmentSecrets;
import xyz.firestige.binder.domain.secrets.SecretsDescriptor;
import xyz.firestige.binder.exception.SecretNotFoundException;

import java.util.ArrayList;
import java.util.List;

/**
 * 环境感知的密钥查找
 * <p>
 * 查找顺序：
 * <ol>
 *   <li>指定了 explicitEnv：只查该环境</li>
 *   <li>否则 ambientEnv 在描述中存在时先查该环境</li>
 *   <li>再查共享 values</li>
 *   <li>仍未找到抛出 {@link SecretNotFoundException}，列出所有已搜索的作用域</li>
 * </ol>
 * 环境级值总是优先于共享值，共享值只作为兜底。
 */
public class SecretsStore {

    private static final Logger log = LoggerFactory.getLogger(SecretsStore.class);

    private final SecretCipher cipher;

    public SecretsStore(SecretCipher cipher) {
        this.cipher = cipher;
    }

    public String getSecretValue(SecretsDescriptor descriptor, String name, String ambientEnv, String explicitEnv) {
        return cipher.decrypt(getEncryptedValue(descriptor, name, ambientEnv, explicitEnv));
    }

    /**
     * 只定位密文，不解密
     */
    public String getEncryptedValue(SecretsDescriptor descriptor, String name, String ambientEnv, String explicitEnv) {
        List<String> searched = new ArrayList<>();
        if (explicitEnv != null) {
            searched.add(explicitEnv);
            String value = lookupEnvironment(descriptor, explicitEnv, name);
            if (value != null) {
                log.debug("密钥 {} 命中显式环境 {}", name, explicitEnv);
                return value;
            }
            throw new SecretNotFoundException(name, searched).withStack(null, explicitEnv);
        }
        if (ambientEnv != null && !ambientEnv.isEmpty() && descriptor.hasEnvironment(ambientEnv)) {
            searched.add(ambientEnv);
            String value = lookupEnvironment(descriptor, ambientEnv, name);
            if (value != null) {
                log.debug("密钥 {} 命中环境 {}", name, ambientEnv);
                return value;
            }
        }
        searched.add(SecretNotFoundException.SHARED_SCOPE);
        String shared = descriptor.getValues().get(name);
        if (shared != null) {
            log.debug("密钥 {} 使用共享值", name);
            return shared;
        }
        throw new SecretNotFoundException(name, searched).withStack(null, ambientEnv);
    }

    private String lookupEnvironment(SecretsDescriptor descriptor, String environment, String name) {
        EnvironmentSecrets env = descriptor.getEnvironments().get(environment);
        return env != null ? env.getValues().get(name) : null;
    }
}
