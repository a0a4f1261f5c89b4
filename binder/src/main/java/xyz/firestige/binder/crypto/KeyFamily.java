package xyz.firestige.binder.crypto;

import xyz.firestige.binder.exception.CryptoException;

import java.security.Key;
import java.security.interfaces.EdECKey;
import java.security.interfaces.RSAKey;

/**
 * 支持的密钥族，按密钥结构识别而非存储标记
 */
public enum KeyFamily {

    RSA("ssh-rsa"),

    ED25519("ssh-ed25519");

    private final String sshType;

    KeyFamily(String sshType) {
        this.sshType = sshType;
    }

    public String getSshType() {
        return sshType;
    }

    public static KeyFamily of(Key key) {
        if (key instanceof RSAKey) {
            return RSA;
        }
        if (key instanceof EdECKey) {
            return ED25519;
        }
        throw new CryptoException("unsupported key type: " + (key == null ? "null" : key.getAlgorithm()));
    }
}
