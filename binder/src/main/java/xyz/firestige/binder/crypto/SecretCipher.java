package xyz.firestige.binder.crypto;

import xyz.firestige.binder.exception.CryptoException;

import java.security.KeyPair;
import java.security.PublicKey;

/**
 * 绑定了一组密钥的密钥值加解密器
 * <p>
 * 只有公钥时仅能加密（例如在 CI 中添加密钥），解密需要私钥。
 */
public class SecretCipher {

    private final CryptoProvider crypto;
    private final PublicKey publicKey;
    private final KeyPair keyPair;

    private SecretCipher(CryptoProvider crypto, PublicKey publicKey, KeyPair keyPair) {
        this.crypto = crypto;
        this.publicKey = publicKey;
        this.keyPair = keyPair;
    }

    public static SecretCipher of(CryptoProvider crypto, KeyPair keyPair) {
        return new SecretCipher(crypto, keyPair.getPublic(), keyPair);
    }

    public static SecretCipher encryptOnly(CryptoProvider crypto, PublicKey publicKey) {
        return new SecretCipher(crypto, publicKey, null);
    }

    /**
     * @param publicKey     authorized_keys 格式公钥
     * @param privateKeyPem PEM 私钥，可为空
     */
    public static SecretCipher fromEncodedKeys(CryptoProvider crypto, String publicKey, String privateKeyPem) {
        PublicKey pub = KeyCodec.parsePublicKey(publicKey);
        if (privateKeyPem == null || privateKeyPem.isBlank()) {
            return encryptOnly(crypto, pub);
        }
        return of(crypto, new KeyPair(pub, KeyCodec.parsePrivateKey(privateKeyPem)));
    }

    public String encrypt(String plaintext) {
        return crypto.encrypt(publicKey, plaintext).encode();
    }

    public String decrypt(String ciphertext) {
        if (keyPair == null) {
            throw new CryptoException("no private key configured, cannot decrypt secrets");
        }
        return crypto.decrypt(keyPair, ciphertext);
    }

    public boolean canDecrypt() {
        return keyPair != null;
    }

    public KeyFamily getKeyFamily() {
        return KeyFamily.of(publicKey);
    }
}
