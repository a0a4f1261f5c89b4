package xyz.firestige.binder.crypto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.binder.exception.CryptoException;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.interfaces.EdECPrivateKey;
import java.security.interfaces.EdECPublicKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.util.Base64;
import java.util.List;

/**
 * 密钥负载加解密入口
 * <p>
 * 支持两种密钥族：
 * <ul>
 *   <li>RSA（≥2048 位）：OAEP 分块加密，支持超过单个 RSA 块的明文</li>
 *   <li>Ed25519：HKDF-SHA256 派生对称密钥 + ChaCha20-Poly1305</li>
 * </ul>
 * 解密时根据私钥结构自动识别密钥族。加密结果非确定性，同一明文每次加密结果不同。
 * <p>
 * Ed25519 解密既接受 {@link PrivateKey}，也接受 {@link KeyPair}；
 * 仅有私钥时由种子重新推导公钥。
 */
public class CryptoProvider {

    private static final Logger log = LoggerFactory.getLogger(CryptoProvider.class);

    private final RsaChunkedCipher rsa = new RsaChunkedCipher();
    private final Ed25519HybridCipher ed25519;

    public CryptoProvider() {
        this(new SecureRandom());
    }

    public CryptoProvider(SecureRandom random) {
        this.ed25519 = new Ed25519HybridCipher(random);
    }

    public EncryptedPayload encrypt(PublicKey publicKey, String plaintext) {
        if (plaintext == null) {
            throw new CryptoException("plaintext must not be null");
        }
        byte[] bytes = plaintext.getBytes(StandardCharsets.UTF_8);
        switch (KeyFamily.of(publicKey)) {
            case RSA:
                return new EncryptedPayload(rsa.encrypt((RSAPublicKey) publicKey, bytes));
            case ED25519:
                byte[] sealed = ed25519.encrypt(KeyCodec.rawEd25519PublicKey(publicKey), bytes);
                return new EncryptedPayload(List.of(Base64.getEncoder().encodeToString(sealed)));
            default:
                throw new CryptoException("unsupported public key: " + publicKey.getAlgorithm());
        }
    }

    public String decrypt(PrivateKey privateKey, EncryptedPayload payload) {
        switch (KeyFamily.of(privateKey)) {
            case RSA:
                return new String(rsa.decrypt((RSAPrivateKey) privateKey, payload.getChunks()), StandardCharsets.UTF_8);
            case ED25519:
                PublicKey derived = KeyCodec.deriveEd25519PublicKey((EdECPrivateKey) privateKey);
                return decryptEd25519(derived, payload);
            default:
                throw new CryptoException("unsupported private key: " + privateKey.getAlgorithm());
        }
    }

    public String decrypt(KeyPair keyPair, EncryptedPayload payload) {
        if (keyPair == null || keyPair.getPrivate() == null) {
            throw new CryptoException("key pair has no private key");
        }
        if (keyPair.getPrivate() instanceof EdECPrivateKey && keyPair.getPublic() instanceof EdECPublicKey) {
            return decryptEd25519(keyPair.getPublic(), payload);
        }
        return decrypt(keyPair.getPrivate(), payload);
    }

    public String decrypt(PrivateKey privateKey, String encoded) {
        return decrypt(privateKey, parse(encoded));
    }

    public String decrypt(KeyPair keyPair, String encoded) {
        return decrypt(keyPair, parse(encoded));
    }

    private String decryptEd25519(PublicKey publicKey, EncryptedPayload payload) {
        if (payload.getChunks().size() != 1) {
            log.debug("Ed25519 负载包含 {} 个分块, 可能使用了 RSA 密钥加密", payload.getChunks().size());
            throw new CryptoException("Ed25519 ciphertext must be a single chunk, got "
                    + payload.getChunks().size() + " (encrypted with an RSA key?)");
        }
        byte[] data;
        try {
            data = Base64.getDecoder().decode(payload.getChunks().get(0));
        } catch (IllegalArgumentException e) {
            throw new CryptoException("ciphertext is not valid base64", e);
        }
        byte[] plain = ed25519.decrypt(KeyCodec.rawEd25519PublicKey(publicKey), data);
        return new String(plain, StandardCharsets.UTF_8);
    }

    private static EncryptedPayload parse(String encoded) {
        try {
            return EncryptedPayload.parse(encoded);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new CryptoException("invalid ciphertext: " + e.getMessage(), e);
        }
    }
}
