package xyz.firestige.binder.crypto;

import xyz.firestige.binder.exception.CryptoException;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Ed25519 密钥的混合加密
 * <p>
 * 每次加密生成 32 字节随机 salt，与原始公钥一起经 HKDF-SHA256 派生出对称密钥，
 * 再用 ChaCha20-Poly1305 加密。输出格式：{@code salt(32) || nonce(12) || ciphertext+tag}。
 */
final class Ed25519HybridCipher {

    static final byte[] INFO = "ed25519-chacha20poly1305".getBytes(StandardCharsets.UTF_8);

    private static final String TRANSFORMATION = "ChaCha20-Poly1305";
    private static final int SALT_LEN = 32;
    private static final int NONCE_LEN = 12;
    private static final int KEY_LEN = 32;
    private static final int TAG_LEN = 16;

    private final SecureRandom random;

    Ed25519HybridCipher(SecureRandom random) {
        this.random = random;
    }

    byte[] encrypt(byte[] rawPublicKey, byte[] plaintext) {
        byte[] salt = new byte[SALT_LEN];
        byte[] nonce = new byte[NONCE_LEN];
        random.nextBytes(salt);
        random.nextBytes(nonce);
        try {
            byte[] key = Hkdf.derive(salt, rawPublicKey, INFO, KEY_LEN);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "ChaCha20"), new IvParameterSpec(nonce));
            byte[] sealed = cipher.doFinal(plaintext);
            byte[] out = new byte[SALT_LEN + NONCE_LEN + sealed.length];
            System.arraycopy(salt, 0, out, 0, SALT_LEN);
            System.arraycopy(nonce, 0, out, SALT_LEN, NONCE_LEN);
            System.arraycopy(sealed, 0, out, SALT_LEN + NONCE_LEN, sealed.length);
            return out;
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Ed25519 encryption failed: " + e.getMessage(), e);
        }
    }

    byte[] decrypt(byte[] rawPublicKey, byte[] data) {
        if (data.length < SALT_LEN + NONCE_LEN + TAG_LEN) {
            throw new CryptoException("Ed25519 ciphertext too short: " + data.length + " bytes");
        }
        byte[] salt = Arrays.copyOfRange(data, 0, SALT_LEN);
        byte[] nonce = Arrays.copyOfRange(data, SALT_LEN, SALT_LEN + NONCE_LEN);
        byte[] sealed = Arrays.copyOfRange(data, SALT_LEN + NONCE_LEN, data.length);
        try {
            byte[] key = Hkdf.derive(salt, rawPublicKey, INFO, KEY_LEN);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "ChaCha20"), new IvParameterSpec(nonce));
            return cipher.doFinal(sealed);
        } catch (AEADBadTagException e) {
            throw new CryptoException("Ed25519 decryption failed: authentication tag mismatch (wrong key?)", e);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Ed25519 decryption failed: " + e.getMessage(), e);
        }
    }
}
