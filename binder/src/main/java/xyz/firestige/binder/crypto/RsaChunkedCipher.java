package xyz.firestige.binder.crypto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.binder.exception.CryptoException;

import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.spec.OAEPParameterSpec;
import javax.crypto.spec.PSource;
import java.io.ByteArrayOutputStream;
import java.security.GeneralSecurityException;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.MGF1ParameterSpec;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;

/**
 * RSA-OAEP 分块加密
 * <p>
 * 明文按模长的一半切块，每块独立 OAEP(SHA-256) 加密后 base64 编码。
 * 解密时若 SHA-256 填充校验失败，回退到旧版本使用的 SHA-512。
 */
final class RsaChunkedCipher {

    private static final Logger log = LoggerFactory.getLogger(RsaChunkedCipher.class);

    static final int MIN_KEY_BITS = 2048;

    private static final String TRANSFORMATION = "RSA/ECB/OAEPPadding";

    private static final OAEPParameterSpec OAEP_SHA256 = new OAEPParameterSpec(
            "SHA-256", "MGF1", MGF1ParameterSpec.SHA256, PSource.PSpecified.DEFAULT);

    private static final OAEPParameterSpec OAEP_SHA512 = new OAEPParameterSpec(
            "SHA-512", "MGF1", MGF1ParameterSpec.SHA512, PSource.PSpecified.DEFAULT);

    List<String> encrypt(RSAPublicKey publicKey, byte[] plaintext) {
        int bits = publicKey.getModulus().bitLength();
        if (bits < MIN_KEY_BITS) {
            throw new CryptoException("RSA key must be at least " + MIN_KEY_BITS + " bits, got " + bits);
        }
        int chunkSize = chunkSize(publicKey);
        List<String> chunks = new ArrayList<>();
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            int offset = 0;
            do {
                int end = Math.min(plaintext.length, offset + chunkSize);
                cipher.init(Cipher.ENCRYPT_MODE, publicKey, OAEP_SHA256);
                byte[] block = cipher.doFinal(Arrays.copyOfRange(plaintext, offset, end));
                chunks.add(Base64.getEncoder().encodeToString(block));
                offset = end;
            } while (offset < plaintext.length);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("RSA encryption failed: " + e.getMessage(), e);
        }
        log.debug("RSA 加密完成, chunks: {}, chunkSize: {}", chunks.size(), chunkSize);
        return chunks;
    }

    byte[] decrypt(RSAPrivateKey privateKey, List<String> chunks) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (String chunk : chunks) {
            byte[] block;
            try {
                block = Base64.getDecoder().decode(chunk);
            } catch (IllegalArgumentException e) {
                throw new CryptoException("ciphertext chunk is not valid base64", e);
            }
            byte[] plain = decryptBlock(privateKey, block);
            out.write(plain, 0, plain.length);
        }
        return out.toByteArray();
    }

    private byte[] decryptBlock(RSAPrivateKey privateKey, byte[] block) {
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            try {
                cipher.init(Cipher.DECRYPT_MODE, privateKey, OAEP_SHA256);
                return cipher.doFinal(block);
            } catch (BadPaddingException e) {
                cipher.init(Cipher.DECRYPT_MODE, privateKey, OAEP_SHA512);
                return cipher.doFinal(block);
            }
        } catch (GeneralSecurityException e) {
            throw new CryptoException("RSA decryption failed: " + e.getMessage(), e);
        }
    }

    static int chunkSize(RSAPublicKey publicKey) {
        int modulusBytes = (publicKey.getModulus().bitLength() + 7) / 8;
        return modulusBytes / 2;
    }
}
