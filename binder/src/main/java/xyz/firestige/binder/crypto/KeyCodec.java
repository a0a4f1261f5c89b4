package xyz.firestige.binder.crypto;

import xyz.firestige.binder.exception.CryptoException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.interfaces.EdECPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.NamedParameterSpec;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.RSAPublicKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;
import java.util.Base64;

/**
 * 密钥编解码工具
 * <p>
 * 公钥使用 SSH authorized_keys 格式（{@code ssh-rsa AAAA... comment}），
 * 私钥使用 PEM（PKCS#8 {@code PRIVATE KEY} 或 PKCS#1 {@code RSA PRIVATE KEY}）。
 */
public final class KeyCodec {

    private static final int ED25519_KEY_LEN = 32;

    // X.509 SubjectPublicKeyInfo 前缀: SEQUENCE { SEQUENCE { OID 1.3.101.112 }, BIT STRING }
    private static final byte[] ED25519_X509_PREFIX = {
            0x30, 0x2a, 0x30, 0x05, 0x06, 0x03, 0x2b, 0x65, 0x70, 0x03, 0x21, 0x00
    };

    // AlgorithmIdentifier { rsaEncryption, NULL }
    private static final byte[] RSA_ALGORITHM_ID = {
            0x30, 0x0d, 0x06, 0x09, 0x2a, (byte) 0x86, 0x48, (byte) 0x86, (byte) 0xf7, 0x0d, 0x01, 0x01, 0x01, 0x05, 0x00
    };

    private static final String PEM_PKCS8 = "PRIVATE KEY";
    private static final String PEM_PKCS1 = "RSA PRIVATE KEY";

    private KeyCodec() {
    }

    // ========== 生成 ==========

    public static KeyPair generateRsaKeyPair(int bits) {
        if (bits < RsaChunkedCipher.MIN_KEY_BITS) {
            throw new CryptoException("RSA key must be at least " + RsaChunkedCipher.MIN_KEY_BITS + " bits");
        }
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(bits);
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new CryptoException("failed to generate RSA key pair", e);
        }
    }

    public static KeyPair generateEd25519KeyPair() {
        try {
            return KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new CryptoException("failed to generate Ed25519 key pair", e);
        }
    }

    // ========== 公钥 ==========

    public static PublicKey parsePublicKey(String authorizedKey) {
        if (authorizedKey == null || authorizedKey.isBlank()) {
            throw new CryptoException("public key is empty");
        }
        String[] parts = authorizedKey.trim().split("\\s+");
        if (parts.length < 2) {
            throw new CryptoException("public key is not in authorized_keys format");
        }
        byte[] blob;
        try {
            blob = Base64.getDecoder().decode(parts[1]);
        } catch (IllegalArgumentException e) {
            throw new CryptoException("public key body is not valid base64", e);
        }
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(blob))) {
            String type = new String(readString(in), StandardCharsets.US_ASCII);
            if (!type.equals(parts[0])) {
                throw new CryptoException("public key type mismatch: " + parts[0] + " vs " + type);
            }
            if (KeyFamily.RSA.getSshType().equals(type)) {
                BigInteger e = new BigInteger(readString(in));
                BigInteger n = new BigInteger(readString(in));
                return KeyFactory.getInstance("RSA").generatePublic(new RSAPublicKeySpec(n, e));
            }
            if (KeyFamily.ED25519.getSshType().equals(type)) {
                return ed25519PublicKeyFromRaw(readString(in));
            }
            throw new CryptoException("unsupported public key type: " + type);
        } catch (IOException | GeneralSecurityException e) {
            throw new CryptoException("failed to parse public key: " + e.getMessage(), e);
        }
    }

    public static String formatPublicKey(PublicKey publicKey) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        KeyFamily family = KeyFamily.of(publicKey);
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            writeString(out, family.getSshType().getBytes(StandardCharsets.US_ASCII));
            if (family == KeyFamily.RSA) {
                RSAPublicKey rsa = (RSAPublicKey) publicKey;
                writeString(out, rsa.getPublicExponent().toByteArray());
                writeString(out, rsa.getModulus().toByteArray());
            } else {
                writeString(out, rawEd25519PublicKey(publicKey));
            }
        } catch (IOException e) {
            throw new CryptoException("failed to format public key", e);
        }
        return family.getSshType() + " " + Base64.getEncoder().encodeToString(bytes.toByteArray());
    }

    static byte[] rawEd25519PublicKey(PublicKey publicKey) {
        byte[] encoded = publicKey.getEncoded();
        if (encoded == null || encoded.length < ED25519_KEY_LEN) {
            throw new CryptoException("Ed25519 public key has no X.509 encoding");
        }
        return Arrays.copyOfRange(encoded, encoded.length - ED25519_KEY_LEN, encoded.length);
    }

    static PublicKey ed25519PublicKeyFromRaw(byte[] raw) throws GeneralSecurityException {
        if (raw.length != ED25519_KEY_LEN) {
            throw new InvalidKeySpecException("Ed25519 public key must be 32 bytes, got " + raw.length);
        }
        byte[] x509 = new byte[ED25519_X509_PREFIX.length + raw.length];
        System.arraycopy(ED25519_X509_PREFIX, 0, x509, 0, ED25519_X509_PREFIX.length);
        System.arraycopy(raw, 0, x509, ED25519_X509_PREFIX.length, raw.length);
        return KeyFactory.getInstance("Ed25519").generatePublic(new X509EncodedKeySpec(x509));
    }

    /**
     * 由 Ed25519 私钥种子重新推导公钥
     */
    static PublicKey deriveEd25519PublicKey(EdECPrivateKey privateKey) {
        byte[] seed = privateKey.getBytes()
                .orElseThrow(() -> new CryptoException("Ed25519 private key does not expose its seed"));
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("Ed25519");
            generator.initialize(NamedParameterSpec.ED25519, new FixedSeedRandom(seed));
            return generator.generateKeyPair().getPublic();
        } catch (GeneralSecurityException e) {
            throw new CryptoException("failed to derive Ed25519 public key", e);
        }
    }

    // ========== 私钥 ==========

    public static PrivateKey parsePrivateKey(String pem) {
        if (pem == null || pem.isBlank()) {
            throw new CryptoException("private key is empty");
        }
        String label = pemLabel(pem);
        byte[] der = pemBody(pem);
        try {
            if (PEM_PKCS1.equals(label)) {
                return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(wrapPkcs1(der)));
            }
            if (!PEM_PKCS8.equals(label)) {
                throw new CryptoException("unsupported private key format: " + label
                        + " (expected PKCS#8 PRIVATE KEY or RSA PRIVATE KEY)");
            }
            PKCS8EncodedKeySpec spec = new PKCS8EncodedKeySpec(der);
            try {
                return KeyFactory.getInstance("RSA").generatePrivate(spec);
            } catch (InvalidKeySpecException notRsa) {
                return KeyFactory.getInstance("Ed25519").generatePrivate(spec);
            }
        } catch (GeneralSecurityException e) {
            throw new CryptoException("failed to parse private key: " + e.getMessage(), e);
        }
    }

    public static String formatPrivateKey(PrivateKey privateKey) {
        String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII))
                .encodeToString(privateKey.getEncoded());
        return "-----BEGIN " + PEM_PKCS8 + "-----\n" + body + "\n-----END " + PEM_PKCS8 + "-----\n";
    }

    public static KeyPair parseKeyPair(String publicKey, String privateKeyPem) {
        return new KeyPair(parsePublicKey(publicKey), parsePrivateKey(privateKeyPem));
    }

    private static String pemLabel(String pem) {
        int begin = pem.indexOf("-----BEGIN ");
        if (begin < 0) {
            throw new CryptoException("private key is not PEM encoded");
        }
        int end = pem.indexOf("-----", begin + 11);
        if (end < 0) {
            throw new CryptoException("private key PEM header is incomplete");
        }
        return pem.substring(begin + 11, end).trim();
    }

    private static byte[] pemBody(String pem) {
        StringBuilder body = new StringBuilder();
        for (String line : pem.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("-----")) {
                continue;
            }
            body.append(trimmed);
        }
        try {
            return Base64.getDecoder().decode(body.toString());
        } catch (IllegalArgumentException e) {
            throw new CryptoException("private key PEM body is not valid base64", e);
        }
    }

    /**
     * PKCS#1 RSAPrivateKey 包装为 PKCS#8 PrivateKeyInfo
     */
    private static byte[] wrapPkcs1(byte[] pkcs1) {
        ByteArrayOutputStream info = new ByteArrayOutputStream();
        info.writeBytes(new byte[]{0x02, 0x01, 0x00});
        info.writeBytes(RSA_ALGORITHM_ID);
        info.write(0x04);
        info.writeBytes(derLength(pkcs1.length));
        info.writeBytes(pkcs1);
        byte[] content = info.toByteArray();

        ByteArrayOutputStream seq = new ByteArrayOutputStream();
        seq.write(0x30);
        seq.writeBytes(derLength(content.length));
        seq.writeBytes(content);
        return seq.toByteArray();
    }

    private static byte[] derLength(int length) {
        if (length < 0x80) {
            return new byte[]{(byte) length};
        }
        int bytes = length > 0xffff ? 3 : (length > 0xff ? 2 : 1);
        byte[] out = new byte[bytes + 1];
        out[0] = (byte) (0x80 | bytes);
        for (int i = 0; i < bytes; i++) {
            out[bytes - i] = (byte) (length >>> (8 * i));
        }
        return out;
    }

    private static byte[] readString(DataInputStream in) throws IOException {
        int len = in.readInt();
        if (len < 0 || len > in.available()) {
            throw new IOException("invalid length field: " + len);
        }
        byte[] buf = new byte[len];
        in.readFully(buf);
        return buf;
    }

    private static void writeString(DataOutputStream out, byte[] value) throws IOException {
        out.writeInt(value.length);
        out.write(value);
    }

    /**
     * 只返回固定种子的随机源，用于由私钥种子重建密钥对
     */
    private static final class FixedSeedRandom extends SecureRandom {

        private static final long serialVersionUID = 1L;

        private final byte[] seed;

        private FixedSeedRandom(byte[] seed) {
            this.seed = seed.clone();
        }

        @Override
        public void nextBytes(byte[] bytes) {
            System.arraycopy(seed, 0, bytes, 0, Math.min(seed.length, bytes.length));
        }
    }
}
