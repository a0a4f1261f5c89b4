package xyz.firestige.binder.crypto;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.ByteArrayOutputStream;
import java.security.GeneralSecurityException;

/**
 * HKDF-SHA256（RFC 5869）
 */
final class Hkdf {

    private static final String HMAC = "HmacSHA256";
    private static final int HASH_LEN = 32;

    private Hkdf() {
    }

    static byte[] derive(byte[] salt, byte[] ikm, byte[] info, int length) throws GeneralSecurityException {
        if (length > 255 * HASH_LEN) {
            throw new IllegalArgumentException("HKDF output length too large: " + length);
        }
        byte[] prk = extract(salt, ikm);
        return expand(prk, info, length);
    }

    private static byte[] extract(byte[] salt, byte[] ikm) throws GeneralSecurityException {
        byte[] effectiveSalt = (salt == null || salt.length == 0) ? new byte[HASH_LEN] : salt;
        Mac mac = Mac.getInstance(HMAC);
        mac.init(new SecretKeySpec(effectiveSalt, HMAC));
        return mac.doFinal(ikm);
    }

    private static byte[] expand(byte[] prk, byte[] info, int length) throws GeneralSecurityException {
        Mac mac = Mac.getInstance(HMAC);
        mac.init(new SecretKeySpec(prk, HMAC));
        ByteArrayOutputStream out = new ByteArrayOutputStream(length);
        byte[] previous = new byte[0];
        int counter = 1;
        while (out.size() < length) {
            mac.update(previous);
            if (info != null) {
                mac.update(info);
            }
            mac.update((byte) counter++);
            previous = mac.doFinal();
            out.write(previous, 0, Math.min(previous.length, length - out.size()));
        }
        return out.toByteArray();
    }
}
