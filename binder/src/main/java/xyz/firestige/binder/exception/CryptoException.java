package xyz.firestige.binder.exception;

/**
 * 加解密失败，包括密钥类型不匹配
 */
public class CryptoException extends BinderException {

    public CryptoException(String message) {
        super(ErrorType.CRYPTO_FAILURE, message);
    }

    public CryptoException(String message, Throwable cause) {
        super(ErrorType.CRYPTO_FAILURE, message, cause);
    }
}
