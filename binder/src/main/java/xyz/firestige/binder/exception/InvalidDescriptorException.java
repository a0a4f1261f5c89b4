package xyz.firestige.binder.exception;

/**
 * 描述文件内容不合法，例如未知资源类型或非法 secretsConfig
 */
public class InvalidDescriptorException extends BinderException {

    public InvalidDescriptorException(String message) {
        super(ErrorType.CONFIGURATION_ERROR, message);
    }

    public InvalidDescriptorException(String message, Throwable cause) {
        super(ErrorType.CONFIGURATION_ERROR, message, cause);
    }
}
