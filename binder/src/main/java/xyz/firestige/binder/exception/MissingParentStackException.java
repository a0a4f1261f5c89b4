package xyz.firestige.binder.exception;

/**
 * 子 Stack 声明的父 Stack 无法解析
 */
public class MissingParentStackException extends BinderException {

    public MissingParentStackException(String message) {
        super(ErrorType.MISSING_PARENT_STACK, message);
    }

    public MissingParentStackException(String message, Throwable cause) {
        super(ErrorType.MISSING_PARENT_STACK, message, cause);
    }
}
