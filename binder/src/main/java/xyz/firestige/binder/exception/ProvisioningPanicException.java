package xyz.firestige.binder.exception;

/**
 * 部署步骤中捕获的非预期异常，保留原始消息
 */
public class ProvisioningPanicException extends BinderException {

    private final String step;
    private final String originalMessage;

    public ProvisioningPanicException(String step, Throwable cause) {
        super(ErrorType.PROVISIONING_PANIC,
                String.format("step %s panicked: %s", step, describe(cause)), cause);
        this.step = step;
        this.originalMessage = cause.getMessage();
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    }

    public String getStep() {
        return step;
    }

    public String getOriginalMessage() {
        return originalMessage;
    }
}
