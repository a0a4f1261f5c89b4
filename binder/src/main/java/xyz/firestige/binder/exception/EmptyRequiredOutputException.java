package xyz.firestige.binder.exception;

/**
 * 跨 Stack 必需输出不存在或为空字符串
 */
public class EmptyRequiredOutputException extends BinderException {

    private final String exportKey;
    private final String reference;

    public EmptyRequiredOutputException(String reference, String exportKey, String detail) {
        super(ErrorType.EMPTY_REQUIRED_OUTPUT, String.format(
                "required output %s of stack %s is empty: %s", exportKey, reference, detail));
        this.exportKey = exportKey;
        this.reference = reference;
        addContext(CTX_KEY, exportKey);
    }

    public String getExportKey() {
        return exportKey;
    }

    public String getReference() {
        return reference;
    }
}
