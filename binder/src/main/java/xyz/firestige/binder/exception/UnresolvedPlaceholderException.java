package xyz.firestige.binder.exception;

/**
 * 占位符没有匹配的扩展解析，也没有默认值
 */
public class UnresolvedPlaceholderException extends BinderException {

    private final String token;

    public UnresolvedPlaceholderException(String token, String reason) {
        super(ErrorType.UNRESOLVED_PLACEHOLDER, "unresolved placeholder " + token
                + (reason != null ? ": " + reason : ""));
        this.token = token;
        addContext(CTX_KEY, token);
    }

    public String getToken() {
        return token;
    }
}
