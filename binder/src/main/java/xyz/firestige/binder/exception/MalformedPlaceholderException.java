package xyz.firestige.binder.exception;

/**
 * 占位符路径段数不正确，例如 {@code ${dependency:a.b}} 缺少属性段
 */
public class MalformedPlaceholderException extends BinderException {

    private final String token;
    private final int expectedSegments;
    private final int actualSegments;

    public MalformedPlaceholderException(String token, int expectedSegments, int actualSegments) {
        super(ErrorType.MALFORMED_PLACEHOLDER, String.format(
                "malformed placeholder %s: expected %d path segments but got %d",
                token, expectedSegments, actualSegments));
        this.token = token;
        this.expectedSegments = expectedSegments;
        this.actualSegments = actualSegments;
        addContext(CTX_KEY, token);
    }

    public String getToken() {
        return token;
    }

    public int getExpectedSegments() {
        return expectedSegments;
    }

    public int getActualSegments() {
        return actualSegments;
    }
}
