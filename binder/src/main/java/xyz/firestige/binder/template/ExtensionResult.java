package xyz.firestige.binder.template;

/**
 * 扩展对单个占位符的处理结果
 */
public final class ExtensionResult {

    public enum Kind {
        /**
         * 已解析
         */
        RESOLVED,
        /**
         * 不由本扩展处理，原样保留给后续轮次
         */
        NOT_APPLICABLE,
        /**
         * 命名空间匹配但没有值
         */
        NOT_FOUND
    }

    private static final ExtensionResult NOT_APPLICABLE = new ExtensionResult(Kind.NOT_APPLICABLE, null);

    private final Kind kind;
    private final String value;

    private ExtensionResult(Kind kind, String value) {
        this.kind = kind;
        this.value = value;
    }

    public static ExtensionResult resolved(String value) {
        return new ExtensionResult(Kind.RESOLVED, value != null ? value : "");
    }

    public static ExtensionResult notApplicable() {
        return NOT_APPLICABLE;
    }

    /**
     * @param reason 未找到原因，出现在错误消息中
     */
    public static ExtensionResult notFound(String reason) {
        return new ExtensionResult(Kind.NOT_FOUND, reason);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * RESOLVED 时为解析值，NOT_FOUND 时为原因
     */
    public String getValue() {
        return value;
    }
}
