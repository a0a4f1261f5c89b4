package xyz.firestige.binder.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 绑定引擎基础异常类
 * 所有解析、密钥、跨 Stack 引用和编排异常的基类
 */
public class BinderException extends RuntimeException {

    public static final String CTX_STACK = "stackName";
    public static final String CTX_ENVIRONMENT = "environment";
    public static final String CTX_KEY = "key";

    /**
     * 错误码
     */
    private final String errorCode;

    /**
     * 错误类型
     */
    private final ErrorType errorType;

    /**
     * 上下文信息（stackName / environment / key）
     */
    private final Map<String, Object> context = new LinkedHashMap<>();

    public BinderException(String message) {
        this(ErrorType.SYSTEM_ERROR, message);
    }

    public BinderException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
        this.errorCode = errorType.name();
    }

    public BinderException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.errorCode = errorType.name();
    }

    /**
     * 添加上下文信息，已存在的键不会被覆盖
     */
    public BinderException addContext(String key, Object value) {
        if (value != null) {
            this.context.putIfAbsent(key, value);
        }
        return this;
    }

    public BinderException withStack(String stackName, String environment) {
        addContext(CTX_STACK, stackName);
        addContext(CTX_ENVIRONMENT, environment);
        return this;
    }

    /**
     * 消息附带上下文，例如 {@code secret not found [stackName=api, environment=prod]}
     */
    @Override
    public String getMessage() {
        String base = super.getMessage();
        if (context.isEmpty()) {
            return base;
        }
        StringBuilder sb = new StringBuilder(base == null ? "" : base).append(" [");
        boolean first = true;
        for (Map.Entry<String, Object> e : context.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(e.getKey()).append('=').append(e.getValue());
            first = false;
        }
        return sb.append(']').toString();
    }

    /**
     * 转换为 FailureInfo
     */
    public FailureInfo toFailureInfo(String failedAt) {
        FailureInfo info = new FailureInfo(errorCode, getMessage(), errorType);
        info.setFailedAt(failedAt);
        Object stack = context.get(CTX_STACK);
        Object env = context.get(CTX_ENVIRONMENT);
        info.setStackName(stack != null ? stack.toString() : null);
        info.setEnvironment(env != null ? env.toString() : null);
        if (getCause() != null) {
            info.setStackTrace(FailureInfo.getStackTraceAsString(this));
        }
        return info;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
