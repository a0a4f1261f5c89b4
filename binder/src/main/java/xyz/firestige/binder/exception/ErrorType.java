package xyz.firestige.binder.exception;

/**
 * 错误类型枚举
 * 用于分类绑定引擎中的不同错误，便于告警和诊断
 */
public enum ErrorType {

    /**
     * 占位符无对应扩展且无默认值
     */
    UNRESOLVED_PLACEHOLDER("占位符无法解析"),

    /**
     * 占位符路径段数不正确
     */
    MALFORMED_PLACEHOLDER("占位符格式错误"),

    /**
     * 密钥不存在
     */
    SECRET_NOT_FOUND("密钥不存在"),

    /**
     * 跨 Stack 输出为空或不存在
     */
    EMPTY_REQUIRED_OUTPUT("必需输出为空"),

    /**
     * 父 Stack 无法解析
     */
    MISSING_PARENT_STACK("父 Stack 不存在"),

    /**
     * 远端 Stack 状态读取失败或超时
     */
    STATE_READ_FAILURE("状态读取失败"),

    /**
     * 计算处理器的一次性初始化命令失败
     */
    BOOTSTRAP_FAILURE("资源初始化失败"),

    /**
     * 加解密失败
     */
    CRYPTO_FAILURE("加解密失败"),

    /**
     * 步骤中出现未预期异常
     */
    PROVISIONING_PANIC("部署步骤异常"),

    /**
     * 部署被取消
     */
    DEPLOY_CANCELLED("部署已取消"),

    /**
     * 描述文件或配置错误
     */
    CONFIGURATION_ERROR("配置错误"),

    /**
     * 系统错误
     */
    SYSTEM_ERROR("系统错误");

    private final String description;

    ErrorType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
