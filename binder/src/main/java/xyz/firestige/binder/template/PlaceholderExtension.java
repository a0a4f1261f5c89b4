package xyz.firestige.binder.template;

/**
 * 单个命名空间的占位符解析函数
 */
@FunctionalInterface
public interface PlaceholderExtension {

    ExtensionResult resolve(Placeholder placeholder, ResolutionContext context);

    /**
     * 第三段是否为扩展参数而非默认值，例如 {@code ${secret:NAME:ENV}} 中的环境名
     */
    default boolean defaultIsArgument() {
        return false;
    }
}
