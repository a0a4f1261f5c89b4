package xyz.firestige.binder.template.extension;

import xyz.firestige.binder.template.ExtensionResult;
import xyz.firestige.binder.template.Placeholder;
import xyz.firestige.binder.template.PlaceholderExtension;
import xyz.firestige.binder.template.ResolutionContext;

/**
 * 占住命名空间但不解析，token 保留到计算上下文收集完成后的轮次
 */
public final class DeferredExtension implements PlaceholderExtension {

    public static final DeferredExtension INSTANCE = new DeferredExtension();

    private DeferredExtension() {
    }

    @Override
    public ExtensionResult resolve(Placeholder placeholder, ResolutionContext context) {
        return ExtensionResult.notApplicable();
    }
}
