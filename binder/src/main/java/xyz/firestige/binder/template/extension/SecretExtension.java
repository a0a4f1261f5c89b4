package xyz.firestige.binder.template.extension;

import xyz.firestige.binder.domain.secrets.SecretsDescriptor;
import xyz.firestige.binder.secrets.SecretsStore;
import xyz.firestige.binder.template.ExtensionResult;
import xyz.firestige.binder.template.Placeholder;
import xyz.firestige.binder.template.PlaceholderExtension;
import xyz.firestige.binder.template.ResolutionContext;

/**
 * {@code ${secret:NAME}} 与 {@code ${secret:NAME:ENV}}
 * <p>
 * 第三段是显式环境，覆盖上下文中的环境；找不到时直接抛出 SecretNotFoundException。
 */
public class SecretExtension implements PlaceholderExtension {

    private final SecretsStore store;
    private final SecretsDescriptor descriptor;

    public SecretExtension(SecretsStore store, SecretsDescriptor descriptor) {
        this.store = store;
        this.descriptor = descriptor;
    }

    @Override
    public ExtensionResult resolve(Placeholder placeholder, ResolutionContext context) {
        String explicitEnv = placeholder.hasDefault() && !placeholder.getDefaultValue().isBlank()
                ? placeholder.getDefaultValue().trim() : null;
        String value = store.getSecretValue(descriptor, placeholder.getPath(), context.getEnvironment(), explicitEnv);
        return ExtensionResult.resolved(value);
    }

    @Override
    public boolean defaultIsArgument() {
        return true;
    }
}
