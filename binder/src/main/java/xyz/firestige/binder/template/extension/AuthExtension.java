package xyz.firestige.binder.template.extension;

import xyz.firestige.binder.domain.secrets.AuthDescriptor;
import xyz.firestige.binder.domain.secrets.SecretsDescriptor;
import xyz.firestige.binder.template.ExtensionResult;
import xyz.firestige.binder.template.Placeholder;
import xyz.firestige.binder.template.PlaceholderExtension;
import xyz.firestige.binder.template.ResolutionContext;

/**
 * {@code ${auth:<provider>}} 返回 credentials，{@code ${auth:<provider>.<property>}} 返回指定属性
 */
public class AuthExtension implements PlaceholderExtension {

    private final SecretsDescriptor descriptor;

    public AuthExtension(SecretsDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    @Override
    public ExtensionResult resolve(Placeholder placeholder, ResolutionContext context) {
        String[] segments = placeholder.requireSegments(1);
        String[] parts = segments[0].split("\\.", 2);
        String provider = parts[0];
        String property = parts.length > 1 ? parts[1] : AuthDescriptor.CREDENTIALS;
        AuthDescriptor auth = descriptor.getAuth().get(provider);
        if (auth == null) {
            return ExtensionResult.notFound("auth provider " + provider + " is not configured");
        }
        if ("type".equals(property)) {
            return ExtensionResult.resolved(auth.getType());
        }
        String value = auth.getConfig().get(property);
        if (value == null) {
            return ExtensionResult.notFound("auth provider " + provider + " has no property " + property);
        }
        return ExtensionResult.resolved(value);
    }
}
