package xyz.firestige.binder.template.extension;

import xyz.firestige.binder.template.ExtensionResult;
import xyz.firestige.binder.template.Placeholder;
import xyz.firestige.binder.template.PlaceholderExtension;
import xyz.firestige.binder.template.ResolutionContext;

import java.util.Map;
import java.util.function.Function;

/**
 * {@code ${resource:<resourceName>.<field>}}，路径必须恰好两段
 */
public class ResourceExtension implements PlaceholderExtension {

    private final Function<String, Map<String, String>> lookup;

    /**
     * @param lookup 资源名 → 模板字段，未注册返回 null
     */
    public ResourceExtension(Function<String, Map<String, String>> lookup) {
        this.lookup = lookup;
    }

    @Override
    public ExtensionResult resolve(Placeholder placeholder, ResolutionContext context) {
        String[] segments = placeholder.requireSegments(2);
        Map<String, String> fields = lookup.apply(segments[0]);
        if (fields == null) {
            return ExtensionResult.notFound("resource " + segments[0] + " is not used by this stack");
        }
        String value = fields.get(segments[1]);
        if (value == null) {
            return ExtensionResult.notFound("resource " + segments[0] + " has no field " + segments[1]
                    + ", available: " + fields.keySet());
        }
        return ExtensionResult.resolved(value);
    }
}
