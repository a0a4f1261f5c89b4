package xyz.firestige.binder.template.extension;

import xyz.firestige.binder.template.ExtensionResult;
import xyz.firestige.binder.template.Placeholder;
import xyz.firestige.binder.template.PlaceholderExtension;
import xyz.firestige.binder.template.ResolutionContext;

import java.util.Map;
import java.util.function.BiFunction;

/**
 * {@code ${dependency:<name>.<resource>.<property>}}，路径必须三段
 */
public class DependencyExtension implements PlaceholderExtension {

    private final BiFunction<String, String, Map<String, String>> lookup;

    /**
     * @param lookup (依赖名, 资源名) → 模板字段，未注册返回 null
     */
    public DependencyExtension(BiFunction<String, String, Map<String, String>> lookup) {
        this.lookup = lookup;
    }

    @Override
    public ExtensionResult resolve(Placeholder placeholder, ResolutionContext context) {
        String[] segments = placeholder.requireSegments(3);
        Map<String, String> fields = lookup.apply(segments[0], segments[1]);
        if (fields == null) {
            return ExtensionResult.notFound("dependency " + segments[0] + " has no resource " + segments[1]);
        }
        String value = fields.get(segments[2]);
        if (value == null) {
            return ExtensionResult.notFound("dependency " + segments[0] + "." + segments[1]
                    + " has no property " + segments[2]);
        }
        return ExtensionResult.resolved(value);
    }
}
