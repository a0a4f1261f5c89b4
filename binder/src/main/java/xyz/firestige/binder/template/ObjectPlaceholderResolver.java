package xyz.firestige.binder.template;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 对象图占位符解析器
 * <p>
 * 遍历 List / Map 的值以及 POJO 字段，对字符串原地执行 {@link PlaceholderEngine#resolve}。
 * Map 的键不参与解析。已访问对象按引用去重，允许环形结构。
 * 需要两轮解析时使用 {@link #resolveDeferring}，第二轮不会重新扫描第一轮写入的值。
 */
public class ObjectPlaceholderResolver {

    private static final Logger log = LoggerFactory.getLogger(ObjectPlaceholderResolver.class);

    private final PlaceholderEngine engine;

    public ObjectPlaceholderResolver(PlaceholderEngine engine) {
        this.engine = engine;
    }

    /**
     * @return 被替换的字符串数量
     */
    public int resolve(Object root, ResolutionContext context, ExtensionRegistry extensions) {
        return walk(root, context, extensions, null);
    }

    /**
     * 解析对象图并记录仍含延迟占位符的位置，后续轮次通过 {@link DeferredPlaceholders#complete} 只补全这些位置
     */
    public DeferredPlaceholders resolveDeferring(Object root, ResolutionContext context, ExtensionRegistry extensions) {
        List<DeferredPlaceholders.Site> sites = new ArrayList<>();
        int replaced = walk(root, context, extensions, sites);
        return new DeferredPlaceholders(engine, replaced, sites);
    }

    @SuppressWarnings("unchecked")
    private int walk(Object root, ResolutionContext context, ExtensionRegistry extensions,
                     List<DeferredPlaceholders.Site> sites) {
        if (root == null) return 0;
        int replacedCount = 0;
        Set<Object> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Object> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Object current = stack.pop();
            if (!visited.add(current)) continue;
            if (current instanceof List<?> list) {
                for (int i = 0; i < list.size(); i++) {
                    Object val = list.get(i);
                    if (val instanceof String s) {
                        int index = i;
                        replacedCount += resolveValue(s, v -> ((List<Object>) list).set(index, v),
                                context, extensions, sites);
                    } else if (isProcessable(val)) stack.push(val);
                }
                continue;
            }
            if (current instanceof Map<?, ?> map) {
                for (Map.Entry<?, ?> e : map.entrySet()) {
                    Object val = e.getValue();
                    if (val instanceof String s) {
                        Map.Entry<Object, Object> entry = (Map.Entry<Object, Object>) e;
                        replacedCount += resolveValue(s, entry::setValue, context, extensions, sites);
                    } else if (isProcessable(val)) stack.push(val);
                }
                continue;
            }
            Class<?> clazz = current.getClass();
            while (clazz != null && clazz != Object.class) {
                for (Field f : clazz.getDeclaredFields()) {
                    if (Modifier.isStatic(f.getModifiers()) || f.isSynthetic()) continue;
                    f.setAccessible(true);
                    try {
                        Object value = f.get(current);
                        if (value instanceof String s) {
                            Object owner = current;
                            replacedCount += resolveValue(s, v -> setField(f, owner, v), context, extensions, sites);
                        } else if (isProcessable(value)) stack.push(value);
                    } catch (IllegalAccessException ex) {
                        log.warn("Field access failure {}.{}: {}", clazz.getSimpleName(), f.getName(), ex.getMessage());
                    }
                }
                clazz = clazz.getSuperclass();
            }
        }
        log.debug("Placeholders resolved: stack={}, replaced={}",
                context != null ? context.getStackName() : null, replacedCount);
        return replacedCount;
    }

    private int resolveValue(String value, Consumer<String> setter, ResolutionContext context,
                             ExtensionRegistry extensions, List<DeferredPlaceholders.Site> sites) {
        PartialResolution partial = engine.resolvePartially(value, context, extensions);
        if (sites != null && partial.hasDeferred()) {
            sites.add(new DeferredPlaceholders.Site(partial, setter));
        }
        String replaced = partial.render();
        if (Objects.equals(value, replaced)) {
            return 0;
        }
        setter.accept(replaced);
        return 1;
    }

    private void setField(Field field, Object owner, String value) {
        try {
            field.set(owner, value);
        } catch (IllegalAccessException ex) {
            log.warn("Field write failure {}.{}: {}", owner.getClass().getSimpleName(), field.getName(), ex.getMessage());
        }
    }

    private boolean isProcessable(Object o) {
        if (o == null) return false;
        if (o instanceof List || o instanceof Map) return true;
        Class<?> c = o.getClass();
        if (c.isEnum() || c.isPrimitive() || c.isArray()) return false;
        String pkg = c.getPackageName();
        return !(pkg.startsWith("java.") || pkg.startsWith("javax."));
    }
}
