package xyz.firestige.binder.template;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.binder.exception.BinderException;
import xyz.firestige.binder.exception.UnresolvedPlaceholderException;

import java.util.Optional;

/**
 * 占位符替换引擎
 * <p>
 * 语法 {@code ${namespace:path[:default]}}。从左到右单遍扫描，替换结果不再被扫描，
 * 不支持嵌套，因此对已解析的字符串再次解析不会产生变化。
 * <ul>
 *   <li>不完整或格式不合法的 token 原样保留</li>
 *   <li>扩展返回 NOT_APPLICABLE 时 token 原样保留，留给后续轮次</li>
 *   <li>命名空间未注册或扩展未找到值时使用默认值，无默认值抛出
 *       {@link UnresolvedPlaceholderException}</li>
 * </ul>
 */
public class PlaceholderEngine {

    private static final Logger log = LoggerFactory.getLogger(PlaceholderEngine.class);

    public String resolve(String input, ResolutionContext context, ExtensionRegistry extensions) {
        return resolvePartially(input, context, extensions).render();
    }

    /**
     * 与 {@link #resolve} 相同，但保留延迟片段的位置，供 {@link #complete} 在后续轮次只替换这些片段
     */
    public PartialResolution resolvePartially(String input, ResolutionContext context, ExtensionRegistry extensions) {
        if (input == null || !input.contains(Placeholder.OPEN)) {
            return PartialResolution.literal(input);
        }
        PartialResolution.Builder out = PartialResolution.builder();
        int i = 0;
        while (i < input.length()) {
            int start = input.indexOf(Placeholder.OPEN, i);
            if (start < 0) {
                out.append(input, i, input.length());
                break;
            }
            int end = input.indexOf(Placeholder.CLOSE, start + Placeholder.OPEN.length());
            if (end < 0) {
                // 未闭合，剩余部分原样保留
                out.append(input, i, input.length());
                break;
            }
            // "${a ${env:X}" 中外层不完整，从最靠近闭合符的起始处开始
            int inner = input.lastIndexOf(Placeholder.OPEN, end);
            if (inner > start) {
                start = inner;
            }
            out.append(input, i, start);
            String token = input.substring(start, end + 1);
            Optional<Placeholder> parsed = Placeholder.parse(token);
            if (parsed.isPresent()) {
                String value = substitute(parsed.get(), context, extensions);
                if (value != null) {
                    out.append(value);
                } else {
                    out.defer(parsed.get());
                }
            } else {
                out.append(token);
            }
            i = end + 1;
        }
        return out.build();
    }

    /**
     * 只替换上一轮留下的延迟片段，字面片段原样拼接
     */
    public PartialResolution complete(PartialResolution partial, ResolutionContext context, ExtensionRegistry extensions) {
        if (!partial.hasDeferred()) {
            return partial;
        }
        PartialResolution.Builder out = PartialResolution.builder();
        for (Object segment : partial.segments()) {
            if (segment instanceof Placeholder) {
                Placeholder placeholder = (Placeholder) segment;
                String value = substitute(placeholder, context, extensions);
                if (value != null) {
                    out.append(value);
                } else {
                    out.defer(placeholder);
                }
            } else {
                out.append((String) segment);
            }
        }
        return out.build();
    }

    /**
     * @return 替换值，扩展返回 NOT_APPLICABLE 时为 null
     */
    private String substitute(Placeholder placeholder, ResolutionContext context, ExtensionRegistry extensions) {
        PlaceholderExtension extension = extensions.get(placeholder.getNamespace());
        if (extension == null) {
            if (placeholder.hasDefault()) {
                log.debug("命名空间 {} 未注册, 使用默认值: {}", placeholder.getNamespace(), placeholder.getToken());
                return placeholder.getDefaultValue();
            }
            throw withContext(new UnresolvedPlaceholderException(placeholder.getToken(),
                    "no extension registered for namespace " + placeholder.getNamespace()), context);
        }
        ExtensionResult result;
        try {
            result = extension.resolve(placeholder, context);
        } catch (BinderException e) {
            throw withContext(e, context);
        }
        switch (result.getKind()) {
            case RESOLVED:
                return result.getValue();
            case NOT_APPLICABLE:
                return null;
            case NOT_FOUND:
            default:
                if (placeholder.hasDefault() && !extension.defaultIsArgument()) {
                    return placeholder.getDefaultValue();
                }
                throw withContext(new UnresolvedPlaceholderException(placeholder.getToken(), result.getValue()), context);
        }
    }

    private static BinderException withContext(BinderException e, ResolutionContext context) {
        if (context != null) {
            e.withStack(context.getStackName(), context.getEnvironment());
        }
        return e;
    }
}
