package xyz.firestige.binder.template;

import xyz.firestige.binder.exception.MalformedPlaceholderException;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 解析后的占位符 {@code ${namespace:path[:default]}}
 */
public final class Placeholder {

    static final String OPEN = "${";
    static final char CLOSE = '}';

    private static final Pattern NAMESPACE = Pattern.compile("[A-Za-z0-9_-]+");

    private final String token;
    private final String namespace;
    private final String path;
    private final String defaultValue;

    private Placeholder(String token, String namespace, String path, String defaultValue) {
        this.token = token;
        this.namespace = namespace;
        this.path = path;
        this.defaultValue = defaultValue;
    }

    /**
     * 解析完整 token（含 {@code ${ }}），不合法时返回 empty，由调用方按原文保留
     */
    public static Optional<Placeholder> parse(String token) {
        if (token == null || !token.startsWith(OPEN) || token.charAt(token.length() - 1) != CLOSE) {
            return Optional.empty();
        }
        String body = token.substring(OPEN.length(), token.length() - 1);
        int colon = body.indexOf(':');
        if (colon <= 0) {
            return Optional.empty();
        }
        String namespace = body.substring(0, colon);
        if (!NAMESPACE.matcher(namespace).matches()) {
            return Optional.empty();
        }
        String rest = body.substring(colon + 1);
        int defaultSep = rest.indexOf(':');
        String path = defaultSep < 0 ? rest : rest.substring(0, defaultSep);
        String defaultValue = defaultSep < 0 ? null : rest.substring(defaultSep + 1);
        return Optional.of(new Placeholder(token, namespace, path.trim(), defaultValue));
    }

    /**
     * 按 '.' 切分路径并检查段数，段数不足或存在空段时抛出 {@link MalformedPlaceholderException}
     * <p>
     * 最后一段保留剩余内容，例如 {@code a.b.c} 按 2 段切分得到 {@code [a, b.c]}。
     */
    public String[] requireSegments(int expected) {
        String[] segments = path.isEmpty() ? new String[0] : path.split("\\.", expected);
        if (segments.length < expected) {
            throw new MalformedPlaceholderException(token, expected, segments.length);
        }
        for (String segment : segments) {
            if (segment.isBlank()) {
                throw new MalformedPlaceholderException(token, expected, segments.length);
            }
        }
        return segments;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public String getToken() {
        return token;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getPath() {
        return path;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    @Override
    public String toString() {
        return token;
    }
}
