package xyz.firestige.binder.template;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一轮解析后的字符串
 * <p>
 * 由字面片段和被扩展延迟（NOT_APPLICABLE）的占位符片段组成。字面片段包含已替换的值，
 * 之后的轮次只处理延迟片段，不会再扫描字面片段。
 */
public final class PartialResolution {

    /**
     * 输入为 null 时为 null
     */
    private final List<Object> segments;

    private PartialResolution(List<Object> segments) {
        this.segments = segments;
    }

    static PartialResolution literal(String value) {
        return new PartialResolution(value == null ? null : List.of(value));
    }

    public boolean hasDeferred() {
        return segments != null && segments.stream().anyMatch(Placeholder.class::isInstance);
    }

    /**
     * 延迟片段按原 token 输出
     */
    public String render() {
        if (segments == null) {
            return null;
        }
        StringBuilder out = new StringBuilder();
        for (Object segment : segments) {
            out.append(segment instanceof Placeholder ? ((Placeholder) segment).getToken() : (String) segment);
        }
        return out.toString();
    }

    List<Object> segments() {
        return segments;
    }

    static Builder builder() {
        return new Builder();
    }

    static final class Builder {

        private final List<Object> segments = new ArrayList<>();
        private final StringBuilder text = new StringBuilder();

        Builder append(CharSequence value, int start, int end) {
            text.append(value, start, end);
            return this;
        }

        Builder append(String value) {
            text.append(value);
            return this;
        }

        Builder defer(Placeholder placeholder) {
            flushText();
            segments.add(placeholder);
            return this;
        }

        PartialResolution build() {
            flushText();
            return new PartialResolution(Collections.unmodifiableList(segments));
        }

        private void flushText() {
            if (text.length() > 0) {
                segments.add(text.toString());
                text.setLength(0);
            }
        }
    }
}
