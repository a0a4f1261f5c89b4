package xyz.firestige.binder.crypto;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 加密结果：一个或多个 base64 分块
 * <p>
 * 字符串形式为各分块以 {@value #SEPARATOR} 连接，base64 字母表不包含该字符。
 */
public final class EncryptedPayload {

    public static final String SEPARATOR = ".";

    private final List<String> chunks;

    public EncryptedPayload(List<String> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            throw new IllegalArgumentException("encrypted payload must contain at least one chunk");
        }
        this.chunks = Collections.unmodifiableList(new ArrayList<>(chunks));
    }

    public static EncryptedPayload parse(String encoded) {
        Objects.requireNonNull(encoded, "encoded");
        String trimmed = encoded.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("encrypted payload is empty");
        }
        return new EncryptedPayload(Arrays.asList(trimmed.split("\\.")));
    }

    public List<String> getChunks() {
        return chunks;
    }

    public String encode() {
        return String.join(SEPARATOR, chunks);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EncryptedPayload)) return false;
        return chunks.equals(((EncryptedPayload) o).chunks);
    }

    @Override
    public int hashCode() {
        return chunks.hashCode();
    }

    @Override
    public String toString() {
        return "EncryptedPayload{chunks=" + chunks.size() + '}';
    }
}
