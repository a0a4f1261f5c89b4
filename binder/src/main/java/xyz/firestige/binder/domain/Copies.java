package xyz.firestige.binder.domain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 描述对象深拷贝工具，只处理 YAML 可表达的结构（Map / List / 标量）
 */
public final class Copies {

    private Copies() {
    }

    public static <V> Map<String, V> copyMap(Map<String, V> source) {
        Map<String, V> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((k, v) -> copy.put(k, copyValue(v)));
        }
        return copy;
    }

    public static <V> List<V> copyList(List<V> source) {
        List<V> copy = new ArrayList<>();
        if (source != null) {
            source.forEach(v -> copy.add(copyValue(v)));
        }
        return copy;
    }

    @SuppressWarnings("unchecked")
    public static <V> V copyValue(V value) {
        if (value instanceof Map) {
            return (V) copyMap((Map<String, Object>) value);
        }
        if (value instanceof List) {
            return (V) copyList((List<Object>) value);
        }
        return value;
    }
}
