package xyz.firestige.binder.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 命名空间 → 扩展的显式注册表
 * <p>
 * 每次部署在基础注册表上组合出自己的实例，不存在全局可变状态。
 */
public class ExtensionRegistry {

    public static final String SECRET = "secret";
    public static final String RESOURCE = "resource";
    public static final String DEPENDENCY = "dependency";
    public static final String AUTH = "auth";
    public static final String ENV = "env";
    public static final String GIT = "git";
    public static final String DATE = "date";
    public static final String PROJECT = "project";

    private final Map<String, PlaceholderExtension> extensions = new LinkedHashMap<>();

    public ExtensionRegistry register(String namespace, PlaceholderExtension extension) {
        extensions.put(namespace, extension);
        return this;
    }

    public PlaceholderExtension get(String namespace) {
        return extensions.get(namespace);
    }

    public boolean contains(String namespace) {
        return extensions.containsKey(namespace);
    }

    public Set<String> namespaces() {
        return Collections.unmodifiableSet(extensions.keySet());
    }

    /**
     * 复制后再注册，原注册表不受影响
     */
    public ExtensionRegistry with(String namespace, PlaceholderExtension extension) {
        return copy().register(namespace, extension);
    }

    public ExtensionRegistry copy() {
        ExtensionRegistry copy = new ExtensionRegistry();
        copy.extensions.putAll(extensions);
        return copy;
    }
}
