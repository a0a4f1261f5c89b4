package xyz.firestige.binder.compute;

import java.util.Locale;

/**
 * 环境变量命名：大写，非字母数字替换为 '_'
 */
public final class EnvVariableNames {

    private EnvVariableNames() {
    }

    public static String toEnvName(String raw) {
        return raw.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_");
    }

    /**
     * {@code S3 + uploads + BUCKET} → {@code S3_UPLOADS_BUCKET}
     */
    public static String infix(String prefix, String resourceName, String suffix) {
        return toEnvName(prefix + "_" + resourceName + "_" + suffix);
    }

    /**
     * {@code BUCKET_NAME + logs} → {@code BUCKET_NAME_LOGS}
     */
    public static String suffixed(String base, String resourceName) {
        return toEnvName(base + "_" + resourceName);
    }
}
