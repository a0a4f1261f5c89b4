package xyz.firestige.binder.secrets;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code ${secret:KEY}} 引用的识别与提取
 */
public final class SecretReferences {

    private static final Pattern REFERENCE = Pattern.compile("^\\$\\{secret:([^}:]+)}$");

    private SecretReferences() {
    }

    public static boolean isSecretReference(String value) {
        return value != null && REFERENCE.matcher(value.trim()).matches();
    }

    /**
     * 引用返回其中的密钥名，原始密钥名原样返回
     */
    public static String extractName(String value) {
        if (value == null) {
            return null;
        }
        Matcher m = REFERENCE.matcher(value.trim());
        return m.matches() ? m.group(1).trim() : value.trim();
    }

    public static String reference(String name) {
        return "${secret:" + name + "}";
    }
}
