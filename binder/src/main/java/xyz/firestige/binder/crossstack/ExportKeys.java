package xyz.firestige.binder.crossstack;

/**
 * 导出键命名，是资源发布方与使用方之间的稳定约定
 * <p>
 * 资源在父 Stack 中按环境区分：{@code <resource>--<env>}，随后追加类型相关后缀，
 * 例如 {@code uploads--prod-bucket-name}。
 */
public final class ExportKeys {

    private ExportKeys() {
    }

    public static String resourceName(String resourceName, String environment) {
        if (environment == null || environment.isBlank()) {
            return resourceName;
        }
        return resourceName + "--" + environment;
    }

    public static String of(String stackName, String resourceName, String field) {
        return stackName + "-" + resourceName + "-" + field;
    }

    public static String bucketName(String res) {
        return res + "-bucket-name";
    }

    public static String bucketRegion(String res) {
        return res + "-bucket-region";
    }

    public static String accessKeyName(String res) {
        return res + "-access-key-name";
    }

    public static String accessKeySecret(String res) {
        return res + "-access-key-secret";
    }

    public static String endpoint(String res) {
        return res + "-endpoint";
    }

    public static String rootUser(String res) {
        return res + "-root-user";
    }

    public static String rootPassword(String res) {
        return res + "-root-password";
    }

    public static String host(String res) {
        return res + "-host";
    }

    public static String port(String res) {
        return res + "-port";
    }

    public static String password(String res) {
        return res + "-password";
    }

    /**
     * 客户端 Stack 导出的计算上下文（供 {@code dependency} 命名空间使用）
     */
    public static String computeContext(String stackName, String environment) {
        return resourceName(stackName, environment) + "-compute-context";
    }
}
