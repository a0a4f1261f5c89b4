package xyz.firestige.binder.crossstack;

/**
 * Stack 引用字符串的展开与折叠
 * <p>
 * 完整形式 {@code organization/project/stackName}，简写为 {@code stackName}。
 */
public final class StackReferences {

    private StackReferences() {
    }

    /**
     * 简写补全为完整引用，已带有 '/' 的引用原样返回
     */
    public static String expand(String reference, String organization, String project) {
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("stack reference must not be blank");
        }
        if (reference.contains("/")) {
            return reference;
        }
        StringBuilder sb = new StringBuilder();
        if (organization != null && !organization.isBlank()) {
            sb.append(organization).append('/');
        }
        if (project != null && !project.isBlank()) {
            sb.append(project).append('/');
        }
        return sb.append(reference).toString();
    }

    /**
     * 取最后一段作为 Stack 名
     */
    public static String collapse(String reference) {
        if (reference == null) {
            return null;
        }
        String[] parts = reference.split("/", 3);
        return parts[parts.length - 1];
    }
}
