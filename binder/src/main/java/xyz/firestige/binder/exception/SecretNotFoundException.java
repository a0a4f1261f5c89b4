package xyz.firestige.binder.exception;

import java.util.List;

/**
 * 密钥不存在，消息中列出所有已搜索的作用域
 */
public class SecretNotFoundException extends BinderException {

    /**
     * 共享值作用域在搜索列表中的名称
     */
    public static final String SHARED_SCOPE = "<shared>";

    private final String secretName;
    private final List<String> searched;

    public SecretNotFoundException(String secretName, List<String> searched) {
        super(ErrorType.SECRET_NOT_FOUND, String.format(
                "secret %s not found, searched %s", secretName, searched));
        this.secretName = secretName;
        this.searched = List.copyOf(searched);
        addContext(CTX_KEY, secretName);
    }

    public String getSecretName() {
        return secretName;
    }

    public List<String> getSearched() {
        return searched;
    }
}
