package xyz.firestige.binder.reconcile;

import xyz.firestige.binder.domain.stack.Stack;
import xyz.firestige.binder.domain.stack.StackConfig;

import java.util.Optional;

/**
 * 调和后的 Stack：已从父 Stack 继承服务端描述和密钥
 */
public final class ReconciledStack {

    private final Stack stack;
    private final StackConfig config;
    private final String secretsEnvironment;
    private final String parentReference;

    public ReconciledStack(Stack stack, StackConfig config, String secretsEnvironment, String parentReference) {
        this.stack = stack;
        this.config = config;
        this.secretsEnvironment = secretsEnvironment;
        this.parentReference = parentReference;
    }

    public Stack getStack() {
        return stack;
    }

    public String getName() {
        return stack.getName();
    }

    public StackConfig getConfig() {
        return config;
    }

    /**
     * 解析 {@code ${secret:...}} 时使用的环境，设置了 parentEnv 时为父环境
     */
    public String getSecretsEnvironment() {
        return secretsEnvironment;
    }

    /**
     * 父 Stack 的完整引用 {@code org/project/stack}，无父 Stack 时为 empty
     */
    public Optional<String> getParentReference() {
        return Optional.ofNullable(parentReference);
    }

    @Override
    public String toString() {
        return "ReconciledStack{" + stack.getName() + ", secretsEnv=" + secretsEnvironment
                + (parentReference != null ? ", parent=" + parentReference : "") + '}';
    }
}
