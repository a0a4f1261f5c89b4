package xyz.firestige.binder.reconcile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.binder.crossstack.StackReferences;
import xyz.firestige.binder.domain.secrets.EnvironmentSecretsConfig;
import xyz.firestige.binder.domain.secrets.SecretsDescriptor;
import xyz.firestige.binder.domain.stack.Stack;
import xyz.firestige.binder.domain.stack.StackConfig;
import xyz.firestige.binder.domain.stack.StackParams;
import xyz.firestige.binder.exception.InvalidDescriptorException;
import xyz.firestige.binder.exception.MissingParentStackException;
import xyz.firestige.binder.secrets.SecretResolver;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 父子 Stack 调和
 * <p>
 * 对目标环境中声明了 parentStack 的 Stack：复制父 Stack 的服务端描述和密钥，
 * 确定密钥解析环境（parentEnv 优先），父 Stack 为该环境声明了 secretsConfig 时
 * 按其过滤共享密钥。输入不被修改。
 * <p>
 * 调和之前先处理 {@code secretsInherit}：被继承 Stack 的 secretsConfig 和密钥描述替换继承方的。
 */
public class StackReconciler {

    private static final Logger log = LoggerFactory.getLogger(StackReconciler.class);

    private final SecretResolver secretResolver;

    public StackReconciler(SecretResolver secretResolver) {
        this.secretResolver = secretResolver;
    }

    public ReconciledStacks reconcileForDeploy(Map<String, Stack> declared, StackParams params) {
        Map<String, Stack> stacks = resolveInheritance(declared);
        String environment = params.getEnvironment();
        List<ReconciledStack> result = new ArrayList<>();
        for (Stack original : stacks.values()) {
            Optional<StackConfig> configured = original.configFor(environment);
            if (configured.isEmpty()) {
                continue;
            }
            Stack stack = original.copy();
            StackConfig config = stack.configFor(environment).orElseThrow();
            if (!config.hasParent()) {
                result.add(new ReconciledStack(stack, config, environment, null));
                continue;
            }
            result.add(reconcileChild(stacks, stack, config, params));
        }
        log.info("Stack 调和完成, 环境: {}, 数量: {}", environment, result.size());
        return new ReconciledStacks(environment, result);
    }

    /**
     * 返回副本，其中声明了 secretsInherit 的 Stack 已替换为被继承方的密钥设置。
     * 允许多级继承，继承链成环或指向未定义的 Stack 时抛出 {@link InvalidDescriptorException}。
     */
    public Map<String, Stack> resolveInheritance(Map<String, Stack> stacks) {
        Map<String, Stack> resolved = new LinkedHashMap<>();
        stacks.forEach((name, stack) -> {
            Stack copy = stack.copy();
            if (stack.getServer().inheritsSecrets()) {
                Stack source = secretsSource(stacks, stack);
                copy.getServer().setSecretsConfig(source.getServer().copy().getSecretsConfig());
                copy.setSecrets(source.getSecrets().copy());
                log.debug("Stack {} 继承 {} 的密钥设置", name, source.getName());
            }
            resolved.put(name, copy);
        });
        return resolved;
    }

    private Stack secretsSource(Map<String, Stack> stacks, Stack stack) {
        Set<String> chain = new LinkedHashSet<>();
        chain.add(stack.getName());
        Stack current = stack;
        while (current.getServer().inheritsSecrets()) {
            String target = StackReferences.collapse(current.getServer().getSecretsInherit());
            if (!chain.add(target)) {
                throw new InvalidDescriptorException(String.format(
                        "secretsInherit of stack %s forms a cycle: %s -> %s", stack.getName(), chain, target));
            }
            current = stacks.get(target);
            if (current == null) {
                throw new InvalidDescriptorException(String.format(
                        "stack %s inherits secrets from undefined stack %s", stack.getName(), target));
            }
        }
        return current;
    }

    private ReconciledStack reconcileChild(Map<String, Stack> stacks, Stack child, StackConfig config, StackParams params) {
        String environment = params.getEnvironment();
        String parentName = StackReferences.collapse(config.getParentStack());
        Stack parent = stacks.get(parentName);
        if (parent == null) {
            throw new MissingParentStackException(String.format(
                    "parent stack \"%s\" is not configured for \"%s\" in \"%s\"",
                    parentName, child.getName(), environment));
        }

        child.setServer(parent.getServer().copy());
        SecretsDescriptor secrets = parent.getSecrets().copy();

        String parentEnv = config.getParentEnv();
        boolean hasParentEnv = parentEnv != null && !parentEnv.isBlank();
        String secretsEnvironment = hasParentEnv ? parentEnv : environment;
        if (hasParentEnv) {
            EnvironmentSecretsConfig secretsConfig = parent.getServer().getSecretsConfig().get(parentEnv);
            if (secretsConfig != null) {
                secrets.setValues(secretResolver.resolve(secrets.getValues(), secretsConfig));
                log.debug("按 secretsConfig 过滤父 Stack {} 的共享密钥, 环境: {}", parentName, parentEnv);
            }
        }
        child.setSecrets(secrets);

        String parentReference = StackReferences.expand(config.getParentStack(),
                params.getOrganization(), params.getProject());
        log.debug("Stack {} 继承父 Stack {}, 密钥环境: {}", child.getName(), parentReference, secretsEnvironment);
        return new ReconciledStack(child, config, secretsEnvironment, parentReference);
    }
}
