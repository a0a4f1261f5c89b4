package xyz.firestige.binder.compute;

import xyz.firestige.binder.crossstack.StackReference;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 一次部署的计算上下文收集器
 * <p>
 * 环境变量采用 add-if-not-exists 语义：同名变量只保留第一次注册的值，
 * 通用别名因此不会覆盖资源限定的名称。实现必须保证并发调用安全。
 */
public interface ComputeContextCollector {

    void addEnvVariableIfNotExist(String name, String value, String resourceType, String resourceName, String stackName);

    void addSecretEnvVariableIfNotExist(String name, String value, String resourceType, String resourceName, String stackName);

    /**
     * 注册后可通过 {@code ${resource:<resourceName>.<field>}} 引用
     */
    void addResourceTplExtension(String resourceName, Map<String, String> fields);

    /**
     * 注册后可通过 {@code ${dependency:<dependencyName>.<resourceName>.<field>}} 引用
     */
    void addDependencyTplExtension(String dependencyName, String resourceName, Map<String, String> fields);

    void addOutput(CompletableFuture<?> output);

    void addDependency(ResourceDependency dependency);

    /**
     * 按完整引用获取另一个 Stack 的输出，同一收集器内缓存
     */
    StackReference stackReference(String fullReference);

    List<ResourceDependency> dependencies();

    List<ComputeEnvVariable> envVariables();

    List<ComputeEnvVariable> secretEnvVariables();
}
