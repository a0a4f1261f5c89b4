package xyz.firestige.binder.compute;

import xyz.firestige.binder.crossstack.StackReference;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * 单个资源的缓冲收集器
 * <p>
 * 计算处理器并行执行时各自写入自己的缓冲，完成后按资源声明顺序
 * {@link #replayInto 回放}到部署收集器，first-registration-wins 因此只取决于声明顺序，
 * 与线程完成先后无关。Stack 引用读取直接委托给部署收集器以共享缓存。
 * 仅由一个处理器线程使用。
 */
public class ResourceScopedCollector implements ComputeContextCollector {

    private final ComputeContextCollector delegate;
    private final List<Consumer<ComputeContextCollector>> operations = new ArrayList<>();
    private final Map<String, ComputeEnvVariable> variables = new LinkedHashMap<>();
    private final List<ResourceDependency> dependencies = new ArrayList<>();

    public ResourceScopedCollector(ComputeContextCollector delegate) {
        this.delegate = delegate;
    }

    @Override
    public void addEnvVariableIfNotExist(String name, String value, String resourceType, String resourceName, String stackName) {
        if (variables.putIfAbsent(name, new ComputeEnvVariable(name, value, false, resourceType, resourceName, stackName)) == null) {
            operations.add(c -> c.addEnvVariableIfNotExist(name, value, resourceType, resourceName, stackName));
        }
    }

    @Override
    public void addSecretEnvVariableIfNotExist(String name, String value, String resourceType, String resourceName, String stackName) {
        if (variables.putIfAbsent(name, new ComputeEnvVariable(name, value, true, resourceType, resourceName, stackName)) == null) {
            operations.add(c -> c.addSecretEnvVariableIfNotExist(name, value, resourceType, resourceName, stackName));
        }
    }

    @Override
    public void addResourceTplExtension(String resourceName, Map<String, String> fields) {
        Map<String, String> copy = new LinkedHashMap<>(fields);
        operations.add(c -> c.addResourceTplExtension(resourceName, copy));
    }

    @Override
    public void addDependencyTplExtension(String dependencyName, String resourceName, Map<String, String> fields) {
        Map<String, String> copy = new LinkedHashMap<>(fields);
        operations.add(c -> c.addDependencyTplExtension(dependencyName, resourceName, copy));
    }

    @Override
    public void addOutput(CompletableFuture<?> output) {
        operations.add(c -> c.addOutput(output));
    }

    @Override
    public void addDependency(ResourceDependency dependency) {
        dependencies.add(dependency);
        operations.add(c -> c.addDependency(dependency));
    }

    @Override
    public StackReference stackReference(String fullReference) {
        return delegate.stackReference(fullReference);
    }

    @Override
    public List<ResourceDependency> dependencies() {
        return List.copyOf(dependencies);
    }

    @Override
    public List<ComputeEnvVariable> envVariables() {
        return variables.values().stream().filter(v -> !v.isSecret()).collect(Collectors.toList());
    }

    @Override
    public List<ComputeEnvVariable> secretEnvVariables() {
        return variables.values().stream().filter(ComputeEnvVariable::isSecret).collect(Collectors.toList());
    }

    /**
     * 按记录顺序写入目标收集器
     */
    public void replayInto(ComputeContextCollector target) {
        operations.forEach(op -> op.accept(target));
    }
}
