package xyz.firestige.binder.compute;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.binder.crossstack.CrossStackReferenceResolver;
import xyz.firestige.binder.crossstack.StackReference;
import xyz.firestige.binder.exception.BinderException;
import xyz.firestige.binder.exception.ErrorType;
import xyz.firestige.binder.template.ExtensionRegistry;
import xyz.firestige.binder.template.PlaceholderEngine;
import xyz.firestige.binder.template.ResolutionContext;
import xyz.firestige.binder.template.extension.DependencyExtension;
import xyz.firestige.binder.template.extension.ResourceExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * 部署级计算上下文收集器
 * <p>
 * 所有写操作在同一把锁内完成 check-then-insert；Stack 引用按引用字符串缓存为 future，
 * 同一父 Stack 的输出只读取一次，读取失败时等待该引用的调用方得到同一个异常。部署结束后丢弃，自身不持久化。
 */
public class DefaultComputeContextCollector implements ComputeContextCollector {

    private static final Logger log = LoggerFactory.getLogger(DefaultComputeContextCollector.class);

    private final String stackName;
    private final CrossStackReferenceResolver resolver;
    private final Instant deadline;
    private final PlaceholderEngine engine;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ComputeEnvVariable> variables = new LinkedHashMap<>();
    private final Map<String, Map<String, String>> resourceExtensions = new LinkedHashMap<>();
    private final Map<String, Map<String, Map<String, String>>> dependencyExtensions = new LinkedHashMap<>();
    private final List<CompletableFuture<?>> outputs = new ArrayList<>();
    private final List<ResourceDependency> dependencies = new ArrayList<>();
    private final ConcurrentMap<String, CompletableFuture<StackReference>> references = new ConcurrentHashMap<>();

    public DefaultComputeContextCollector(String stackName, CrossStackReferenceResolver resolver,
                                          Instant deadline, PlaceholderEngine engine) {
        this.stackName = stackName;
        this.resolver = resolver;
        this.deadline = deadline;
        this.engine = engine;
    }

    @Override
    public void addEnvVariableIfNotExist(String name, String value, String resourceType, String resourceName, String stackName) {
        addIfNotExist(new ComputeEnvVariable(name, value, false, resourceType, resourceName, stackName));
    }

    @Override
    public void addSecretEnvVariableIfNotExist(String name, String value, String resourceType, String resourceName, String stackName) {
        addIfNotExist(new ComputeEnvVariable(name, value, true, resourceType, resourceName, stackName));
    }

    private void addIfNotExist(ComputeEnvVariable variable) {
        lock.lock();
        try {
            ComputeEnvVariable existing = variables.putIfAbsent(variable.getName(), variable);
            if (existing != null) {
                log.debug("环境变量 {} 已由 {}:{} 注册, 跳过 {}:{}", variable.getName(),
                        existing.getResourceType(), existing.getResourceName(),
                        variable.getResourceType(), variable.getResourceName());
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void addResourceTplExtension(String resourceName, Map<String, String> fields) {
        lock.lock();
        try {
            Map<String, String> target = resourceExtensions.computeIfAbsent(resourceName, k -> new LinkedHashMap<>());
            fields.forEach(target::putIfAbsent);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void addDependencyTplExtension(String dependencyName, String resourceName, Map<String, String> fields) {
        lock.lock();
        try {
            Map<String, String> target = dependencyExtensions
                    .computeIfAbsent(dependencyName, k -> new LinkedHashMap<>())
                    .computeIfAbsent(resourceName, k -> new LinkedHashMap<>());
            fields.forEach(target::putIfAbsent);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void addOutput(CompletableFuture<?> output) {
        lock.lock();
        try {
            outputs.add(output);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void addDependency(ResourceDependency dependency) {
        lock.lock();
        try {
            if (!dependencies.contains(dependency)) {
                dependencies.add(dependency);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public StackReference stackReference(String fullReference) {
        CompletableFuture<StackReference> created = new CompletableFuture<>();
        CompletableFuture<StackReference> existing = references.putIfAbsent(fullReference, created);
        if (existing == null) {
            // 远端读取在映射表锁之外进行，同一引用的其它调用方等待这个 future
            log.info("读取 Stack 输出: {}, 使用方: {}", fullReference, stackName);
            try {
                created.complete(resolver.resolve(fullReference, deadline));
            } catch (RuntimeException e) {
                created.completeExceptionally(e);
                throw e;
            }
            return created.join();
        }
        try {
            return existing.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    @Override
    public List<ResourceDependency> dependencies() {
        lock.lock();
        try {
            return List.copyOf(dependencies);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ComputeEnvVariable> envVariables() {
        return snapshot(false);
    }

    @Override
    public List<ComputeEnvVariable> secretEnvVariables() {
        return snapshot(true);
    }

    private List<ComputeEnvVariable> snapshot(boolean secret) {
        lock.lock();
        try {
            return variables.values().stream()
                    .filter(v -> v.isSecret() == secret)
                    .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Map<String, String>> resourceTplExtensions() {
        lock.lock();
        try {
            Map<String, Map<String, String>> copy = new LinkedHashMap<>();
            resourceExtensions.forEach((k, v) -> copy.put(k, Collections.unmodifiableMap(new LinkedHashMap<>(v))));
            return copy;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 在 base 上叠加 resource / dependency 扩展
     */
    public ExtensionRegistry extensions(ExtensionRegistry base) {
        return base.copy()
                .register(ExtensionRegistry.RESOURCE, new ResourceExtension(this::resourceFields))
                .register(ExtensionRegistry.DEPENDENCY, new DependencyExtension(this::dependencyFields));
    }

    /**
     * 只使用 resource / dependency 扩展解析，其它命名空间的 token 按引擎规则处理
     */
    public String resolvePlaceholders(String input, ResolutionContext context) {
        return engine.resolve(input, context, extensions(new ExtensionRegistry()));
    }

    /**
     * 等待所有异步输出完成，任何一个失败即抛出
     */
    public void awaitOutputs() {
        List<CompletableFuture<?>> pending;
        lock.lock();
        try {
            pending = new ArrayList<>(outputs);
        } finally {
            lock.unlock();
        }
        if (pending.isEmpty()) {
            return;
        }
        long remaining = Math.max(0, Duration.between(Instant.now(), deadline).toMillis());
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0])).get(remaining, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new BinderException(ErrorType.STATE_READ_FAILURE,
                    "timed out waiting for " + pending.size() + " outputs of stack " + stackName, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BinderException(ErrorType.SYSTEM_ERROR, "interrupted while waiting for outputs", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof BinderException) {
                throw (BinderException) cause;
            }
            throw new BinderException(ErrorType.SYSTEM_ERROR, "output failed: " + cause.getMessage(), cause);
        }
    }

    private Map<String, String> resourceFields(String resourceName) {
        lock.lock();
        try {
            return resourceExtensions.get(resourceName);
        } finally {
            lock.unlock();
        }
    }

    private Map<String, String> dependencyFields(String dependencyName, String resourceName) {
        lock.lock();
        try {
            Map<String, Map<String, String>> byResource = dependencyExtensions.get(dependencyName);
            return byResource != null ? byResource.get(resourceName) : null;
        } finally {
            lock.unlock();
        }
    }

    public String getStackName() {
        return stackName;
    }
}
