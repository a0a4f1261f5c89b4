package xyz.firestige.binder.orchestration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.binder.compute.ComputeEnvVariable;
import xyz.firestige.binder.compute.ComputeProcessor;
import xyz.firestige.binder.compute.ComputeProcessorRegistry;
import xyz.firestige.binder.compute.DefaultComputeContextCollector;
import xyz.firestige.binder.compute.ProcessorContext;
import xyz.firestige.binder.compute.ResourceScopedCollector;
import xyz.firestige.binder.crossstack.CrossStackReferenceResolver;
import xyz.firestige.binder.crossstack.ExportKeys;
import xyz.firestige.binder.crossstack.StackOutputs;
import xyz.firestige.binder.crossstack.StackReference;
import xyz.firestige.binder.crossstack.StackReferences;
import xyz.firestige.binder.crossstack.StackStateRepository;
import xyz.firestige.binder.domain.resource.ResourceDescriptor;
import xyz.firestige.binder.domain.resource.ResourceTypeRegistry;
import xyz.firestige.binder.domain.stack.DeployParams;
import xyz.firestige.binder.domain.stack.Stack;
import xyz.firestige.binder.domain.stack.StackConfig;
import xyz.firestige.binder.domain.stack.StackDependency;
import xyz.firestige.binder.domain.stack.StackParams;
import xyz.firestige.binder.event.DeployAbortedEvent;
import xyz.firestige.binder.event.DeployCompletedEvent;
import xyz.firestige.binder.event.DeployStartedEvent;
import xyz.firestige.binder.event.DeployStepCompletedEvent;
import xyz.firestige.binder.event.DomainEventPublisher;
import xyz.firestige.binder.exception.BinderException;
import xyz.firestige.binder.exception.DeployCancelledException;
import xyz.firestige.binder.exception.EmptyRequiredOutputException;
import xyz.firestige.binder.exception.ErrorType;
import xyz.firestige.binder.exception.FailureInfo;
import xyz.firestige.binder.exception.InvalidDescriptorException;
import xyz.firestige.binder.exception.ProvisioningPanicException;
import xyz.firestige.binder.metrics.MetricsRegistry;
import xyz.firestige.binder.reconcile.ReconciledStack;
import xyz.firestige.binder.reconcile.StackReconciler;
import xyz.firestige.binder.secrets.SecretsStore;
import xyz.firestige.binder.template.DeferredPlaceholders;
import xyz.firestige.binder.template.ExtensionRegistry;
import xyz.firestige.binder.template.ObjectPlaceholderResolver;
import xyz.firestige.binder.template.PlaceholderEngine;
import xyz.firestige.binder.template.ResolutionContext;
import xyz.firestige.binder.template.extension.AuthExtension;
import xyz.firestige.binder.template.extension.DeferredExtension;
import xyz.firestige.binder.template.extension.GitExtension;
import xyz.firestige.binder.template.extension.GitRepository;
import xyz.firestige.binder.template.extension.ProjectExtension;
import xyz.firestige.binder.template.extension.SecretExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 部署编排器
 * <p>
 * 按 {@link DeployState} 顺序执行各步骤，每个步骤外有统一的边界：
 * <ul>
 *   <li>捕获步骤内任何 Throwable（StackOverflowError 以外的 VirtualMachineError 除外）</li>
 *   <li>非 BinderException 转换为 {@link ProvisioningPanicException}，保留原始消息</li>
 *   <li>失败时只告警一次，状态迁移到 ABORTED，结果中携带 FailureInfo</li>
 * </ul>
 * 取消信号只在步骤边界检查；取消后不做 flush。{@link #deploy} 不抛出异常。
 */
public class ProvisioningOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ProvisioningOrchestrator.class);

    private static final TypeReference<Map<String, Map<String, String>>> COMPUTE_CONTEXT_TYPE =
            new TypeReference<Map<String, Map<String, String>>>() { };

    private final StackReconciler reconciler;
    private final PlaceholderEngine engine;
    private final ObjectPlaceholderResolver objectResolver;
    private final ExtensionRegistry baseExtensions;
    private final SecretsStore secretsStore;
    private final ResourceTypeRegistry resourceTypes;
    private final ProvisionerRegistry provisioners;
    private final ComputeProcessorRegistry processors;
    private final StackStateRepository stateRepository;
    private final CrossStackReferenceResolver referenceResolver;
    private final Executor computeExecutor;
    private final WorkloadConfigurer workloadConfigurer;
    private final AlertNotifier alertNotifier;
    private final DomainEventPublisher eventPublisher;
    private final MetricsRegistry metrics;
    private final ObjectMapper objectMapper;
    private final Duration readTimeout;

    private ProvisioningOrchestrator(Builder builder) {
        this.reconciler = Objects.requireNonNull(builder.reconciler, "reconciler");
        this.engine = Objects.requireNonNull(builder.engine, "engine");
        this.objectResolver = new ObjectPlaceholderResolver(engine);
        this.baseExtensions = builder.baseExtensions != null ? builder.baseExtensions : new ExtensionRegistry();
        this.secretsStore = Objects.requireNonNull(builder.secretsStore, "secretsStore");
        this.resourceTypes = Objects.requireNonNull(builder.resourceTypes, "resourceTypes");
        this.provisioners = builder.provisioners != null ? builder.provisioners : new ProvisionerRegistry();
        this.processors = Objects.requireNonNull(builder.processors, "processors");
        this.stateRepository = Objects.requireNonNull(builder.stateRepository, "stateRepository");
        this.referenceResolver = Objects.requireNonNull(builder.referenceResolver, "referenceResolver");
        this.computeExecutor = Objects.requireNonNull(builder.computeExecutor, "computeExecutor");
        this.workloadConfigurer = Objects.requireNonNull(builder.workloadConfigurer, "workloadConfigurer");
        this.alertNotifier = Objects.requireNonNull(builder.alertNotifier, "alertNotifier");
        this.eventPublisher = Objects.requireNonNull(builder.eventPublisher, "eventPublisher");
        this.metrics = Objects.requireNonNull(builder.metrics, "metrics");
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
        this.readTimeout = builder.readTimeout != null ? builder.readTimeout : Duration.ofSeconds(30);
    }

    public static Builder builder() {
        return new Builder();
    }

    public DeployResult deploy(DeployRequest request) {
        return deploy(request, CancellationSignal.none());
    }

    public DeployResult deploy(DeployRequest request, CancellationSignal signal) {
        DeployParams params = request.getParams();
        DeployExecution exec = new DeployExecution(request);
        DeployStateMachine stateMachine = new DeployStateMachine();
        stateMachine.addListener((from, to) -> log.debug("[{}@{}] {} -> {}",
                params.getStackName(), params.getEnvironment(), from, to));

        log.info("开始部署: {}", params);
        eventPublisher.publish(new DeployStartedEvent(params.getStackName(), params.getEnvironment(), params.isPreview()));
        try {
            runStep(DeployState.RECONCILE, exec, stateMachine, signal, () -> reconcile(exec));
            runStep(DeployState.RESOLVE_PLACEHOLDERS, exec, stateMachine, signal, () -> resolvePlaceholders(exec));
            runStep(DeployState.PROVISION, exec, stateMachine, signal, () -> provision(exec));
            runStep(DeployState.COLLECT_COMPUTE_CONTEXT, exec, stateMachine, signal, () -> collectComputeContext(exec));
            runStep(DeployState.FLUSH, exec, stateMachine, signal, () -> flush(exec));
        } catch (BinderException e) {
            return abort(exec, stateMachine, e);
        }
        stateMachine.transitionTo(DeployState.DONE);

        FlushPayload payload = exec.payload;
        metrics.incrementCounter(MetricsRegistry.DEPLOY_COMPLETED);
        metrics.setGauge(MetricsRegistry.DEPLOY_ENV_VARIABLES, payload.getEnv().size() + payload.getSecrets().size());
        eventPublisher.publish(new DeployCompletedEvent(params.getStackName(), params.getEnvironment(),
                params.isPreview(), payload.getEnv().size(), payload.getSecrets().size()));
        log.info("部署完成: {}, {}", params, payload);
        return DeployResult.success(params.getStackName(), params.getEnvironment(), params.isPreview(), payload);
    }

    private void runStep(DeployState step, DeployExecution exec, DeployStateMachine stateMachine,
                         CancellationSignal signal, Runnable body) {
        exec.currentStep = step;
        if (signal.isCancelled()) {
            throw new DeployCancelledException(step.name());
        }
        stateMachine.transitionTo(step);
        long start = System.nanoTime();
        log.info("[{}@{}] 步骤开始: {}", exec.stackName(), exec.environment(), step.getDescription());
        try {
            body.run();
        } catch (Throwable t) {
            throw recover(step, t);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        log.info("[{}@{}] 步骤完成: {}, 耗时 {}ms", exec.stackName(), exec.environment(),
                step.getDescription(), elapsed.toMillis());
        eventPublisher.publish(new DeployStepCompletedEvent(exec.stackName(), exec.environment(), step.name(), elapsed));
    }

    static BinderException recover(DeployState step, Throwable t) {
        if (t instanceof VirtualMachineError && !(t instanceof StackOverflowError)) {
            throw (VirtualMachineError) t;
        }
        if (t instanceof BinderException) {
            return (BinderException) t;
        }
        log.error("步骤 {} 出现非预期异常", step, t);
        return new ProvisioningPanicException(step.name(), t);
    }

    private DeployResult abort(DeployExecution exec, DeployStateMachine stateMachine, BinderException e) {
        DeployState failedStep = exec.currentStep;
        e.withStack(exec.stackName(), exec.environment());
        FailureInfo failureInfo = e.toFailureInfo(failedStep.name());
        if (!stateMachine.getCurrent().isTerminal()) {
            stateMachine.transitionTo(DeployState.ABORTED);
        }
        log.error("部署中止: {}@{}, 步骤: {}, 原因: {}",
                exec.stackName(), exec.environment(), failedStep, e.getMessage());

        DeployAlert alert = new DeployAlert(exec.stackName(), exec.environment(), failedStep, failureInfo);
        try {
            alertNotifier.notify(alert);
        } catch (RuntimeException notifyError) {
            log.error("告警发送失败: {}", alert.getTitle(), notifyError);
        }
        metrics.incrementCounter(MetricsRegistry.DEPLOY_ABORTED);
        eventPublisher.publish(new DeployAbortedEvent(exec.stackName(), exec.environment(), failureInfo));
        return DeployResult.aborted(exec.stackName(), exec.environment(), exec.params().isPreview(), failureInfo, e);
    }

    // ---- steps ----

    private void reconcile(DeployExecution exec) {
        StackParams params = exec.params().getStackParams();
        Map<String, Stack> stacks = reconciler.resolveInheritance(exec.request.getStacks());
        exec.target = reconciler.reconcileForDeploy(stacks, params)
                .find(params.getStackName())
                .orElseGet(() -> serverOnly(stacks, params));
    }

    /**
     * 只声明了服务端资源、没有客户端配置的 Stack
     */
    private ReconciledStack serverOnly(Map<String, Stack> stacks, StackParams params) {
        Stack stack = stacks.get(params.getStackName());
        if (stack == null) {
            throw new InvalidDescriptorException("stack " + params.getStackName() + " is not defined");
        }
        if (stack.getServer().resourcesFor(params.getEnvironment()).isEmpty()) {
            throw new InvalidDescriptorException(String.format(
                    "stack %s is not configured for environment %s", params.getStackName(), params.getEnvironment()));
        }
        return new ReconciledStack(stack.copy(), new StackConfig(), params.getEnvironment(), null);
    }

    private void resolvePlaceholders(DeployExecution exec) {
        ReconciledStack target = exec.target;
        exec.config = target.getConfig().copy();
        exec.ownedResources = new ArrayList<>();
        if (target.getParentReference().isEmpty()) {
            target.getStack().getServer().resourcesFor(exec.environment())
                    .forEach(r -> exec.ownedResources.add(r.copy()));
        }
        exec.extensions = deployExtensions(target.getStack(), exec.params().getRootDir());
        exec.context = ResolutionContext.of(exec.stackName(), target.getSecretsEnvironment());

        exec.deferred = objectResolver.resolveDeferring(exec.config, exec.context, exec.extensions);
        int replaced = exec.deferred.getReplacedCount();
        for (ResourceDescriptor resource : exec.ownedResources) {
            replaced += objectResolver.resolve(resource, exec.context, exec.extensions);
        }
        log.debug("占位符解析完成, 替换 {} 处, 延迟 {} 处", replaced, exec.deferred.size());
    }

    private ExtensionRegistry deployExtensions(Stack stack, Path rootDir) {
        ExtensionRegistry registry = baseExtensions.copy()
                .register(ExtensionRegistry.SECRET, new SecretExtension(secretsStore, stack.getSecrets()))
                .register(ExtensionRegistry.AUTH, new AuthExtension(stack.getSecrets()))
                .register(ExtensionRegistry.RESOURCE, DeferredExtension.INSTANCE)
                .register(ExtensionRegistry.DEPENDENCY, DeferredExtension.INSTANCE);
        if (rootDir != null) {
            registry.register(ExtensionRegistry.GIT, new GitExtension(GitRepository.discover(rootDir)))
                    .register(ExtensionRegistry.PROJECT, new ProjectExtension(rootDir));
        }
        return registry;
    }

    private void provision(DeployExecution exec) {
        if (exec.params().isPreview()) {
            log.info("预览模式, 跳过资源创建: {} 个资源", exec.ownedResources.size());
            return;
        }
        ProvisionContext context = new ProvisionContext(exec.params().getStackParams(), exec.selfReference(), resourceTypes);
        for (ResourceDescriptor resource : exec.ownedResources) {
            ResourceProvisioner provisioner = provisioners.require(resource.getType());
            log.info("创建资源: {} ({})", resource.getName(), resource.getType());
            StackOutputs outputs = provisioner.provision(resource, context);
            if (outputs != null && !outputs.isEmpty()) {
                stateRepository.publish(exec.selfReference(), outputs);
            }
        }
    }

    private void collectComputeContext(DeployExecution exec) {
        // 读取超时从本步骤开始计算，资源创建耗时不计入
        Instant deadline = Instant.now().plus(readTimeout);
        DefaultComputeContextCollector collector = new DefaultComputeContextCollector(
                exec.stackName(), referenceResolver, deadline, engine);
        exec.collector = collector;

        List<String> uses = exec.config.getUses();
        if (!uses.isEmpty()) {
            runProcessors(exec, collector, uses);
        }
        for (StackDependency dependency : exec.config.getDependencies()) {
            registerDependency(exec, collector, dependency);
        }
        collector.awaitOutputs();

        int replaced = exec.deferred.complete(exec.context, collector.extensions(exec.extensions));
        log.debug("计算上下文收集完成, 延迟占位符替换 {} 处", replaced);
    }

    private void runProcessors(DeployExecution exec, DefaultComputeContextCollector collector, List<String> uses) {
        String ownerReference = exec.target.getParentReference().orElse(exec.selfReference());
        String ownerEnvironment = exec.ownerEnvironment();
        StackReference owner = collector.stackReference(ownerReference);

        // 先完成全部查找，查找失败时还没有任何处理器开始执行
        List<ResourceScopedCollector> buffers = new ArrayList<>();
        List<Runnable> tasks = new ArrayList<>();
        for (String use : uses) {
            ResourceDescriptor resource = exec.target.getStack().getServer().findResource(ownerEnvironment, use)
                    .orElseThrow(() -> new InvalidDescriptorException(String.format(
                            "resource %s is not declared by stack %s in environment %s",
                            use, ownerReference, ownerEnvironment)));
            ComputeProcessor processor = processors.require(resource.getType());
            ResourceScopedCollector buffer = new ResourceScopedCollector(collector);
            ProcessorContext context = new ProcessorContext(resource, buffer, owner, ownerEnvironment,
                    exec.params().getStackParams(), referenceResolver, resourceTypes, exec.params().isPreview());
            buffers.add(buffer);
            tasks.add(() -> processor.process(context));
        }

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        AtomicBoolean failed = new AtomicBoolean(false);
        for (int i = 0; i < tasks.size(); i++) {
            Runnable task = tasks.get(i);
            String use = uses.get(i);
            CompletableFuture<Void> future = CompletableFuture.runAsync(() -> {
                if (failed.get()) {
                    log.debug("已有处理器失败, 跳过资源 {}", use);
                    return;
                }
                task.run();
            }, computeExecutor);
            future.whenComplete((ignored, error) -> {
                if (error != null) {
                    failed.set(true);
                }
            });
            futures.add(future);
        }

        // 一个失败后尚未开始的处理器不再执行，已在运行的全部结束后才返回
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .handle((ignored, error) -> null)
                .join();

        // 按声明顺序取第一个失败
        for (CompletableFuture<Void> future : futures) {
            try {
                future.join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                if (cause instanceof Error) {
                    throw (Error) cause;
                }
                throw e;
            }
        }
        buffers.forEach(b -> b.replayInto(collector));
    }

    private void registerDependency(DeployExecution exec, DefaultComputeContextCollector collector,
                                    StackDependency dependency) {
        StackParams params = exec.params().getStackParams();
        String ownerReference = StackReferences.expand(dependency.getOwner(), params.getOrganization(), params.getProject());
        String exportKey = ExportKeys.computeContext(StackReferences.collapse(ownerReference), params.getEnvironment());
        StackReference owner = collector.stackReference(ownerReference);
        String json = referenceResolver.getParentOutput(owner, exportKey, ownerReference, true);

        Map<String, Map<String, String>> exported;
        try {
            exported = objectMapper.readValue(json, COMPUTE_CONTEXT_TYPE);
        } catch (JsonProcessingException e) {
            throw new BinderException(ErrorType.STATE_READ_FAILURE,
                    "invalid compute context exported by " + ownerReference + ": " + e.getOriginalMessage(), e);
        }
        Map<String, String> fields = exported.get(dependency.getResource());
        if (fields == null) {
            throw new EmptyRequiredOutputException(ownerReference, exportKey,
                    "resource " + dependency.getResource() + " is not exported");
        }
        collector.addDependencyTplExtension(dependency.getName(), dependency.getResource(), fields);
    }

    private void flush(DeployExecution exec) {
        DefaultComputeContextCollector collector = exec.collector;

        Map<String, String> env = new LinkedHashMap<>(exec.config.getEnv());
        for (ComputeEnvVariable v : collector.envVariables()) {
            env.putIfAbsent(v.getName(), v.getValue());
        }
        Map<String, String> secrets = new LinkedHashMap<>(exec.config.getSecrets());
        for (ComputeEnvVariable v : collector.secretEnvVariables()) {
            secrets.putIfAbsent(v.getName(), v.getValue());
        }
        Map<String, Map<String, String>> resourceFields = collector.resourceTplExtensions();

        exec.payload = FlushPayload.builder()
                .stackName(exec.stackName())
                .environment(exec.environment())
                .workloadType(exec.config.getType())
                .env(env)
                .secrets(secrets)
                .config(exec.config.getConfig())
                .resourceFields(resourceFields)
                .dependencies(collector.dependencies())
                .build();

        if (exec.params().isPreview()) {
            log.info("预览模式, 不下发配置: {}", exec.payload);
            return;
        }
        workloadConfigurer.apply(exec.payload);
        if (!resourceFields.isEmpty()) {
            publishComputeContext(exec, resourceFields);
        }
    }

    private void publishComputeContext(DeployExecution exec, Map<String, Map<String, String>> resourceFields) {
        String json;
        try {
            json = objectMapper.writeValueAsString(resourceFields);
        } catch (JsonProcessingException e) {
            throw new BinderException(ErrorType.SYSTEM_ERROR, "failed to encode compute context", e);
        }
        StackOutputs outputs = StackOutputs.empty()
                .putSecret(ExportKeys.computeContext(exec.stackName(), exec.environment()), json);
        stateRepository.publish(exec.selfReference(), outputs);
    }

    /**
     * 单次部署的中间状态，只在编排线程内使用
     */
    private static final class DeployExecution {

        private final DeployRequest request;

        private DeployState currentStep = DeployState.CREATED;
        private ReconciledStack target;
        private StackConfig config;
        private List<ResourceDescriptor> ownedResources = new ArrayList<>();
        private ExtensionRegistry extensions;
        private ResolutionContext context;
        private DeferredPlaceholders deferred;
        private DefaultComputeContextCollector collector;
        private FlushPayload payload;

        private DeployExecution(DeployRequest request) {
            this.request = request;
        }

        DeployParams params() {
            return request.getParams();
        }

        String stackName() {
            return request.getStackName();
        }

        String environment() {
            return request.getEnvironment();
        }

        String selfReference() {
            StackParams p = params().getStackParams();
            return StackReferences.expand(p.getStackName(), p.getOrganization(), p.getProject());
        }

        /**
         * 被使用资源所在的环境：设置了 parentEnv 时为父环境
         */
        String ownerEnvironment() {
            String parentEnv = config.getParentEnv();
            return parentEnv != null && !parentEnv.isBlank() ? parentEnv : environment();
        }
    }

    public static class Builder {
        private StackReconciler reconciler;
        private PlaceholderEngine engine;
        private ExtensionRegistry baseExtensions;
        private SecretsStore secretsStore;
        private ResourceTypeRegistry resourceTypes;
        private ProvisionerRegistry provisioners;
        private ComputeProcessorRegistry processors;
        private StackStateRepository stateRepository;
        private CrossStackReferenceResolver referenceResolver;
        private Executor computeExecutor;
        private WorkloadConfigurer workloadConfigurer;
        private AlertNotifier alertNotifier;
        private DomainEventPublisher eventPublisher;
        private MetricsRegistry metrics;
        private ObjectMapper objectMapper;
        private Duration readTimeout;

        public Builder reconciler(StackReconciler reconciler) {
            this.reconciler = reconciler;
            return this;
        }

        public Builder engine(PlaceholderEngine engine) {
            this.engine = engine;
            return this;
        }

        /**
         * 与具体 Stack 无关的扩展（env、date 等）
         */
        public Builder baseExtensions(ExtensionRegistry baseExtensions) {
            this.baseExtensions = baseExtensions;
            return this;
        }

        public Builder secretsStore(SecretsStore secretsStore) {
            this.secretsStore = secretsStore;
            return this;
        }

        public Builder resourceTypes(ResourceTypeRegistry resourceTypes) {
            this.resourceTypes = resourceTypes;
            return this;
        }

        public Builder provisioners(ProvisionerRegistry provisioners) {
            this.provisioners = provisioners;
            return this;
        }

        public Builder processors(ComputeProcessorRegistry processors) {
            this.processors = processors;
            return this;
        }

        public Builder stateRepository(StackStateRepository stateRepository) {
            this.stateRepository = stateRepository;
            return this;
        }

        public Builder referenceResolver(CrossStackReferenceResolver referenceResolver) {
            this.referenceResolver = referenceResolver;
            return this;
        }

        public Builder computeExecutor(Executor computeExecutor) {
            this.computeExecutor = computeExecutor;
            return this;
        }

        public Builder workloadConfigurer(WorkloadConfigurer workloadConfigurer) {
            this.workloadConfigurer = workloadConfigurer;
            return this;
        }

        public Builder alertNotifier(AlertNotifier alertNotifier) {
            this.alertNotifier = alertNotifier;
            return this;
        }

        public Builder eventPublisher(DomainEventPublisher eventPublisher) {
            this.eventPublisher = eventPublisher;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder readTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public ProvisioningOrchestrator build() {
            return new ProvisioningOrchestrator(this);
        }
    }
}
