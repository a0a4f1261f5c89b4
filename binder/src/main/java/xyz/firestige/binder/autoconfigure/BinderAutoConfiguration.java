package xyz.firestige.binder.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import xyz.firestige.binder.compute.ComputeProcessor;
import xyz.firestige.binder.compute.ComputeProcessorRegistry;
import xyz.firestige.binder.compute.processor.BucketComputeProcessor;
import xyz.firestige.binder.compute.processor.DatabaseBootstrapper;
import xyz.firestige.binder.compute.processor.PasswordGenerator;
import xyz.firestige.binder.compute.processor.PostgresComputeProcessor;
import xyz.firestige.binder.compute.processor.RedisComputeProcessor;
import xyz.firestige.binder.compute.processor.S3BucketComputeProcessor;
import xyz.firestige.binder.config.BinderProperties;
import xyz.firestige.binder.config.StackDescriptorLoader;
import xyz.firestige.binder.crossstack.CrossStackReferenceResolver;
import xyz.firestige.binder.crossstack.StackStateRepository;
import xyz.firestige.binder.crypto.CryptoProvider;
import xyz.firestige.binder.crypto.SecretCipher;
import xyz.firestige.binder.domain.resource.ResourceTypeRegistry;
import xyz.firestige.binder.event.DomainEventPublisher;
import xyz.firestige.binder.event.SpringDomainEventPublisher;
import xyz.firestige.binder.exception.BinderException;
import xyz.firestige.binder.exception.ErrorType;
import xyz.firestige.binder.metrics.MetricsRegistry;
import xyz.firestige.binder.metrics.MicrometerMetricsRegistry;
import xyz.firestige.binder.metrics.NoopMetricsRegistry;
import xyz.firestige.binder.orchestration.AlertNotifier;
import xyz.firestige.binder.orchestration.ProvisionerRegistry;
import xyz.firestige.binder.orchestration.ProvisioningOrchestrator;
import xyz.firestige.binder.orchestration.ResourceProvisioner;
import xyz.firestige.binder.orchestration.WorkloadConfigurer;
import xyz.firestige.binder.orchestration.notify.EventPublishingAlertNotifier;
import xyz.firestige.binder.orchestration.notify.LoggingAlertNotifier;
import xyz.firestige.binder.reconcile.StackReconciler;
import xyz.firestige.binder.secrets.SecretResolver;
import xyz.firestige.binder.secrets.SecretsDescriptorRepository;
import xyz.firestige.binder.secrets.SecretsManager;
import xyz.firestige.binder.secrets.SecretsStore;
import xyz.firestige.binder.template.ExtensionRegistry;
import xyz.firestige.binder.template.PlaceholderEngine;
import xyz.firestige.binder.template.extension.DateExtension;
import xyz.firestige.binder.template.extension.EnvExtension;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 绑定引擎自动配置
 * <p>
 * 所有注册表都是在这里显式构建的对象，不存在全局静态注册；
 * 每个 Bean 均为 {@code @ConditionalOnMissingBean}，可由应用覆盖。
 * 密钥相关 Bean（SecretCipher / SecretsStore / SecretsManager / 编排器）需要配置
 * {@code binder.keys.public-key}。
 */
@AutoConfiguration(after = StackStateAutoConfiguration.class)
@EnableConfigurationProperties(BinderProperties.class)
public class BinderAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(BinderAutoConfiguration.class);

    // ========== Template ==========

    @Bean
    @ConditionalOnMissingBean
    public PlaceholderEngine placeholderEngine() {
        return new PlaceholderEngine();
    }

    /**
     * 与 Stack 无关的占位符扩展：env、date。secret / auth / git / project 按部署构建。
     */
    @Bean
    @ConditionalOnMissingBean
    public ExtensionRegistry binderBaseExtensions(ObjectProvider<Clock> clock) {
        return new ExtensionRegistry()
                .register(ExtensionRegistry.ENV, new EnvExtension())
                .register(ExtensionRegistry.DATE, new DateExtension(clock.getIfAvailable(Clock::systemDefaultZone)));
    }

    // ========== Resource types & compute processors ==========

    @Bean
    @ConditionalOnMissingBean
    public ResourceTypeRegistry resourceTypeRegistry(ObjectProvider<ObjectMapper> objectMapper,
                                                     ObjectProvider<Validator> validator) {
        return ResourceTypeRegistry.withDefaults(
                objectMapper.getIfAvailable(ObjectMapper::new),
                validator.getIfAvailable(() -> Validation.buildDefaultValidatorFactory().getValidator()));
    }

    @Bean
    @ConditionalOnMissingBean
    public PasswordGenerator passwordGenerator() {
        return new PasswordGenerator();
    }

    /**
     * 内置处理器 + 应用声明的 ComputeProcessor Bean（同类型时以应用的为准）
     */
    @Bean
    @ConditionalOnMissingBean
    public ComputeProcessorRegistry computeProcessorRegistry(ObjectProvider<ComputeProcessor> processors,
                                                             ObjectProvider<DatabaseBootstrapper> bootstrapper,
                                                             PasswordGenerator passwordGenerator) {
        ComputeProcessorRegistry registry = new ComputeProcessorRegistry();
        processors.orderedStream().forEach(registry::register);
        DatabaseBootstrapper db = bootstrapper.getIfAvailable(() -> request -> {
            throw new BinderException(ErrorType.CONFIGURATION_ERROR,
                    "no DatabaseBootstrapper configured, cannot create database " + request.getDatabase());
        });
        for (ComputeProcessor builtin : new ComputeProcessor[]{
                new BucketComputeProcessor(),
                new S3BucketComputeProcessor(),
                new PostgresComputeProcessor(db, passwordGenerator),
                new RedisComputeProcessor()}) {
            if (registry.find(builtin.resourceType()).isEmpty()) {
                registry.register(builtin);
            }
        }
        logger.info("[AutoConfig] 计算处理器: {}", registry.resourceTypes());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public ProvisionerRegistry provisionerRegistry(ObjectProvider<ResourceProvisioner> provisioners) {
        ProvisionerRegistry registry = new ProvisionerRegistry();
        provisioners.orderedStream().forEach(registry::register);
        logger.info("[AutoConfig] 资源创建者: {}", registry.resourceTypes());
        return registry;
    }

    // ========== Secrets ==========

    @Bean
    @ConditionalOnMissingBean
    public CryptoProvider cryptoProvider() {
        return new CryptoProvider();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "binder.keys", name = "public-key")
    public SecretCipher secretCipher(CryptoProvider cryptoProvider, BinderProperties properties) {
        SecretCipher cipher = SecretCipher.fromEncodedKeys(cryptoProvider,
                properties.getKeys().getPublicKey(), properties.getKeys().getPrivateKey());
        logger.info("[AutoConfig] 密钥族: {}, 可解密: {}", cipher.getKeyFamily(), cipher.canDecrypt());
        return cipher;
    }

    @Bean
    @ConditionalOnMissingBean
    public SecretsDescriptorRepository secretsDescriptorRepository() {
        return new SecretsDescriptorRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(SecretCipher.class)
    public SecretsStore secretsStore(SecretCipher secretCipher) {
        return new SecretsStore(secretCipher);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(SecretCipher.class)
    public SecretsManager secretsManager(SecretCipher secretCipher, SecretsDescriptorRepository repository) {
        return new SecretsManager(secretCipher, repository);
    }

    @Bean
    @ConditionalOnMissingBean
    public SecretResolver secretResolver() {
        return new SecretResolver();
    }

    // ========== Stacks ==========

    @Bean
    @ConditionalOnMissingBean
    public StackDescriptorLoader stackDescriptorLoader(SecretsDescriptorRepository repository,
                                                       BinderProperties properties) {
        return new StackDescriptorLoader(repository, properties.getStacksDir(), properties.getSecretsFile());
    }

    @Bean
    @ConditionalOnMissingBean
    public StackReconciler stackReconciler(SecretResolver secretResolver) {
        return new StackReconciler(secretResolver);
    }

    @Bean(name = "binderStateReadExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "binderStateReadExecutor")
    public ExecutorService binderStateReadExecutor() {
        CustomizableThreadFactory factory = new CustomizableThreadFactory("binder-state-");
        factory.setDaemon(true);
        return Executors.newCachedThreadPool(factory);
    }

    @Bean
    @ConditionalOnMissingBean
    public CrossStackReferenceResolver crossStackReferenceResolver(StackStateRepository stateRepository,
                                                                   @Qualifier("binderStateReadExecutor") ExecutorService binderStateReadExecutor) {
        return new CrossStackReferenceResolver(stateRepository, binderStateReadExecutor);
    }

    // ========== Events / metrics / alerts ==========

    @Bean
    @ConditionalOnMissingBean
    public DomainEventPublisher domainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        return new SpringDomainEventPublisher(applicationEventPublisher);
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsRegistry binderMetricsRegistry(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry == null) {
            logger.info("[AutoConfig] 未发现 MeterRegistry, 使用 Noop 指标");
            return new NoopMetricsRegistry();
        }
        return new MicrometerMetricsRegistry(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertNotifier alertNotifier(BinderProperties properties, ApplicationEventPublisher publisher) {
        if (properties.getAlerts().isEnabled()) {
            return new EventPublishingAlertNotifier(publisher);
        }
        return new LoggingAlertNotifier();
    }

    // ========== Orchestrator ==========

    @Bean(name = "binderComputeExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "binderComputeExecutor")
    public ExecutorService binderComputeExecutor(BinderProperties properties) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory("binder-compute-");
        factory.setDaemon(true);
        return Executors.newFixedThreadPool(properties.getCompute().getMaxConcurrency(), factory);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({SecretsStore.class, WorkloadConfigurer.class})
    public ProvisioningOrchestrator provisioningOrchestrator(BinderProperties properties,
                                                             StackReconciler reconciler,
                                                             PlaceholderEngine engine,
                                                             ExtensionRegistry binderBaseExtensions,
                                                             SecretsStore secretsStore,
                                                             ResourceTypeRegistry resourceTypes,
                                                             ProvisionerRegistry provisioners,
                                                             ComputeProcessorRegistry processors,
                                                             StackStateRepository stateRepository,
                                                             CrossStackReferenceResolver referenceResolver,
                                                             @Qualifier("binderComputeExecutor") ExecutorService binderComputeExecutor,
                                                             WorkloadConfigurer workloadConfigurer,
                                                             AlertNotifier alertNotifier,
                                                             DomainEventPublisher eventPublisher,
                                                             MetricsRegistry metrics,
                                                             ObjectProvider<ObjectMapper> objectMapper) {
        logger.info("[AutoConfig] 装配部署编排器, 计算并发: {}, 状态读取超时: {}",
                properties.getCompute().getMaxConcurrency(), properties.getState().getReadTimeout());
        return ProvisioningOrchestrator.builder()
                .reconciler(reconciler)
                .engine(engine)
                .baseExtensions(binderBaseExtensions)
                .secretsStore(secretsStore)
                .resourceTypes(resourceTypes)
                .provisioners(provisioners)
                .processors(processors)
                .stateRepository(stateRepository)
                .referenceResolver(referenceResolver)
                .computeExecutor(binderComputeExecutor)
                .workloadConfigurer(workloadConfigurer)
                .alertNotifier(alertNotifier)
                .eventPublisher(eventPublisher)
                .metrics(metrics)
                .objectMapper(objectMapper.getIfAvailable(ObjectMapper::new))
                .readTimeout(properties.getState().getReadTimeout())
                .build();
    }
}
