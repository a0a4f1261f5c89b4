package xyz.firestige.binder.autoconfigure;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import xyz.firestige.binder.compute.ComputeProcessorRegistry;
import xyz.firestige.binder.crossstack.StackStateRepository;
import xyz.firestige.binder.crossstack.file.FileSystemStackStateRepository;
import xyz.firestige.binder.crossstack.memory.InMemoryStackStateRepository;
import xyz.firestige.binder.crypto.KeyCodec;
import xyz.firestige.binder.crypto.KeyFamily;
import xyz.firestige.binder.crypto.SecretCipher;
import xyz.firestige.binder.domain.resource.ResourceTypes;
import xyz.firestige.binder.metrics.MetricsRegistry;
import xyz.firestige.binder.metrics.NoopMetricsRegistry;
import xyz.firestige.binder.orchestration.AlertNotifier;
import xyz.firestige.binder.orchestration.ProvisioningOrchestrator;
import xyz.firestige.binder.orchestration.WorkloadConfigurer;
import xyz.firestige.binder.orchestration.notify.EventPublishingAlertNotifier;
import xyz.firestige.binder.orchestration.notify.LoggingAlertNotifier;
import xyz.firestige.binder.secrets.SecretsManager;
import xyz.firestige.binder.secrets.SecretsStore;

import java.nio.file.Path;
import java.security.KeyPair;

import static org.assertj.core.api.Assertions.*;

/**
 * 自动配置装配测试
 */
@DisplayName("BinderAutoConfiguration 装配测试")
class BinderAutoConfigurationTest {

    private static String publicKey;
    private static String privateKey;

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(StackStateAutoConfiguration.class, BinderAutoConfiguration.class));

    @BeforeAll
    static void generateKeys() {
        KeyPair keyPair = KeyCodec.generateEd25519KeyPair();
        publicKey = KeyCodec.formatPublicKey(keyPair.getPublic());
        privateKey = KeyCodec.formatPrivateKey(keyPair.getPrivate());
    }

    @Test
    @DisplayName("默认使用内存状态存储与内置处理器")
    void defaults_useInMemoryStore() {
        runner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context.getBean(StackStateRepository.class)).isInstanceOf(InMemoryStackStateRepository.class);
            assertThat(context.getBean(ComputeProcessorRegistry.class).resourceTypes())
                    .contains(ResourceTypes.BUCKET, ResourceTypes.S3_BUCKET, ResourceTypes.POSTGRES, ResourceTypes.REDIS);
            assertThat(context.getBean(MetricsRegistry.class)).isInstanceOf(NoopMetricsRegistry.class);
            assertThat(context.getBean(AlertNotifier.class)).isInstanceOf(EventPublishingAlertNotifier.class);
        });
    }

    @Test
    @DisplayName("没有配置公钥时不装配密钥相关 Bean 与编排器")
    void withoutKeys_noSecretBeans() {
        runner.withUserConfiguration(WorkloadConfig.class).run(context -> {
            assertThat(context).doesNotHaveBean(SecretCipher.class);
            assertThat(context).doesNotHaveBean(SecretsStore.class);
            assertThat(context).doesNotHaveBean(ProvisioningOrchestrator.class);
        });
    }

    @Test
    @DisplayName("配置密钥对且存在 WorkloadConfigurer 时装配编排器")
    void withKeysAndWorkload_orchestratorPresent() {
        runner.withUserConfiguration(WorkloadConfig.class)
                .withPropertyValues("binder.keys.public-key=" + publicKey,
                        "binder.keys.private-key=" + privateKey,
                        "binder.compute.max-concurrency=2")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    SecretCipher cipher = context.getBean(SecretCipher.class);
                    assertThat(cipher.getKeyFamily()).isEqualTo(KeyFamily.ED25519);
                    assertThat(cipher.canDecrypt()).isTrue();
                    assertThat(context).hasSingleBean(SecretsManager.class);
                    assertThat(context).hasSingleBean(ProvisioningOrchestrator.class);
                });
    }

    @Test
    @DisplayName("缺少 WorkloadConfigurer 时不装配编排器")
    void withoutWorkload_noOrchestrator() {
        runner.withPropertyValues("binder.keys.public-key=" + publicKey)
                .run(context -> {
                    assertThat(context).hasSingleBean(SecretsStore.class);
                    assertThat(context.getBean(SecretCipher.class).canDecrypt()).isFalse();
                    assertThat(context).doesNotHaveBean(ProvisioningOrchestrator.class);
                });
    }

    @Test
    @DisplayName("store-type=file 时使用文件系统状态存储")
    void fileStore_configured(@TempDir Path dir) {
        runner.withPropertyValues("binder.state.store-type=file", "binder.state.directory=" + dir)
                .run(context -> assertThat(context.getBean(StackStateRepository.class))
                        .isInstanceOf(FileSystemStackStateRepository.class));
    }

    @Test
    @DisplayName("store-type=file 但未配置目录时启动失败")
    void fileStore_withoutDirectory_fails() {
        runner.withPropertyValues("binder.state.store-type=file")
                .run(context -> assertThat(context).hasFailed()
                        .getFailure().hasStackTraceContaining("binder.state.directory is required"));
    }

    @Test
    @DisplayName("关闭告警事件时使用日志告警")
    void alertsDisabled_usesLoggingNotifier() {
        runner.withPropertyValues("binder.alerts.enabled=false")
                .run(context -> assertThat(context.getBean(AlertNotifier.class))
                        .isInstanceOf(LoggingAlertNotifier.class));
    }

    @Test
    @DisplayName("应用自定义的状态存储优先")
    void userRepository_wins() {
        runner.withUserConfiguration(CustomStoreConfig.class)
                .withPropertyValues("binder.state.store-type=file")
                .run(context -> assertThat(context.getBean(StackStateRepository.class))
                        .isSameAs(CustomStoreConfig.STORE));
    }

    @Configuration(proxyBeanMethods = false)
    static class WorkloadConfig {

        @Bean
        WorkloadConfigurer workloadConfigurer() {
            return payload -> { };
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomStoreConfig {

        static final InMemoryStackStateRepository STORE = new InMemoryStackStateRepository();

        @Bean
        StackStateRepository customStore() {
            return STORE;
        }
    }
}
