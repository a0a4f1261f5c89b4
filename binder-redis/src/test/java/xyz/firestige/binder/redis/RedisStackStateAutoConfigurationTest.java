package xyz.firestige.binder.redis;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import xyz.firestige.binder.autoconfigure.StackStateAutoConfiguration;
import xyz.firestige.binder.crossstack.StackStateRepository;
import xyz.firestige.binder.crossstack.memory.InMemoryStackStateRepository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

/**
 * Redis 状态存储自动配置测试
 */
class RedisStackStateAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(RedisStackStateAutoConfiguration.class, StackStateAutoConfiguration.class))
        .withBean(RedisConnectionFactory.class, () -> mock(RedisConnectionFactory.class));

    @Test
    void storeTypeRedis_createsRedisRepository() {
        contextRunner
            .withPropertyValues("binder.state.store-type=redis", "binder.state.namespace=test-ns")
            .run(context -> {
                assertThat(context).hasBean("binderStateRedisTemplate");
                StackStateRepository repository = context.getBean(StackStateRepository.class);
                assertThat(repository).isInstanceOf(RedisStackStateRepository.class);
                assertThat(((RedisStackStateRepository) repository).keyFor("acme/shop/api"))
                    .isEqualTo("test-ns:stack:acme/shop/api");
            });
    }

    @Test
    void storeTypeMemory_fallsBackToInMemory() {
        contextRunner
            .run(context -> {
                assertThat(context).doesNotHaveBean("binderStateRedisTemplate");
                assertThat(context.getBean(StackStateRepository.class)).isInstanceOf(InMemoryStackStateRepository.class);
            });
    }
}
