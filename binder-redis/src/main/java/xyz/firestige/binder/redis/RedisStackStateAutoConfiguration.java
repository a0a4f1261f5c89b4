package xyz.firestige.binder.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import xyz.firestige.binder.autoconfigure.StackStateAutoConfiguration;
import xyz.firestige.binder.config.BinderProperties;
import xyz.firestige.binder.crossstack.StackStateRepository;

/**
 * Redis 状态存储自动配置
 * <p>
 * 配置示例（application.yml）：
 * <pre>
 * binder:
 *   state:
 *     store-type: redis
 *     namespace: stack-binder   # Redis Key 前缀
 * </pre>
 */
@AutoConfiguration(after = RedisAutoConfiguration.class, before = StackStateAutoConfiguration.class)
@ConditionalOnClass(RedisConnectionFactory.class)
@ConditionalOnProperty(prefix = "binder.state", name = "store-type", havingValue = "redis")
@EnableConfigurationProperties(BinderProperties.class)
public class RedisStackStateAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(RedisStackStateAutoConfiguration.class);

    /**
     * 使用 StringRedisTemplate 简化序列化
     */
    @Bean(name = "binderStateRedisTemplate")
    @ConditionalOnMissingBean(name = "binderStateRedisTemplate")
    public RedisTemplate<String, String> binderStateRedisTemplate(RedisConnectionFactory factory) {
        logger.info("[AutoConfig] 创建 Redis Template for Stack State");
        StringRedisTemplate template = new StringRedisTemplate();
        template.setConnectionFactory(factory);
        template.afterPropertiesSet();
        return template;
    }

    @Bean
    @ConditionalOnMissingBean(StackStateRepository.class)
    public StackStateRepository redisStackStateRepository(
            @Qualifier("binderStateRedisTemplate") RedisTemplate<String, String> binderStateRedisTemplate,
            ObjectProvider<ObjectMapper> objectMapper,
            BinderProperties properties) {
        logger.info("[AutoConfig] 装配 Redis 状态存储, namespace: {}", properties.getState().getNamespace());
        return new RedisStackStateRepository(binderStateRedisTemplate,
                objectMapper.getIfAvailable(ObjectMapper::new), properties.getState().getNamespace());
    }
}
