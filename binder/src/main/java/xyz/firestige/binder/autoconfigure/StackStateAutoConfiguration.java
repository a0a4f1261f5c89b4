package xyz.firestige.binder.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import xyz.firestige.binder.config.BinderProperties;
import xyz.firestige.binder.crossstack.StackStateRepository;
import xyz.firestige.binder.crossstack.file.FileSystemStackStateRepository;
import xyz.firestige.binder.crossstack.memory.InMemoryStackStateRepository;
import xyz.firestige.binder.exception.InvalidDescriptorException;

import java.nio.file.Path;

/**
 * Stack 输出状态存储自动配置
 * <p>
 * 配置示例（application.yml）：
 * <pre>
 * binder:
 *   state:
 *     store-type: file   # memory / file / redis，默认 memory
 *     directory: .sc/state
 * </pre>
 * redis 实现位于 stack-binder-redis 模块，引入后在本配置之前装配。
 */
@AutoConfiguration
@EnableConfigurationProperties(BinderProperties.class)
public class StackStateAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(StackStateAutoConfiguration.class);

    /**
     * 文件系统状态存储
     */
    @Bean
    @ConditionalOnMissingBean(StackStateRepository.class)
    @ConditionalOnProperty(prefix = "binder.state", name = "store-type", havingValue = "file")
    public StackStateRepository fileSystemStackStateRepository(BinderProperties properties,
                                                               ObjectProvider<ObjectMapper> objectMapper) {
        String directory = properties.getState().getDirectory();
        if (directory == null || directory.isBlank()) {
            throw new InvalidDescriptorException("binder.state.directory is required when store-type is file");
        }
        logger.info("[AutoConfig] 装配文件系统状态存储: {}", directory);
        return new FileSystemStackStateRepository(Path.of(directory),
                objectMapper.getIfAvailable(ObjectMapper::new));
    }

    /**
     * 内存状态存储（Fallback）
     */
    @Bean
    @ConditionalOnMissingBean(StackStateRepository.class)
    public StackStateRepository inMemoryStackStateRepository(BinderProperties properties) {
        if (!"memory".equals(properties.getState().getStoreType())) {
            logger.warn("[AutoConfig] store-type={} 没有可用实现, 回退到 InMemory 状态存储",
                    properties.getState().getStoreType());
        } else {
            logger.info("[AutoConfig] 装配 InMemory 状态存储");
        }
        return new InMemoryStackStateRepository();
    }
}
