package xyz.firestige.binder.domain.resource;

/**
 * 资源类型相关配置的标记接口
 */
public interface ResourceConfig {
}
