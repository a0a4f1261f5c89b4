package xyz.firestige.binder.event;

import java.util.List;

/**
 * 领域事件发布器
 * <p>
 * 部署流程只依赖该接口，默认实现转发到 Spring 本地事件总线。
 */
public interface DomainEventPublisher {

    /**
     * 发布单个领域事件
     *
     * @param event 领域事件对象
     */
    void publish(Object event);

    /**
     * 批量发布领域事件
     *
     * @param events 领域事件列表
     */
    default void publishAll(List<?> events) {
        if (events != null) {
            events.forEach(this::publish);
        }
    }
}
