package xyz.firestige.binder.event;

import org.springframework.context.ApplicationEventPublisher;

/**
 * Spring 本地事件总线实现，同步或异步取决于 @EventListener 配置
 */
public class SpringDomainEventPublisher implements DomainEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    public SpringDomainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void publish(Object event) {
        applicationEventPublisher.publishEvent(event);
    }
}
