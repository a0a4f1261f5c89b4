package xyz.firestige.binder.orchestration.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import xyz.firestige.binder.orchestration.AlertNotifier;
import xyz.firestige.binder.orchestration.DeployAlert;

/**
 * 以 Spring 事件发布告警，由应用侧 @EventListener 转发到 Slack、邮件等渠道
 */
public class EventPublishingAlertNotifier implements AlertNotifier {

    private static final Logger log = LoggerFactory.getLogger(EventPublishingAlertNotifier.class);

    private final ApplicationEventPublisher publisher;

    public EventPublishingAlertNotifier(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void notify(DeployAlert alert) {
        log.warn("发布部署告警: {}", alert.getTitle());
        publisher.publishEvent(alert);
    }
}
