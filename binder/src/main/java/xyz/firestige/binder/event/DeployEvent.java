package xyz.firestige.binder.event;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * 部署领域事件基类
 */
public abstract class DeployEvent {

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final String eventId;
    private final LocalDateTime occurredOn;
    private final String stackName;
    private final String environment;
    private String message;

    protected DeployEvent(String stackName, String environment) {
        this.eventId = UUID.randomUUID().toString();
        this.occurredOn = LocalDateTime.now();
        this.stackName = stackName;
        this.environment = environment;
        this.message = "";
    }

    public String getEventName() {
        return getClass().getSimpleName();
    }

    public String getEventId() {
        return eventId;
    }

    public LocalDateTime getOccurredOn() {
        return occurredOn;
    }

    public String getFormattedTimestamp() {
        return occurredOn.format(FORMATTER);
    }

    public String getStackName() {
        return stackName;
    }

    public String getEnvironment() {
        return environment;
    }

    public String getMessage() {
        return message;
    }

    protected void setMessage(String message) {
        this.message = message;
    }

    @Override
    public String toString() {
        return getEventName() + "{stack='" + stackName + "', env='" + environment + "', occurredOn=" + occurredOn + "}";
    }
}
