package xyz.firestige.binder.orchestration.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.binder.orchestration.AlertNotifier;
import xyz.firestige.binder.orchestration.DeployAlert;

public class LoggingAlertNotifier implements AlertNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingAlertNotifier.class);

    @Override
    public void notify(DeployAlert alert) {
        log.error("[ALERT] {}, 错误类型: {}, 原因: {}", alert.getTitle(),
                alert.getFailureInfo().getErrorType(), alert.getFailureInfo().getErrorMessage());
    }
}
