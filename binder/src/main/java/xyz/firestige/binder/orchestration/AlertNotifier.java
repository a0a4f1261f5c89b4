package xyz.firestige.binder.orchestration;

/**
 * 部署失败告警，每次失败的部署恰好调用一次
 */
@FunctionalInterface
public interface AlertNotifier {

    void notify(DeployAlert alert);
}
