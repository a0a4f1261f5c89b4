package xyz.firestige.binder.orchestration;

/**
 * 部署状态，步骤按声明顺序推进
 */
public enum DeployState {

    CREATED("已创建"),
    RECONCILE("调和父子 Stack"),
    RESOLVE_PLACEHOLDERS("解析占位符"),
    PROVISION("创建资源"),
    COLLECT_COMPUTE_CONTEXT("收集计算上下文"),
    FLUSH("下发工作负载配置"),
    DONE("已完成"),
    ABORTED("已中止");

    private final String description;

    DeployState(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this == DONE || this == ABORTED;
    }
}
