package xyz.firestige.binder.orchestration;

/**
 * 将最终配置应用到具体的工作负载（容器、函数等），由云厂商实现提供
 */
@FunctionalInterface
public interface WorkloadConfigurer {

    void apply(FlushPayload payload);
}
