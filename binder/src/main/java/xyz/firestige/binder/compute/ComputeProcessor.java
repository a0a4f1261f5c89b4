package xyz.firestige.binder.compute;

/**
 * 资源类型相关的计算处理器
 * <p>
 * 对部署使用的每个资源调用一次：读取资源所属 Stack 发布的输出，注册环境变量和
 * {@code resource} 模板扩展。必需输出缺失时抛出类型化异常，不使用默认值。
 */
public interface ComputeProcessor {

    /**
     * 处理的资源类型标签
     */
    String resourceType();

    void process(ProcessorContext context);
}
