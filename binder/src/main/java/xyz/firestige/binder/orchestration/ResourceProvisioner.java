package xyz.firestige.binder.orchestration;

import xyz.firestige.binder.crossstack.StackOutputs;
import xyz.firestige.binder.domain.resource.ResourceDescriptor;

/**
 * 某一资源类型的创建者
 * <p>
 * 返回按 {@link xyz.firestige.binder.crossstack.ExportKeys} 命名的输出，由编排器发布到状态存储。
 */
public interface ResourceProvisioner {

    String resourceType();

    StackOutputs provision(ResourceDescriptor resource, ProvisionContext context);
}
