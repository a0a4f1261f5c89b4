package xyz.firestige.binder.compute;

import xyz.firestige.binder.crossstack.CrossStackReferenceResolver;
import xyz.firestige.binder.crossstack.ExportKeys;
import xyz.firestige.binder.crossstack.StackReference;
import xyz.firestige.binder.domain.resource.ResourceConfig;
import xyz.firestige.binder.domain.resource.ResourceDescriptor;
import xyz.firestige.binder.domain.resource.ResourceTypeRegistry;
import xyz.firestige.binder.domain.stack.StackParams;

import java.util.Optional;

/**
 * 一次计算处理器调用的输入
 */
public class ProcessorContext {

    private final ResourceDescriptor resource;
    private final ComputeContextCollector collector;
    private final StackReference ownerReference;
    private final String ownerEnvironment;
    private final StackParams consumer;
    private final CrossStackReferenceResolver resolver;
    private final ResourceTypeRegistry resourceTypes;
    private final boolean preview;

    public ProcessorContext(ResourceDescriptor resource, ComputeContextCollector collector,
                            StackReference ownerReference, String ownerEnvironment, StackParams consumer,
                            CrossStackReferenceResolver resolver, ResourceTypeRegistry resourceTypes, boolean preview) {
        this.resource = resource;
        this.collector = collector;
        this.ownerReference = ownerReference;
        this.ownerEnvironment = ownerEnvironment;
        this.consumer = consumer;
        this.resolver = resolver;
        this.resourceTypes = resourceTypes;
        this.preview = preview;
    }

    /**
     * 资源在所属 Stack 中的导出名前缀，{@code <resource>--<env>}
     */
    public String exportName() {
        return ExportKeys.resourceName(resource.getName(), ownerEnvironment);
    }

    public String requireOutput(String exportKey) {
        return resolver.getParentOutput(ownerReference, exportKey, ownerReference.getFullReference(), false);
    }

    public String requireSecretOutput(String exportKey) {
        return resolver.getParentOutput(ownerReference, exportKey, ownerReference.getFullReference(), true);
    }

    public Optional<String> optionalOutput(String exportKey) {
        return resolver.getOptionalOutput(ownerReference, exportKey);
    }

    public boolean hasOutput(String exportKey) {
        return ownerReference.getOutputs().get(exportKey).isPresent();
    }

    public <T extends ResourceConfig> T config(Class<T> type) {
        return resourceTypes.decode(resource, type);
    }

    public void addEnv(String name, String value) {
        collector.addEnvVariableIfNotExist(name, value, resource.getType(), resource.getName(), ownerReference.getStackName());
    }

    public void addSecretEnv(String name, String value) {
        collector.addSecretEnvVariableIfNotExist(name, value, resource.getType(), resource.getName(), ownerReference.getStackName());
    }

    public ResourceDescriptor getResource() {
        return resource;
    }

    public ComputeContextCollector getCollector() {
        return collector;
    }

    public StackReference getOwnerReference() {
        return ownerReference;
    }

    public String getOwnerEnvironment() {
        return ownerEnvironment;
    }

    public StackParams getConsumer() {
        return consumer;
    }

    public boolean isPreview() {
        return preview;
    }
}
