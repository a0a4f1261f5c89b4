package xyz.firestige.binder.orchestration;

import xyz.firestige.binder.crossstack.ExportKeys;
import xyz.firestige.binder.domain.resource.ResourceConfig;
import xyz.firestige.binder.domain.resource.ResourceDescriptor;
import xyz.firestige.binder.domain.resource.ResourceTypeRegistry;
import xyz.firestige.binder.domain.stack.StackParams;

public class ProvisionContext {

    private final StackParams stackParams;
    private final String fullReference;
    private final ResourceTypeRegistry resourceTypes;

    public ProvisionContext(StackParams stackParams, String fullReference, ResourceTypeRegistry resourceTypes) {
        this.stackParams = stackParams;
        this.fullReference = fullReference;
        this.resourceTypes = resourceTypes;
    }

    /**
     * 资源导出名前缀，{@code <resource>--<env>}
     */
    public String exportName(ResourceDescriptor resource) {
        return ExportKeys.resourceName(resource.getName(), stackParams.getEnvironment());
    }

    public <T extends ResourceConfig> T config(ResourceDescriptor resource, Class<T> type) {
        return resourceTypes.decode(resource, type);
    }

    public StackParams getStackParams() {
        return stackParams;
    }

    public String getFullReference() {
        return fullReference;
    }
}
