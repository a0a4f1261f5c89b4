package xyz.firestige.binder.compute;

import java.util.Objects;

/**
 * 工作负载对某个资源的依赖边
 */
public final class ResourceDependency {

    private final String resourceType;
    private final String resourceName;
    private final String ownerReference;

    public ResourceDependency(String resourceType, String resourceName, String ownerReference) {
        this.resourceType = resourceType;
        this.resourceName = resourceName;
        this.ownerReference = ownerReference;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceName() {
        return resourceName;
    }

    public String getOwnerReference() {
        return ownerReference;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourceDependency)) return false;
        ResourceDependency that = (ResourceDependency) o;
        return Objects.equals(resourceType, that.resourceType)
                && Objects.equals(resourceName, that.resourceName)
                && Objects.equals(ownerReference, that.ownerReference);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resourceType, resourceName, ownerReference);
    }

    @Override
    public String toString() {
        return resourceType + ":" + resourceName + "@" + ownerReference;
    }
}
