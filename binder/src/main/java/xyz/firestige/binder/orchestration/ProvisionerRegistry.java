package xyz.firestige.binder.orchestration;

import xyz.firestige.binder.exception.InvalidDescriptorException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 资源类型 → 创建者
 */
public class ProvisionerRegistry {

    private final Map<String, ResourceProvisioner> provisioners = new LinkedHashMap<>();

    public ProvisionerRegistry register(ResourceProvisioner provisioner) {
        ResourceProvisioner previous = provisioners.putIfAbsent(provisioner.resourceType(), provisioner);
        if (previous != null && previous != provisioner) {
            throw new IllegalStateException("provisioner for " + provisioner.resourceType() + " already registered");
        }
        return this;
    }

    public Optional<ResourceProvisioner> find(String resourceType) {
        return Optional.ofNullable(provisioners.get(resourceType));
    }

    public ResourceProvisioner require(String resourceType) {
        return find(resourceType).orElseThrow(() -> new InvalidDescriptorException(
                "no provisioner registered for resource type " + resourceType
                        + ", registered: " + provisioners.keySet()));
    }

    public Set<String> resourceTypes() {
        return Collections.unmodifiableSet(provisioners.keySet());
    }
}
