package xyz.firestige.binder.compute;

import xyz.firestige.binder.exception.InvalidDescriptorException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 资源类型 → 计算处理器，进程启动时显式构建
 */
public class ComputeProcessorRegistry {

    private final Map<String, ComputeProcessor> processors = new LinkedHashMap<>();

    public ComputeProcessorRegistry register(ComputeProcessor processor) {
        ComputeProcessor previous = processors.putIfAbsent(processor.resourceType(), processor);
        if (previous != null && previous != processor) {
            throw new IllegalStateException("compute processor for " + processor.resourceType() + " already registered");
        }
        return this;
    }

    public Optional<ComputeProcessor> find(String resourceType) {
        return Optional.ofNullable(processors.get(resourceType));
    }

    public ComputeProcessor require(String resourceType) {
        return find(resourceType).orElseThrow(() -> new InvalidDescriptorException(
                "no compute processor registered for resource type " + resourceType
                        + ", registered: " + processors.keySet()));
    }

    public Set<String> resourceTypes() {
        return Collections.unmodifiableSet(processors.keySet());
    }
}
