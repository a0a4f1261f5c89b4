package xyz.firestige.binder.compute.processor;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import xyz.firestige.binder.compute.ComputeContextCollector;
import xyz.firestige.binder.compute.ProcessorContext;
import xyz.firestige.binder.crossstack.CrossStackReferenceResolver;
import xyz.firestige.binder.crossstack.StackOutputs;
import xyz.firestige.binder.crossstack.StackReference;
import xyz.firestige.binder.crossstack.memory.InMemoryStackStateRepository;
import xyz.firestige.binder.domain.resource.ResourceDescriptor;
import xyz.firestige.binder.domain.resource.ResourceTypeRegistry;
import xyz.firestige.binder.domain.stack.StackParams;

import java.util.Map;

/**
 * 处理器测试共用的上下文构造
 */
final class ProcessorFixtures {

    static final String OWNER = "acme/shop/platform";
    static final String ENV = "prod";

    static final ResourceTypeRegistry TYPES = ResourceTypeRegistry.withDefaults(
            new ObjectMapper(), Validation.buildDefaultValidatorFactory().getValidator());

    private static final CrossStackReferenceResolver RESOLVER =
            new CrossStackReferenceResolver(new InMemoryStackStateRepository(), Runnable::run);

    private ProcessorFixtures() {
    }

    static StackParams consumer(String stackName) {
        return new StackParams(stackName, ENV, "1.0.0", "acme", "shop");
    }

    static ProcessorContext context(String type, String name, Map<String, Object> config,
                                    StackOutputs outputs, ComputeContextCollector collector, boolean preview) {
        return new ProcessorContext(new ResourceDescriptor(type, name, config), collector,
                new StackReference(OWNER, outputs), ENV, consumer("billing-api"), RESOLVER, TYPES, preview);
    }

    static ProcessorContext context(String type, String name, StackOutputs outputs, ComputeContextCollector collector) {
        return context(type, name, Map.of(), outputs, collector, false);
    }
}
