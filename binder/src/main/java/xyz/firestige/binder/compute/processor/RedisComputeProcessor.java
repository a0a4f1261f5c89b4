package xyz.firestige.binder.compute.processor;

import xyz.firestige.binder.compute.ComputeProcessor;
import xyz.firestige.binder.compute.ProcessorContext;
import xyz.firestige.binder.compute.ResourceDependency;
import xyz.firestige.binder.crossstack.ExportKeys;
import xyz.firestige.binder.domain.resource.ResourceTypes;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static xyz.firestige.binder.compute.EnvVariableNames.suffixed;

public class RedisComputeProcessor implements ComputeProcessor {

    @Override
    public String resourceType() {
        return ResourceTypes.REDIS;
    }

    @Override
    public void process(ProcessorContext ctx) {
        String res = ctx.exportName();
        String resourceName = ctx.getResource().getName();
        String host = ctx.requireOutput(ExportKeys.host(res));
        String port = ctx.requireOutput(ExportKeys.port(res));
        Optional<String> password = ctx.hasOutput(ExportKeys.password(res))
                ? Optional.of(ctx.requireSecretOutput(ExportKeys.password(res)))
                : Optional.empty();

        ctx.addEnv(suffixed("REDIS_HOST", resourceName), host);
        ctx.addEnv(suffixed("REDIS_PORT", resourceName), port);
        password.ifPresent(p -> ctx.addSecretEnv(suffixed("REDIS_PASSWORD", resourceName), p));
        ctx.addEnv("REDIS_HOST", host);
        ctx.addEnv("REDIS_PORT", port);
        password.ifPresent(p -> ctx.addSecretEnv("REDIS_PASSWORD", p));

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("host", host);
        fields.put("port", port);
        password.ifPresent(p -> fields.put("password", p));
        fields.put("url", password.map(p -> "redis://:" + p + "@").orElse("redis://") + host + ":" + port);
        ctx.getCollector().addResourceTplExtension(resourceName, fields);
        ctx.getCollector().addDependency(new ResourceDependency(
                resourceType(), resourceName, ctx.getOwnerReference().getFullReference()));
    }
}
