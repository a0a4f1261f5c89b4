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

/**
 * 通用对象存储桶
 * <p>
 * 环境变量：{@code BUCKET_NAME_<RES>}、{@code BUCKET_REGION_<RES>}，
 * 以及通用别名 {@code BUCKET_NAME}、{@code BUCKET_REGION}（由第一个声明的桶占用）。
 * 模板字段：name、region。
 */
public class BucketComputeProcessor implements ComputeProcessor {

    @Override
    public String resourceType() {
        return ResourceTypes.BUCKET;
    }

    @Override
    public void process(ProcessorContext ctx) {
        String res = ctx.exportName();
        String resourceName = ctx.getResource().getName();
        String bucketName = ctx.requireOutput(ExportKeys.bucketName(res));
        Optional<String> region = ctx.optionalOutput(ExportKeys.bucketRegion(res));

        ctx.addEnv(suffixed("BUCKET_NAME", resourceName), bucketName);
        region.ifPresent(r -> ctx.addEnv(suffixed("BUCKET_REGION", resourceName), r));
        ctx.addEnv("BUCKET_NAME", bucketName);
        region.ifPresent(r -> ctx.addEnv("BUCKET_REGION", r));

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("name", bucketName);
        region.ifPresent(r -> fields.put("region", r));
        ctx.getCollector().addResourceTplExtension(resourceName, fields);
        ctx.getCollector().addDependency(new ResourceDependency(
                resourceType(), resourceName, ctx.getOwnerReference().getFullReference()));
    }
}
