package xyz.firestige.binder.compute.processor;

import xyz.firestige.binder.compute.ComputeProcessor;
import xyz.firestige.binder.compute.ProcessorContext;
import xyz.firestige.binder.compute.ResourceDependency;
import xyz.firestige.binder.crossstack.ExportKeys;
import xyz.firestige.binder.domain.resource.ResourceTypes;

import java.util.LinkedHashMap;
import java.util.Map;

import static xyz.firestige.binder.compute.EnvVariableNames.infix;

/**
 * S3 桶
 * <p>
 * 环境变量：{@code S3_<RES>_BUCKET/REGION/ACCESS_KEY/SECRET_KEY}，通用别名
 * {@code S3_BUCKET/S3_REGION/S3_ACCESS_KEY/S3_SECRET_KEY}；访问密钥以密文变量注册。
 * 模板字段：bucket、region、access-key、secret-key。
 */
public class S3BucketComputeProcessor implements ComputeProcessor {

    @Override
    public String resourceType() {
        return ResourceTypes.S3_BUCKET;
    }

    @Override
    public void process(ProcessorContext ctx) {
        String res = ctx.exportName();
        String resourceName = ctx.getResource().getName();
        String bucket = ctx.requireOutput(ExportKeys.bucketName(res));
        String region = ctx.requireOutput(ExportKeys.bucketRegion(res));
        String accessKey = ctx.requireSecretOutput(ExportKeys.accessKeyName(res));
        String secretKey = ctx.requireSecretOutput(ExportKeys.accessKeySecret(res));

        ctx.addEnv(infix("S3", resourceName, "REGION"), region);
        ctx.addEnv(infix("S3", resourceName, "BUCKET"), bucket);
        ctx.addSecretEnv(infix("S3", resourceName, "ACCESS_KEY"), accessKey);
        ctx.addSecretEnv(infix("S3", resourceName, "SECRET_KEY"), secretKey);

        ctx.addEnv("S3_REGION", region);
        ctx.addEnv("S3_BUCKET", bucket);
        ctx.addSecretEnv("S3_ACCESS_KEY", accessKey);
        ctx.addSecretEnv("S3_SECRET_KEY", secretKey);

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("bucket", bucket);
        fields.put("region", region);
        fields.put("access-key", accessKey);
        fields.put("secret-key", secretKey);
        ctx.getCollector().addResourceTplExtension(resourceName, fields);
        ctx.getCollector().addDependency(new ResourceDependency(
                resourceType(), resourceName, ctx.getOwnerReference().getFullReference()));
    }
}
