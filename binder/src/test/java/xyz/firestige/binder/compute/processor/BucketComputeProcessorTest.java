package xyz.firestige.binder.compute.processor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.firestige.binder.compute.ComputeEnvVariable;
import xyz.firestige.binder.compute.DefaultComputeContextCollector;
import xyz.firestige.binder.compute.ResourceDependency;
import xyz.firestige.binder.crossstack.ExportKeys;
import xyz.firestige.binder.crossstack.StackOutputs;
import xyz.firestige.binder.domain.resource.ResourceTypes;
import xyz.firestige.binder.exception.EmptyRequiredOutputException;
import xyz.firestige.binder.template.PlaceholderEngine;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;
import static xyz.firestige.binder.compute.processor.ProcessorFixtures.*;

@DisplayName("BucketComputeProcessor 单元测试")
class BucketComputeProcessorTest {

    private final BucketComputeProcessor processor = new BucketComputeProcessor();
    private DefaultComputeContextCollector collector;
    private StackOutputs outputs;

    @BeforeEach
    void setUp() {
        collector = new DefaultComputeContextCollector("billing-api", null,
                Instant.now().plusSeconds(30), new PlaceholderEngine());
        outputs = new StackOutputs()
                .putPlain(ExportKeys.bucketName("logs--prod"), "acme-logs-prod")
                .putPlain(ExportKeys.bucketRegion("logs--prod"), "eu-central-1")
                .putPlain(ExportKeys.bucketName("assets--prod"), "acme-assets-prod");
    }

    @Test
    @DisplayName("多个桶按声明顺序处理，通用别名归第一个桶")
    void firstBucket_ownsGenericAlias() {
        // When
        processor.process(context(ResourceTypes.BUCKET, "logs", outputs, collector));
        processor.process(context(ResourceTypes.BUCKET, "assets", outputs, collector));

        // Then
        Map<String, String> env = collector.envVariables().stream()
                .collect(Collectors.toMap(ComputeEnvVariable::getName, ComputeEnvVariable::getValue));
        assertThat(env)
                .containsEntry("BUCKET_NAME_LOGS", "acme-logs-prod")
                .containsEntry("BUCKET_REGION_LOGS", "eu-central-1")
                .containsEntry("BUCKET_NAME_ASSETS", "acme-assets-prod")
                .containsEntry("BUCKET_NAME", "acme-logs-prod")
                .containsEntry("BUCKET_REGION", "eu-central-1")
                .doesNotContainKey("BUCKET_REGION_ASSETS");
        assertThat(collector.secretEnvVariables()).isEmpty();
        assertThat(collector.resourceTplExtensions().get("logs"))
                .containsEntry("name", "acme-logs-prod")
                .containsEntry("region", "eu-central-1");
        assertThat(collector.dependencies()).containsExactly(
                new ResourceDependency(ResourceTypes.BUCKET, "logs", OWNER),
                new ResourceDependency(ResourceTypes.BUCKET, "assets", OWNER));
    }

    @Test
    @DisplayName("变量来源记录资源与所属 Stack")
    void variables_recordSource() {
        // When
        processor.process(context(ResourceTypes.BUCKET, "logs", outputs, collector));

        // Then
        ComputeEnvVariable first = collector.envVariables().get(0);
        assertThat(first.getResourceType()).isEqualTo(ResourceTypes.BUCKET);
        assertThat(first.getResourceName()).isEqualTo("logs");
        assertThat(first.getStackName()).isEqualTo("platform");
    }

    @Test
    @DisplayName("缺少桶名输出时抛出 EmptyRequiredOutputException 并指明导出键")
    void missingBucketName_throws() {
        assertThatThrownBy(() -> processor.process(context(ResourceTypes.BUCKET, "media", outputs, collector)))
                .isInstanceOf(EmptyRequiredOutputException.class)
                .hasMessageContaining("media--prod-bucket-name")
                .satisfies(e -> assertThat(((EmptyRequiredOutputException) e).getReference()).isEqualTo(OWNER));
        assertThat(collector.envVariables()).isEmpty();
    }

    @Test
    @DisplayName("空字符串输出视为缺失")
    void emptyOutput_isRejected() {
        // Given
        outputs.putPlain(ExportKeys.bucketName("media--prod"), "");

        // When / Then
        assertThatThrownBy(() -> processor.process(context(ResourceTypes.BUCKET, "media", outputs, collector)))
                .isInstanceOf(EmptyRequiredOutputException.class)
                .hasMessageContaining("empty");
    }
}
