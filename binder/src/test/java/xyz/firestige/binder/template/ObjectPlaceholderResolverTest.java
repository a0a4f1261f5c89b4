package xyz.firestige.binder.template;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.firestige.binder.template.extension.DeferredExtension;
import xyz.firestige.binder.template.extension.EnvExtension;
import xyz.firestige.binder.template.extension.ResourceExtension;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ObjectPlaceholderResolver 单元测试")
class ObjectPlaceholderResolverTest {

    private final ObjectPlaceholderResolver resolver = new ObjectPlaceholderResolver(new PlaceholderEngine());
    private final ExtensionRegistry extensions = new ExtensionRegistry()
            .register(ExtensionRegistry.ENV, new EnvExtension(Map.of("REGION", "eu-1", "TAG", "v2")::get));

    static class Target {
        private String image = "app:${env:TAG}";
        private final Map<String, Object> env = new LinkedHashMap<>();
        private final List<Object> args = new ArrayList<>();
        private Nested nested = new Nested();
        private int replicas = 3;
    }

    static class Nested {
        private String region = "${env:REGION}";
    }

    @Test
    @DisplayName("递归替换字段、Map 值与 List 元素")
    void resolvesObjectGraph() {
        // Given
        Target target = new Target();
        target.env.put("REGION", "${env:REGION}");
        target.env.put("INNER", new LinkedHashMap<>(Map.of("tag", "${env:TAG}")));
        target.args.add("--region=${env:REGION}");
        target.args.add(List.of("literal"));

        // When
        int replaced = resolver.resolve(target, ResolutionContext.of("api", "prod"), extensions);

        // Then
        assertThat(replaced).isEqualTo(5);
        assertThat(target.image).isEqualTo("app:v2");
        assertThat(target.env).containsEntry("REGION", "eu-1");
        @SuppressWarnings("unchecked")
        Map<String, Object> inner = (Map<String, Object>) target.env.get("INNER");
        assertThat(inner).containsEntry("tag", "v2");
        assertThat(target.args.get(0)).isEqualTo("--region=eu-1");
        assertThat(target.nested.region).isEqualTo("eu-1");
        assertThat(target.replicas).isEqualTo(3);
    }

    @Test
    @DisplayName("循环引用不会导致死循环")
    void cyclicGraph_terminates() {
        // Given
        Map<String, Object> a = new LinkedHashMap<>();
        Map<String, Object> b = new LinkedHashMap<>();
        a.put("b", b);
        b.put("a", a);
        b.put("v", "${env:TAG}");

        // When
        int replaced = resolver.resolve(a, ResolutionContext.of("api", "prod"), extensions);

        // Then
        assertThat(replaced).isEqualTo(1);
        assertThat(b).containsEntry("v", "v2");
    }

    @Test
    @DisplayName("两轮解析：第二轮只补全延迟位置，首轮写入的值保持原样")
    void resolveDeferring_completesOnlyDeferredSites() {
        // Given
        ResolutionContext context = ResolutionContext.of("api", "prod");
        ExtensionRegistry firstPass = new ExtensionRegistry()
                .register(ExtensionRegistry.ENV, new EnvExtension(Map.of("RAW", "${env:TAG}")::get))
                .register(ExtensionRegistry.RESOURCE, DeferredExtension.INSTANCE);
        ExtensionRegistry secondPass = new ExtensionRegistry()
                .register(ExtensionRegistry.ENV, new EnvExtension(Map.of("RAW", "other", "TAG", "v2")::get))
                .register(ExtensionRegistry.RESOURCE, new ResourceExtension(name -> Map.of("host", "db.internal")));
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("raw", "${env:RAW}");
        config.put("mixed", "${env:RAW}@${resource:db.host}");
        config.put("plain", "static");

        // When
        DeferredPlaceholders deferred = resolver.resolveDeferring(config, context, firstPass);
        int completed = deferred.complete(context, secondPass);

        // Then
        assertThat(deferred.getReplacedCount()).isEqualTo(2);
        assertThat(deferred.size()).isEqualTo(1);
        assertThat(completed).isEqualTo(1);
        assertThat(config)
                .containsEntry("raw", "${env:TAG}")
                .containsEntry("mixed", "${env:TAG}@db.internal")
                .containsEntry("plain", "static");
    }
}
