package xyz.firestige.binder.template;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.firestige.binder.exception.BinderException;
import xyz.firestige.binder.exception.MalformedPlaceholderException;
import xyz.firestige.binder.exception.UnresolvedPlaceholderException;
import xyz.firestige.binder.template.extension.DeferredExtension;
import xyz.firestige.binder.template.extension.EnvExtension;
import xyz.firestige.binder.template.extension.ResourceExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * PlaceholderEngine 单元测试
 */
@DisplayName("PlaceholderEngine 单元测试")
class PlaceholderEngineTest {

    private PlaceholderEngine engine;
    private ExtensionRegistry extensions;
    private ResolutionContext context;

    @BeforeEach
    void setUp() {
        engine = new PlaceholderEngine();
        Map<String, String> env = Map.of("HOME", "/home/app", "NAME", "api", "LOOP", "${env:HOME}");
        extensions = new ExtensionRegistry()
                .register(ExtensionRegistry.ENV, new EnvExtension(env::get))
                .register(ExtensionRegistry.RESOURCE, new ResourceExtension(
                        name -> "db".equals(name) ? Map.of("host", "db.internal", "port", "5432") : null));
        context = ResolutionContext.of("api", "prod");
    }

    @Test
    @DisplayName("替换多个占位符并保留周围文本")
    void resolvesMultiplePlaceholders() {
        // When
        String result = engine.resolve("postgres://${resource:db.host}:${resource:db.port}/${env:NAME}", context, extensions);

        // Then
        assertThat(result).isEqualTo("postgres://db.internal:5432/api");
    }

    @Test
    @DisplayName("不含占位符的字符串原样返回")
    void plainString_unchanged() {
        assertThat(engine.resolve("plain value", context, extensions)).isEqualTo("plain value");
        assertThat(engine.resolve(null, context, extensions)).isNull();
    }

    @Test
    @DisplayName("未注册命名空间有默认值时使用默认值")
    void unregisteredNamespace_withDefault_usesDefault() {
        // When
        String result = engine.resolve("${vault:path:fallback}", context, extensions);

        // Then
        assertThat(result).isEqualTo("fallback");
    }

    @Test
    @DisplayName("未注册命名空间无默认值时抛出 UnresolvedPlaceholderException")
    void unregisteredNamespace_withoutDefault_throws() {
        assertThatThrownBy(() -> engine.resolve("x ${vault:path}", context, extensions))
                .isInstanceOf(UnresolvedPlaceholderException.class)
                .hasMessageContaining("${vault:path}")
                .satisfies(e -> assertThat(((BinderException) e).getContext())
                        .containsEntry(BinderException.CTX_STACK, "api")
                        .containsEntry(BinderException.CTX_ENVIRONMENT, "prod"));
    }

    @Test
    @DisplayName("扩展未找到值时优先使用默认值")
    void notFound_withDefault_usesDefault() {
        assertThat(engine.resolve("${env:MISSING:dflt}", context, extensions)).isEqualTo("dflt");
        assertThatThrownBy(() -> engine.resolve("${env:MISSING}", context, extensions))
                .isInstanceOf(UnresolvedPlaceholderException.class);
    }

    @Test
    @DisplayName("段数不足的 resource 占位符抛出 MalformedPlaceholderException")
    void malformedResourcePlaceholder_throwsTypedError() {
        assertThatThrownBy(() -> engine.resolve("${resource:db}", context, extensions))
                .isInstanceOf(MalformedPlaceholderException.class)
                .hasMessageContaining("${resource:db}");
        assertThatThrownBy(() -> engine.resolve("${resource:db.}", context, extensions))
                .isInstanceOf(MalformedPlaceholderException.class);
    }

    @Test
    @DisplayName("NOT_APPLICABLE 的占位符原样保留")
    void notApplicable_keepsToken() {
        // Given
        ExtensionRegistry deferred = extensions.with(ExtensionRegistry.DEPENDENCY, DeferredExtension.INSTANCE);

        // When
        String result = engine.resolve("${dependency:db.main.url}|${env:NAME}", context, deferred);

        // Then
        assertThat(result).isEqualTo("${dependency:db.main.url}|api");
        assertThat(extensions.contains(ExtensionRegistry.DEPENDENCY)).isFalse();
    }

    @Test
    @DisplayName("替换结果不再被扫描")
    void replacement_isNotRescanned() {
        // When
        String result = engine.resolve("v=${env:LOOP}", context, extensions);

        // Then
        assertThat(result).isEqualTo("v=${env:HOME}");
    }

    @Test
    @DisplayName("对已解析的字符串再次解析结果不变")
    void resolvingTwice_isIdempotent() {
        // Given
        String input = "${env:NAME}@${resource:db.host} ${vault:x:d}";

        // When
        String once = engine.resolve(input, context, extensions);
        String twice = engine.resolve(once, context, extensions);

        // Then
        assertThat(once).isEqualTo("api@db.internal d");
        assertThat(twice).isEqualTo(once);
    }

    @Test
    @DisplayName("不完整的外层 token 保留，内层占位符照常替换")
    void incompleteOuterToken_resolvesInner() {
        // When
        String result = engine.resolve("${a ${env:NAME}", context, extensions);

        // Then
        assertThat(result).isEqualTo("${a api");
    }

    @Test
    @DisplayName("未闭合或格式不合法的 token 原样保留")
    void malformedTokens_areKept() {
        assertThat(engine.resolve("${env:NAME", context, extensions)).isEqualTo("${env:NAME");
        assertThat(engine.resolve("${noColon}", context, extensions)).isEqualTo("${noColon}");
        assertThat(engine.resolve("${:path}", context, extensions)).isEqualTo("${:path}");
    }

    @Test
    @DisplayName("第二轮只替换延迟片段，首轮写入的值不再被扫描")
    void complete_onlyReplacesDeferredSegments() {
        // Given
        ExtensionRegistry firstPass = extensions.with(ExtensionRegistry.RESOURCE, DeferredExtension.INSTANCE);

        // When
        PartialResolution partial = engine.resolvePartially("${env:LOOP}|${resource:db.host}", context, firstPass);
        PartialResolution completed = engine.complete(partial, context, extensions);

        // Then
        assertThat(partial.hasDeferred()).isTrue();
        assertThat(partial.render()).isEqualTo("${env:HOME}|${resource:db.host}");
        assertThat(completed.hasDeferred()).isFalse();
        assertThat(completed.render()).isEqualTo("${env:HOME}|db.internal");
    }

    @Test
    @DisplayName("第二轮仍不适用的片段继续保留")
    void complete_keepsStillDeferredSegments() {
        // Given
        ExtensionRegistry deferring = extensions.with(ExtensionRegistry.RESOURCE, DeferredExtension.INSTANCE);
        PartialResolution partial = engine.resolvePartially("${resource:db.host}/${env:NAME}", context, deferring);

        // When
        PartialResolution completed = engine.complete(partial, context, deferring);

        // Then
        assertThat(completed.hasDeferred()).isTrue();
        assertThat(completed.render()).isEqualTo("${resource:db.host}/api");
    }
}
