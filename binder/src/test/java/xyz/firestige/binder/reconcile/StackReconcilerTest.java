package xyz.firestige.binder.reconcile;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.firestige.binder.domain.resource.ResourceDescriptor;
import xyz.firestige.binder.domain.secrets.EnvironmentSecretsConfig;
import xyz.firestige.binder.domain.secrets.SecretsConfigMode;
import xyz.firestige.binder.domain.stack.Stack;
import xyz.firestige.binder.domain.stack.StackConfig;
import xyz.firestige.binder.domain.stack.StackParams;
import xyz.firestige.binder.exception.InvalidDescriptorException;
import xyz.firestige.binder.exception.MissingParentStackException;
import xyz.firestige.binder.secrets.SecretResolver;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * StackReconciler 单元测试
 */
@DisplayName("StackReconciler 单元测试")
class StackReconcilerTest {

    private StackReconciler reconciler;
    private Map<String, Stack> stacks;
    private final StackParams prod = new StackParams("api", "prod", "1.0.0", "acme", "shop");

    @BeforeEach
    void setUp() {
        reconciler = new StackReconciler(new SecretResolver());

        Stack platform = new Stack("platform");
        platform.getServer().getResources().put("prod", List.of(
                new ResourceDescriptor("bucket", "logs", Map.of())));
        platform.getServer().getResources().put("staging", List.of(
                new ResourceDescriptor("bucket", "logs", Map.of())));
        platform.getSecrets().getValues().put("DB_PASSWORD", "enc-db");
        platform.getSecrets().getValues().put("ADMIN_TOKEN", "enc-admin");
        platform.getServer().getSecretsConfig().put("staging", new EnvironmentSecretsConfig(
                SecretsConfigMode.INCLUDE, false, Map.of("DB_PASSWORD", "DB_PASSWORD")));
        platform.getEnvironments().put("prod", new StackConfig());

        Stack api = new Stack("api");
        StackConfig apiProd = new StackConfig();
        apiProd.setParentStack("platform");
        api.getEnvironments().put("prod", apiProd);

        Stack worker = new Stack("worker");
        StackConfig workerProd = new StackConfig();
        workerProd.setParentStack("acme/shop/platform");
        workerProd.setParentEnv("staging");
        worker.getEnvironments().put("prod", workerProd);

        Stack devOnly = new Stack("dev-only");
        devOnly.getEnvironments().put("dev", new StackConfig());

        stacks = new LinkedHashMap<>();
        stacks.put("platform", platform);
        stacks.put("api", api);
        stacks.put("worker", worker);
        stacks.put("dev-only", devOnly);
    }

    @Test
    @DisplayName("子 Stack 继承父 Stack 的资源与密钥")
    void child_inheritsParentServerAndSecrets() {
        // When
        ReconciledStacks result = reconciler.reconcileForDeploy(stacks, prod);

        // Then
        ReconciledStack api = result.find("api").orElseThrow();
        assertThat(api.getSecretsEnvironment()).isEqualTo("prod");
        assertThat(api.getParentReference()).contains("acme/shop/platform");
        assertThat(api.getStack().getServer().resourcesFor("prod")).extracting(ResourceDescriptor::getName)
                .containsExactly("logs");
        assertThat(api.getStack().getSecrets().getValues()).containsOnlyKeys("DB_PASSWORD", "ADMIN_TOKEN");
    }

    @Test
    @DisplayName("parentEnv 决定密钥环境并按 secretsConfig 过滤")
    void parentEnv_filtersSharedSecrets() {
        // When
        ReconciledStack worker = reconciler.reconcileForDeploy(stacks, prod).find("worker").orElseThrow();

        // Then
        assertThat(worker.getSecretsEnvironment()).isEqualTo("staging");
        assertThat(worker.getStack().getSecrets().getValues()).containsOnlyKeys("DB_PASSWORD");
        assertThat(stacks.get("platform").getSecrets().getValues()).containsKey("ADMIN_TOKEN");
    }

    @Test
    @DisplayName("没有目标环境配置的 Stack 被跳过，父 Stack 自身无父引用")
    void unconfiguredStacks_areSkipped() {
        // When
        ReconciledStacks result = reconciler.reconcileForDeploy(stacks, prod);

        // Then
        assertThat(result.size()).isEqualTo(3);
        assertThat(result.find("dev-only")).isEmpty();
        assertThat(result.find("platform").orElseThrow().getParentReference()).isEmpty();
        assertThat(result.getEnvironment()).isEqualTo("prod");
    }

    @Test
    @DisplayName("输入 Stack 不被修改")
    void input_isNotMutated() {
        // When
        reconciler.reconcileForDeploy(stacks, prod);

        // Then
        assertThat(stacks.get("api").getServer().getResources()).isEmpty();
        assertThat(stacks.get("api").getSecrets().getValues()).isEmpty();
    }

    @Test
    @DisplayName("父 Stack 不存在时抛出 MissingParentStackException")
    void missingParent_throws() {
        // Given
        stacks.remove("platform");

        // When / Then
        assertThatThrownBy(() -> reconciler.reconcileForDeploy(stacks, prod))
                .isInstanceOf(MissingParentStackException.class)
                .hasMessageContaining("\"platform\"")
                .hasMessageContaining("\"prod\"");
    }

    @Test
    @DisplayName("secretsInherit：继承另一个 Stack 的密钥描述与 secretsConfig")
    void secretsInherit_copiesSecretsFromSource() {
        // Given
        Stack common = new Stack("common");
        common.getSecrets().getValues().put("SHARED_TOKEN", "enc-shared");
        common.getServer().getSecretsConfig().put("staging", new EnvironmentSecretsConfig(
                SecretsConfigMode.INCLUDE, false, Map.of("SHARED_TOKEN", "SHARED_TOKEN")));
        stacks.put("common", common);
        stacks.get("platform").getServer().setSecretsInherit("common");

        // When
        Map<String, Stack> resolved = reconciler.resolveInheritance(stacks);
        ReconciledStack api = reconciler.reconcileForDeploy(stacks, prod).find("api").orElseThrow();

        // Then
        Stack platform = resolved.get("platform");
        assertThat(platform.getSecrets().getValues()).containsOnlyKeys("SHARED_TOKEN");
        assertThat(platform.getServer().getSecretsConfig()).containsOnlyKeys("staging");
        assertThat(platform.getServer().resourcesFor("prod")).extracting(ResourceDescriptor::getName)
                .containsExactly("logs");
        assertThat(api.getStack().getSecrets().getValues()).containsOnlyKeys("SHARED_TOKEN");
        assertThat(stacks.get("platform").getSecrets().getValues()).containsKey("DB_PASSWORD");
    }

    @Test
    @DisplayName("secretsInherit 支持多级继承")
    void secretsInherit_followsChain() {
        // Given
        Stack root = new Stack("root");
        root.getSecrets().getValues().put("ROOT_KEY", "enc-root");
        Stack middle = new Stack("middle");
        middle.getServer().setSecretsInherit("root");
        stacks.put("root", root);
        stacks.put("middle", middle);
        stacks.get("platform").getServer().setSecretsInherit("middle");

        // When
        Map<String, Stack> resolved = reconciler.resolveInheritance(stacks);

        // Then
        assertThat(resolved.get("platform").getSecrets().getValues()).containsOnlyKeys("ROOT_KEY");
        assertThat(resolved.get("middle").getSecrets().getValues()).containsOnlyKeys("ROOT_KEY");
    }

    @Test
    @DisplayName("secretsInherit 指向未定义的 Stack 或形成环时报错")
    void secretsInherit_invalidTargets_throw() {
        // Given
        stacks.get("platform").getServer().setSecretsInherit("ghost");

        // Then
        assertThatThrownBy(() -> reconciler.resolveInheritance(stacks))
                .isInstanceOf(InvalidDescriptorException.class)
                .hasMessageContaining("ghost");

        // Given
        stacks.get("platform").getServer().setSecretsInherit("api");
        stacks.get("api").getServer().setSecretsInherit("platform");

        // Then
        assertThatThrownBy(() -> reconciler.resolveInheritance(stacks))
                .isInstanceOf(InvalidDescriptorException.class)
                .hasMessageContaining("cycle");
    }
}
