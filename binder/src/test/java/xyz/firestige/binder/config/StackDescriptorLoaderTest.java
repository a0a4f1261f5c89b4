package xyz.firestige.binder.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.binder.domain.resource.ResourceDescriptor;
import xyz.firestige.binder.domain.secrets.SecretsConfigMode;
import xyz.firestige.binder.domain.stack.Stack;
import xyz.firestige.binder.domain.stack.StackConfig;
import xyz.firestige.binder.exception.InvalidDescriptorException;
import xyz.firestige.binder.secrets.SecretsDescriptorRepository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("StackDescriptorLoader 测试")
class StackDescriptorLoaderTest {

    @TempDir
    Path root;

    private StackDescriptorLoader loader;

    @BeforeEach
    void setUp() {
        loader = new StackDescriptorLoader(new SecretsDescriptorRepository(), "stacks", "secrets.yaml");
    }

    @Test
    @DisplayName("读取 server.yaml、client.yaml 与 secrets.yaml")
    void load_readsAllDescriptors() throws IOException {
        // Given
        write("platform/server.yaml", String.join("\n",
                "resources:",
                "  prod:",
                "    - type: postgres",
                "      name: main",
                "      config:",
                "        database: shop",
                "    - type: bucket",
                "      name: logs",
                "secretsConfig:",
                "  staging:",
                "    mode: include",
                "    secrets:",
                "      DB_PASSWORD: DB_PASSWORD",
                "secretsInherit: common",
                ""));
        write("platform/secrets.yaml", String.join("\n",
                "schemaVersion: \"1.0\"",
                "values:",
                "  DB_PASSWORD: enc-db",
                ""));
        write("api/client.yaml", String.join("\n",
                "schemaVersion: \"1.0\"",
                "stacks:",
                "  prod:",
                "    type: container",
                "    parentStack: platform",
                "    parentEnv: staging",
                "    uses: [main, logs]",
                "    dependencies:",
                "      - name: upstream",
                "        owner: worker",
                "        resource: queue",
                "    env:",
                "      LOG_LEVEL: info",
                "    secrets:",
                "      DB_PASSWORD: \"${secret:DB_PASSWORD}\"",
                "    futureField: ignored",
                ""));

        // When
        Map<String, Stack> stacks = loader.loadAll(root);

        // Then
        assertThat(stacks).containsOnlyKeys("api", "platform");

        Stack platform = stacks.get("platform");
        assertThat(platform.getServer().resourcesFor("prod")).extracting(ResourceDescriptor::getName)
                .containsExactly("main", "logs");
        assertThat(platform.getServer().findResource("prod", "main"))
                .hasValueSatisfying(r -> assertThat(r.getConfig()).containsEntry("database", "shop"));
        assertThat(platform.getServer().getSecretsConfig().get("staging").mode()).isEqualTo(SecretsConfigMode.INCLUDE);
        assertThat(platform.getServer().getSecretsInherit()).isEqualTo("common");
        assertThat(platform.getSecrets().getValues()).containsEntry("DB_PASSWORD", "enc-db");
        assertThat(platform.getEnvironments()).isEmpty();

        StackConfig apiProd = stacks.get("api").configFor("prod").orElseThrow();
        assertThat(apiProd.getType()).isEqualTo("container");
        assertThat(apiProd.getParentStack()).isEqualTo("platform");
        assertThat(apiProd.getParentEnv()).isEqualTo("staging");
        assertThat(apiProd.getUses()).containsExactly("main", "logs");
        assertThat(apiProd.getDependencies()).singleElement()
                .satisfies(d -> {
                    assertThat(d.getName()).isEqualTo("upstream");
                    assertThat(d.getOwner()).isEqualTo("worker");
                    assertThat(d.getResource()).isEqualTo("queue");
                });
        assertThat(apiProd.getEnv()).containsEntry("LOG_LEVEL", "info");
        assertThat(apiProd.getSecrets()).containsEntry("DB_PASSWORD", "${secret:DB_PASSWORD}");
        assertThat(stacks.get("api").getSecrets().getValues()).isEmpty();
    }

    @Test
    @DisplayName("Stack 目录不存在时返回空集合")
    void missingStacksDir_returnsEmpty() {
        // When
        Map<String, Stack> stacks = loader.loadAll(root.resolve("nowhere"));

        // Then
        assertThat(stacks).isEmpty();
    }

    @Test
    @DisplayName("YAML 格式错误时抛出 InvalidDescriptorException 并指明文件")
    void malformedYaml_throws() throws IOException {
        // Given
        write("broken/server.yaml", "resources: [unclosed\n");

        // When & Then
        assertThatThrownBy(() -> loader.load(root, "broken"))
                .isInstanceOf(InvalidDescriptorException.class)
                .hasMessageContaining("server.yaml");
    }

    private void write(String relative, String content) throws IOException {
        Path file = loader.stacksRoot(root).resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
