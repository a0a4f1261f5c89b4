package xyz.firestige.binder.template.extension;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.binder.domain.secrets.AuthDescriptor;
import xyz.firestige.binder.domain.secrets.EnvironmentSecrets;
import xyz.firestige.binder.domain.secrets.SecretsDescriptor;
import xyz.firestige.binder.exception.SecretNotFoundException;
import xyz.firestige.binder.exception.UnresolvedPlaceholderException;
import xyz.firestige.binder.secrets.SecretsStore;
import xyz.firestige.binder.crypto.SecretCipher;
import xyz.firestige.binder.template.ExtensionRegistry;
import xyz.firestige.binder.template.PlaceholderEngine;
import xyz.firestige.binder.template.ResolutionContext;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * 内置占位符扩展测试
 */
@DisplayName("占位符扩展测试")
class ExtensionsTest {

    private final PlaceholderEngine engine = new PlaceholderEngine();
    private final ResolutionContext context = ResolutionContext.of("api", "prod");

    private String resolve(String input, String namespace, xyz.firestige.binder.template.PlaceholderExtension extension) {
        return engine.resolve(input, context, new ExtensionRegistry().register(namespace, extension));
    }

    @Nested
    @DisplayName("date")
    class DateExtensionTest {

        private final Clock clock = Clock.fixed(Instant.parse("2024-03-05T07:08:09Z"), ZoneOffset.UTC);
        private final DateExtension date = new DateExtension(clock);

        @Test
        @DisplayName("按固定时钟输出各种格式")
        void formats() {
            assertThat(resolve("${date:time}", "date", date)).isEqualTo("07:08:09");
            assertThat(resolve("${date:date}", "date", date)).isEqualTo("2024-03-05");
            assertThat(resolve("${date:dateOnly}", "date", date)).isEqualTo("20240305");
            assertThat(resolve("${date:timestamp}", "date", date)).isEqualTo("1709622489");
            assertThat(resolve("${date:year}", "date", date)).isEqualTo("2024");
            assertThat(resolve("${date:iso}", "date", date)).isEqualTo("2024-03-05T07:08:09Z");
        }

        @Test
        @DisplayName("未知格式使用默认值或报错")
        void unknownFormat() {
            assertThat(resolve("${date:week:none}", "date", date)).isEqualTo("none");
            assertThatThrownBy(() -> resolve("${date:week}", "date", date))
                    .isInstanceOf(UnresolvedPlaceholderException.class);
        }
    }

    @Nested
    @DisplayName("git")
    class GitExtensionTest {

        @TempDir
        Path repo;

        @Test
        @DisplayName("读取 loose ref 的提交与分支")
        void looseRef() throws Exception {
            // Given
            Path git = Files.createDirectories(repo.resolve(".git/refs/heads/feature"));
            Files.writeString(repo.resolve(".git/HEAD"), "ref: refs/heads/feature/ABC_1\n", StandardCharsets.UTF_8);
            Files.writeString(git.resolve("ABC_1"), "0123456789abcdef0123456789abcdef01234567\n", StandardCharsets.UTF_8);
            Path sub = Files.createDirectories(repo.resolve("services/api"));
            GitExtension ext = new GitExtension(GitRepository.discover(sub));

            // When / Then
            assertThat(resolve("${git:commit.short}", "git", ext)).isEqualTo("0123456");
            assertThat(resolve("${git:commit.full}", "git", ext)).hasSize(40);
            assertThat(resolve("${git:branch.raw}", "git", ext)).isEqualTo("feature/ABC_1");
            assertThat(resolve("${git:branch.clean}", "git", ext)).isEqualTo("feature-abc-1");
            assertThat(resolve("${git:root}", "git", ext)).isEqualTo(repo.toAbsolutePath().normalize().toString());
        }

        @Test
        @DisplayName("从 packed-refs 读取提交")
        void packedRef() throws Exception {
            // Given
            Files.createDirectories(repo.resolve(".git"));
            Files.writeString(repo.resolve(".git/HEAD"), "ref: refs/heads/main\n", StandardCharsets.UTF_8);
            Files.writeString(repo.resolve(".git/packed-refs"),
                    "# pack-refs with: peeled\nfedcba9876543210fedcba9876543210fedcba98 refs/heads/main\n",
                    StandardCharsets.UTF_8);
            GitExtension ext = new GitExtension(GitRepository.discover(repo));

            // When / Then
            assertThat(resolve("${git:commit.short}", "git", ext)).isEqualTo("fedcba9");
        }

        @Test
        @DisplayName("不在仓库中时无默认值报错")
        void outsideRepository() {
            GitExtension ext = new GitExtension(Optional.empty());
            assertThat(resolve("${git:commit.short:local}", "git", ext)).isEqualTo("local");
            assertThatThrownBy(() -> resolve("${git:commit.short}", "git", ext))
                    .isInstanceOf(UnresolvedPlaceholderException.class);
        }

        @Test
        @DisplayName("project:root 优先使用仓库根目录")
        void projectRoot() throws Exception {
            // Given
            Files.createDirectories(repo.resolve(".git"));
            Path sub = Files.createDirectories(repo.resolve("a/b"));

            // When / Then
            assertThat(resolve("${project:root}", "project", new ProjectExtension(sub)))
                    .isEqualTo(repo.toAbsolutePath().normalize().toString());
        }
    }

    @Nested
    @DisplayName("auth")
    class AuthExtensionTest {

        @Test
        @DisplayName("读取认证配置属性与类型")
        void resolvesProperties() {
            // Given
            SecretsDescriptor descriptor = new SecretsDescriptor();
            descriptor.getAuth().put("registry", new AuthDescriptor("credentials", Map.of("username", "bot")));
            AuthExtension auth = new AuthExtension(descriptor);

            // When / Then
            assertThat(resolve("${auth:registry.username}", "auth", auth)).isEqualTo("bot");
            assertThat(resolve("${auth:registry.type}", "auth", auth)).isEqualTo("credentials");
            assertThatThrownBy(() -> resolve("${auth:other.username}", "auth", auth))
                    .isInstanceOf(UnresolvedPlaceholderException.class)
                    .hasMessageContaining("other");
        }
    }

    @Nested
    @DisplayName("secret")
    class SecretExtensionTest {

        private SecretExtension secretExtension() {
            SecretCipher cipher = mock(SecretCipher.class);
            when(cipher.decrypt(anyString())).thenAnswer(inv -> "plain-" + inv.getArgument(0));
            SecretsDescriptor descriptor = new SecretsDescriptor();
            descriptor.getValues().put("TOKEN", "shared");
            descriptor.getEnvironments().put("prod", new EnvironmentSecrets(Map.of("TOKEN", "prod")));
            descriptor.getEnvironments().put("staging", new EnvironmentSecrets(Map.of("TOKEN", "staging")));
            return new SecretExtension(new SecretsStore(cipher), descriptor);
        }

        @Test
        @DisplayName("第三段为显式环境而非默认值")
        void thirdSegment_isExplicitEnvironment() {
            SecretExtension ext = secretExtension();
            assertThat(resolve("${secret:TOKEN}", "secret", ext)).isEqualTo("plain-prod");
            assertThat(resolve("${secret:TOKEN:staging}", "secret", ext)).isEqualTo("plain-staging");
        }

        @Test
        @DisplayName("找不到密钥时不使用第三段作为默认值")
        void missingSecret_throws() {
            SecretExtension ext = secretExtension();
            assertThatThrownBy(() -> resolve("${secret:NOPE:staging}", "secret", ext))
                    .isInstanceOf(SecretNotFoundException.class);
        }
    }
}
