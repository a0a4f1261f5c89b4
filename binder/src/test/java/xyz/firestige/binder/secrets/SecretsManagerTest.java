package xyz.firestige.binder.secrets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.binder.crypto.CryptoProvider;
import xyz.firestige.binder.crypto.KeyCodec;
import xyz.firestige.binder.crypto.SecretCipher;
import xyz.firestige.binder.domain.secrets.SecretsDescriptor;
import xyz.firestige.binder.exception.SecretNotFoundException;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SecretsManager 单元测试")
class SecretsManagerTest {

    private SecretsManager manager;
    private SecretsDescriptorRepository repository;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        SecretCipher cipher = SecretCipher.of(new CryptoProvider(), KeyCodec.generateEd25519KeyPair());
        repository = new SecretsDescriptorRepository();
        manager = new SecretsManager(cipher, repository);
    }

    @Test
    @DisplayName("添加环境密钥后升级为 v2.0 并可查看明文")
    void addEnvironmentSecret_upgradesSchema() {
        // Given
        SecretsDescriptor descriptor = new SecretsDescriptor();

        // When
        manager.addSecret(descriptor, "TOKEN", "t-prod", "prod");

        // Then
        assertThat(descriptor.getSchemaVersion()).isEqualTo(SecretsDescriptor.SCHEMA_V2);
        assertThat(descriptor.getEnvironmentValue("prod", "TOKEN"))
                .hasValueSatisfying(v -> assertThat(v).isNotEqualTo("t-prod"));
        assertThat(manager.revealSecret(descriptor, "TOKEN", "prod")).isEqualTo("t-prod");
    }

    @Test
    @DisplayName("只重新加密被修改的值")
    void addSecret_leavesOtherCiphertextsUntouched() {
        // Given
        SecretsDescriptor descriptor = new SecretsDescriptor();
        manager.addSecret(descriptor, "A", "a", null);
        manager.addSecret(descriptor, "B", "b", null);
        String before = descriptor.getValues().get("A");

        // When
        manager.addSecret(descriptor, "B", "b2", null);

        // Then
        assertThat(descriptor.getValues().get("A")).isEqualTo(before);
        assertThat(manager.revealSecret(descriptor, "B", null)).isEqualTo("b2");
        assertThat(descriptor.getSchemaVersion()).isEqualTo(SecretsDescriptor.SCHEMA_V1);
    }

    @Test
    @DisplayName("删除环境中最后一个值时移除环境条目")
    void deleteLastEnvironmentValue_removesEnvironment() {
        // Given
        SecretsDescriptor descriptor = new SecretsDescriptor();
        manager.addSecret(descriptor, "TOKEN", "t", "prod");

        // When
        boolean removed = manager.deleteSecret(descriptor, "TOKEN", "prod");

        // Then
        assertThat(removed).isTrue();
        assertThat(descriptor.hasEnvironment("prod")).isFalse();
        assertThat(manager.deleteSecret(descriptor, "TOKEN", "prod")).isFalse();
    }

    @Test
    @DisplayName("列出密钥按名称排序")
    void listSecrets_isSorted() {
        // Given
        SecretsDescriptor descriptor = new SecretsDescriptor();
        manager.addSecret(descriptor, "ZETA", "z", null);
        manager.addSecret(descriptor, "ALPHA", "a", null);

        // When / Then
        assertThat(manager.listSecrets(descriptor, null)).containsExactly("ALPHA", "ZETA");
        assertThat(manager.listSecrets(descriptor, "prod")).isEmpty();
    }

    @Test
    @DisplayName("查看不存在的密钥抛出 SecretNotFoundException")
    void revealMissing_throws() {
        assertThatThrownBy(() -> manager.revealSecret(new SecretsDescriptor(), "NOPE", "prod"))
                .isInstanceOf(SecretNotFoundException.class);
    }

    @Test
    @DisplayName("文件级操作读写 secrets.yaml")
    void fileOperations_persistDescriptor() {
        // Given
        Path file = tempDir.resolve("nested/secrets.yaml");

        // When
        manager.addSecret(file, "DB_PASSWORD", "s3cret", null);
        manager.addSecret(file, "DB_PASSWORD", "s3cret-prod", "prod");

        // Then
        SecretsDescriptor reloaded = repository.load(file);
        assertThat(reloaded.getSchemaVersion()).isEqualTo(SecretsDescriptor.SCHEMA_V2);
        assertThat(manager.revealSecret(reloaded, "DB_PASSWORD", null)).isEqualTo("s3cret");
        assertThat(manager.revealSecret(reloaded, "DB_PASSWORD", "prod")).isEqualTo("s3cret-prod");
        assertThat(manager.listSecrets(file, "prod")).containsExactly("DB_PASSWORD");
        assertThat(manager.deleteSecret(file, "DB_PASSWORD", "prod")).isTrue();
        assertThat(repository.load(file).hasEnvironment("prod")).isFalse();
    }

    @Test
    @DisplayName("空密钥名被拒绝")
    void blankName_isRejected() {
        assertThatThrownBy(() -> manager.addSecret(new SecretsDescriptor(), " ", "v", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
