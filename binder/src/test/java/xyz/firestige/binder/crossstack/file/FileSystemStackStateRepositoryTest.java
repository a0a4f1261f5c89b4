package xyz.firestige.binder.crossstack.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.binder.crossstack.StackOutput;
import xyz.firestige.binder.crossstack.StackOutputs;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FileSystemStackStateRepository 单元测试")
class FileSystemStackStateRepositoryTest {

    @TempDir
    Path dir;

    private FileSystemStackStateRepository repository;

    @BeforeEach
    void setUp() {
        repository = new FileSystemStackStateRepository(dir, new ObjectMapper());
    }

    @Test
    @DisplayName("发布后按完整引用读取，secret 标记保留")
    void publishAndLoad() {
        // When
        repository.publish("acme/shop/platform", new StackOutputs()
                .putPlain("logs--prod-bucket-name", "acme-logs")
                .putSecret("main--prod-root-password", "pw"));

        // Then
        assertThat(Files.exists(dir.resolve("acme/shop/platform.json"))).isTrue();
        Optional<StackOutputs> loaded = repository.load("acme/shop/platform");
        assertThat(loaded).isPresent();
        assertThat(loaded.get().get("logs--prod-bucket-name")).contains(StackOutput.plain("acme-logs"));
        assertThat(loaded.get().get("main--prod-root-password")).contains(StackOutput.secret("pw"));
    }

    @Test
    @DisplayName("再次发布与已有输出合并")
    void publish_mergesWithExisting() {
        // Given
        repository.publish("acme/shop/platform", new StackOutputs().putPlain("a", "1").putPlain("b", "1"));

        // When
        repository.publish("acme/shop/platform", new StackOutputs().putPlain("b", "2"));

        // Then
        StackOutputs loaded = repository.load("acme/shop/platform").orElseThrow();
        assertThat(loaded.asMap()).containsOnlyKeys("a", "b");
        assertThat(loaded.get("b")).contains(StackOutput.plain("2"));
    }

    @Test
    @DisplayName("未发布的 Stack 返回 empty")
    void load_missing_returnsEmpty() {
        assertThat(repository.load("acme/shop/nothing")).isEmpty();
    }

    @Test
    @DisplayName("包含路径穿越的引用被拒绝")
    void traversal_isRejected() {
        assertThatThrownBy(() -> repository.load("acme/../etc"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
