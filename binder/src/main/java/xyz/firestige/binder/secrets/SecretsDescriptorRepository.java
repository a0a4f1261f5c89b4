package xyz.firestige.binder.secrets;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.binder.domain.secrets.SecretsDescriptor;
import xyz.firestige.binder.exception.InvalidDescriptorException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * secrets.yaml 读写
 * <p>
 * 文件不存在时返回空的 v1.0 描述。写入由调用方保证单写者，这里不加锁。
 */
public class SecretsDescriptorRepository {

    private static final Logger log = LoggerFactory.getLogger(SecretsDescriptorRepository.class);

    private final ObjectMapper yamlMapper;

    public SecretsDescriptorRepository() {
        this(new ObjectMapper(new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)));
    }

    public SecretsDescriptorRepository(ObjectMapper yamlMapper) {
        this.yamlMapper = yamlMapper;
    }

    public SecretsDescriptor load(Path file) {
        if (!Files.exists(file)) {
            log.debug("密钥文件不存在, 使用空描述: {}", file);
            return new SecretsDescriptor();
        }
        try (InputStream in = Files.newInputStream(file)) {
            return read(in, file.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read secrets file " + file, e);
        }
    }

    public SecretsDescriptor read(InputStream in, String source) {
        try {
            SecretsDescriptor descriptor = yamlMapper.readValue(in, SecretsDescriptor.class);
            if (descriptor == null) {
                return new SecretsDescriptor();
            }
            log.debug("加载密钥描述: {}, schemaVersion: {}, environments: {}",
                    source, descriptor.getSchemaVersion(), descriptor.getEnvironmentNames());
            return descriptor;
        } catch (IOException e) {
            throw new InvalidDescriptorException("invalid secrets descriptor " + source + ": " + e.getMessage(), e);
        }
    }

    public void save(Path file, SecretsDescriptor descriptor) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            yamlMapper.writeValue(tmp.toFile(), descriptor);
            Files.move(tmp, file, java.nio.file.StandardCopyOption.REPLACE_EXISTING);
            log.info("保存密钥描述: {}", file);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write secrets file " + file, e);
        }
    }
}
