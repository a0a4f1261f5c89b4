package xyz.firestige.binder.crossstack.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.binder.crossstack.StackOutputs;
import xyz.firestige.binder.crossstack.StackStateRepository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * 文件系统实现：每个 Stack 一个 JSON 文件，{@code <dir>/<org>/<project>/<stack>.json}
 */
public class FileSystemStackStateRepository implements StackStateRepository {

    private static final Logger log = LoggerFactory.getLogger(FileSystemStackStateRepository.class);

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileSystemStackStateRepository(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<StackOutputs> load(String fullReference) {
        Path file = fileFor(fullReference);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), StackOutputs.class));
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read stack state " + file, e);
        }
    }

    @Override
    public synchronized void publish(String fullReference, StackOutputs outputs) {
        Path file = fileFor(fullReference);
        StackOutputs merged = load(fullReference).map(existing -> existing.merge(outputs)).orElse(outputs);
        try {
            Files.createDirectories(file.getParent());
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), merged);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            log.info("发布 Stack 输出: {}, keys: {}", fullReference, outputs.keys());
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write stack state " + file, e);
        }
    }

    private Path fileFor(String fullReference) {
        Path file = directory;
        for (String part : fullReference.split("/")) {
            if (part.isBlank() || part.equals("..") || part.equals(".")) {
                throw new IllegalArgumentException("invalid stack reference: " + fullReference);
            }
            file = file.resolve(part);
        }
        return file.resolveSibling(file.getFileName() + ".json");
    }
}
