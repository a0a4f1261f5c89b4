package xyz.firestige.binder.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.binder.config.model.ClientDescriptor;
import xyz.firestige.binder.domain.stack.ServerDescriptor;
import xyz.firestige.binder.domain.stack.Stack;
import xyz.firestige.binder.exception.InvalidDescriptorException;
import xyz.firestige.binder.secrets.SecretsDescriptorRepository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Stack 描述加载器
 * <p>
 * 目录结构：{@code <root>/<stacksDir>/<stack>/{server.yaml, client.yaml, secrets.yaml}}，
 * 三个文件均可缺省。
 */
public class StackDescriptorLoader {

    private static final Logger log = LoggerFactory.getLogger(StackDescriptorLoader.class);

    public static final String SERVER_FILE = "server.yaml";
    public static final String CLIENT_FILE = "client.yaml";

    private final ObjectMapper yamlMapper;
    private final SecretsDescriptorRepository secretsRepository;
    private final String stacksDir;
    private final String secretsFile;

    public StackDescriptorLoader(SecretsDescriptorRepository secretsRepository, String stacksDir, String secretsFile) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.secretsRepository = secretsRepository;
        this.stacksDir = stacksDir;
        this.secretsFile = secretsFile;
    }

    public Path stacksRoot(Path rootDir) {
        return rootDir.resolve(stacksDir);
    }

    /**
     * 加载项目下的全部 Stack，按名称索引
     */
    public Map<String, Stack> loadAll(Path rootDir) {
        Path root = stacksRoot(rootDir);
        if (!Files.isDirectory(root)) {
            log.warn("Stack 目录不存在: {}", root);
            return new LinkedHashMap<>();
        }
        List<Path> dirs;
        try (Stream<Path> children = Files.list(root)) {
            dirs = children.filter(Files::isDirectory).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new InvalidDescriptorException("cannot list stacks in " + root, e);
        }
        Map<String, Stack> stacks = new LinkedHashMap<>();
        for (Path dir : dirs) {
            Stack stack = load(rootDir, dir.getFileName().toString());
            stacks.put(stack.getName(), stack);
        }
        log.info("加载 Stack 完成: {}", stacks.keySet());
        return stacks;
    }

    public Stack load(Path rootDir, String stackName) {
        Path dir = stacksRoot(rootDir).resolve(stackName);
        Stack stack = new Stack(stackName);

        Path server = dir.resolve(SERVER_FILE);
        if (Files.exists(server)) {
            stack.setServer(read(server, ServerDescriptor.class));
        }
        Path client = dir.resolve(CLIENT_FILE);
        if (Files.exists(client)) {
            stack.setEnvironments(read(client, ClientDescriptor.class).getStacks());
        }
        stack.setSecrets(secretsRepository.load(dir.resolve(secretsFile)));
        log.debug("加载 Stack {}: 环境 {}, 资源环境 {}", stackName,
                stack.getEnvironments().keySet(), stack.getServer().getResources().keySet());
        return stack;
    }

    private <T> T read(Path file, Class<T> type) {
        try {
            T value = yamlMapper.readValue(file.toFile(), type);
            if (value == null) {
                throw new InvalidDescriptorException("empty descriptor " + file);
            }
            return value;
        } catch (IOException e) {
            throw new InvalidDescriptorException("cannot read " + file + ": " + e.getMessage(), e);
        }
    }
}
