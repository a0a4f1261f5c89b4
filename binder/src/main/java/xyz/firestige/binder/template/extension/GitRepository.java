package xyz.firestige.binder.template.extension;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 直接读取 .git 目录获取仓库元数据，不依赖 git 命令
 */
public final class GitRepository {

    private static final String REF_PREFIX = "ref: ";
    private static final String HEADS = "refs/heads/";

    private final Path root;
    private final Path gitDir;

    private GitRepository(Path root, Path gitDir) {
        this.root = root;
        this.gitDir = gitDir;
    }

    /**
     * 从 start 向上查找包含 .git 的目录；.git 为文件时按 {@code gitdir: <path>} 解析（worktree）
     */
    public static Optional<GitRepository> discover(Path start) {
        Path current = start.toAbsolutePath().normalize();
        while (current != null) {
            Path dotGit = current.resolve(".git");
            if (Files.isDirectory(dotGit)) {
                return Optional.of(new GitRepository(current, dotGit));
            }
            if (Files.isRegularFile(dotGit)) {
                String content = read(dotGit).trim();
                if (content.startsWith("gitdir:")) {
                    Path gitDir = current.resolve(content.substring("gitdir:".length()).trim()).normalize();
                    return Optional.of(new GitRepository(current, gitDir));
                }
            }
            current = current.getParent();
        }
        return Optional.empty();
    }

    public Path getRoot() {
        return root;
    }

    /**
     * HEAD 指向的分支引用，detached 时为 empty
     */
    public Optional<String> headRef() {
        String head = read(gitDir.resolve("HEAD")).trim();
        return head.startsWith(REF_PREFIX) ? Optional.of(head.substring(REF_PREFIX.length()).trim()) : Optional.empty();
    }

    public String commit() {
        Optional<String> ref = headRef();
        if (ref.isEmpty()) {
            return read(gitDir.resolve("HEAD")).trim();
        }
        Path loose = gitDir.resolve(ref.get());
        if (Files.isRegularFile(loose)) {
            return read(loose).trim();
        }
        Path packed = gitDir.resolve("packed-refs");
        if (Files.isRegularFile(packed)) {
            try {
                List<String> lines = Files.readAllLines(packed, StandardCharsets.UTF_8);
                for (String line : lines) {
                    if (line.startsWith("#") || line.startsWith("^")) {
                        continue;
                    }
                    String[] parts = line.trim().split(" ", 2);
                    if (parts.length == 2 && parts[1].equals(ref.get())) {
                        return parts[0];
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException("failed to read " + packed, e);
            }
        }
        // 新建仓库尚无提交
        return "";
    }

    public String branch() {
        return headRef().map(r -> r.startsWith(HEADS) ? r.substring(HEADS.length()) : r).orElse("HEAD");
    }

    /**
     * 分支名规范化为可用于资源命名的形式，例如 {@code feature/ABC_1} → {@code feature-abc-1}
     */
    public static String cleanBranch(String raw) {
        String lower = raw.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        return lower.replaceAll("^-+", "").replaceAll("-+$", "");
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read " + file, e);
        }
    }
}
