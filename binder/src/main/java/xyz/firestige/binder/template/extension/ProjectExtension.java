package xyz.firestige.binder.template.extension;

import xyz.firestige.binder.template.ExtensionResult;
import xyz.firestige.binder.template.Placeholder;
import xyz.firestige.binder.template.PlaceholderExtension;
import xyz.firestige.binder.template.ResolutionContext;

import java.nio.file.Path;

/**
 * {@code ${project:root}}：位于 git 仓库内时为仓库根目录，否则为配置的项目目录
 */
public class ProjectExtension implements PlaceholderExtension {

    private final Path root;

    public ProjectExtension(Path projectDir) {
        this.root = GitRepository.discover(projectDir)
                .map(GitRepository::getRoot)
                .orElse(projectDir.toAbsolutePath().normalize());
    }

    @Override
    public ExtensionResult resolve(Placeholder placeholder, ResolutionContext context) {
        if ("root".equals(placeholder.getPath())) {
            return ExtensionResult.resolved(root.toString());
        }
        return ExtensionResult.notFound("unknown project property " + placeholder.getPath());
    }
}
