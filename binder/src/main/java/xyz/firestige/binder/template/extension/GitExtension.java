package xyz.firestige.binder.template.extension;

import xyz.firestige.binder.template.ExtensionResult;
import xyz.firestige.binder.template.Placeholder;
import xyz.firestige.binder.template.PlaceholderExtension;
import xyz.firestige.binder.template.ResolutionContext;

import java.util.Optional;

/**
 * {@code ${git:root|commit.short|commit.full|branch.raw|branch.clean}}
 */
public class GitExtension implements PlaceholderExtension {

    private static final int SHORT_COMMIT = 7;

    private final Optional<GitRepository> repository;

    public GitExtension(Optional<GitRepository> repository) {
        this.repository = repository;
    }

    @Override
    public ExtensionResult resolve(Placeholder placeholder, ResolutionContext context) {
        if (repository.isEmpty()) {
            return ExtensionResult.notFound("not inside a git repository");
        }
        GitRepository git = repository.get();
        switch (placeholder.getPath()) {
            case "root":
                return ExtensionResult.resolved(git.getRoot().toString());
            case "commit.full":
                return ExtensionResult.resolved(git.commit());
            case "commit.short": {
                String commit = git.commit();
                return ExtensionResult.resolved(commit.length() > SHORT_COMMIT ? commit.substring(0, SHORT_COMMIT) : commit);
            }
            case "branch.raw":
                return ExtensionResult.resolved(git.branch());
            case "branch.clean":
                return ExtensionResult.resolved(GitRepository.cleanBranch(git.branch()));
            default:
                return ExtensionResult.notFound("unknown git property " + placeholder.getPath());
        }
    }
}
