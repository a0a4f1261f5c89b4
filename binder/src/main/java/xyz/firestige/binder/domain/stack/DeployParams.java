package xyz.firestige.binder.domain.stack;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 部署参数：身份、项目根目录、是否为预览
 */
public final class DeployParams {

    private final StackParams stackParams;
    private final Path rootDir;
    private final boolean preview;

    public DeployParams(StackParams stackParams, Path rootDir, boolean preview) {
        this.stackParams = Objects.requireNonNull(stackParams, "stackParams");
        this.rootDir = rootDir;
        this.preview = preview;
    }

    public StackParams getStackParams() {
        return stackParams;
    }

    public String getStackName() {
        return stackParams.getStackName();
    }

    public String getEnvironment() {
        return stackParams.getEnvironment();
    }

    public Path getRootDir() {
        return rootDir;
    }

    public boolean isPreview() {
        return preview;
    }

    @Override
    public String toString() {
        return "DeployParams{" + stackParams + ", preview=" + preview + '}';
    }
}
