package xyz.firestige.binder.crossstack;

import java.util.Optional;

/**
 * Stack 输出的持久化状态，按完整引用 {@code organization/project/stackName} 存取
 */
public interface StackStateRepository {

    /**
     * @return Stack 从未发布过输出时为 empty
     */
    Optional<StackOutputs> load(String fullReference);

    /**
     * 合并发布，同名键覆盖
     */
    void publish(String fullReference, StackOutputs outputs);
}
