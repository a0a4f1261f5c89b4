package xyz.firestige.binder.crossstack;

import java.util.Objects;

/**
 * 另一个 Stack 已发布输出的只读句柄
 */
public final class StackReference {

    private final String fullReference;
    private final String stackName;
    private final StackOutputs outputs;

    public StackReference(String fullReference, StackOutputs outputs) {
        this.fullReference = Objects.requireNonNull(fullReference, "fullReference");
        this.stackName = StackReferences.collapse(fullReference);
        this.outputs = outputs != null ? outputs : StackOutputs.empty();
    }

    public String getFullReference() {
        return fullReference;
    }

    public String getStackName() {
        return stackName;
    }

    public StackOutputs getOutputs() {
        return outputs;
    }

    @Override
    public String toString() {
        return "StackReference{" + fullReference + ", outputs=" + outputs.keys().size() + '}';
    }
}
