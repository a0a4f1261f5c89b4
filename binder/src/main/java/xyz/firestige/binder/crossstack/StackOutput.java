package xyz.firestige.binder.crossstack;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 单个导出值
 */
public final class StackOutput {

    private final String value;
    private final boolean secret;

    @JsonCreator
    public StackOutput(@JsonProperty("value") String value, @JsonProperty("secret") boolean secret) {
        this.value = value;
        this.secret = secret;
    }

    public static StackOutput plain(String value) {
        return new StackOutput(value, false);
    }

    public static StackOutput secret(String value) {
        return new StackOutput(value, true);
    }

    public String getValue() {
        return value;
    }

    public boolean isSecret() {
        return secret;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StackOutput)) return false;
        StackOutput that = (StackOutput) o;
        return secret == that.secret && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, secret);
    }

    @Override
    public String toString() {
        return secret ? "StackOutput{***}" : "StackOutput{" + value + '}';
    }
}
