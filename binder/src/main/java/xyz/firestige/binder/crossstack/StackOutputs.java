package xyz.firestige.binder.crossstack;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 一个 Stack 已发布的具名输出集合
 */
public class StackOutputs {

    private final Map<String, StackOutput> outputs = new LinkedHashMap<>();

    public StackOutputs() {
    }

    public StackOutputs(Map<String, StackOutput> outputs) {
        if (outputs != null) {
            this.outputs.putAll(outputs);
        }
    }

    public static StackOutputs empty() {
        return new StackOutputs();
    }

    public Optional<StackOutput> get(String exportKey) {
        return Optional.ofNullable(outputs.get(exportKey));
    }

    @JsonAnySetter
    public StackOutputs put(String exportKey, StackOutput output) {
        outputs.put(exportKey, output);
        return this;
    }

    public StackOutputs putPlain(String exportKey, String value) {
        return put(exportKey, StackOutput.plain(value));
    }

    public StackOutputs putSecret(String exportKey, String value) {
        return put(exportKey, StackOutput.secret(value));
    }

    /**
     * 合并，同名键以 other 为准
     */
    public StackOutputs merge(StackOutputs other) {
        StackOutputs merged = new StackOutputs(outputs);
        merged.outputs.putAll(other.outputs);
        return merged;
    }

    @JsonIgnore
    public Set<String> keys() {
        return Collections.unmodifiableSet(outputs.keySet());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return outputs.isEmpty();
    }

    @JsonAnyGetter
    public Map<String, StackOutput> asMap() {
        return Collections.unmodifiableMap(outputs);
    }
}
