package xyz.firestige.binder.reconcile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class ReconciledStacks {

    private final String environment;
    private final Map<String, ReconciledStack> stacks = new LinkedHashMap<>();

    ReconciledStacks(String environment, List<ReconciledStack> stacks) {
        this.environment = environment;
        stacks.forEach(s -> this.stacks.put(s.getName(), s));
    }

    public String getEnvironment() {
        return environment;
    }

    public Optional<ReconciledStack> find(String stackName) {
        return Optional.ofNullable(stacks.get(stackName));
    }

    public List<ReconciledStack> all() {
        return List.copyOf(stacks.values());
    }

    public Map<String, ReconciledStack> asMap() {
        return Collections.unmodifiableMap(stacks);
    }

    public int size() {
        return stacks.size();
    }
}
