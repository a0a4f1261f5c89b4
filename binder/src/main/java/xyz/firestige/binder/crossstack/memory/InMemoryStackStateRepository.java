package xyz.firestige.binder.crossstack.memory;

import xyz.firestige.binder.crossstack.StackOutputs;
import xyz.firestige.binder.crossstack.StackStateRepository;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 内存实现（单进程 / 测试）
 */
public class InMemoryStackStateRepository implements StackStateRepository {

    private final ConcurrentMap<String, StackOutputs> states = new ConcurrentHashMap<>();

    @Override
    public Optional<StackOutputs> load(String fullReference) {
        return Optional.ofNullable(states.get(fullReference));
    }

    @Override
    public void publish(String fullReference, StackOutputs outputs) {
        states.merge(fullReference, outputs, StackOutputs::merge);
    }

    public void clear() {
        states.clear();
    }
}
