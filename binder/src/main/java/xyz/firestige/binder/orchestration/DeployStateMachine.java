package xyz.firestige.binder.orchestration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 单次部署的状态机
 * <p>
 * 线性推进，ABORTED 可从任意非终态进入。非法迁移抛出 IllegalStateException，
 * 属于编排器自身的缺陷而非部署失败。
 */
public class DeployStateMachine {

    private DeployState current;

    private final Map<DeployState, Set<DeployState>> rules = new EnumMap<>(DeployState.class);
    private final List<TransitionListener> listeners = new ArrayList<>();

    public DeployStateMachine() {
        this(DeployState.CREATED);
    }

    public DeployStateMachine(DeployState initial) {
        this.current = initial;
        initRules();
    }

    private void initRules() {
        rules.put(DeployState.CREATED, EnumSet.of(DeployState.RECONCILE, DeployState.ABORTED));
        rules.put(DeployState.RECONCILE, EnumSet.of(DeployState.RESOLVE_PLACEHOLDERS, DeployState.ABORTED));
        rules.put(DeployState.RESOLVE_PLACEHOLDERS, EnumSet.of(DeployState.PROVISION, DeployState.ABORTED));
        rules.put(DeployState.PROVISION, EnumSet.of(DeployState.COLLECT_COMPUTE_CONTEXT, DeployState.ABORTED));
        rules.put(DeployState.COLLECT_COMPUTE_CONTEXT, EnumSet.of(DeployState.FLUSH, DeployState.ABORTED));
        rules.put(DeployState.FLUSH, EnumSet.of(DeployState.DONE, DeployState.ABORTED));
        rules.put(DeployState.DONE, EnumSet.noneOf(DeployState.class));
        rules.put(DeployState.ABORTED, EnumSet.noneOf(DeployState.class));
    }

    public void addListener(TransitionListener listener) {
        listeners.add(listener);
    }

    public synchronized boolean canTransition(DeployState to) {
        return rules.getOrDefault(current, Collections.emptySet()).contains(to);
    }

    public synchronized DeployState transitionTo(DeployState to) {
        if (!canTransition(to)) {
            throw new IllegalStateException("illegal deploy transition " + current + " -> " + to);
        }
        DeployState old = current;
        current = to;
        for (TransitionListener l : listeners) {
            l.onTransition(old, to);
        }
        return current;
    }

    public synchronized DeployState getCurrent() {
        return current;
    }

    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(DeployState from, DeployState to);
    }
}
