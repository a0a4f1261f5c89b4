package xyz.firestige.binder.orchestration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DeployStateMachine 单元测试")
class DeployStateMachineTest {

    @Test
    @DisplayName("按步骤顺序迁移到 DONE 并通知监听器")
    void happyPath_notifiesListeners() {
        // Given
        DeployStateMachine machine = new DeployStateMachine();
        List<String> transitions = new ArrayList<>();
        machine.addListener((from, to) -> transitions.add(from + "->" + to));

        // When
        machine.transitionTo(DeployState.RECONCILE);
        machine.transitionTo(DeployState.RESOLVE_PLACEHOLDERS);
        machine.transitionTo(DeployState.PROVISION);
        machine.transitionTo(DeployState.COLLECT_COMPUTE_CONTEXT);
        machine.transitionTo(DeployState.FLUSH);
        machine.transitionTo(DeployState.DONE);

        // Then
        assertThat(machine.getCurrent()).isEqualTo(DeployState.DONE);
        assertThat(machine.getCurrent().isTerminal()).isTrue();
        assertThat(transitions).hasSize(6).first().isEqualTo("CREATED->RECONCILE");
    }

    @ParameterizedTest
    @EnumSource(value = DeployState.class, names = {"CREATED", "RECONCILE", "RESOLVE_PLACEHOLDERS",
            "PROVISION", "COLLECT_COMPUTE_CONTEXT", "FLUSH"})
    @DisplayName("任意非终态都可以中止")
    void anyNonTerminalState_canAbort(DeployState state) {
        // Given
        DeployStateMachine machine = new DeployStateMachine(state);

        // When / Then
        assertThat(machine.canTransition(DeployState.ABORTED)).isTrue();
        machine.transitionTo(DeployState.ABORTED);
        assertThat(machine.getCurrent()).isEqualTo(DeployState.ABORTED);
    }

    @Test
    @DisplayName("跳步与终态迁移被拒绝")
    void illegalTransitions_areRejected() {
        // Given
        DeployStateMachine machine = new DeployStateMachine();
        DeployStateMachine done = new DeployStateMachine(DeployState.DONE);

        // When / Then
        assertThatThrownBy(() -> machine.transitionTo(DeployState.FLUSH))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("CREATED -> FLUSH");
        assertThat(done.canTransition(DeployState.ABORTED)).isFalse();
        assertThat(machine.getCurrent()).isEqualTo(DeployState.CREATED);
    }
}
