package com.eainde.dialog.state;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DialogStackTest {

    @ParameterizedTest
    @CsvSource({"0,0", "1,0", "1,1", "3,1", "5,2", "6,6"})
    void reduce_shouldLeaveNMinusMEntries_whenNPushesAndMPopsApplied(int pushes, int pops) {
        // Arrange
        AgentContext[] agents = AgentContext.values();
        List<AgentContext> stack = new ArrayList<>();
        List<AgentContext> expected = new ArrayList<>();
        for (int i = 0; i < pushes; i++) {
            AgentContext agent = agents[i % agents.length];
            stack = DialogStack.reduce(stack, DialogStackOperation.push(agent));
            expected.add(agent);
        }

        // Act
        for (int i = 0; i < pops; i++) {
            stack = DialogStack.reduce(stack, DialogStackOperation.pop());
            expected.remove(expected.size() - 1);
        }

        // Assert
        assertThat(stack).hasSize(pushes - pops);
        assertThat(stack).containsExactlyElementsOf(expected);
        if (!expected.isEmpty()) {
            assertThat(stack.get(stack.size() - 1)).isEqualTo(expected.get(expected.size() - 1));
        }
    }

    @ParameterizedTest
    @EnumSource(AgentContext.class)
    void reduce_shouldRestorePreviousStack_whenPushIsFollowedByPop(AgentContext agent) {
        // Arrange
        List<AgentContext> before = List.of(AgentContext.ARCHITECT, AgentContext.CODER);

        // Act
        List<AgentContext> pushed = DialogStack.reduce(before, DialogStackOperation.push(agent));
        List<AgentContext> popped = DialogStack.reduce(pushed, DialogStackOperation.pop());

        // Assert
        assertThat(pushed).endsWith(agent);
        assertThat(popped).isEqualTo(before);
    }

    @Test
    void reduce_shouldStayEmpty_whenPoppingEmptyStack() {
        // Act
        List<AgentContext> result = DialogStack.reduce(List.of(), DialogStackOperation.pop());

        // Assert
        assertThat(result).isEmpty();
    }

    @Test
    void reduce_shouldNotMutateInput_whenPushing() {
        // Arrange
        List<AgentContext> stored = new ArrayList<>(List.of(AgentContext.TESTER));

        // Act
        List<AgentContext> result = DialogStack.reduce(stored, DialogStackOperation.push(AgentContext.CODER));

        // Assert
        assertThat(stored).containsExactly(AgentContext.TESTER);
        assertThat(result).containsExactly(AgentContext.TESTER, AgentContext.CODER);
    }

    @Test
    void reduce_shouldCopyStack_whenOperationIsNoOpOrNull() {
        // Arrange
        List<AgentContext> stored = List.of(AgentContext.CODER);

        // Act & Assert
        assertThat(DialogStack.reduce(stored, DialogStackOperation.noOp())).containsExactly(AgentContext.CODER);
        assertThat(DialogStack.reduce(stored, null)).containsExactly(AgentContext.CODER);
    }

    @Test
    void merge_shouldReject_whenUpdateIsNotAnOperation() {
        // Act & Assert
        assertThatThrownBy(() -> DialogStack.merge(List.of(), "coder_assistant"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported dialog stack update");
    }

    @Test
    void push_shouldRequireValue() {
        // Act & Assert
        assertThatThrownBy(() -> DialogStackOperation.push(null))
                .isInstanceOf(NullPointerException.class);
    }
}
