package com.eainde.dialog.cli;

import com.eainde.dialog.config.RouterProperties;
import com.eainde.dialog.exception.RetryExhaustedException;
import com.eainde.dialog.workflow.DialogSessionEngine;
import com.eainde.dialog.workflow.SessionReply;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConsoleChatRunnerTest {

    @Mock
    private DialogSessionEngine engine;

    @Test
    void converse_shouldStop_whenAssistantSaysGoodbye() throws Exception {
        // Arrange
        when(engine.chat("0", "bye")).thenReturn(new SessionReply("0", "Assistant: Goodbye!", null));
        ConsoleChatRunner runner = new ConsoleChatRunner(engine, new RouterProperties());
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        // Act
        runner.converse(new StringReader("bye\nnever read\n"), new PrintStream(out, true, StandardCharsets.UTF_8));

        // Assert
        assertThat(out.toString(StandardCharsets.UTF_8))
                .contains("Assistant: Goodbye!")
                .doesNotContain("Assistant: Assistant:");
        verify(engine, never()).chat("0", "never read");
    }

    @Test
    void converse_shouldKeepGoing_whenAssistantSaysPlainGoodbye() throws Exception {
        // Arrange
        when(engine.chat("0", "bye")).thenReturn(new SessionReply("0", "Goodbye!", null));
        when(engine.chat("0", "still here")).thenReturn(new SessionReply("0", "Yes?", null));
        ConsoleChatRunner runner = new ConsoleChatRunner(engine, new RouterProperties());

        // Act
        runner.converse(new StringReader("bye\nstill here\nexit\n"), new PrintStream(new ByteArrayOutputStream()));

        // Assert
        verify(engine).chat("0", "still here");
    }

    @Test
    void converse_shouldStop_whenUserTypesExit() throws Exception {
        // Arrange
        ConsoleChatRunner runner = new ConsoleChatRunner(engine, new RouterProperties());

        // Act
        runner.converse(new StringReader("exit\n"), new PrintStream(new ByteArrayOutputStream()));

        // Assert
        verify(engine, never()).chat(anyString(), anyString());
    }

    @Test
    void converse_shouldKeepGoing_whenTurnFails() throws Exception {
        // Arrange
        when(engine.chat("0", "hello")).thenThrow(new RetryExhaustedException("primary_assistant", 5));
        when(engine.chat("0", "again")).thenReturn(new SessionReply("0", "Hi!", null));
        ConsoleChatRunner runner = new ConsoleChatRunner(engine, new RouterProperties());
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        // Act
        runner.converse(new StringReader("hello\nagain\nquit\n"), new PrintStream(out, true, StandardCharsets.UTF_8));

        // Assert
        assertThat(out.toString(StandardCharsets.UTF_8))
                .contains("Error: Agent 'primary_assistant' produced no usable output after 5 attempts")
                .contains("Assistant: Hi!");
    }
}
