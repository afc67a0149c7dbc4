package com.eainde.dialog.model;

import com.eainde.dialog.message.Message;
import com.eainde.dialog.message.ToolCall;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MessageMapperTest {

    @Test
    void toChatMessages_shouldMapEveryRole() {
        // Arrange
        ToolCall call = new ToolCall("c1", "list_directory", "{}");
        List<Message> history = List.of(
                Message.user("what is there?"),
                Message.assistant(null, List.of(call)),
                Message.toolResult(call, "src/"),
                Message.assistant("There is a src folder."));

        // Act
        List<ChatMessage> mapped = MessageMapper.toChatMessages(history);

        // Assert
        assertThat(mapped.get(0)).isInstanceOf(UserMessage.class);
        assertThat(((AiMessage) mapped.get(1)).toolExecutionRequests()).singleElement()
                .satisfies(request -> {
                    assertThat(request.id()).isEqualTo("c1");
                    assertThat(request.name()).isEqualTo("list_directory");
                });
        ToolExecutionResultMessage result = (ToolExecutionResultMessage) mapped.get(2);
        assertThat(result.id()).isEqualTo("c1");
        assertThat(result.text()).isEqualTo("src/");
        assertThat(((AiMessage) mapped.get(3)).text()).isEqualTo("There is a src folder.");
    }

    @Test
    void fromAiMessage_shouldGenerateIds_whenModelOmitsThem() {
        // Arrange
        AiMessage aiMessage = AiMessage.from(List.of(ToolExecutionRequest.builder()
                .name("ToCoderAssistant")
                .arguments("{\"request\":\"api\"}")
                .build()));

        // Act
        Message message = MessageMapper.fromAiMessage(aiMessage);

        // Assert
        assertThat(message.toolCalls()).singleElement().satisfies(call -> {
            assertThat(call.id()).startsWith("call_");
            assertThat(call.name()).isEqualTo("ToCoderAssistant");
            assertThat(call.arguments()).isEqualTo("{\"request\":\"api\"}");
        });
    }

    @Test
    void fromAiMessage_shouldKeepText_whenNoToolCalls() {
        // Act
        Message message = MessageMapper.fromAiMessage(AiMessage.from("Hello"));

        // Assert
        assertThat(message.content()).isEqualTo("Hello");
        assertThat(message.hasToolCalls()).isFalse();
    }

    @Test
    void fromAiMessage_shouldReturnEmptyAssistant_whenNull() {
        // Act & Assert
        assertThat(MessageMapper.fromAiMessage(null).hasText()).isFalse();
    }
}
