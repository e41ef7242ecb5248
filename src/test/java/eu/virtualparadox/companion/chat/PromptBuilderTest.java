package eu.virtualparadox.companion.chat;

import eu.virtualparadox.companion.conversation.EMessageRole;
import eu.virtualparadox.companion.conversation.entity.MessageEntity;
import eu.virtualparadox.companion.rag.index.ScoredChunk;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PromptBuilderTest {

    private final PromptBuilder builder = new PromptBuilder();

    private static MessageEntity message(EMessageRole role, String content) {
        return MessageEntity.builder().role(role).content(content).build();
    }

    @Test
    void testWithoutContextOnlySystemPromptIsUsed() {
        Prompt prompt = builder.build(List.of(), "hi", List.of());

        List<Message> messages = prompt.getInstructions();
        assertThat(messages).hasSize(2);
        assertThat(messages.get(0).getText()).isEqualTo(PromptBuilder.SYSTEM_PROMPT);
        assertThat(messages.get(1).getMessageType()).isEqualTo(MessageType.USER);
        assertThat(messages.get(1).getText()).isEqualTo("hi");
    }

    @Test
    void testHistoryKeepsRolesAndOrder() {
        Prompt prompt = builder.build(List.of(
                message(EMessageRole.USER, "q1"),
                message(EMessageRole.ASSISTANT, "a1")), "q2", List.of());

        assertThat(prompt.getInstructions())
                .extracting(Message::getMessageType)
                .containsExactly(MessageType.SYSTEM, MessageType.USER, MessageType.ASSISTANT, MessageType.USER);
        assertThat(prompt.getInstructions())
                .extracting(Message::getText)
                .endsWith("q1", "a1", "q2");
    }

    @Test
    void testContextIsFoldedIntoSystemMessage() {
        List<ScoredChunk> context = List.of(
                new ScoredChunk("d", "d_00000", 0, "  Alpha facts. ", 1, 1, 0.9f),
                new ScoredChunk("d", "d_00003", 3, "Beta facts.", 2, 2, 0.7f));

        String system = builder.build(List.of(), "question", context).getInstructions().get(0).getText();

        assertThat(system)
                .startsWith(PromptBuilder.SYSTEM_PROMPT)
                .contains(PromptBuilder.CONTEXT_HEADER + "Alpha facts.\nBeta facts." + PromptBuilder.CONTEXT_FOOTER);
    }
}
