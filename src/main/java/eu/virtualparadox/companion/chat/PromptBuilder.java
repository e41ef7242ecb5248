package eu.virtualparadox.companion.chat;

import eu.virtualparadox.companion.conversation.EMessageRole;
import eu.virtualparadox.companion.conversation.entity.MessageEntity;
import eu.virtualparadox.companion.rag.index.ScoredChunk;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles system instructions, retrieved context, history and the new user message.
 */
@Component
public class PromptBuilder {

    static final String SYSTEM_PROMPT = String.join("\n",
            "You are Companion, a helpful and knowledgeable assistant.",
            "",
            "Guidelines for your responses:",
            "- Be clear, accurate, and well-structured",
            "- Use markdown formatting for better readability:",
            "  - Use **bold** for important terms or emphasis",
            "  - Use bullet points or numbered lists for steps or multiple items",
            "  - Use headings (## or ###) for organizing longer responses",
            "  - Use `code` formatting for technical terms, commands, or code",
            "- Keep paragraphs concise and separated",
            "- When providing steps or instructions, number them clearly",
            "- Be friendly but professional in tone",
            "- If you don't know something, say so honestly");

    static final String CONTEXT_HEADER = "\n\nContext information is below.\n---------------------\n";
    static final String CONTEXT_FOOTER = "\n---------------------\n"
            + "Given the context information and not prior knowledge, answer the query.";

    /**
     * @param history previous messages of the conversation, oldest first, without the new message
     * @param context retrieved chunks; empty means no context segment
     */
    public Prompt build(final List<MessageEntity> history, final String userMessage, final List<ScoredChunk> context) {
        final List<Message> messages = new ArrayList<>(history.size() + 2);
        messages.add(new SystemMessage(systemText(context)));

        for (final MessageEntity message : history) {
            if (message.getRole() == EMessageRole.USER) {
                messages.add(new UserMessage(message.getContent()));
            } else {
                messages.add(new AssistantMessage(message.getContent()));
            }
        }
        messages.add(new UserMessage(userMessage));
        return new Prompt(messages);
    }

    private static String systemText(final List<ScoredChunk> context) {
        if (context.isEmpty()) {
            return SYSTEM_PROMPT;
        }
        final StringBuilder sb = new StringBuilder(SYSTEM_PROMPT).append(CONTEXT_HEADER);
        for (int i = 0; i < context.size(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(context.get(i).text().strip());
        }
        return sb.append(CONTEXT_FOOTER).toString();
    }
}
