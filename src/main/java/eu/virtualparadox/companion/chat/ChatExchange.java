package eu.virtualparadox.companion.chat;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable state of one chat turn: current stage and the fragments received so far.
 */
@Slf4j
final class ChatExchange {

    @Getter
    private final String conversationId;
    @Getter
    private volatile List<String> sourceChunkIds = List.of();

    private final StringBuilder content = new StringBuilder();
    private final AtomicBoolean finalizing = new AtomicBoolean();
    private volatile EChatState state = EChatState.PENDING;

    ChatExchange(final String conversationId) {
        this.conversationId = conversationId;
    }

    void useSources(final List<String> chunkIds) {
        this.sourceChunkIds = List.copyOf(chunkIds);
    }

    void moveTo(final EChatState next) {
        log.debug("Conversation {}: {} -> {}", conversationId, state, next);
        state = next;
    }

    EChatState state() {
        return state;
    }

    synchronized void append(final String fragment) {
        content.append(fragment);
    }

    synchronized String content() {
        return content.toString();
    }

    /**
     * @return {@code true} for the first caller only
     */
    boolean beginFinalizing() {
        if (finalizing.compareAndSet(false, true)) {
            moveTo(EChatState.FINALIZING);
            return true;
        }
        return false;
    }
}
