package eu.virtualparadox.companion.chat;

import eu.virtualparadox.companion.conversation.EMessageRole;
import eu.virtualparadox.companion.conversation.entity.ConversationEntity;
import eu.virtualparadox.companion.conversation.entity.MessageEntity;
import eu.virtualparadox.companion.conversation.service.ConversationStore;
import eu.virtualparadox.companion.error.ConversationBusyException;
import eu.virtualparadox.companion.llm.router.ModelRouter;
import eu.virtualparadox.companion.rag.citation.Citation;
import eu.virtualparadox.companion.rag.citation.CitationResolverService;
import eu.virtualparadox.companion.rag.index.ScoredChunk;
import eu.virtualparadox.companion.rag.retriever.RetrieverService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Runs one chat turn.
 * <ol>
 *   <li>Load or create the conversation, read its recent history and store the user message</li>
 *   <li>Retrieve context from the selected documents, if any</li>
 *   <li>Build the prompt and hand it to the {@link ModelRouter}</li>
 *   <li>Forward fragments as they arrive while accumulating the answer</li>
 *   <li>Store the assistant message when the stream completes, fails or is cancelled</li>
 * </ol>
 * Steps 1 to 3 happen in {@link #chat(ChatCommand)}; generation starts when the caller subscribes.
 * <p>
 * Turns of one conversation do not overlap: a turn holds its conversation in {@link ConversationTurns}
 * from step 1 until its answer is finalized, and a concurrent turn is rejected. The returned fragments
 * must therefore be subscribed, or the conversation stays held.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatOrchestrator {

    private final ConversationStore conversationStore;
    private final RetrieverService retrieverService;
    private final CitationResolverService citationResolverService;
    private final PromptBuilder promptBuilder;
    private final ModelRouter modelRouter;
    private final ConversationTurns turns;

    /**
     * @throws IllegalArgumentException  if the message is blank
     * @throws ConversationBusyException if the conversation is still answering a previous message
     */
    public ChatStream chat(final ChatCommand command) {
        if (StringUtils.isBlank(command.message())) {
            throw new IllegalArgumentException("message must not be blank");
        }

        final ConversationEntity conversation = conversationStore.createOrGet(command.conversationId(), command.message());
        final String conversationId = conversation.getId();
        turns.begin(conversationId);

        final ChatExchange exchange = new ChatExchange(conversationId);
        final List<ScoredChunk> context;
        final List<Citation> citations;
        final Prompt prompt;
        try {
            final List<MessageEntity> history = conversationStore.recentHistory(conversationId);
            conversationStore.append(conversationId, EMessageRole.USER, command.message(), true, List.of());

            if (command.documentIds().isEmpty()) {
                context = List.of();
            } else {
                exchange.moveTo(EChatState.RETRIEVING);
                log.debug("Conversation {}: retrieving from {}", conversationId, command.documentIds());
                context = retrieverService.retrieve(command.message(), command.documentIds());
            }
            citations = citationResolverService.resolve(context);
            prompt = promptBuilder.build(history, command.message(), context);
            log.info("Conversation {}: {} history messages, {} context chunks", conversationId, history.size(), context.size());
        } catch (RuntimeException e) {
            log.warn("Conversation {}: turn failed before generation: {}", conversationId, e.getMessage());
            if (exchange.beginFinalizing()) {
                exchange.moveTo(EChatState.FAILED);
            }
            turns.end(conversationId);
            throw e;
        }

        exchange.useSources(context.stream().map(ScoredChunk::chunkId).toList());

        final Flux<String> fragments = Flux.defer(() -> {
                    exchange.moveTo(EChatState.GENERATING);
                    return modelRouter.generate(prompt);
                })
                // persistence below blocks; keep it off the HTTP client's event loop
                .publishOn(Schedulers.boundedElastic())
                .doOnNext(exchange::append)
                .doOnComplete(() -> complete(exchange))
                .doOnError(error -> abort(exchange, error))
                .doOnCancel(() -> cancel(exchange));
        return new ChatStream(conversationId, context, citations, fragments);
    }

    private void complete(final ChatExchange exchange) {
        if (!exchange.beginFinalizing()) {
            return;
        }
        try {
            conversationStore.append(exchange.getConversationId(), EMessageRole.ASSISTANT, exchange.content(),
                    true, exchange.getSourceChunkIds());
            exchange.moveTo(EChatState.DONE);
        } catch (RuntimeException e) {
            exchange.moveTo(EChatState.FAILED);
            throw e;
        } finally {
            turns.end(exchange.getConversationId());
        }
    }

    private void abort(final ChatExchange exchange, final Throwable error) {
        if (!exchange.beginFinalizing()) {
            return;
        }
        log.warn("Conversation {}: generation failed: {}", exchange.getConversationId(), error.getMessage());
        try {
            storePartial(exchange);
        } finally {
            exchange.moveTo(EChatState.FAILED);
            turns.end(exchange.getConversationId());
        }
    }

    private void cancel(final ChatExchange exchange) {
        if (!exchange.beginFinalizing()) {
            return;
        }
        log.info("Conversation {}: client went away during generation", exchange.getConversationId());
        try {
            storePartial(exchange);
        } catch (RuntimeException e) {
            // no subscriber left to report to
            log.error("Conversation {}: unable to store partial answer", exchange.getConversationId(), e);
        } finally {
            exchange.moveTo(EChatState.FAILED);
            turns.end(exchange.getConversationId());
        }
    }

    private void storePartial(final ChatExchange exchange) {
        final String partial = exchange.content();
        if (partial.isEmpty()) {
            return;
        }
        conversationStore.append(exchange.getConversationId(), EMessageRole.ASSISTANT, partial,
                false, exchange.getSourceChunkIds());
    }
}
