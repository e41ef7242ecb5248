package eu.virtualparadox.companion.chat;

import eu.virtualparadox.companion.rag.citation.Citation;
import eu.virtualparadox.companion.rag.index.ScoredChunk;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Result of starting a chat turn. Nothing is generated until {@code fragments} is subscribed;
 * the assistant message is stored when the stream terminates or is cancelled.
 */
public record ChatStream(String conversationId,
                         List<ScoredChunk> sources,
                         List<Citation> citations,
                         Flux<String> fragments) {
}
