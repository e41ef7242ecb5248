package eu.virtualparadox.companion.web;

import eu.virtualparadox.companion.application.config.ApplicationConfig;
import eu.virtualparadox.companion.chat.ChatCommand;
import eu.virtualparadox.companion.chat.ChatOrchestrator;
import eu.virtualparadox.companion.chat.ChatStream;
import eu.virtualparadox.companion.error.StreamInterruptedException;
import eu.virtualparadox.companion.web.dto.ChatRequest;
import eu.virtualparadox.companion.web.dto.ChatResponse;
import eu.virtualparadox.companion.web.dto.CitationResponse;
import eu.virtualparadox.companion.web.dto.SourceResponse;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.stream.Collectors;

/**
 * {@code POST /chat}. Answers either as one JSON document or as a server-sent event stream
 * of {@code data:} fragments terminated by {@code data: [DONE]}.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ChatController {

    static final String CONVERSATION_HEADER = "X-Conversation-Id";
    static final String DONE_MARKER = "[DONE]";

    private final ChatOrchestrator chatOrchestrator;
    private final ApplicationConfig config;

    /**
     * @return a {@link SseEmitter} when {@code stream} is set, a {@link ChatResponse} otherwise
     */
    @PostMapping("/chat")
    public Object chat(@RequestBody final ChatRequest request, final HttpServletResponse response) {
        final ChatStream stream = chatOrchestrator.chat(
                new ChatCommand(request.conversationId(), request.message(), request.documentIds()));
        response.setHeader(CONVERSATION_HEADER, stream.conversationId());

        if (request.stream()) {
            return stream(stream);
        }

        final Duration timeout = config.getChat().getResponseTimeout();
        final String answer = stream.fragments()
                .collect(Collectors.joining())
                .timeout(timeout, Mono.error(() -> new StreamInterruptedException(
                        "No complete response within " + timeout.toSeconds() + "s")))
                .block();

        return new ChatResponse(
                stream.conversationId(),
                answer,
                Instant.now(),
                stream.sources().stream().map(SourceResponse::of).toList(),
                stream.citations().stream().map(CitationResponse::of).toList());
    }

    private SseEmitter stream(final ChatStream stream) {
        final SseEmitter emitter = new SseEmitter(config.getChat().getSseTimeout().toMillis());

        final Disposable subscription = stream.fragments()
                .publishOn(Schedulers.boundedElastic(), config.getChat().getStreamBuffer())
                .subscribe(
                        fragment -> send(emitter, fragmentEvent(fragment)),
                        error -> {
                            log.warn("Streaming answer for conversation {} failed: {}", stream.conversationId(), error.getMessage());
                            send(emitter, SseEmitter.event()
                                    .name("error")
                                    .data(ApiExceptionHandler.toErrorResponse(error)));
                            emitter.complete();
                        },
                        () -> {
                            send(emitter, SseEmitter.event().data(" " + DONE_MARKER));
                            emitter.complete();
                        });

        emitter.onCompletion(subscription::dispose);
        emitter.onTimeout(subscription::dispose);
        emitter.onError(t -> subscription.dispose());

        return emitter;
    }

    /**
     * One {@code data:} line per line of the fragment. The leading space is the optional separator
     * that SSE clients strip, so fragments starting with whitespace survive.
     */
    static SseEmitter.SseEventBuilder fragmentEvent(final String fragment) {
        final SseEmitter.SseEventBuilder event = SseEmitter.event();
        for (final String line : fragment.split("\n", -1)) {
            event.data(" " + line);
        }
        return event;
    }

    private static void send(final SseEmitter emitter, final SseEmitter.SseEventBuilder event) {
        try {
            emitter.send(event);
        } catch (IOException e) {
            emitter.completeWithError(e);
        }
    }
}
