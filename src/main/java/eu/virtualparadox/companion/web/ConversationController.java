package eu.virtualparadox.companion.web;

import eu.virtualparadox.companion.conversation.entity.ConversationEntity;
import eu.virtualparadox.companion.conversation.service.ConversationStore;
import eu.virtualparadox.companion.web.dto.ConversationListResponse;
import eu.virtualparadox.companion.web.dto.ConversationResponse;
import eu.virtualparadox.companion.web.dto.MessageResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/conversations")
@RequiredArgsConstructor
public class ConversationController {

    private static final int MAX_PAGE = 100;

    private final ConversationStore conversationStore;

    @GetMapping
    public ConversationListResponse list(@RequestParam(name = "limit", defaultValue = "20") final int limit,
                                         @RequestParam(name = "offset", defaultValue = "0") final int offset) {
        if (limit < 1 || limit > MAX_PAGE || offset < 0) {
            throw new IllegalArgumentException("limit must be within 1.." + MAX_PAGE + " and offset must not be negative");
        }
        return new ConversationListResponse(
                conversationStore.list(limit, offset).stream().map(ConversationListResponse.Summary::of).toList(),
                limit, offset);
    }

    @GetMapping("/{id}")
    public ConversationResponse get(@PathVariable("id") final String id) {
        final ConversationEntity conversation = conversationStore.require(id);
        return new ConversationResponse(
                conversation.getId(),
                conversation.getTitle(),
                conversationStore.get(id).stream().map(MessageResponse::of).toList(),
                conversation.getCreatedAt(),
                conversation.getUpdatedAt());
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable("id") final String id) {
        conversationStore.delete(id);
    }
}
