package eu.virtualparadox.companion.conversation.service;

import eu.virtualparadox.companion.application.config.ApplicationConfig;
import eu.virtualparadox.companion.conversation.EMessageRole;
import eu.virtualparadox.companion.conversation.entity.ConversationEntity;
import eu.virtualparadox.companion.conversation.entity.MessageEntity;
import eu.virtualparadox.companion.conversation.repo.ConversationRepository;
import eu.virtualparadox.companion.conversation.repo.MessageRepository;
import eu.virtualparadox.companion.error.NotFoundException;
import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable, append-only message history keyed by conversation id.
 * <p>
 * Appends to one conversation are serialized by a lock and each append runs in its own transaction,
 * so sequence numbers follow arrival order and a message is either fully stored or not at all.
 * Locks come from a fixed set of stripes chosen by conversation id: an id always maps to the same
 * lock, also after its conversation was deleted and created again, and unrelated conversations only
 * contend when they share a stripe.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationStore {

    static final int TITLE_LENGTH = 50;
    static final int LOCK_STRIPES = 64;

    private final ConversationRepository conversations;
    private final MessageRepository messages;
    private final TransactionTemplate transactionTemplate;
    private final EntityManager entityManager;
    private final ApplicationConfig config;

    private final ReentrantLock[] locks = newStripes();

    /**
     * Returns the conversation with {@code conversationId}, creating it when the id is
     * {@code null} or unknown.
     *
     * @param firstMessage used to derive the title of a new conversation
     */
    public ConversationEntity createOrGet(final String conversationId, final String firstMessage) {
        final String id = StringUtils.isBlank(conversationId) ? UUID.randomUUID().toString() : conversationId;

        final ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            return transactionTemplate.execute(status -> conversations.findById(id)
                    .orElseGet(() -> {
                        log.info("Starting conversation {}", id);
                        return conversations.save(ConversationEntity.builder()
                                .id(id)
                                .title(titleFrom(firstMessage))
                                .build());
                    }));
        } catch (DataIntegrityViolationException e) {
            // created concurrently by another node sharing the database
            return conversations.findById(id).orElseThrow(() -> e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends a message at the end of the conversation.
     *
     * @throws NotFoundException if the conversation does not exist
     */
    public MessageEntity append(final String conversationId,
                                final EMessageRole role,
                                final String content,
                                final boolean complete,
                                final List<String> sourceChunkIds) {
        final ReentrantLock lock = lockFor(conversationId);
        lock.lock();
        try {
            return transactionTemplate.execute(status -> {
                final ConversationEntity conversation = conversations.findById(conversationId)
                        .orElseThrow(() -> new NotFoundException("Conversation not found: " + conversationId));

                final Instant now = Instant.now();
                final MessageEntity message = MessageEntity.builder()
                        .conversationId(conversationId)
                        .seq(messages.maxSeq(conversationId) + 1)
                        .role(role)
                        .content(content)
                        .complete(complete)
                        .createdAt(now)
                        .sourceChunkIds(sourceChunkIds == null ? new ArrayList<>() : new ArrayList<>(sourceChunkIds))
                        .build();

                conversation.setUpdatedAt(now);
                conversations.save(conversation);
                return messages.save(message);
            });
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws NotFoundException if the conversation does not exist
     */
    @Transactional(readOnly = true)
    public ConversationEntity require(final String conversationId) {
        return conversations.findById(conversationId)
                .orElseThrow(() -> new NotFoundException("Conversation not found: " + conversationId));
    }

    /**
     * @return all messages in arrival order
     * @throws NotFoundException if the conversation does not exist
     */
    @Transactional(readOnly = true)
    public List<MessageEntity> get(final String conversationId) {
        require(conversationId);
        return messages.findByConversationIdOrderBySeqAsc(conversationId);
    }

    /**
     * The most recent messages that fit {@code companion.history.max-messages} and
     * {@code companion.history.max-chars}, oldest first. Older messages are dropped first and the
     * result is always a contiguous tail of the conversation.
     */
    @Transactional(readOnly = true)
    public List<MessageEntity> recentHistory(final String conversationId) {
        final ApplicationConfig.History history = config.getHistory();
        if (history.getMaxMessages() <= 0) {
            return List.of();
        }

        final List<MessageEntity> newestFirst = messages.findByConversationIdOrderBySeqDesc(
                conversationId, PageRequest.of(0, history.getMaxMessages()));

        final List<MessageEntity> kept = new ArrayList<>(newestFirst.size());
        int chars = 0;
        for (final MessageEntity message : newestFirst) {
            chars += message.getContent().length();
            if (chars > history.getMaxChars()) {
                break;
            }
            kept.add(message);
        }
        Collections.reverse(kept);
        return kept;
    }

    /**
     * @return conversations by most recent activity
     */
    @Transactional(readOnly = true)
    public List<ConversationEntity> list(final int limit, final int offset) {
        return entityManager
                .createQuery("select c from ConversationEntity c order by c.updatedAt desc, c.id", ConversationEntity.class)
                .setFirstResult(Math.max(0, offset))
                .setMaxResults(Math.max(0, limit))
                .getResultList();
    }

    /**
     * @throws NotFoundException if the conversation does not exist
     */
    public void delete(final String conversationId) {
        final ReentrantLock lock = lockFor(conversationId);
        lock.lock();
        try {
            transactionTemplate.executeWithoutResult(status -> {
                final ConversationEntity conversation = conversations.findById(conversationId)
                        .orElseThrow(() -> new NotFoundException("Conversation not found: " + conversationId));
                final long removed = messages.deleteByConversationId(conversationId);
                conversations.delete(conversation);
                log.info("Deleted conversation {} with {} messages", conversationId, removed);
            });
        } finally {
            lock.unlock();
        }
    }

    /**
     * First {@value #TITLE_LENGTH} characters of the opening message, with an ellipsis when cut.
     */
    static String titleFrom(final String message) {
        if (message == null) {
            return null;
        }
        final String trimmed = message.strip();
        return trimmed.length() > TITLE_LENGTH ? trimmed.substring(0, TITLE_LENGTH) + "..." : trimmed;
    }

    ReentrantLock lockFor(final String conversationId) {
        return locks[Math.floorMod(conversationId.hashCode(), locks.length)];
    }

    private static ReentrantLock[] newStripes() {
        final ReentrantLock[] stripes = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
        return stripes;
    }
}
