package eu.virtualparadox.companion.conversation.service;

import eu.virtualparadox.companion.conversation.EMessageRole;
import eu.virtualparadox.companion.conversation.entity.ConversationEntity;
import eu.virtualparadox.companion.conversation.entity.MessageEntity;
import eu.virtualparadox.companion.error.NotFoundException;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class ConversationStoreTest {

    @Autowired
    private ConversationStore store;

    @Test
    void testNewConversationGetsIdAndTitle() {
        ConversationEntity created = store.createOrGet(null, "  What is the boiling point of water at sea level in Kelvin?  ");

        assertThat(created.getId()).isNotBlank();
        assertThat(created.getTitle()).isEqualTo("What is the boiling point of water at sea level in...");
        assertThat(store.createOrGet(created.getId(), "another opening").getTitle()).isEqualTo(created.getTitle());
    }

    @Test
    void testClientChosenIdIsKept() {
        String id = "client-" + UUID.randomUUID();

        assertThat(store.createOrGet(id, "hello").getId()).isEqualTo(id);
        assertThat(store.require(id).getTitle()).isEqualTo("hello");
    }

    @Test
    void testMessagesKeepArrivalOrder() {
        String id = store.createOrGet(null, "q1").getId();

        store.append(id, EMessageRole.USER, "q1", true, List.of());
        store.append(id, EMessageRole.ASSISTANT, "a1", true, List.of("doc_00001", "doc_00000"));
        store.append(id, EMessageRole.USER, "q2", true, List.of());
        store.append(id, EMessageRole.ASSISTANT, "a2 (cut", false, List.of());

        List<MessageEntity> messages = store.get(id);
        assertThat(messages).extracting(MessageEntity::getSeq).containsExactly(1, 2, 3, 4);
        assertThat(messages).extracting(MessageEntity::getContent).containsExactly("q1", "a1", "q2", "a2 (cut");
        assertThat(messages.get(1).getSourceChunkIds()).containsExactly("doc_00001", "doc_00000");
        assertThat(messages.get(3).isComplete()).isFalse();
    }

    @Test
    void testAppendToUnknownConversationFails() {
        assertThatThrownBy(() -> store.append("missing-" + UUID.randomUUID(), EMessageRole.USER, "x", true, List.of()))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.get("missing")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void testRecentHistoryKeepsNewestMessages() {
        String id = store.createOrGet(null, "m1").getId();
        for (int i = 1; i <= 12; i++) {
            store.append(id, i % 2 == 1 ? EMessageRole.USER : EMessageRole.ASSISTANT, "m" + i, true, List.of());
        }

        List<MessageEntity> history = store.recentHistory(id);

        assertThat(history).extracting(MessageEntity::getContent)
                .containsExactly("m3", "m4", "m5", "m6", "m7", "m8", "m9", "m10", "m11", "m12");
    }

    @Test
    void testRecentHistoryRespectsCharacterBudget() {
        String id = store.createOrGet(null, "long").getId();
        store.append(id, EMessageRole.USER, StringUtils.repeat('a', 7000), true, List.of());
        store.append(id, EMessageRole.ASSISTANT, StringUtils.repeat('b', 6000), true, List.of());
        store.append(id, EMessageRole.USER, "short", true, List.of());

        List<MessageEntity> history = store.recentHistory(id);

        assertThat(history).extracting(MessageEntity::getSeq).containsExactly(2, 3);
    }

    @Test
    void testConcurrentAppendsGetDistinctSequenceNumbers() throws Exception {
        String id = store.createOrGet(null, "busy").getId();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                final int thread = t;
                futures.add(pool.submit(() -> IntStream.range(0, 25).forEach(i ->
                        store.append(id, EMessageRole.USER, "t" + thread + "-" + i, true, List.of()))));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdown();
        }

        assertThat(store.get(id)).extracting(MessageEntity::getSeq)
                .containsExactlyElementsOf(IntStream.rangeClosed(1, 200).boxed().toList());
    }

    @Test
    void testRecreatedConversationKeepsSequenceOrder() throws Exception {
        String id = "client-" + UUID.randomUUID();
        store.createOrGet(id, "first life");
        store.append(id, EMessageRole.USER, "gone soon", true, List.of());
        store.delete(id);

        store.createOrGet(id, "second life");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                futures.add(pool.submit(() -> IntStream.range(0, 10).forEach(i ->
                        store.append(id, EMessageRole.USER, "again " + i, true, List.of()))));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdown();
        }

        assertThat(store.get(id)).extracting(MessageEntity::getSeq)
                .containsExactlyElementsOf(IntStream.rangeClosed(1, 40).boxed().toList());
    }

    @Test
    void testLocksStayBoundedAcrossManyConversations() {
        ConversationStore plain = new ConversationStore(null, null, null, null, null);
        Set<ReentrantLock> distinct = Collections.newSetFromMap(new IdentityHashMap<>());

        for (int i = 0; i < 1000; i++) {
            String id = UUID.randomUUID().toString();
            ReentrantLock lock = plain.lockFor(id);
            assertThat(plain.lockFor(id)).isSameAs(lock);
            distinct.add(lock);
        }

        assertThat(distinct).hasSizeLessThanOrEqualTo(ConversationStore.LOCK_STRIPES);
    }

    @Test
    void testListOrdersByLatestActivity() throws Exception {
        String older = store.createOrGet(null, "older").getId();
        Thread.sleep(5);
        String newer = store.createOrGet(null, "newer").getId();
        Thread.sleep(5);
        store.append(older, EMessageRole.USER, "bump", true, List.of());

        List<String> ids = store.list(1000, 0).stream().map(ConversationEntity::getId).toList();

        assertThat(ids.indexOf(older)).isLessThan(ids.indexOf(newer));
        assertThat(store.list(1, 0)).hasSize(1);
    }

    @Test
    void testDeleteRemovesConversation() {
        String id = store.createOrGet(null, "bye").getId();
        store.append(id, EMessageRole.USER, "bye", true, List.of("x_00000"));

        store.delete(id);

        assertThatThrownBy(() -> store.require(id)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.delete(id)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void testTitleIsCutAfterFiftyCharacters() {
        assertThat(ConversationStore.titleFrom("short")).isEqualTo("short");
        assertThat(ConversationStore.titleFrom(StringUtils.repeat('x', 50))).isEqualTo(StringUtils.repeat('x', 50));
        assertThat(ConversationStore.titleFrom(StringUtils.repeat('x', 51))).isEqualTo(StringUtils.repeat('x', 50) + "...");
    }
}
