package eu.virtualparadox.companion.chat;

import eu.virtualparadox.companion.conversation.EMessageRole;
import eu.virtualparadox.companion.conversation.entity.ConversationEntity;
import eu.virtualparadox.companion.conversation.service.ConversationStore;
import eu.virtualparadox.companion.error.EmbeddingUnavailableException;
import eu.virtualparadox.companion.llm.router.ModelRouter;
import eu.virtualparadox.companion.rag.citation.CitationResolverService;
import eu.virtualparadox.companion.rag.retriever.RetrieverService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatOrchestratorRetrievalFailureTest {

    @Mock
    private ConversationStore conversationStore;
    @Mock
    private RetrieverService retrieverService;
    @Mock
    private CitationResolverService citationResolverService;
    @Mock
    private PromptBuilder promptBuilder;
    @Mock
    private ModelRouter modelRouter;

    private ConversationTurns turns;
    private ChatOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        turns = new ConversationTurns();
        orchestrator = new ChatOrchestrator(conversationStore, retrieverService, citationResolverService,
                promptBuilder, modelRouter, turns);
        when(conversationStore.createOrGet(eq("c1"), any()))
                .thenReturn(ConversationEntity.builder().id("c1").title("q").build());
    }

    @Test
    void testRetrievalFailureReleasesConversation() {
        when(retrieverService.retrieve("what does it say?", List.of("doc-1")))
                .thenThrow(new EmbeddingUnavailableException("embedding backend unreachable"));

        assertThatThrownBy(() -> orchestrator.chat(new ChatCommand("c1", "what does it say?", List.of("doc-1"))))
                .isInstanceOf(EmbeddingUnavailableException.class)
                .hasMessage("embedding backend unreachable");

        verify(conversationStore).append("c1", EMessageRole.USER, "what does it say?", true, List.of());
        verify(conversationStore, never()).append(eq("c1"), eq(EMessageRole.ASSISTANT), any(), eq(true), anyList());
        verifyNoInteractions(promptBuilder, modelRouter);
        assertThat(turns.isActive("c1")).isFalse();
    }

    @Test
    void testNextTurnIsAcceptedAfterRetrievalFailure() {
        when(retrieverService.retrieve("first", List.of("doc-1")))
                .thenThrow(new EmbeddingUnavailableException("embedding backend unreachable"));

        assertThatThrownBy(() -> orchestrator.chat(new ChatCommand("c1", "first", List.of("doc-1"))))
                .isInstanceOf(EmbeddingUnavailableException.class);

        ChatStream stream = orchestrator.chat(new ChatCommand("c1", "second", null));

        assertThat(stream.conversationId()).isEqualTo("c1");
        assertThat(turns.isActive("c1")).isTrue();
        verify(conversationStore, times(2)).append(eq("c1"), eq(EMessageRole.USER), any(), eq(true), anyList());
    }
}
