package eu.virtualparadox.companion.conversation.entity;

import eu.virtualparadox.companion.conversation.EMessageRole;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One turn of a conversation. {@code seq} orders the messages of a conversation by arrival;
 * {@code complete} is {@code false} for an assistant answer cut short by an error or a disconnect.
 */
@Entity
@Table(name = "messages",
        uniqueConstraints = @UniqueConstraint(name = "uk_message_seq", columnNames = {"conversation_id", "seq"}),
        indexes = @Index(name = "ix_message_conversation", columnList = "conversation_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MessageEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "conversation_id", length = 64, nullable = false, updatable = false)
    private String conversationId;

    @Column(nullable = false, updatable = false)
    private int seq;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false, updatable = false)
    private EMessageRole role;

    @Lob
    @Column(nullable = false, updatable = false)
    private String content;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false, updatable = false)
    private boolean complete;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "message_sources", joinColumns = @JoinColumn(name = "message_id"))
    @OrderColumn(name = "source_order")
    @Column(name = "chunk_id", length = 128)
    @Builder.Default
    private List<String> sourceChunkIds = new ArrayList<>();
}
