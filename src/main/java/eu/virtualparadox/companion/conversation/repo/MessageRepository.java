package eu.virtualparadox.companion.conversation.repo;

import eu.virtualparadox.companion.conversation.entity.MessageEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface MessageRepository extends JpaRepository<MessageEntity, Long> {

    List<MessageEntity> findByConversationIdOrderBySeqAsc(String conversationId);

    List<MessageEntity> findByConversationIdOrderBySeqDesc(String conversationId, Pageable pageable);

    @Query("select coalesce(max(m.seq), 0) from MessageEntity m where m.conversationId = :conversationId")
    int maxSeq(@Param("conversationId") String conversationId);

    long deleteByConversationId(String conversationId);
}
