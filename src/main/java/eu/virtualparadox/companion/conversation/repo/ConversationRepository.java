package eu.virtualparadox.companion.conversation.repo;

import eu.virtualparadox.companion.conversation.entity.ConversationEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ConversationRepository extends JpaRepository<ConversationEntity, String> {
}
