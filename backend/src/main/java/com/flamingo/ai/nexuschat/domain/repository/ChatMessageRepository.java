package com.flamingo.ai.nexuschat.domain.repository;

import com.flamingo.ai.nexuschat.domain.entity.ChatMessage;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for ChatMessage entities. */
@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, UUID> {

  /** Finds recent messages for a session, newest first. */
  @Query(
      "SELECT m FROM ChatMessage m WHERE m.session.id = :sessionId "
          + "ORDER BY m.createdAt DESC")
  List<ChatMessage> findRecentMessages(@Param("sessionId") UUID sessionId, Pageable pageable);

  /** Finds recent messages with a limit. */
  default List<ChatMessage> findRecentMessages(UUID sessionId, int limit) {
    return findRecentMessages(sessionId, Pageable.ofSize(limit));
  }
}
