package com.flamingo.ai.nexuschat.domain.repository;

import com.flamingo.ai.nexuschat.domain.entity.Session;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Session entities. */
@Repository
public interface SessionRepository extends JpaRepository<Session, UUID> {

  /** Finds a session only when it belongs to the given user. */
  Optional<Session> findByIdAndUserId(UUID id, String userId);
}
