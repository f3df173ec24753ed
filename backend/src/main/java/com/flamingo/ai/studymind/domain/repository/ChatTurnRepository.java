package com.flamingo.ai.studymind.domain.repository;

import com.flamingo.ai.studymind.domain.entity.ChatTurn;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for ChatTurn entities. */
@Repository
public interface ChatTurnRepository extends JpaRepository<ChatTurn, Long> {

  /** Finds all turns of a session in chronological order. */
  List<ChatTurn> findBySessionIdOrderByCreatedAtAscIdAsc(Long sessionId);

  /** Counts turns of a session. */
  long countBySessionId(Long sessionId);
}
