package com.flamingo.ai.studymind.domain.repository;

import com.flamingo.ai.studymind.domain.entity.ChatSession;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for ChatSession entities. */
@Repository
public interface ChatSessionRepository extends JpaRepository<ChatSession, Long> {

  /** Finds a session by its external id, regardless of owner. */
  Optional<ChatSession> findByUid(UUID uid);

  /** Finds a user's active sessions, most recently updated first. */
  List<ChatSession> findByUserIdAndIsActiveTrueOrderByUpdatedAtDesc(Long userId);

  /** Finds a user's active sessions whose title contains the given text (case-insensitive). */
  @Query(
      "SELECT s FROM ChatSession s WHERE s.userId = :userId AND s.isActive = true "
          + "AND LOWER(s.title) LIKE LOWER(CONCAT('%', :title, '%')) ORDER BY s.updatedAt DESC")
  List<ChatSession> searchActiveByTitle(
      @Param("userId") Long userId, @Param("title") String title);
}
