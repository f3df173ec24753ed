package com.flamingo.ai.studymind.domain.repository;

import com.flamingo.ai.studymind.domain.entity.LibraryItem;
import com.flamingo.ai.studymind.domain.enums.LibraryItemType;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for LibraryItem entities. All reads are scoped to an owner and to active items. */
@Repository
public interface LibraryItemRepository extends JpaRepository<LibraryItem, Long> {

  /** Finds one active item by its external id. */
  Optional<LibraryItem> findByUidAndUserIdAndIsActiveTrue(UUID uid, Long userId);

  /** Finds one active item by its numeric id. */
  Optional<LibraryItem> findByIdAndUserIdAndIsActiveTrue(Long id, Long userId);

  /** Finds the active items among the given external ids. */
  List<LibraryItem> findByUidInAndUserIdAndIsActiveTrue(Collection<UUID> uids, Long userId);

  /** Finds the active direct children of a folder that are not folders themselves. */
  @Query(
      "SELECT i FROM LibraryItem i WHERE i.parentId = :parentId AND i.userId = :userId "
          + "AND i.isActive = true AND i.type <> :excluded ORDER BY i.createdAt ASC")
  List<LibraryItem> findActiveChildrenExcludingType(
      @Param("parentId") Long parentId,
      @Param("userId") Long userId,
      @Param("excluded") LibraryItemType excluded);
}
