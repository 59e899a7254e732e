package com.giftbattle.backend.repository;

import com.giftbattle.backend.entity.InventoryEntry;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface InventoryEntryRepository extends JpaRepository<InventoryEntry, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from InventoryEntry e where e.id = :id and e.user.id = :userId")
    Optional<InventoryEntry> findByIdAndUserIdForUpdate(@Param("id") Long id, @Param("userId") Long userId);

    @Query("""
        SELECT e FROM InventoryEntry e
        JOIN FETCH e.item
        LEFT JOIN FETCH e.sourceCase
        WHERE e.user.id = :userId
          AND e.sold = false
        ORDER BY e.createdAt DESC, e.id DESC
        """)
    List<InventoryEntry> findUnsoldByUserId(@Param("userId") Long userId);

    long countByUser_IdAndSoldFalse(Long userId);
}
