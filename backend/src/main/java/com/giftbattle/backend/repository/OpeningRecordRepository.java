package com.giftbattle.backend.repository;

import com.giftbattle.backend.entity.OpeningRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

public interface OpeningRecordRepository extends JpaRepository<OpeningRecord, Long> {

    @EntityGraph(attributePaths = {"lootCase", "item"})
    Page<OpeningRecord> findByUser_IdOrderByCreatedAtDescIdDesc(Long userId, Pageable pageable);

    long countByUser_Id(Long userId);
}
