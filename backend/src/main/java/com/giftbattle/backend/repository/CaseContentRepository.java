package com.giftbattle.backend.repository;

import com.giftbattle.backend.entity.CaseContent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface CaseContentRepository extends JpaRepository<CaseContent, Long> {

    @Query("""
        SELECT cc FROM CaseContent cc
        JOIN FETCH cc.item i
        WHERE cc.lootCase.id = :caseId
          AND cc.active = true
          AND i.active = true
        ORDER BY cc.id
        """)
    List<CaseContent> findActiveByCaseId(@Param("caseId") Long caseId);

    @Query("""
        SELECT cc FROM CaseContent cc
        JOIN FETCH cc.item i
        JOIN FETCH cc.lootCase c
        WHERE c.active = true
          AND cc.active = true
          AND i.active = true
        ORDER BY c.id, cc.id
        """)
    List<CaseContent> findActiveInActiveCases();
}
