package com.giftbattle.backend.repository;

import com.giftbattle.backend.entity.LootCase;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LootCaseRepository extends JpaRepository<LootCase, Long> {

    List<LootCase> findByActiveTrueOrderByIdAsc();
}
