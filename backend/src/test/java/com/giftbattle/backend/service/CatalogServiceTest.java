package com.giftbattle.backend.service;

import com.giftbattle.backend.dto.CaseDto;
import com.giftbattle.backend.entity.Item;
import com.giftbattle.backend.entity.LootCase;
import com.giftbattle.backend.entity.Rarity;
import com.giftbattle.backend.exception.EconomyErrorCode;
import com.giftbattle.backend.exception.EconomyException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class CatalogServiceTest {

    @Autowired
    private CatalogService catalogService;

    @Autowired
    private EconomyFixtures fixtures;

    @Test
    @DisplayName("the draw pool keeps only rows where both the content and the item are active")
    void activeContentsFiltersInactiveRows() {
        LootCase lootCase = fixtures.lootCase("Starter", 100);
        Item bear = fixtures.item("Bear", 50);
        Item rose = fixtures.item("Rose", 20);
        Item retired = fixtures.item("Retired", 500, Rarity.LEGENDARY, false);
        Item hidden = fixtures.item("Hidden", 80);
        fixtures.content(lootCase, bear, 1.0);
        fixtures.content(lootCase, rose, 3.0);
        fixtures.content(lootCase, retired, 1.0);
        fixtures.inactiveContent(lootCase, hidden, 1.0);

        List<DrawCandidate> pool = catalogService.activeContents(lootCase.getId());

        assertThat(pool).extracting(candidate -> candidate.item().name()).containsExactly("Bear", "Rose");
        assertThat(pool).extracting(DrawCandidate::weight).containsExactly(1.0, 3.0);
    }

    @Test
    @DisplayName("rows with a non-positive weight never reach the selector")
    void activeContentsDropsUnusableWeights() {
        LootCase lootCase = fixtures.lootCase("Broken", 100);
        fixtures.content(lootCase, fixtures.item("Zero", 10), 0.0);
        fixtures.content(lootCase, fixtures.item("Negative", 10), -2.0);
        fixtures.content(lootCase, fixtures.item("Fine", 10), 0.5);

        assertThat(catalogService.activeContents(lootCase.getId()))
                .extracting(candidate -> candidate.item().name())
                .containsExactly("Fine");
    }

    @Test
    @DisplayName("a case without eligible contents yields an empty pool")
    void emptyPoolIsNotAnError() {
        LootCase lootCase = fixtures.lootCase("Empty", 100);

        assertThat(catalogService.activeContents(lootCase.getId())).isEmpty();
        assertThat(catalogService.activeContents(-1L)).isEmpty();
    }

    @Test
    @DisplayName("listing shows active cases with the display chance of each item")
    void listCasesShowsChances() {
        LootCase starter = fixtures.lootCase("Starter", 100);
        LootCase archived = fixtures.lootCase("Archived", 100, false);
        LootCase empty = fixtures.lootCase("Empty", 10);
        fixtures.content(starter, fixtures.item("Bear", 50), 1.0);
        fixtures.content(starter, fixtures.item("Rose", 20), 3.0);
        fixtures.content(archived, fixtures.item("Old", 20), 1.0);

        List<CaseDto> cases = catalogService.listCases();

        assertThat(cases).extracting(CaseDto::getId).contains(starter.getId(), empty.getId()).doesNotContain(archived.getId());
        CaseDto listed = cases.stream().filter(c -> c.getId().equals(starter.getId())).findFirst().orElseThrow();
        assertThat(listed.getPrice()).isEqualTo(100);
        assertThat(listed.getContents()).extracting(content -> content.chancePercent())
                .containsExactly(new BigDecimal("25.00"), new BigDecimal("75.00"));
        CaseDto listedEmpty = cases.stream().filter(c -> c.getId().equals(empty.getId())).findFirst().orElseThrow();
        assertThat(listedEmpty.getContents()).isEmpty();
    }

    @Test
    @DisplayName("a pool whose weights sum past the double range is treated as empty")
    void overflowingPoolIsEmpty() {
        LootCase lootCase = fixtures.lootCase("Overflow", 100);
        fixtures.content(lootCase, fixtures.item("Huge", 10), Double.MAX_VALUE);
        fixtures.content(lootCase, fixtures.item("Huger", 10), Double.MAX_VALUE);

        assertThat(catalogService.activeContents(lootCase.getId())).isEmpty();
        CaseDto listed = catalogService.listCases().stream()
                .filter(c -> c.getId().equals(lootCase.getId()))
                .findFirst()
                .orElseThrow();
        assertThat(listed.getContents()).isEmpty();
        assertThat(catalogService.getCase(lootCase.getId()).getContents()).isEmpty();
    }

    @Test
    @DisplayName("an inactive or unknown case cannot be looked up")
    void getCaseRejectsInactiveCase() {
        LootCase archived = fixtures.lootCase("Archived", 100, false);

        assertThatThrownBy(() -> catalogService.getCase(archived.getId()))
                .isInstanceOf(EconomyException.class)
                .extracting(ex -> ((EconomyException) ex).getCode())
                .isEqualTo(EconomyErrorCode.CASE_NOT_FOUND);
        assertThatThrownBy(() -> catalogService.getCase(Long.MAX_VALUE))
                .isInstanceOf(EconomyException.class);
    }
}
