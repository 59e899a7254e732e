package com.giftbattle.backend.service;

import com.giftbattle.backend.dto.CaseContentDto;
import com.giftbattle.backend.dto.CaseDto;
import com.giftbattle.backend.dto.ItemDto;
import com.giftbattle.backend.entity.CaseContent;
import com.giftbattle.backend.entity.LootCase;
import com.giftbattle.backend.exception.EconomyErrorCode;
import com.giftbattle.backend.exception.EconomyException;
import com.giftbattle.backend.repository.CaseContentRepository;
import com.giftbattle.backend.repository.LootCaseRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only access to cases and their draw pools.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final LootCaseRepository lootCaseRepository;
    private final CaseContentRepository caseContentRepository;

    /**
     * Returns the draw pool of a case: contents whose row and item are both active.
     * An empty list means the case cannot be opened, including when the weights overflow a double.
     */
    @Transactional(readOnly = true)
    public List<DrawCandidate> activeContents(Long caseId) {
        List<DrawCandidate> pool = caseContentRepository.findActiveByCaseId(caseId).stream()
                .filter(this::hasUsableWeight)
                .map(content -> new DrawCandidate(ItemDto.fromEntity(content.getItem()), content.getWeight()))
                .toList();
        return drawable(caseId, pool);
    }

    @Transactional(readOnly = true)
    public List<CaseDto> listCases() {
        Map<Long, List<DrawCandidate>> poolsByCase = caseContentRepository.findActiveInActiveCases().stream()
                .filter(this::hasUsableWeight)
                .collect(Collectors.groupingBy(
                        content -> content.getLootCase().getId(),
                        LinkedHashMap::new,
                        Collectors.mapping(
                                content -> new DrawCandidate(ItemDto.fromEntity(content.getItem()), content.getWeight()),
                                Collectors.toList())));

        return lootCaseRepository.findByActiveTrueOrderByIdAsc().stream()
                .map(lootCase -> toDto(lootCase, drawable(lootCase.getId(), poolsByCase.getOrDefault(lootCase.getId(), List.of()))))
                .toList();
    }

    @Transactional(readOnly = true)
    public CaseDto getCase(Long caseId) {
        LootCase lootCase = lootCaseRepository.findById(caseId)
                .filter(LootCase::isActive)
                .orElseThrow(() -> new EconomyException(EconomyErrorCode.CASE_NOT_FOUND, "Case not found: " + caseId));
        return toDto(lootCase, activeContents(caseId));
    }

    private boolean hasUsableWeight(CaseContent content) {
        double weight = content.getWeight();
        if (weight > 0 && !Double.isInfinite(weight)) {
            return true;
        }
        log.warn("[CATALOG] skipping case content {} with weight {}", content.getId(), weight);
        return false;
    }

    private List<DrawCandidate> drawable(Long caseId, List<DrawCandidate> pool) {
        double total = pool.stream().mapToDouble(DrawCandidate::weight).sum();
        if (Double.isFinite(total)) {
            return pool;
        }
        log.warn("[CATALOG] case {} has a total weight of {}; treating its pool as empty", caseId, total);
        return List.of();
    }

    private CaseDto toDto(LootCase lootCase, List<DrawCandidate> pool) {
        double total = pool.stream().mapToDouble(DrawCandidate::weight).sum();
        List<CaseContentDto> contents = pool.stream()
                .map(candidate -> new CaseContentDto(candidate.item(), candidate.weight(), chancePercent(candidate.weight(), total)))
                .toList();
        return CaseDto.builder()
                .id(lootCase.getId())
                .name(lootCase.getName())
                .description(lootCase.getDescription())
                .price(lootCase.getPrice())
                .imageUrl(lootCase.getImageUrl())
                .contents(contents)
                .build();
    }

    private BigDecimal chancePercent(double weight, double total) {
        return BigDecimal.valueOf(weight)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
    }
}
