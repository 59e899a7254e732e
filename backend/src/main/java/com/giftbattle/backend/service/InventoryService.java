package com.giftbattle.backend.service;

import com.giftbattle.backend.dto.InventoryEntryDto;
import com.giftbattle.backend.dto.OpeningRecordDto;
import com.giftbattle.backend.repository.InventoryEntryRepository;
import com.giftbattle.backend.repository.OpeningRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class InventoryService {

    private final InventoryEntryRepository inventoryEntryRepository;
    private final OpeningRecordRepository openingRecordRepository;
    private final EconomyLedgerService economyLedgerService;

    @Transactional(readOnly = true)
    public List<InventoryEntryDto> listInventory(Long userId) {
        return inventoryEntryRepository.findUnsoldByUserId(userId).stream()
                .map(entry -> InventoryEntryDto.fromEntity(entry, economyLedgerService.quoteSellPrice(entry.getItem().getPrice())))
                .toList();
    }

    @Transactional(readOnly = true)
    public Page<OpeningRecordDto> getOpeningHistory(Long userId, Pageable pageable) {
        return openingRecordRepository.findByUser_IdOrderByCreatedAtDescIdDesc(userId, pageable)
                .map(OpeningRecordDto::fromEntity);
    }
}
