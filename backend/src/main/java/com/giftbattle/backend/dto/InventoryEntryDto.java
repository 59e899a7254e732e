package com.giftbattle.backend.dto;

import com.giftbattle.backend.entity.InventoryEntry;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class InventoryEntryDto {
    Long id;
    ItemDto item;
    Long sourceCaseId;
    int sellPrice;
    LocalDateTime acquiredAt;

    public static InventoryEntryDto fromEntity(InventoryEntry entry, int sellPrice) {
        return InventoryEntryDto.builder()
                .id(entry.getId())
                .item(ItemDto.fromEntity(entry.getItem()))
                .sourceCaseId(entry.getSourceCase() != null ? entry.getSourceCase().getId() : null)
                .sellPrice(sellPrice)
                .acquiredAt(entry.getCreatedAt())
                .build();
    }
}
