package com.giftbattle.backend.dto;

import com.giftbattle.backend.entity.OpeningRecord;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class OpeningRecordDto {
    Long id;
    Long caseId;
    String caseName;
    ItemDto item;
    int spent;
    LocalDateTime openedAt;

    public static OpeningRecordDto fromEntity(OpeningRecord record) {
        return OpeningRecordDto.builder()
                .id(record.getId())
                .caseId(record.getLootCase().getId())
                .caseName(record.getLootCase().getName())
                .item(ItemDto.fromEntity(record.getItem()))
                .spent(record.getSpent())
                .openedAt(record.getCreatedAt())
                .build();
    }
}
