package com.giftbattle.backend.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CaseDto {
    Long id;
    String name;
    String description;
    int price;
    String imageUrl;
    List<CaseContentDto> contents;
}
