package com.giftbattle.backend.dto;

import java.math.BigDecimal;

public record CaseContentDto(ItemDto item, double weight, BigDecimal chancePercent) {}
