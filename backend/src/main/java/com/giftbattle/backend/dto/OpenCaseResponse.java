package com.giftbattle.backend.dto;

public record OpenCaseResponse(ItemDto item, Long inventoryEntryId, long balance) {}
