package com.giftbattle.backend.dto;

public record SellItemResponse(Long inventoryEntryId, int proceeds, long balance) {}
