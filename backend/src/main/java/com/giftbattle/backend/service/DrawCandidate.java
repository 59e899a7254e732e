package com.giftbattle.backend.service;

import com.giftbattle.backend.dto.ItemDto;

public record DrawCandidate(ItemDto item, double weight) {}
