package com.giftbattle.backend.dto;

import com.giftbattle.backend.entity.Item;
import com.giftbattle.backend.entity.Rarity;

/**
 * Point-in-time view of an item, detached from the persistence context.
 */
public record ItemDto(Long id, String name, String description, Rarity rarity, int price, String imageUrl) {

    public static ItemDto fromEntity(Item item) {
        return new ItemDto(
                item.getId(),
                item.getName(),
                item.getDescription(),
                item.getRarity(),
                item.getPrice(),
                item.getImageUrl()
        );
    }
}
