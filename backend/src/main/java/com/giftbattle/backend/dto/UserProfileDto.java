package com.giftbattle.backend.dto;

import com.giftbattle.backend.entity.User;

import java.time.LocalDateTime;

public record UserProfileDto(
        Long id,
        Long telegramId,
        String username,
        String firstName,
        String lastName,
        long balance,
        long totalSpent,
        int casesOpened,
        long inventorySize,
        LocalDateTime createdAt
) {

    public static UserProfileDto fromEntity(User user, long inventorySize) {
        return new UserProfileDto(
                user.getId(),
                user.getTelegramId(),
                user.getUsername(),
                user.getFirstName(),
                user.getLastName(),
                user.getBalance(),
                user.getTotalSpent(),
                user.getCasesOpened(),
                inventorySize,
                user.getCreatedAt()
        );
    }
}
