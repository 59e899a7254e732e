package com.giftbattle.backend.service;

import com.giftbattle.backend.auth.TelegramIdentity;
import com.giftbattle.backend.dto.UserProfileDto;
import com.giftbattle.backend.entity.User;
import com.giftbattle.backend.exception.EconomyErrorCode;
import com.giftbattle.backend.exception.EconomyException;
import com.giftbattle.backend.repository.InventoryEntryRepository;
import com.giftbattle.backend.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final InventoryEntryRepository inventoryEntryRepository;
    private final long startingBalance;

    public UserService(UserRepository userRepository,
                       InventoryEntryRepository inventoryEntryRepository,
                       @Value("${economy.starting-balance:1000}") long startingBalance) {
        if (startingBalance < 0) {
            throw new IllegalArgumentException("economy.starting-balance must not be negative");
        }
        this.userRepository = userRepository;
        this.inventoryEntryRepository = inventoryEntryRepository;
        this.startingBalance = startingBalance;
    }

    /**
     * Finds the user for a Telegram identity, creating it with the starting balance on first contact.
     * Runs outside a surrounding transaction so that a lost insert race can re-read the winner's row.
     */
    public User getOrCreate(TelegramIdentity identity) {
        return userRepository.findByTelegramId(identity.id())
                .orElseGet(() -> create(identity));
    }

    @Transactional(readOnly = true)
    public UserProfileDto getProfile(Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new EconomyException(EconomyErrorCode.USER_NOT_FOUND, "User not found: " + userId));
        return UserProfileDto.fromEntity(user, inventoryEntryRepository.countByUser_IdAndSoldFalse(userId));
    }

    private User create(TelegramIdentity identity) {
        User user = User.builder()
                .telegramId(identity.id())
                .username(identity.username())
                .firstName(identity.firstName())
                .lastName(identity.lastName())
                .balance(startingBalance)
                .build();
        try {
            User saved = userRepository.saveAndFlush(user);
            log.info("[USER] created user {} for telegram id {}", saved.getId(), identity.id());
            return saved;
        } catch (DataIntegrityViolationException ex) {
            return userRepository.findByTelegramId(identity.id())
                    .orElseThrow(() -> ex);
        }
    }
}
