package com.giftbattle.backend.service;

import com.giftbattle.backend.dto.OpenCaseResponse;
import com.giftbattle.backend.dto.SellItemResponse;
import com.giftbattle.backend.entity.InventoryEntry;
import com.giftbattle.backend.entity.Item;
import com.giftbattle.backend.entity.LootCase;
import com.giftbattle.backend.entity.OpeningRecord;
import com.giftbattle.backend.entity.User;
import com.giftbattle.backend.exception.EconomyErrorCode;
import com.giftbattle.backend.repository.InventoryEntryRepository;
import com.giftbattle.backend.repository.ItemRepository;
import com.giftbattle.backend.repository.LootCaseRepository;
import com.giftbattle.backend.repository.OpeningRecordRepository;
import com.giftbattle.backend.repository.UserRepository;
import com.giftbattle.backend.service.loot.WeightedSelector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * Sole writer of balances, inventory entries and the opening history.
 * Each operation holds a row lock on the acting user until it commits, so mutations of one
 * user's balance are serialized while different users proceed independently.
 */
@Service
@Slf4j
public class EconomyLedgerService {

    private final UserRepository userRepository;
    private final LootCaseRepository lootCaseRepository;
    private final ItemRepository itemRepository;
    private final InventoryEntryRepository inventoryEntryRepository;
    private final OpeningRecordRepository openingRecordRepository;
    private final CatalogService catalogService;
    private final WeightedSelector weightedSelector;
    private final BigDecimal sellRatio;

    public EconomyLedgerService(UserRepository userRepository,
                                LootCaseRepository lootCaseRepository,
                                ItemRepository itemRepository,
                                InventoryEntryRepository inventoryEntryRepository,
                                OpeningRecordRepository openingRecordRepository,
                                CatalogService catalogService,
                                WeightedSelector weightedSelector,
                                @Value("${economy.sell-ratio:0.7}") BigDecimal sellRatio) {
        if (sellRatio.signum() < 0 || sellRatio.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("economy.sell-ratio must be between 0 and 1, got " + sellRatio);
        }
        this.userRepository = userRepository;
        this.lootCaseRepository = lootCaseRepository;
        this.itemRepository = itemRepository;
        this.inventoryEntryRepository = inventoryEntryRepository;
        this.openingRecordRepository = openingRecordRepository;
        this.catalogService = catalogService;
        this.weightedSelector = weightedSelector;
        this.sellRatio = sellRatio;
    }

    @Transactional
    public LedgerResult<OpenCaseResponse> openCase(Long userId, Long caseId) {
        Optional<User> lockedUser = userRepository.findByIdForUpdate(userId);
        if (lockedUser.isEmpty()) {
            return LedgerResult.failure(EconomyErrorCode.USER_NOT_FOUND, "User not found: " + userId);
        }
        User user = lockedUser.get();

        Optional<LootCase> foundCase = lootCaseRepository.findById(caseId);
        if (foundCase.isEmpty()) {
            return LedgerResult.failure(EconomyErrorCode.CASE_NOT_FOUND, "Case not found: " + caseId);
        }
        LootCase lootCase = foundCase.get();
        if (!lootCase.isActive()) {
            return LedgerResult.failure(EconomyErrorCode.CASE_INACTIVE, "Case is not available: " + caseId);
        }

        List<DrawCandidate> pool = catalogService.activeContents(caseId);
        if (pool.isEmpty()) {
            log.warn("[LEDGER] case {} has no eligible contents", caseId);
            return LedgerResult.failure(EconomyErrorCode.EMPTY_POOL, "Case has nothing to draw: " + caseId);
        }

        int price = lootCase.getPrice();
        if (user.getBalance() < price) {
            log.info("[LEDGER] user {} cannot afford case {} (balance={}, price={})", userId, caseId, user.getBalance(), price);
            return LedgerResult.failure(EconomyErrorCode.INSUFFICIENT_FUNDS, "Not enough stars to open this case");
        }

        DrawCandidate drawn = weightedSelector.select(pool, DrawCandidate::weight);
        Item item = itemRepository.getReferenceById(drawn.item().id());

        user.chargeOpening(price);
        userRepository.saveAndFlush(user);
        InventoryEntry entry = inventoryEntryRepository.save(new InventoryEntry(user, item, lootCase));
        openingRecordRepository.save(new OpeningRecord(user, lootCase, item, price));

        log.info("[LEDGER] user {} opened case {} for {} and drew item {} (balance={})",
                userId, caseId, price, item.getId(), user.getBalance());
        return LedgerResult.success(new OpenCaseResponse(drawn.item(), entry.getId(), user.getBalance()));
    }

    @Transactional
    public LedgerResult<SellItemResponse> sellItem(Long userId, Long inventoryEntryId) {
        // user first, then entry: the same order openCase would take
        Optional<User> lockedUser = userRepository.findByIdForUpdate(userId);
        if (lockedUser.isEmpty()) {
            return LedgerResult.failure(EconomyErrorCode.USER_NOT_FOUND, "User not found: " + userId);
        }
        User user = lockedUser.get();

        Optional<InventoryEntry> lockedEntry = inventoryEntryRepository.findByIdAndUserIdForUpdate(inventoryEntryId, userId)
                .filter(entry -> !entry.isSold());
        if (lockedEntry.isEmpty()) {
            return LedgerResult.failure(EconomyErrorCode.INVENTORY_ENTRY_NOT_FOUND,
                    "No unsold inventory entry " + inventoryEntryId + " for this user");
        }
        InventoryEntry entry = lockedEntry.get();

        int proceeds = quoteSellPrice(entry.getItem().getPrice());
        entry.markSold(proceeds);
        user.credit(proceeds);
        inventoryEntryRepository.save(entry);
        userRepository.save(user);

        log.info("[LEDGER] user {} sold inventory entry {} for {} (balance={})",
                userId, inventoryEntryId, proceeds, user.getBalance());
        return LedgerResult.success(new SellItemResponse(inventoryEntryId, proceeds, user.getBalance()));
    }

    /**
     * Buy-back price of an item: {@code floor(price * sellRatio)}, computed exactly.
     */
    public int quoteSellPrice(int itemPrice) {
        return BigDecimal.valueOf(itemPrice)
                .multiply(sellRatio)
                .setScale(0, RoundingMode.FLOOR)
                .intValueExact();
    }
}
