package com.giftbattle.backend.controller;

import com.giftbattle.backend.auth.AuthPrincipal;
import com.giftbattle.backend.dto.InventoryEntryDto;
import com.giftbattle.backend.dto.SellItemResponse;
import com.giftbattle.backend.service.EconomyLedgerService;
import com.giftbattle.backend.service.InventoryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/inventory")
@RequiredArgsConstructor
public class InventoryController {

    private final InventoryService inventoryService;
    private final EconomyLedgerService economyLedgerService;

    @GetMapping
    public ResponseEntity<List<InventoryEntryDto>> listInventory(@AuthenticationPrincipal AuthPrincipal principal) {
        return ResponseEntity.ok(inventoryService.listInventory(principal.id()));
    }

    @PostMapping("/{entryId}/sell")
    public ResponseEntity<SellItemResponse> sellItem(
            @AuthenticationPrincipal AuthPrincipal principal,
            @PathVariable Long entryId
    ) {
        return ResponseEntity.ok(economyLedgerService.sellItem(principal.id(), entryId).orElseThrow());
    }
}
