package com.giftbattle.backend.controller;

import com.giftbattle.backend.auth.AuthPrincipal;
import com.giftbattle.backend.auth.TelegramAuthService;
import com.giftbattle.backend.config.InitDataAuthenticationEntryPoint;
import com.giftbattle.backend.config.SecurityConfig;
import com.giftbattle.backend.dto.InventoryEntryDto;
import com.giftbattle.backend.dto.ItemDto;
import com.giftbattle.backend.dto.SellItemResponse;
import com.giftbattle.backend.entity.Rarity;
import com.giftbattle.backend.exception.EconomyErrorCode;
import com.giftbattle.backend.service.EconomyLedgerService;
import com.giftbattle.backend.service.InventoryService;
import com.giftbattle.backend.service.LedgerResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(InventoryController.class)
@Import({SecurityConfig.class, InitDataAuthenticationEntryPoint.class})
class InventoryControllerTest {

    private static final String SIGNED = "tma signed-init-data";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TelegramAuthService telegramAuthService;

    @MockBean
    private InventoryService inventoryService;

    @MockBean
    private EconomyLedgerService economyLedgerService;

    @BeforeEach
    void setUp() {
        when(telegramAuthService.authenticate("signed-init-data")).thenReturn(Optional.of(
                new AuthPrincipal(7L, 42L, "alice", List.of(new SimpleGrantedAuthority("ROLE_USER")))));
    }

    @Test
    @DisplayName("the inventory lists unsold entries with their buy-back quote")
    void listInventory() throws Exception {
        ItemDto bear = new ItemDto(11L, "Bear", null, Rarity.RARE, 100, null);
        InventoryEntryDto entry = InventoryEntryDto.builder()
                .id(501L)
                .item(bear)
                .sourceCaseId(3L)
                .sellPrice(70)
                .acquiredAt(LocalDateTime.of(2024, 9, 17, 12, 30, 15))
                .build();
        when(inventoryService.listInventory(7L)).thenReturn(List.of(entry));

        mockMvc.perform(get("/api/inventory").header("Authorization", SIGNED))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(501))
                .andExpect(jsonPath("$[0].source_case_id").value(3))
                .andExpect(jsonPath("$[0].sell_price").value(70))
                .andExpect(jsonPath("$[0].acquired_at").value("2024-09-17T12:30:15"));
    }

    @Test
    @DisplayName("the inventory is private")
    void listInventoryRequiresAuthentication() throws Exception {
        mockMvc.perform(get("/api/inventory"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("selling reports proceeds and the new balance")
    void sellItem() throws Exception {
        when(economyLedgerService.sellItem(7L, 501L))
                .thenReturn(LedgerResult.success(new SellItemResponse(501L, 70, 970L)));

        mockMvc.perform(post("/api/inventory/501/sell").header("Authorization", SIGNED))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.inventory_entry_id").value(501))
                .andExpect(jsonPath("$.proceeds").value(70))
                .andExpect(jsonPath("$.balance").value(970));
    }

    @Test
    @DisplayName("selling an entry that is gone, sold or foreign answers 404")
    void sellMissingEntry() throws Exception {
        when(economyLedgerService.sellItem(7L, 502L))
                .thenReturn(LedgerResult.failure(EconomyErrorCode.INVENTORY_ENTRY_NOT_FOUND, "Inventory entry not found: 502"));

        mockMvc.perform(post("/api/inventory/502/sell").header("Authorization", SIGNED))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("INVENTORY_ENTRY_NOT_FOUND"));
    }
}
