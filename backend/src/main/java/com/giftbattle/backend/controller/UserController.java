package com.giftbattle.backend.controller;

import com.giftbattle.backend.auth.AuthPrincipal;
import com.giftbattle.backend.dto.OpeningRecordDto;
import com.giftbattle.backend.dto.PageResponse;
import com.giftbattle.backend.dto.UserProfileDto;
import com.giftbattle.backend.service.InventoryService;
import com.giftbattle.backend.service.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;
    private final InventoryService inventoryService;

    @GetMapping("/me")
    public ResponseEntity<UserProfileDto> getMyProfile(@AuthenticationPrincipal AuthPrincipal principal) {
        return ResponseEntity.ok(userService.getProfile(principal.id()));
    }

    @GetMapping("/me/openings")
    public ResponseEntity<PageResponse<OpeningRecordDto>> getMyOpenings(
            @AuthenticationPrincipal AuthPrincipal principal,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "10") int size
    ) {
        Page<OpeningRecordDto> openings = inventoryService.getOpeningHistory(
                principal.id(),
                PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), 50))
        );
        return ResponseEntity.ok(PageResponse.of(openings));
    }
}
