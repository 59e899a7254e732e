package com.giftbattle.backend.controller;

import com.giftbattle.backend.auth.AuthPrincipal;
import com.giftbattle.backend.dto.CaseDto;
import com.giftbattle.backend.dto.OpenCaseResponse;
import com.giftbattle.backend.service.CatalogService;
import com.giftbattle.backend.service.EconomyLedgerService;
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
@RequestMapping("/api/cases")
@RequiredArgsConstructor
public class CaseController {

    private final CatalogService catalogService;
    private final EconomyLedgerService economyLedgerService;

    @GetMapping
    public ResponseEntity<List<CaseDto>> listCases() {
        return ResponseEntity.ok(catalogService.listCases());
    }

    @GetMapping("/{caseId}")
    public ResponseEntity<CaseDto> getCase(@PathVariable Long caseId) {
        return ResponseEntity.ok(catalogService.getCase(caseId));
    }

    @PostMapping("/{caseId}/open")
    public ResponseEntity<OpenCaseResponse> openCase(
            @AuthenticationPrincipal AuthPrincipal principal,
            @PathVariable Long caseId
    ) {
        return ResponseEntity.ok(economyLedgerService.openCase(principal.id(), caseId).orElseThrow());
    }
}
