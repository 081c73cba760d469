package com.wpanther.multisigcoordinator.controller;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.wpanther.multisigcoordinator.dto.RegisterWalletRequest;
import com.wpanther.multisigcoordinator.dto.RegisterWalletResponse;
import com.wpanther.multisigcoordinator.dto.WalletDetailResponse;
import com.wpanther.multisigcoordinator.dto.WalletSummary;
import com.wpanther.multisigcoordinator.service.MultisigCoordinator;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/wallets")
@RequiredArgsConstructor
@Slf4j
public class WalletController {

    private final MultisigCoordinator coordinator;

    @PostMapping
    public ResponseEntity<RegisterWalletResponse> registerWallet(@Valid @RequestBody RegisterWalletRequest request) {
        RegisterWalletResponse response = coordinator.registerWallet(request);
        return new ResponseEntity<>(response, HttpStatus.CREATED);
    }

    /**
     * Lists every wallet, or only the wallets the given PKH participates in
     */
    @GetMapping
    public ResponseEntity<List<WalletSummary>> listWallets(@RequestParam(name = "pkh", required = false) String pkh) {
        log.debug("Listing wallets: pkh={}", pkh);
        return ResponseEntity.ok(coordinator.listWallets(pkh));
    }

    @GetMapping("/{spendingConditionId}")
    public ResponseEntity<WalletDetailResponse> getWallet(@PathVariable String spendingConditionId) {
        log.debug("Fetching wallet: {}", spendingConditionId);
        return ResponseEntity.ok(coordinator.getWallet(spendingConditionId));
    }
}
