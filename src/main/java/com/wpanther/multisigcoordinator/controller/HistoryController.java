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

import com.wpanther.multisigcoordinator.dto.DirectSpendRequest;
import com.wpanther.multisigcoordinator.dto.DirectSpendResponse;
import com.wpanther.multisigcoordinator.dto.HistoryEntryResponse;
import com.wpanther.multisigcoordinator.service.MultisigCoordinator;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/history")
@RequiredArgsConstructor
@Slf4j
public class HistoryController {

    private final MultisigCoordinator coordinator;

    @GetMapping
    public ResponseEntity<List<HistoryEntryResponse>> listHistory(
            @RequestParam(name = "pkh", required = false) String pkh,
            @RequestParam(name = "spending_condition_id", required = false) String spendingConditionId) {
        log.debug("Listing history: pkh={}, spendingConditionId={}", pkh, spendingConditionId);
        return ResponseEntity.ok(coordinator.listHistory(pkh, spendingConditionId));
    }

    /**
     * Records a spend that did not need signature collection
     */
    @PostMapping("/direct")
    public ResponseEntity<DirectSpendResponse> directSpend(@Valid @RequestBody DirectSpendRequest request) {
        DirectSpendResponse response = coordinator.directSpend(request);
        return new ResponseEntity<>(response, HttpStatus.CREATED);
    }

    @PostMapping("/{id}/confirm")
    public ResponseEntity<HistoryEntryResponse> confirmEntry(@PathVariable String id) {
        return ResponseEntity.ok(coordinator.confirmHistory(id));
    }

    @PostMapping("/{id}/fail")
    public ResponseEntity<HistoryEntryResponse> failEntry(@PathVariable String id) {
        return ResponseEntity.ok(coordinator.failHistory(id));
    }
}
