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

import com.wpanther.multisigcoordinator.dto.BroadcastProposalRequest;
import com.wpanther.multisigcoordinator.dto.BroadcastProposalResponse;
import com.wpanther.multisigcoordinator.dto.CreateProposalRequest;
import com.wpanther.multisigcoordinator.dto.CreateProposalResponse;
import com.wpanther.multisigcoordinator.dto.ProposalDetailResponse;
import com.wpanther.multisigcoordinator.dto.ProposalSummary;
import com.wpanther.multisigcoordinator.dto.SignProposalRequest;
import com.wpanther.multisigcoordinator.dto.SignProposalResponse;
import com.wpanther.multisigcoordinator.service.MultisigCoordinator;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Spend proposals and their signature collection
 */
@RestController
@RequestMapping("/api/proposals")
@RequiredArgsConstructor
@Slf4j
public class ProposalController {

    private final MultisigCoordinator coordinator;

    @PostMapping
    public ResponseEntity<CreateProposalResponse> createProposal(@Valid @RequestBody CreateProposalRequest request) {
        CreateProposalResponse response = coordinator.createProposal(request);
        return new ResponseEntity<>(response, HttpStatus.CREATED);
    }

    @GetMapping
    public ResponseEntity<List<ProposalSummary>> listProposals(
            @RequestParam(name = "pkh", required = false) String pkh,
            @RequestParam(name = "spending_condition_id", required = false) String spendingConditionId,
            @RequestParam(name = "status", required = false) String status) {
        log.debug("Listing proposals: pkh={}, spendingConditionId={}, status={}", pkh, spendingConditionId, status);
        return ResponseEntity.ok(coordinator.listProposals(pkh, spendingConditionId, status));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ProposalDetailResponse> getProposal(@PathVariable String id) {
        log.debug("Fetching proposal: {}", id);
        return ResponseEntity.ok(coordinator.getProposal(id));
    }

    @PostMapping("/{id}/sign")
    public ResponseEntity<SignProposalResponse> signProposal(
            @PathVariable String id,
            @Valid @RequestBody SignProposalRequest request) {
        return ResponseEntity.ok(coordinator.signProposal(id, request));
    }

    /**
     * Reports that the merged transaction was submitted to the network.
     * The body is optional.
     */
    @PostMapping("/{id}/broadcast")
    public ResponseEntity<BroadcastProposalResponse> markBroadcast(
            @PathVariable String id,
            @RequestBody(required = false) BroadcastProposalRequest request) {
        return ResponseEntity.ok(coordinator.markBroadcast(id, request));
    }

    @PostMapping("/{id}/confirm")
    public ResponseEntity<ProposalSummary> confirmProposal(@PathVariable String id) {
        return ResponseEntity.ok(coordinator.confirmProposal(id));
    }

    @PostMapping("/{id}/expire")
    public ResponseEntity<ProposalSummary> expireProposal(@PathVariable String id) {
        return ResponseEntity.ok(coordinator.expireProposal(id));
    }
}
