package com.wpanther.multisigcoordinator.dto;

import com.wpanther.multisigcoordinator.entity.ProposalStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Full proposal view including the opaque payloads clients need to produce
 * their own signature, every collected signature and the wallet's participants
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProposalDetailResponse {
    private String id;
    private String txId;
    private String spendingConditionId;
    private String proposer;
    private ProposalStatus status;
    private int threshold;
    private int signaturesCollected;
    private String unsignedPayload;
    private String signingContext;
    private String spendConditions;
    private long totalInputValue;
    private List<OutputSummary> outputs;
    private List<String> signers;
    private List<SignatureEntry> signatures;
    private List<String> participants;
    private Instant createdAt;
    private Instant updatedAt;
}
