package com.wpanther.multisigcoordinator.dto;

import com.wpanther.multisigcoordinator.entity.ProposalStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProposalSummary {
    private String id;
    private String txId;
    private String spendingConditionId;
    private String proposer;
    private ProposalStatus status;
    private int threshold;
    private int signaturesCollected;
    private long totalInputValue;
    private List<OutputSummary> outputs;
    private List<String> signers;
    private Instant createdAt;
    private Instant updatedAt;
}
