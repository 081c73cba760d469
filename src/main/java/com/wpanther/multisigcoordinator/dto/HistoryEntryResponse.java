package com.wpanther.multisigcoordinator.dto;

import com.wpanther.multisigcoordinator.entity.HistoryStatus;
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
public class HistoryEntryResponse {
    private String id;
    private String txId;
    private String spendingConditionId;
    private String initiator;
    private HistoryStatus status;
    private long totalInputValue;
    private List<OutputSummary> outputs;
    private List<String> signers;
    private String proposalId;
    private Instant createdAt;
    private Instant broadcastAt;
    private Instant confirmedAt;
}
