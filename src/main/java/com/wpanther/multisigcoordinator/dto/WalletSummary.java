package com.wpanther.multisigcoordinator.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WalletSummary {
    private String id;
    private String spendingConditionId;
    private int threshold;
    private int totalSigners;
    private String createdBy;
    private Instant createdAt;
}
