package com.wpanther.multisigcoordinator.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Single-wallet view. Clients need the participants to rebuild the spending condition.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WalletDetailResponse {
    private String id;
    private String spendingConditionId;
    private int threshold;
    private int totalSigners;
    private String createdBy;
    private Instant createdAt;
    private List<String> participants;
}
