package com.wpanther.multisigcoordinator.dto;

import java.time.Instant;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO containing counts of wallets, proposals and finalized spends
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoordinatorMetricsResponse {

    private long wallets;

    // Proposals keyed by status value
    private Map<String, Long> proposalsByStatus;

    // History entries keyed by status value
    private Map<String, Long> historyByStatus;

    private long directSpends;

    // Proposals created in the last 24 hours
    private long proposalsLast24Hours;

    // Timestamp when metrics were calculated
    private Instant timestamp;
}
