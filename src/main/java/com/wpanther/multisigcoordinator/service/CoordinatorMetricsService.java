package com.wpanther.multisigcoordinator.service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.wpanther.multisigcoordinator.dto.CoordinatorMetricsResponse;
import com.wpanther.multisigcoordinator.entity.HistoryStatus;
import com.wpanther.multisigcoordinator.entity.ProposalStatus;
import com.wpanther.multisigcoordinator.repository.ProposalRepository;
import com.wpanther.multisigcoordinator.repository.TransactionHistoryRepository;
import com.wpanther.multisigcoordinator.repository.WalletRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Service for calculating coordinator-wide counts
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CoordinatorMetricsService {

    private final WalletRepository walletRepository;
    private final ProposalRepository proposalRepository;
    private final TransactionHistoryRepository historyRepository;

    @Transactional(readOnly = true)
    public CoordinatorMetricsResponse calculateMetrics() {
        log.debug("Calculating coordinator metrics");

        Instant now = Instant.now();
        Instant oneDayAgo = now.minus(24, ChronoUnit.HOURS);

        return CoordinatorMetricsResponse.builder()
                .wallets(walletRepository.count())
                .proposalsByStatus(countProposalsByStatus())
                .historyByStatus(countHistoryByStatus())
                .directSpends(historyRepository.countByProposalIdIsNull())
                .proposalsLast24Hours(proposalRepository.countByCreatedAtAfter(oneDayAgo))
                .timestamp(now)
                .build();
    }

    private Map<String, Long> countProposalsByStatus() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (ProposalStatus status : ProposalStatus.values()) {
            counts.put(status.getValue(), proposalRepository.countByStatus(status));
        }
        return counts;
    }

    private Map<String, Long> countHistoryByStatus() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (HistoryStatus status : HistoryStatus.values()) {
            counts.put(status.getValue(), historyRepository.countByStatus(status));
        }
        return counts;
    }
}
