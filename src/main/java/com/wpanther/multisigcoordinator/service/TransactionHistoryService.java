package com.wpanther.multisigcoordinator.service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import com.wpanther.multisigcoordinator.dto.DirectSpendRequest;
import com.wpanther.multisigcoordinator.entity.HistoryStatus;
import com.wpanther.multisigcoordinator.entity.TransactionHistory;
import com.wpanther.multisigcoordinator.exception.InvalidStateException;
import com.wpanther.multisigcoordinator.exception.NotFoundException;
import com.wpanther.multisigcoordinator.exception.NotParticipantException;
import com.wpanther.multisigcoordinator.repository.TransactionHistoryRepository;
import com.wpanther.multisigcoordinator.util.JsonColumnMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Record of finalized spends, whether they went through a proposal or not
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionHistoryService {

    private final TransactionHistoryRepository historyRepository;
    private final WalletRegistryService walletRegistryService;
    private final JsonColumnMapper jsonColumnMapper;

    @Transactional
    public TransactionHistory append(TransactionHistory entry) {
        historyRepository.save(entry);
        log.info("Appended history entry: id={}, txId={}, spendingConditionId={}, status={}",
                entry.getId(), entry.getTxId(), entry.getSpendingConditionId(), entry.getStatus());
        return entry;
    }

    /**
     * Records a spend authorized by a single participant without collecting signatures.
     * The wallet's threshold is not consulted; the client decides when this shortcut applies.
     */
    @Transactional
    public TransactionHistory directSpend(DirectSpendRequest request) {
        String spendingConditionId = request.getSpendingConditionId();
        if (!walletRegistryService.exists(spendingConditionId)) {
            throw NotFoundException.wallet(spendingConditionId);
        }
        if (!walletRegistryService.isParticipant(spendingConditionId, request.getSigner())) {
            log.warn("Rejected direct spend from non-participant: signer={}, spendingConditionId={}",
                    request.getSigner(), spendingConditionId);
            throw new NotParticipantException(request.getSigner(), spendingConditionId);
        }

        Instant now = Instant.now();
        TransactionHistory entry = TransactionHistory.builder()
                .id(UUID.randomUUID().toString())
                .txId(request.getTxId())
                .spendingConditionId(spendingConditionId)
                .initiator(request.getSigner())
                .status(HistoryStatus.BROADCAST)
                .totalInputValue(request.getTotalInputValue())
                .outputsJson(jsonColumnMapper.writeOutputs(request.getOutputs()))
                .signersJson(jsonColumnMapper.writeSigners(List.of(request.getSigner())))
                .createdAt(now)
                .broadcastAt(now)
                .build();

        return append(entry);
    }

    /**
     * Lists history newest broadcast first. The participant filter takes precedence over the wallet filter.
     */
    @Transactional(readOnly = true)
    public List<TransactionHistory> list(String participant, String spendingConditionId) {
        if (StringUtils.hasText(participant)) {
            return historyRepository.findForParticipant(participant);
        }
        if (StringUtils.hasText(spendingConditionId)) {
            return historyRepository.findBySpendingConditionIdOrderByBroadcastAtDesc(spendingConditionId);
        }
        return historyRepository.findAllByOrderByBroadcastAtDesc();
    }

    @Transactional(readOnly = true)
    public TransactionHistory get(String historyId) {
        return historyRepository.findById(historyId)
                .orElseThrow(() -> NotFoundException.history(historyId));
    }

    /**
     * Confirms the broadcast entries written for a proposal
     */
    @Transactional
    public void confirmForProposal(String proposalId, Instant confirmedAt) {
        for (TransactionHistory entry : historyRepository.findByProposalId(proposalId)) {
            if (entry.getStatus() == HistoryStatus.BROADCAST) {
                entry.setStatus(HistoryStatus.CONFIRMED);
                entry.setConfirmedAt(confirmedAt);
                historyRepository.save(entry);
            }
        }
    }

    @Transactional
    public TransactionHistory markConfirmed(String historyId) {
        TransactionHistory entry = requireBroadcast(historyId);
        entry.setStatus(HistoryStatus.CONFIRMED);
        entry.setConfirmedAt(Instant.now());
        historyRepository.save(entry);

        log.info("History entry confirmed: id={}, txId={}", historyId, entry.getTxId());
        return entry;
    }

    @Transactional
    public TransactionHistory markFailed(String historyId) {
        TransactionHistory entry = requireBroadcast(historyId);
        entry.setStatus(HistoryStatus.FAILED);
        historyRepository.save(entry);

        log.warn("History entry failed: id={}, txId={}", historyId, entry.getTxId());
        return entry;
    }

    private TransactionHistory requireBroadcast(String historyId) {
        TransactionHistory entry = get(historyId);
        if (entry.getStatus() != HistoryStatus.BROADCAST) {
            throw InvalidStateException.notBroadcast(historyId, entry.getStatus());
        }
        return entry;
    }
}
