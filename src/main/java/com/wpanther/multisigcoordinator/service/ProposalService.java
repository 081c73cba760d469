package com.wpanther.multisigcoordinator.service;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import com.wpanther.multisigcoordinator.dto.CreateProposalRequest;
import com.wpanther.multisigcoordinator.entity.HistoryStatus;
import com.wpanther.multisigcoordinator.entity.Proposal;
import com.wpanther.multisigcoordinator.entity.ProposalStatus;
import com.wpanther.multisigcoordinator.entity.TransactionHistory;
import com.wpanther.multisigcoordinator.entity.Wallet;
import com.wpanther.multisigcoordinator.exception.ConflictException;
import com.wpanther.multisigcoordinator.exception.InvalidInputException;
import com.wpanther.multisigcoordinator.exception.InvalidStateException;
import com.wpanther.multisigcoordinator.exception.NotFoundException;
import com.wpanther.multisigcoordinator.exception.NotParticipantException;
import com.wpanther.multisigcoordinator.repository.ProposalRepository;
import com.wpanther.multisigcoordinator.util.JsonColumnMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the proposal lifecycle.
 *
 * <p>Every transition loads the proposal with a row write lock, so signature
 * counting and the pending to ready decision are serialized per proposal.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProposalService {

    private static final EnumSet<ProposalStatus> EXPIRABLE_WHEN_STALE =
            EnumSet.of(ProposalStatus.PENDING, ProposalStatus.READY);

    private final ProposalRepository proposalRepository;
    private final WalletRegistryService walletRegistryService;
    private final SignatureLedgerService signatureLedgerService;
    private final TransactionHistoryService transactionHistoryService;
    private final JsonColumnMapper jsonColumnMapper;
    private final TransactionTemplate transactionTemplate;

    @Value("${app.proposals.require-proposer-participant:true}")
    private boolean requireProposerParticipant;

    /**
     * Creates a proposal and records the proposer's own signature in one transaction.
     * A 1-of-n proposal is ready as soon as it is created.
     */
    @Transactional
    public Proposal create(CreateProposalRequest request) {
        String txId = request.getTxId();
        if (proposalRepository.existsByTxId(txId)) {
            log.warn("Rejected proposal with existing txId: {}", txId);
            throw ConflictException.txIdExists(txId);
        }

        Wallet wallet = walletRegistryService.get(request.getSpendingConditionId());

        if (requireProposerParticipant && !wallet.getParticipants().contains(request.getProposer())) {
            log.warn("Rejected proposal from non-participant: proposer={}, spendingConditionId={}",
                    request.getProposer(), wallet.getSpendingConditionId());
            throw new NotParticipantException(request.getProposer(), wallet.getSpendingConditionId());
        }
        if (request.getThreshold() != null && request.getThreshold() != wallet.getThreshold()) {
            throw InvalidInputException.thresholdMismatch(request.getThreshold(), wallet.getThreshold());
        }

        Instant now = Instant.now();
        Proposal proposal = Proposal.builder()
                .id(UUID.randomUUID().toString())
                .txId(txId)
                .spendingConditionId(wallet.getSpendingConditionId())
                .proposer(request.getProposer())
                .status(ProposalStatus.PENDING)
                .threshold(wallet.getThreshold())
                .unsignedPayload(request.getUnsignedPayload())
                .signingContext(request.getSigningContext())
                .spendConditions(request.getSpendConditions())
                .totalInputValue(request.getTotalInputValue())
                .outputsJson(jsonColumnMapper.writeOutputs(request.getOutputs()))
                .createdAt(now)
                .updatedAt(now)
                .build();

        try {
            proposalRepository.saveAndFlush(proposal);
        } catch (DataIntegrityViolationException e) {
            log.warn("Lost concurrent proposal creation: txId={}", txId);
            throw ConflictException.txIdExists(txId, e);
        }

        long count = signatureLedgerService.record(
                proposal, request.getProposer(), request.getProposerSignedPayload(), now);
        promoteIfThresholdReached(proposal, count, now);
        proposalRepository.save(proposal);

        log.info("Created proposal: id={}, txId={}, spendingConditionId={}, threshold={}, status={}",
                proposal.getId(), txId, proposal.getSpendingConditionId(), proposal.getThreshold(),
                proposal.getStatus());
        return proposal;
    }

    /**
     * Adds a participant's signature. Checks, in order: the proposal exists,
     * it is still pending, the signer participates in its wallet and has not
     * signed yet.
     */
    @Transactional
    public SignOutcome sign(String proposalId, String signer, String signedPayload) {
        Proposal proposal = lockProposal(proposalId);

        if (proposal.getStatus() != ProposalStatus.PENDING) {
            log.warn("Rejected signature on non-pending proposal: id={}, status={}, signer={}",
                    proposalId, proposal.getStatus(), signer);
            throw InvalidStateException.notPending(proposalId, proposal.getStatus());
        }
        if (!walletRegistryService.isParticipant(proposal.getSpendingConditionId(), signer)) {
            log.warn("Rejected signature from non-participant: id={}, signer={}", proposalId, signer);
            throw new NotParticipantException(signer, proposal.getSpendingConditionId());
        }

        Instant now = Instant.now();
        long count = signatureLedgerService.record(proposal, signer, signedPayload, now);
        boolean becameReady = promoteIfThresholdReached(proposal, count, now);
        proposalRepository.save(proposal);

        log.info("Accepted signature: id={}, signer={}, count={}/{}, ready={}",
                proposalId, signer, count, proposal.getThreshold(), becameReady);
        return new SignOutcome(count, becameReady);
    }

    /**
     * Moves a ready proposal to broadcast and appends its history entry.
     *
     * @param finalTxId transaction id after signature merging; blank means the proposal's own tx id
     */
    @Transactional
    public TransactionHistory markBroadcast(String proposalId, String finalTxId) {
        Proposal proposal = lockProposal(proposalId);

        if (proposal.getStatus() != ProposalStatus.READY) {
            log.warn("Rejected broadcast of proposal: id={}, status={}", proposalId, proposal.getStatus());
            throw InvalidStateException.notReady(proposalId, proposal.getStatus());
        }

        Instant now = Instant.now();
        List<String> signers = signatureLedgerService.signersFor(proposalId);
        String txId = StringUtils.hasText(finalTxId) ? finalTxId : proposal.getTxId();

        TransactionHistory entry = TransactionHistory.builder()
                .id(UUID.randomUUID().toString())
                .txId(txId)
                .spendingConditionId(proposal.getSpendingConditionId())
                .initiator(proposal.getProposer())
                .status(HistoryStatus.BROADCAST)
                .totalInputValue(proposal.getTotalInputValue())
                .outputsJson(proposal.getOutputsJson())
                .signersJson(jsonColumnMapper.writeSigners(signers))
                .proposalId(proposalId)
                .createdAt(proposal.getCreatedAt())
                .broadcastAt(now)
                .build();
        transactionHistoryService.append(entry);

        proposal.setStatus(ProposalStatus.BROADCAST);
        proposal.setUpdatedAt(now);
        proposalRepository.save(proposal);

        log.info("Proposal broadcast: id={}, txId={}, historyId={}, signers={}",
                proposalId, txId, entry.getId(), signers.size());
        return entry;
    }

    /**
     * Confirmation signal from a chain watcher
     */
    @Transactional
    public Proposal confirm(String proposalId) {
        Proposal proposal = lockProposal(proposalId);
        if (proposal.getStatus() != ProposalStatus.BROADCAST) {
            throw InvalidStateException.notBroadcast(proposalId, proposal.getStatus());
        }

        Instant now = Instant.now();
        proposal.setStatus(ProposalStatus.CONFIRMED);
        proposal.setUpdatedAt(now);
        proposalRepository.save(proposal);
        transactionHistoryService.confirmForProposal(proposalId, now);

        log.info("Proposal confirmed: id={}", proposalId);
        return proposal;
    }

    @Transactional
    public Proposal expire(String proposalId) {
        Proposal proposal = lockProposal(proposalId);
        if (!proposal.getStatus().canTransitionTo(ProposalStatus.EXPIRED)) {
            throw InvalidStateException.alreadyTerminal(proposalId, proposal.getStatus());
        }

        proposal.setStatus(ProposalStatus.EXPIRED);
        proposal.setUpdatedAt(Instant.now());
        proposalRepository.save(proposal);

        log.info("Proposal expired: id={}", proposalId);
        return proposal;
    }

    /**
     * Expires pending and ready proposals untouched since the cutoff.
     *
     * <p>Each candidate is locked and expired in its own transaction. A candidate
     * that cannot be expired, for example because another request holds its lock
     * past the lock timeout, is logged and left for the next sweep.
     *
     * @return number of proposals expired
     */
    public int expireStale(Instant cutoff) {
        List<String> candidateIds = proposalRepository.findIdsByStatusInAndUpdatedAtBefore(EXPIRABLE_WHEN_STALE, cutoff);

        int expired = 0;
        int skipped = 0;
        for (String candidateId : candidateIds) {
            try {
                Boolean done = transactionTemplate.execute(status -> expireIfStale(candidateId, cutoff));
                if (Boolean.TRUE.equals(done)) {
                    expired++;
                }
            } catch (RuntimeException e) {
                skipped++;
                log.warn("Could not expire stale proposal: id={}, error={}", candidateId, e.getMessage(), e);
            }
        }

        if (skipped > 0) {
            log.warn("Stale proposal sweep left {} of {} candidates for the next run", skipped, candidateIds.size());
        }
        return expired;
    }

    private boolean expireIfStale(String proposalId, Instant cutoff) {
        // Re-check under the lock, a signature may have landed since the scan
        Proposal proposal = lockProposal(proposalId);
        if (!EXPIRABLE_WHEN_STALE.contains(proposal.getStatus()) || !proposal.getUpdatedAt().isBefore(cutoff)) {
            return false;
        }

        proposal.setStatus(ProposalStatus.EXPIRED);
        proposal.setUpdatedAt(Instant.now());
        proposalRepository.save(proposal);

        log.debug("Expired stale proposal: id={}, txId={}", proposal.getId(), proposal.getTxId());
        return true;
    }

    @Transactional(readOnly = true)
    public Proposal get(String proposalId) {
        return proposalRepository.findById(proposalId)
                .orElseThrow(() -> NotFoundException.proposal(proposalId));
    }

    /**
     * Lists proposals, newest first. The participant filter takes precedence
     * over the wallet filter; the status filter applies on top of either.
     *
     * @throws InvalidInputException if the status is not a known proposal status
     */
    @Transactional(readOnly = true)
    public List<Proposal> list(String participant, String spendingConditionId, String status) {
        ProposalStatus statusFilter = StringUtils.hasText(status) ? ProposalStatus.fromValue(status) : null;

        List<Proposal> proposals;
        if (StringUtils.hasText(participant)) {
            proposals = proposalRepository.findForParticipant(participant);
        } else if (StringUtils.hasText(spendingConditionId)) {
            proposals = proposalRepository.findBySpendingConditionIdOrderByCreatedAtDesc(spendingConditionId);
        } else {
            proposals = proposalRepository.findAllByOrderByCreatedAtDesc();
        }

        if (statusFilter == null) {
            return proposals;
        }
        return proposals.stream()
                .filter(proposal -> proposal.getStatus() == statusFilter)
                .toList();
    }

    private Proposal lockProposal(String proposalId) {
        return proposalRepository.findByIdForUpdate(proposalId)
                .orElseThrow(() -> NotFoundException.proposal(proposalId));
    }

    // Writes READY at most once: only a pending proposal can cross
    private boolean promoteIfThresholdReached(Proposal proposal, long signatureCount, Instant now) {
        proposal.setUpdatedAt(now);
        if (proposal.getStatus() == ProposalStatus.PENDING && signatureCount >= proposal.getThreshold()) {
            proposal.setStatus(ProposalStatus.READY);
            log.info("Proposal reached threshold: id={}, signatures={}, threshold={}",
                    proposal.getId(), signatureCount, proposal.getThreshold());
            return true;
        }
        return false;
    }
}
