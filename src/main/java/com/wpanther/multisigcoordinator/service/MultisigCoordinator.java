package com.wpanther.multisigcoordinator.service;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import com.wpanther.multisigcoordinator.dto.BroadcastProposalRequest;
import com.wpanther.multisigcoordinator.dto.BroadcastProposalResponse;
import com.wpanther.multisigcoordinator.dto.CreateProposalRequest;
import com.wpanther.multisigcoordinator.dto.CreateProposalResponse;
import com.wpanther.multisigcoordinator.dto.DirectSpendRequest;
import com.wpanther.multisigcoordinator.dto.DirectSpendResponse;
import com.wpanther.multisigcoordinator.dto.HistoryEntryResponse;
import com.wpanther.multisigcoordinator.dto.ProposalDetailResponse;
import com.wpanther.multisigcoordinator.dto.ProposalSummary;
import com.wpanther.multisigcoordinator.dto.RegisterWalletRequest;
import com.wpanther.multisigcoordinator.dto.RegisterWalletResponse;
import com.wpanther.multisigcoordinator.dto.SignProposalRequest;
import com.wpanther.multisigcoordinator.dto.SignProposalResponse;
import com.wpanther.multisigcoordinator.dto.SignatureEntry;
import com.wpanther.multisigcoordinator.dto.WalletDetailResponse;
import com.wpanther.multisigcoordinator.dto.WalletSummary;
import com.wpanther.multisigcoordinator.entity.Proposal;
import com.wpanther.multisigcoordinator.entity.ProposalSignature;
import com.wpanther.multisigcoordinator.entity.TransactionHistory;
import com.wpanther.multisigcoordinator.entity.Wallet;
import com.wpanther.multisigcoordinator.util.JsonColumnMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for the REST layer. Sequences the registry, ledger, proposal
 * and history services so that each request runs as one transaction, and
 * renders entities as response DTOs. Holds no state of its own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MultisigCoordinator {

    private final WalletRegistryService walletRegistryService;
    private final SignatureLedgerService signatureLedgerService;
    private final ProposalService proposalService;
    private final TransactionHistoryService transactionHistoryService;
    private final JsonColumnMapper jsonColumnMapper;

    // Wallets

    @Transactional
    public RegisterWalletResponse registerWallet(RegisterWalletRequest request) {
        Wallet wallet = walletRegistryService.register(
                request.getSpendingConditionId(),
                request.getThreshold(),
                request.getTotalSigners(),
                request.getParticipants(),
                request.getCreatedBy());

        return RegisterWalletResponse.builder()
                .id(wallet.getId())
                .spendingConditionId(wallet.getSpendingConditionId())
                .build();
    }

    @Transactional(readOnly = true)
    public List<WalletSummary> listWallets(String participant) {
        List<Wallet> wallets = StringUtils.hasText(participant)
                ? walletRegistryService.listForSigner(participant)
                : walletRegistryService.listAll();
        return wallets.stream()
                .map(this::toWalletSummary)
                .toList();
    }

    @Transactional(readOnly = true)
    public WalletDetailResponse getWallet(String spendingConditionId) {
        Wallet wallet = walletRegistryService.get(spendingConditionId);
        return WalletDetailResponse.builder()
                .id(wallet.getId())
                .spendingConditionId(wallet.getSpendingConditionId())
                .threshold(wallet.getThreshold())
                .totalSigners(wallet.getTotalSigners())
                .createdBy(wallet.getCreatedBy())
                .createdAt(wallet.getCreatedAt())
                .participants(sortedParticipants(wallet))
                .build();
    }

    // Proposals

    @Transactional
    public CreateProposalResponse createProposal(CreateProposalRequest request) {
        Proposal proposal = proposalService.create(request);
        return CreateProposalResponse.builder()
                .id(proposal.getId())
                .txId(proposal.getTxId())
                .status(proposal.getStatus())
                .build();
    }

    @Transactional(readOnly = true)
    public List<ProposalSummary> listProposals(String participant, String spendingConditionId, String status) {
        return proposalService.list(participant, spendingConditionId, status).stream()
                .map(this::toProposalSummary)
                .toList();
    }

    @Transactional(readOnly = true)
    public ProposalDetailResponse getProposal(String proposalId) {
        Proposal proposal = proposalService.get(proposalId);
        List<ProposalSignature> signatures = signatureLedgerService.listFor(proposalId);
        Wallet wallet = walletRegistryService.get(proposal.getSpendingConditionId());

        List<String> signers = signatures.stream()
                .map(ProposalSignature::getSigner)
                .toList();
        List<SignatureEntry> entries = signatures.stream()
                .map(signature -> SignatureEntry.builder()
                        .signer(signature.getSigner())
                        .signedPayload(signature.getSignedPayload())
                        .signedAt(signature.getSignedAt())
                        .build())
                .toList();

        return ProposalDetailResponse.builder()
                .id(proposal.getId())
                .txId(proposal.getTxId())
                .spendingConditionId(proposal.getSpendingConditionId())
                .proposer(proposal.getProposer())
                .status(proposal.getStatus())
                .threshold(proposal.getThreshold())
                .signaturesCollected(signers.size())
                .unsignedPayload(proposal.getUnsignedPayload())
                .signingContext(proposal.getSigningContext())
                .spendConditions(proposal.getSpendConditions())
                .totalInputValue(proposal.getTotalInputValue())
                .outputs(jsonColumnMapper.readOutputs(proposal.getOutputsJson()))
                .signers(signers)
                .signatures(entries)
                .participants(sortedParticipants(wallet))
                .createdAt(proposal.getCreatedAt())
                .updatedAt(proposal.getUpdatedAt())
                .build();
    }

    @Transactional
    public SignProposalResponse signProposal(String proposalId, SignProposalRequest request) {
        SignOutcome outcome = proposalService.sign(proposalId, request.getSigner(), request.getSignedPayload());
        return SignProposalResponse.builder()
                .signaturesCollected(outcome.getSignatureCount())
                .readyToBroadcast(outcome.isBecameReady())
                .build();
    }

    @Transactional
    public BroadcastProposalResponse markBroadcast(String proposalId, BroadcastProposalRequest request) {
        String finalTxId = request != null ? request.getFinalTxId() : null;
        if (request != null && request.getBroadcaster() != null) {
            log.debug("Broadcast of proposal {} reported by {}", proposalId, request.getBroadcaster());
        }

        TransactionHistory entry = proposalService.markBroadcast(proposalId, finalTxId);
        return BroadcastProposalResponse.builder()
                .historyId(entry.getId())
                .txId(entry.getTxId())
                .build();
    }

    @Transactional
    public ProposalSummary confirmProposal(String proposalId) {
        return toProposalSummary(proposalService.confirm(proposalId));
    }

    @Transactional
    public ProposalSummary expireProposal(String proposalId) {
        return toProposalSummary(proposalService.expire(proposalId));
    }

    // History

    @Transactional
    public DirectSpendResponse directSpend(DirectSpendRequest request) {
        TransactionHistory entry = transactionHistoryService.directSpend(request);
        return DirectSpendResponse.builder()
                .historyId(entry.getId())
                .build();
    }

    @Transactional(readOnly = true)
    public List<HistoryEntryResponse> listHistory(String participant, String spendingConditionId) {
        return transactionHistoryService.list(participant, spendingConditionId).stream()
                .map(this::toHistoryEntry)
                .toList();
    }

    @Transactional
    public HistoryEntryResponse confirmHistory(String historyId) {
        return toHistoryEntry(transactionHistoryService.markConfirmed(historyId));
    }

    @Transactional
    public HistoryEntryResponse failHistory(String historyId) {
        return toHistoryEntry(transactionHistoryService.markFailed(historyId));
    }

    private WalletSummary toWalletSummary(Wallet wallet) {
        return WalletSummary.builder()
                .id(wallet.getId())
                .spendingConditionId(wallet.getSpendingConditionId())
                .threshold(wallet.getThreshold())
                .totalSigners(wallet.getTotalSigners())
                .createdBy(wallet.getCreatedBy())
                .createdAt(wallet.getCreatedAt())
                .build();
    }

    private ProposalSummary toProposalSummary(Proposal proposal) {
        List<String> signers = signatureLedgerService.signersFor(proposal.getId());
        return ProposalSummary.builder()
                .id(proposal.getId())
                .txId(proposal.getTxId())
                .spendingConditionId(proposal.getSpendingConditionId())
                .proposer(proposal.getProposer())
                .status(proposal.getStatus())
                .threshold(proposal.getThreshold())
                .signaturesCollected(signers.size())
                .totalInputValue(proposal.getTotalInputValue())
                .outputs(jsonColumnMapper.readOutputs(proposal.getOutputsJson()))
                .signers(signers)
                .createdAt(proposal.getCreatedAt())
                .updatedAt(proposal.getUpdatedAt())
                .build();
    }

    private HistoryEntryResponse toHistoryEntry(TransactionHistory entry) {
        return HistoryEntryResponse.builder()
                .id(entry.getId())
                .txId(entry.getTxId())
                .spendingConditionId(entry.getSpendingConditionId())
                .initiator(entry.getInitiator())
                .status(entry.getStatus())
                .totalInputValue(entry.getTotalInputValue())
                .outputs(jsonColumnMapper.readOutputs(entry.getOutputsJson()))
                .signers(jsonColumnMapper.readSigners(entry.getSignersJson()))
                .proposalId(entry.getProposalId())
                .createdAt(entry.getCreatedAt())
                .broadcastAt(entry.getBroadcastAt())
                .confirmedAt(entry.getConfirmedAt())
                .build();
    }

    private List<String> sortedParticipants(Wallet wallet) {
        return wallet.getParticipants().stream()
                .sorted()
                .toList();
    }
}
