package com.wpanther.multisigcoordinator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wpanther.multisigcoordinator.dto.CreateProposalRequest;
import com.wpanther.multisigcoordinator.dto.OutputSummary;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ProposalService
 */
@ExtendWith(MockitoExtension.class)
class ProposalServiceTest {

    @Mock
    private ProposalRepository proposalRepository;

    @Mock
    private WalletRegistryService walletRegistryService;

    @Mock
    private SignatureLedgerService signatureLedgerService;

    @Mock
    private TransactionHistoryService transactionHistoryService;

    @Mock
    private PlatformTransactionManager transactionManager;

    private JsonColumnMapper jsonColumnMapper;

    private ProposalService proposalService;

    private static final String CONDITION_ID = "sc-2of3";
    private static final String PROPOSAL_ID = "proposal-1";
    private static final String TX_ID = "tx-abc";

    @BeforeEach
    void setUp() {
        jsonColumnMapper = new JsonColumnMapper(new ObjectMapper());
        proposalService = new ProposalService(proposalRepository, walletRegistryService,
                signatureLedgerService, transactionHistoryService, jsonColumnMapper,
                new TransactionTemplate(transactionManager));
        ReflectionTestUtils.setField(proposalService, "requireProposerParticipant", true);
    }

    //----------------------------------------------------------------------
    // create
    //----------------------------------------------------------------------

    @Test
    void testCreateProposal_PendingUntilThreshold() {
        // Arrange
        when(proposalRepository.existsByTxId(TX_ID)).thenReturn(false);
        when(walletRegistryService.get(CONDITION_ID)).thenReturn(wallet(2, "A", "B", "C"));
        when(signatureLedgerService.record(any(Proposal.class), eq("A"), eq("signed-by-a"), any(Instant.class)))
                .thenReturn(1L);

        // Act
        Proposal result = proposalService.create(createRequest("A", null));

        // Assert
        assertThat(result.getId()).isNotBlank();
        assertThat(result.getTxId()).isEqualTo(TX_ID);
        assertThat(result.getStatus()).isEqualTo(ProposalStatus.PENDING);
        assertThat(result.getThreshold()).isEqualTo(2);
        assertThat(result.getProposer()).isEqualTo("A");
        assertThat(result.getOutputsJson()).contains("\"recipient\":\"addr-1\"");
        assertThat(result.getCreatedAt()).isNotNull();

        verify(proposalRepository).saveAndFlush(result);
        verify(proposalRepository).save(result);
    }

    @Test
    void testCreateProposal_OneOfNReadyImmediately() {
        // Arrange
        when(proposalRepository.existsByTxId(TX_ID)).thenReturn(false);
        when(walletRegistryService.get(CONDITION_ID)).thenReturn(wallet(1, "A", "B"));
        when(signatureLedgerService.record(any(Proposal.class), eq("A"), anyString(), any(Instant.class)))
                .thenReturn(1L);

        // Act
        Proposal result = proposalService.create(createRequest("A", null));

        // Assert
        assertThat(result.getStatus()).isEqualTo(ProposalStatus.READY);
    }

    @Test
    void testCreateProposal_DuplicateTxIdCheckedBeforeWallet() {
        // Arrange
        when(proposalRepository.existsByTxId(TX_ID)).thenReturn(true);

        // Act & Assert
        assertThatThrownBy(() -> proposalService.create(createRequest("A", null)))
                .isInstanceOf(ConflictException.class)
                .extracting("errorCode")
                .isEqualTo(ConflictException.TX_ID_EXISTS);

        verifyNoInteractions(walletRegistryService, signatureLedgerService);
    }

    @Test
    void testCreateProposal_LosesConcurrentInsert() {
        // Arrange
        when(proposalRepository.existsByTxId(TX_ID)).thenReturn(false);
        when(walletRegistryService.get(CONDITION_ID)).thenReturn(wallet(2, "A", "B", "C"));
        when(proposalRepository.saveAndFlush(any(Proposal.class)))
                .thenThrow(new DataIntegrityViolationException("tx_id"));

        // Act & Assert
        assertThatThrownBy(() -> proposalService.create(createRequest("A", null)))
                .isInstanceOf(ConflictException.class)
                .extracting("errorCode")
                .isEqualTo(ConflictException.TX_ID_EXISTS);

        verifyNoInteractions(signatureLedgerService);
    }

    @Test
    void testCreateProposal_ProposerNotParticipant() {
        // Arrange
        when(proposalRepository.existsByTxId(TX_ID)).thenReturn(false);
        when(walletRegistryService.get(CONDITION_ID)).thenReturn(wallet(2, "A", "B", "C"));

        // Act & Assert
        assertThatThrownBy(() -> proposalService.create(createRequest("X", null)))
                .isInstanceOf(NotParticipantException.class);

        verify(proposalRepository, never()).saveAndFlush(any());
    }

    @Test
    void testCreateProposal_NonParticipantAllowedWhenCheckDisabled() {
        // Arrange
        ReflectionTestUtils.setField(proposalService, "requireProposerParticipant", false);
        when(proposalRepository.existsByTxId(TX_ID)).thenReturn(false);
        when(walletRegistryService.get(CONDITION_ID)).thenReturn(wallet(2, "A", "B", "C"));
        when(signatureLedgerService.record(any(Proposal.class), eq("X"), anyString(), any(Instant.class)))
                .thenReturn(1L);

        // Act
        Proposal result = proposalService.create(createRequest("X", null));

        // Assert
        assertThat(result.getProposer()).isEqualTo("X");
        assertThat(result.getStatus()).isEqualTo(ProposalStatus.PENDING);
    }

    @Test
    void testCreateProposal_ThresholdMismatch() {
        // Arrange
        when(proposalRepository.existsByTxId(TX_ID)).thenReturn(false);
        when(walletRegistryService.get(CONDITION_ID)).thenReturn(wallet(2, "A", "B", "C"));

        // Act & Assert
        assertThatThrownBy(() -> proposalService.create(createRequest("A", 3)))
                .isInstanceOf(InvalidInputException.class)
                .extracting("errorCode")
                .isEqualTo(InvalidInputException.THRESHOLD_MISMATCH);
    }

    @Test
    void testCreateProposal_UnknownWallet() {
        // Arrange
        when(proposalRepository.existsByTxId(TX_ID)).thenReturn(false);
        when(walletRegistryService.get(CONDITION_ID)).thenThrow(NotFoundException.wallet(CONDITION_ID));

        // Act & Assert
        assertThatThrownBy(() -> proposalService.create(createRequest("A", null)))
                .isInstanceOf(NotFoundException.class)
                .extracting("errorCode")
                .isEqualTo(NotFoundException.WALLET_NOT_FOUND);
    }

    //----------------------------------------------------------------------
    // sign
    //----------------------------------------------------------------------

    @Test
    void testSign_ReachesThreshold() {
        // Arrange
        Proposal proposal = proposal(ProposalStatus.PENDING, 2);
        when(proposalRepository.findByIdForUpdate(PROPOSAL_ID)).thenReturn(Optional.of(proposal));
        when(walletRegistryService.isParticipant(CONDITION_ID, "B")).thenReturn(true);
        when(signatureLedgerService.record(eq(proposal), eq("B"), eq("signed-by-b"), any(Instant.class)))
                .thenReturn(2L);

        // Act
        SignOutcome outcome = proposalService.sign(PROPOSAL_ID, "B", "signed-by-b");

        // Assert
        assertThat(outcome.getSignatureCount()).isEqualTo(2L);
        assertThat(outcome.isBecameReady()).isTrue();
        assertThat(proposal.getStatus()).isEqualTo(ProposalStatus.READY);
        verify(proposalRepository).save(proposal);
    }

    @Test
    void testSign_BelowThreshold() {
        // Arrange
        Proposal proposal = proposal(ProposalStatus.PENDING, 3);
        Instant before = proposal.getUpdatedAt();
        when(proposalRepository.findByIdForUpdate(PROPOSAL_ID)).thenReturn(Optional.of(proposal));
        when(walletRegistryService.isParticipant(CONDITION_ID, "B")).thenReturn(true);
        when(signatureLedgerService.record(eq(proposal), eq("B"), anyString(), any(Instant.class)))
                .thenReturn(2L);

        // Act
        SignOutcome outcome = proposalService.sign(PROPOSAL_ID, "B", "signed-by-b");

        // Assert
        assertThat(outcome.getSignatureCount()).isEqualTo(2L);
        assertThat(outcome.isBecameReady()).isFalse();
        assertThat(proposal.getStatus()).isEqualTo(ProposalStatus.PENDING);
        assertThat(proposal.getUpdatedAt()).isAfter(before);
    }

    @Test
    void testSign_NotPending() {
        // Arrange
        when(proposalRepository.findByIdForUpdate(PROPOSAL_ID))
                .thenReturn(Optional.of(proposal(ProposalStatus.READY, 2)));

        // Act & Assert
        assertThatThrownBy(() -> proposalService.sign(PROPOSAL_ID, "C", "late"))
                .isInstanceOf(InvalidStateException.class)
                .extracting("errorCode")
                .isEqualTo(InvalidStateException.NOT_PENDING);

        verifyNoInteractions(signatureLedgerService);
    }

    @Test
    void testSign_NotParticipant() {
        // Arrange
        when(proposalRepository.findByIdForUpdate(PROPOSAL_ID))
                .thenReturn(Optional.of(proposal(ProposalStatus.PENDING, 2)));
        when(walletRegistryService.isParticipant(CONDITION_ID, "X")).thenReturn(false);

        // Act & Assert
        assertThatThrownBy(() -> proposalService.sign(PROPOSAL_ID, "X", "sig"))
                .isInstanceOf(NotParticipantException.class)
                .hasMessageContaining("X");

        verifyNoInteractions(signatureLedgerService);
    }

    @Test
    void testSign_ProposalNotFound() {
        // Arrange
        when(proposalRepository.findByIdForUpdate("missing")).thenReturn(Optional.empty());

        // Act & Assert
        assertThatThrownBy(() -> proposalService.sign("missing", "A", "sig"))
                .isInstanceOf(NotFoundException.class)
                .extracting("errorCode")
                .isEqualTo(NotFoundException.PROPOSAL_NOT_FOUND);
    }

    //----------------------------------------------------------------------
    // broadcast, confirm, expire
    //----------------------------------------------------------------------

    @Test
    void testMarkBroadcast_WritesHistoryWithFinalTxId() {
        // Arrange
        Proposal proposal = proposal(ProposalStatus.READY, 2);
        when(proposalRepository.findByIdForUpdate(PROPOSAL_ID)).thenReturn(Optional.of(proposal));
        when(signatureLedgerService.signersFor(PROPOSAL_ID)).thenReturn(List.of("A", "B"));

        // Act
        TransactionHistory entry = proposalService.markBroadcast(PROPOSAL_ID, "tx-final");

        // Assert
        ArgumentCaptor<TransactionHistory> captor = ArgumentCaptor.forClass(TransactionHistory.class);
        verify(transactionHistoryService).append(captor.capture());
        TransactionHistory appended = captor.getValue();

        assertThat(appended).isSameAs(entry);
        assertThat(appended.getTxId()).isEqualTo("tx-final");
        assertThat(appended.getStatus()).isEqualTo(HistoryStatus.BROADCAST);
        assertThat(appended.getInitiator()).isEqualTo("A");
        assertThat(appended.getProposalId()).isEqualTo(PROPOSAL_ID);
        assertThat(appended.getCreatedAt()).isEqualTo(proposal.getCreatedAt());
        assertThat(appended.getBroadcastAt()).isNotNull();
        assertThat(jsonColumnMapper.readSigners(appended.getSignersJson())).containsExactly("A", "B");
        assertThat(proposal.getStatus()).isEqualTo(ProposalStatus.BROADCAST);
    }

    @Test
    void testMarkBroadcast_DefaultsToProposalTxId() {
        // Arrange
        when(proposalRepository.findByIdForUpdate(PROPOSAL_ID))
                .thenReturn(Optional.of(proposal(ProposalStatus.READY, 2)));
        when(signatureLedgerService.signersFor(PROPOSAL_ID)).thenReturn(List.of("A", "B"));

        // Act
        TransactionHistory entry = proposalService.markBroadcast(PROPOSAL_ID, "  ");

        // Assert
        assertThat(entry.getTxId()).isEqualTo(TX_ID);
    }

    @Test
    void testMarkBroadcast_NotReady() {
        // Arrange
        when(proposalRepository.findByIdForUpdate(PROPOSAL_ID))
                .thenReturn(Optional.of(proposal(ProposalStatus.PENDING, 2)));

        // Act & Assert
        assertThatThrownBy(() -> proposalService.markBroadcast(PROPOSAL_ID, null))
                .isInstanceOf(InvalidStateException.class)
                .extracting("errorCode")
                .isEqualTo(InvalidStateException.NOT_READY);

        verifyNoInteractions(transactionHistoryService);
    }

    @Test
    void testConfirm_PropagatesToHistory() {
        // Arrange
        Proposal proposal = proposal(ProposalStatus.BROADCAST, 2);
        when(proposalRepository.findByIdForUpdate(PROPOSAL_ID)).thenReturn(Optional.of(proposal));

        // Act
        Proposal result = proposalService.confirm(PROPOSAL_ID);

        // Assert
        assertThat(result.getStatus()).isEqualTo(ProposalStatus.CONFIRMED);
        verify(transactionHistoryService).confirmForProposal(eq(PROPOSAL_ID), any(Instant.class));
    }

    @Test
    void testConfirm_NotBroadcast() {
        // Arrange
        when(proposalRepository.findByIdForUpdate(PROPOSAL_ID))
                .thenReturn(Optional.of(proposal(ProposalStatus.READY, 2)));

        // Act & Assert
        assertThatThrownBy(() -> proposalService.confirm(PROPOSAL_ID))
                .isInstanceOf(InvalidStateException.class)
                .extracting("errorCode")
                .isEqualTo(InvalidStateException.NOT_BROADCAST);
    }

    @Test
    void testExpire_Pending() {
        // Arrange
        Proposal proposal = proposal(ProposalStatus.PENDING, 2);
        when(proposalRepository.findByIdForUpdate(PROPOSAL_ID)).thenReturn(Optional.of(proposal));

        // Act
        Proposal result = proposalService.expire(PROPOSAL_ID);

        // Assert
        assertThat(result.getStatus()).isEqualTo(ProposalStatus.EXPIRED);
        verify(proposalRepository).save(proposal);
    }

    @Test
    void testExpire_AlreadyTerminal() {
        // Arrange
        when(proposalRepository.findByIdForUpdate(PROPOSAL_ID))
                .thenReturn(Optional.of(proposal(ProposalStatus.CONFIRMED, 2)));

        // Act & Assert
        assertThatThrownBy(() -> proposalService.expire(PROPOSAL_ID))
                .isInstanceOf(InvalidStateException.class)
                .extracting("errorCode")
                .isEqualTo(InvalidStateException.ALREADY_TERMINAL);
    }

    @Test
    void testExpireStale_SkipsProposalsTouchedSinceScan() {
        // Arrange
        Instant cutoff = Instant.now().minus(1, ChronoUnit.DAYS);

        Proposal stale = proposal(ProposalStatus.PENDING, 2);
        stale.setUpdatedAt(cutoff.minus(1, ChronoUnit.HOURS));

        Proposal refreshed = proposal(ProposalStatus.READY, 2);
        refreshed.setId("proposal-2");
        refreshed.setUpdatedAt(Instant.now());

        when(proposalRepository.findIdsByStatusInAndUpdatedAtBefore(anyCollection(), eq(cutoff)))
                .thenReturn(List.of(PROPOSAL_ID, "proposal-2"));
        when(proposalRepository.findByIdForUpdate(PROPOSAL_ID)).thenReturn(Optional.of(stale));
        when(proposalRepository.findByIdForUpdate("proposal-2")).thenReturn(Optional.of(refreshed));

        // Act
        int expired = proposalService.expireStale(cutoff);

        // Assert
        assertThat(expired).isEqualTo(1);
        assertThat(stale.getStatus()).isEqualTo(ProposalStatus.EXPIRED);
        assertThat(refreshed.getStatus()).isEqualTo(ProposalStatus.READY);
        verify(proposalRepository, times(1)).save(any(Proposal.class));
    }

    @Test
    void testExpireStale_ContendedProposalDoesNotBlockOthers() {
        // Arrange
        Instant cutoff = Instant.now().minus(1, ChronoUnit.DAYS);

        Proposal stale = proposal(ProposalStatus.PENDING, 2);
        stale.setId("proposal-2");
        stale.setUpdatedAt(cutoff.minus(1, ChronoUnit.HOURS));

        when(proposalRepository.findIdsByStatusInAndUpdatedAtBefore(anyCollection(), eq(cutoff)))
                .thenReturn(List.of(PROPOSAL_ID, "proposal-2"));
        when(proposalRepository.findByIdForUpdate(PROPOSAL_ID))
                .thenThrow(new PessimisticLockingFailureException("lock wait timeout"));
        when(proposalRepository.findByIdForUpdate("proposal-2")).thenReturn(Optional.of(stale));

        // Act
        int expired = proposalService.expireStale(cutoff);

        // Assert
        assertThat(expired).isEqualTo(1);
        assertThat(stale.getStatus()).isEqualTo(ProposalStatus.EXPIRED);
        verify(proposalRepository, times(1)).save(stale);
        // One transaction per candidate: the contended one rolls back, the other commits
        verify(transactionManager, times(2)).getTransaction(any());
        verify(transactionManager, times(1)).rollback(any());
        verify(transactionManager, times(1)).commit(any());
    }

    //----------------------------------------------------------------------
    // list
    //----------------------------------------------------------------------

    @Test
    void testList_InvalidStatus() {
        // Act & Assert
        assertThatThrownBy(() -> proposalService.list(null, null, "approved"))
                .isInstanceOf(InvalidInputException.class)
                .extracting("errorCode")
                .isEqualTo(InvalidInputException.INVALID_STATUS);

        verifyNoInteractions(proposalRepository);
    }

    @Test
    void testList_ParticipantTakesPrecedenceAndStatusFilters() {
        // Arrange
        Proposal pending = proposal(ProposalStatus.PENDING, 2);
        Proposal ready = proposal(ProposalStatus.READY, 2);
        ready.setId("proposal-2");
        when(proposalRepository.findForParticipant("B")).thenReturn(List.of(pending, ready));

        // Act
        List<Proposal> result = proposalService.list("B", CONDITION_ID, "READY");

        // Assert
        assertThat(result).containsExactly(ready);
        verify(proposalRepository, never()).findBySpendingConditionIdOrderByCreatedAtDesc(any());
    }

    private Wallet wallet(int threshold, String... participants) {
        return Wallet.builder()
                .id("wallet-1")
                .spendingConditionId(CONDITION_ID)
                .threshold(threshold)
                .totalSigners(participants.length)
                .participants(new LinkedHashSet<>(List.of(participants)))
                .createdBy(participants[0])
                .createdAt(Instant.now())
                .build();
    }

    private CreateProposalRequest createRequest(String proposer, Integer threshold) {
        return CreateProposalRequest.builder()
                .txId(TX_ID)
                .spendingConditionId(CONDITION_ID)
                .proposer(proposer)
                .threshold(threshold)
                .unsignedPayload("unsigned-tx")
                .signingContext("ctx")
                .spendConditions("conditions")
                .totalInputValue(1000L)
                .outputs(List.of(new OutputSummary("addr-1", 900L)))
                .proposerSignedPayload("signed-by-" + proposer.toLowerCase())
                .build();
    }

    private Proposal proposal(ProposalStatus status, int threshold) {
        Instant created = Instant.now().minus(10, ChronoUnit.MINUTES);
        return Proposal.builder()
                .id(PROPOSAL_ID)
                .txId(TX_ID)
                .spendingConditionId(CONDITION_ID)
                .proposer("A")
                .status(status)
                .threshold(threshold)
                .unsignedPayload("unsigned-tx")
                .signingContext("ctx")
                .spendConditions("conditions")
                .totalInputValue(1000L)
                .outputsJson("[{\"recipient\":\"addr-1\",\"amount\":900}]")
                .createdAt(created)
                .updatedAt(created)
                .build();
    }
}
