package com.wpanther.multisigcoordinator.service;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.wpanther.multisigcoordinator.entity.Wallet;
import com.wpanther.multisigcoordinator.exception.ConflictException;
import com.wpanther.multisigcoordinator.exception.NotFoundException;
import com.wpanther.multisigcoordinator.repository.WalletRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Registry of shared spending conditions and their participants.
 * Wallets are immutable once registered, so there is no update or delete.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletRegistryService {

    private final WalletRepository walletRepository;

    /**
     * Registers a spending condition.
     * Two clients deriving the same condition may race here; the unique
     * constraint on the spending condition id decides the winner.
     *
     * @throws ConflictException if the spending condition is already registered
     */
    @Transactional
    public Wallet register(String spendingConditionId, int threshold, int totalSigners,
                           Collection<String> participants, String createdBy) {
        if (walletRepository.existsBySpendingConditionId(spendingConditionId)) {
            log.warn("Rejected duplicate wallet registration: spendingConditionId={}", spendingConditionId);
            throw ConflictException.walletExists(spendingConditionId);
        }

        Wallet wallet = Wallet.builder()
                .id(UUID.randomUUID().toString())
                .spendingConditionId(spendingConditionId)
                .threshold(threshold)
                .totalSigners(totalSigners)
                .participants(new LinkedHashSet<>(participants))
                .createdBy(createdBy)
                .createdAt(Instant.now())
                .build();

        try {
            walletRepository.saveAndFlush(wallet);
        } catch (DataIntegrityViolationException e) {
            log.warn("Lost concurrent wallet registration: spendingConditionId={}", spendingConditionId);
            throw ConflictException.walletExists(spendingConditionId, e);
        }

        log.info("Registered wallet: id={}, spendingConditionId={}, threshold={}, participants={}",
                wallet.getId(), spendingConditionId, threshold, wallet.getParticipants().size());
        return wallet;
    }

    @Transactional(readOnly = true)
    public Wallet get(String spendingConditionId) {
        return walletRepository.findBySpendingConditionId(spendingConditionId)
                .orElseThrow(() -> NotFoundException.wallet(spendingConditionId));
    }

    @Transactional(readOnly = true)
    public boolean exists(String spendingConditionId) {
        return walletRepository.existsBySpendingConditionId(spendingConditionId);
    }

    @Transactional(readOnly = true)
    public List<Wallet> listAll() {
        return walletRepository.findAllByOrderByCreatedAtAsc();
    }

    @Transactional(readOnly = true)
    public List<Wallet> listForSigner(String signer) {
        log.debug("Listing wallets for signer: {}", signer);
        return walletRepository.findByParticipant(signer);
    }

    @Transactional(readOnly = true)
    public boolean isParticipant(String spendingConditionId, String signer) {
        return walletRepository.countParticipant(spendingConditionId, signer) > 0;
    }
}
