package com.wpanther.multisigcoordinator.service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.wpanther.multisigcoordinator.entity.Proposal;
import com.wpanther.multisigcoordinator.entity.ProposalSignature;
import com.wpanther.multisigcoordinator.exception.ConflictException;
import com.wpanther.multisigcoordinator.repository.ProposalSignatureRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Append-only record of which participant signed which proposal
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SignatureLedgerService {

    private final ProposalSignatureRepository signatureRepository;

    /**
     * Records a signature and returns the proposal's signature count including it.
     * Must run inside the transaction that holds the proposal, so that the
     * count and the caller's status decision see the same set of rows.
     *
     * @throws ConflictException if the signer already signed this proposal
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public long record(Proposal proposal, String signer, String signedPayload, Instant signedAt) {
        String proposalId = proposal.getId();
        if (signatureRepository.existsByProposalIdAndSigner(proposalId, signer)) {
            log.warn("Rejected duplicate signature: proposalId={}, signer={}", proposalId, signer);
            throw ConflictException.alreadySigned(proposalId, signer);
        }

        ProposalSignature signature = ProposalSignature.builder()
                .id(UUID.randomUUID().toString())
                .proposalId(proposalId)
                .signer(signer)
                .signedPayload(signedPayload)
                .signedAt(signedAt)
                .build();

        try {
            signatureRepository.saveAndFlush(signature);
        } catch (DataIntegrityViolationException e) {
            throw ConflictException.alreadySigned(proposalId, signer, e);
        }

        long count = signatureRepository.countByProposalId(proposalId);
        log.debug("Recorded signature: proposalId={}, signer={}, count={}", proposalId, signer, count);
        return count;
    }

    @Transactional(readOnly = true)
    public long countFor(String proposalId) {
        return signatureRepository.countByProposalId(proposalId);
    }

    @Transactional(readOnly = true)
    public List<ProposalSignature> listFor(String proposalId) {
        return signatureRepository.findByProposalIdOrderBySignedAtAscIdAsc(proposalId);
    }

    @Transactional(readOnly = true)
    public List<String> signersFor(String proposalId) {
        return listFor(proposalId).stream()
                .map(ProposalSignature::getSigner)
                .toList();
    }
}
