package com.wpanther.multisigcoordinator.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.wpanther.multisigcoordinator.entity.ProposalSignature;

@Repository
public interface ProposalSignatureRepository extends JpaRepository<ProposalSignature, String> {

    boolean existsByProposalIdAndSigner(String proposalId, String signer);

    long countByProposalId(String proposalId);

    /**
     * Signatures of a proposal in the order they were recorded
     */
    List<ProposalSignature> findByProposalIdOrderBySignedAtAscIdAsc(String proposalId);
}
