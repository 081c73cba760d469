package com.wpanther.multisigcoordinator.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * One participant's contribution to a proposal. Immutable once written.
 */
@Entity
@Table(name = "proposal_signatures",
        uniqueConstraints = @UniqueConstraint(name = "uk_proposal_signatures_signer",
                columnNames = {"proposal_id", "signer"}),
        indexes = @Index(name = "idx_proposal_signatures_signer", columnList = "signer"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProposalSignature {

    @Id
    private String id;

    @Column(name = "proposal_id", nullable = false, updatable = false)
    private String proposalId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "proposal_id", referencedColumnName = "id", insertable = false, updatable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Proposal proposal;

    @Column(name = "signer", nullable = false, updatable = false)
    private String signer;

    // The signer's signed transaction as produced by the client
    @Column(name = "signed_payload", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String signedPayload;

    @Column(name = "signed_at", nullable = false, updatable = false)
    private Instant signedAt;
}
