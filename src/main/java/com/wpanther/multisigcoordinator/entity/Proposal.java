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
 * A candidate spend from a shared wallet, awaiting enough participant signatures
 */
@Entity
@Table(name = "proposals", indexes = {
        @Index(name = "idx_proposals_spending_condition", columnList = "spending_condition_id"),
        @Index(name = "idx_proposals_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Proposal {

    @Id
    private String id;

    @Column(name = "tx_id", nullable = false, unique = true, updatable = false)
    private String txId;

    @Column(name = "spending_condition_id", nullable = false, updatable = false)
    private String spendingConditionId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "spending_condition_id", referencedColumnName = "spending_condition_id",
            insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_proposals_wallet"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Wallet wallet;

    @Column(name = "proposer", nullable = false, updatable = false)
    private String proposer;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ProposalStatus status;

    // Copied from the wallet at creation; the proposal never re-reads it
    @Column(name = "threshold", nullable = false, updatable = false)
    private int threshold;

    // Opaque client blobs, stored and returned verbatim
    @Column(name = "unsigned_payload", nullable = false, columnDefinition = "TEXT")
    private String unsignedPayload;

    @Column(name = "signing_context", nullable = false, columnDefinition = "TEXT")
    private String signingContext;

    @Column(name = "spend_conditions", nullable = false, columnDefinition = "TEXT")
    private String spendConditions;

    @Column(name = "total_input_value", nullable = false)
    private long totalInputValue;

    // JSON array of {recipient, amount}
    @Column(name = "outputs_json", nullable = false, columnDefinition = "TEXT")
    private String outputsJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
