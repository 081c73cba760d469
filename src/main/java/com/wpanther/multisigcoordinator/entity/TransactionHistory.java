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
 * A finalized spend, reached either through a proposal or a direct single-signer spend
 */
@Entity
@Table(name = "transaction_history", indexes = {
        @Index(name = "idx_transaction_history_spending_condition", columnList = "spending_condition_id"),
        @Index(name = "idx_transaction_history_proposal", columnList = "proposal_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionHistory {

    @Id
    private String id;

    // Final transaction id, may differ from the proposal's original tx_id
    @Column(name = "tx_id", nullable = false)
    private String txId;

    @Column(name = "spending_condition_id", nullable = false)
    private String spendingConditionId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "spending_condition_id", referencedColumnName = "spending_condition_id",
            insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_transaction_history_wallet"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Wallet wallet;

    @Column(name = "initiator", nullable = false)
    private String initiator;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private HistoryStatus status;

    @Column(name = "total_input_value", nullable = false)
    private long totalInputValue;

    @Column(name = "outputs_json", nullable = false, columnDefinition = "TEXT")
    private String outputsJson;

    // JSON array of signer PKHs
    @Column(name = "signers_json", nullable = false, columnDefinition = "TEXT")
    private String signersJson;

    // Null for direct spends
    @Column(name = "proposal_id")
    private String proposalId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "proposal_id", referencedColumnName = "id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_transaction_history_proposal"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Proposal proposal;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "broadcast_at")
    private Instant broadcastAt;

    @Column(name = "confirmed_at")
    private Instant confirmedAt;
}
