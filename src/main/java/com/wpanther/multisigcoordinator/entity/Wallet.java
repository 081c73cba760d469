package com.wpanther.multisigcoordinator.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.Set;

/**
 * A shared spending condition (m-of-n lock) and its participant set.
 * Rows are written once at registration and never updated.
 */
@Entity
@Table(name = "wallets")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Wallet implements Serializable {

    private static final long serialVersionUID = 1L;

    @Id
    private String id;

    // Client-computed lock hash, unique across all wallets
    @Column(name = "spending_condition_id", nullable = false, unique = true, updatable = false)
    private String spendingConditionId;

    @Column(nullable = false, updatable = false)
    private int threshold;

    // Declared size only, not reconciled with the participant rows
    @Column(name = "total_signers", nullable = false, updatable = false)
    private int totalSigners;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "wallet_participants", joinColumns = @JoinColumn(name = "wallet_id"),
            indexes = @Index(name = "idx_wallet_participants_signer", columnList = "signer"))
    @Column(name = "signer", nullable = false)
    private Set<String> participants;

    @Column(name = "created_by", nullable = false, updatable = false)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
