package com.wpanther.multisigcoordinator.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.wpanther.multisigcoordinator.entity.Wallet;

@Repository
public interface WalletRepository extends JpaRepository<Wallet, String> {

    /**
     * Find a wallet by its client-computed spending condition id
     */
    Optional<Wallet> findBySpendingConditionId(String spendingConditionId);

    boolean existsBySpendingConditionId(String spendingConditionId);

    List<Wallet> findAllByOrderByCreatedAtAsc();

    /**
     * Find all wallets where the signer is a participant
     */
    @Query("SELECT DISTINCT w FROM Wallet w JOIN w.participants p WHERE p = :signer ORDER BY w.createdAt")
    List<Wallet> findByParticipant(@Param("signer") String signer);

    /**
     * Returns 1 when the signer is a participant of the wallet, 0 otherwise
     */
    @Query("SELECT COUNT(w) FROM Wallet w JOIN w.participants p "
            + "WHERE w.spendingConditionId = :spendingConditionId AND p = :signer")
    long countParticipant(@Param("spendingConditionId") String spendingConditionId,
                          @Param("signer") String signer);
}
