package com.wpanther.multisigcoordinator.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.wpanther.multisigcoordinator.entity.HistoryStatus;
import com.wpanther.multisigcoordinator.entity.TransactionHistory;

@Repository
public interface TransactionHistoryRepository extends JpaRepository<TransactionHistory, String> {

    List<TransactionHistory> findAllByOrderByBroadcastAtDesc();

    List<TransactionHistory> findBySpendingConditionIdOrderByBroadcastAtDesc(String spendingConditionId);

    /**
     * Find history of every wallet the signer participates in
     */
    @Query("SELECT h FROM TransactionHistory h WHERE h.spendingConditionId IN "
            + "(SELECT w.spendingConditionId FROM Wallet w JOIN w.participants wp WHERE wp = :signer) "
            + "ORDER BY h.broadcastAt DESC")
    List<TransactionHistory> findForParticipant(@Param("signer") String signer);

    List<TransactionHistory> findByProposalId(String proposalId);

    long countByStatus(HistoryStatus status);

    long countByProposalIdIsNull();
}
