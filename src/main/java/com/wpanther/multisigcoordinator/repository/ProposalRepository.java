package com.wpanther.multisigcoordinator.repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.wpanther.multisigcoordinator.entity.Proposal;
import com.wpanther.multisigcoordinator.entity.ProposalStatus;

import jakarta.persistence.LockModeType;

@Repository
public interface ProposalRepository extends JpaRepository<Proposal, String> {

    boolean existsByTxId(String txId);

    /**
     * Load a proposal holding a row write lock until the surrounding transaction ends.
     * Every status transition goes through this lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Proposal p WHERE p.id = :id")
    Optional<Proposal> findByIdForUpdate(@Param("id") String id);

    List<Proposal> findAllByOrderByCreatedAtDesc();

    List<Proposal> findBySpendingConditionIdOrderByCreatedAtDesc(String spendingConditionId);

    /**
     * Find proposals for every wallet the signer participates in
     */
    @Query("SELECT p FROM Proposal p WHERE p.spendingConditionId IN "
            + "(SELECT w.spendingConditionId FROM Wallet w JOIN w.participants wp WHERE wp = :signer) "
            + "ORDER BY p.createdAt DESC")
    List<Proposal> findForParticipant(@Param("signer") String signer);

    /**
     * Find proposals in the given states that have not changed since the cutoff
     */
    @Query("SELECT p.id FROM Proposal p WHERE p.status IN :statuses AND p.updatedAt < :cutoff")
    List<String> findIdsByStatusInAndUpdatedAtBefore(@Param("statuses") Collection<ProposalStatus> statuses,
                                                     @Param("cutoff") Instant cutoff);

    long countByStatus(ProposalStatus status);

    long countByCreatedAtAfter(Instant since);
}
