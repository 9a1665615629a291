package com.pennywise.repository;

import com.pennywise.domain.Transfer;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Transfer entity.
 *
 * Writes go through TransferService, which locks both accounts first.
 *
 * 1. existsByFromAccountIdOrToAccountId(id, id)
 *    WHY: An account that still appears on either side of a transfer must not
 *         be deleted (entries are never orphaned).
 *
 * 2. sumAmountByFromAccountId / sumAmountByToAccountId
 *    WHY: Reconciliation recomputes the ledger balance of one account on demand.
 *    RETURNS: null when no transfer matches.
 */
@Repository
public interface TransferRepository extends JpaRepository<Transfer, Long> {

    List<Transfer> findByUserIdOrderByCreatedAtDesc(Long userId);

    Optional<Transfer> findByIdAndUserId(Long id, Long userId);

    /**
     * Same lookup with an exclusive row lock held until the transaction ends.
     * Update and delete read the stored transfer through this so the effect
     * they reverse is the committed one.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT t FROM Transfer t WHERE t.id = :id AND t.user.id = :userId")
    Optional<Transfer> findByIdAndUserIdForUpdate(@Param("id") Long id, @Param("userId") Long userId);

    List<Transfer> findByUserIdAndCreatedAtBetween(Long userId, Instant from, Instant to);

    boolean existsByFromAccountIdOrToAccountId(Long fromAccountId, Long toAccountId);

    @Query("SELECT SUM(t.amount) FROM Transfer t WHERE t.fromAccount.id = :accountId")
    BigDecimal sumAmountByFromAccountId(@Param("accountId") Long accountId);

    @Query("SELECT SUM(t.amount) FROM Transfer t WHERE t.toAccount.id = :accountId")
    BigDecimal sumAmountByToAccountId(@Param("accountId") Long accountId);
}
