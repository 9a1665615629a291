package com.pennywise.repository;

import com.pennywise.domain.Expense;
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
 * Repository interface for Expense entity.
 *
 * Expenses are editable; every write goes through ExpenseService so the
 * account balance moves with it. Never call save()/delete() directly.
 */
@Repository
public interface ExpenseRepository extends JpaRepository<Expense, Long> {

    List<Expense> findByUserIdOrderByCreatedAtDesc(Long userId);

    Optional<Expense> findByIdAndUserId(Long id, Long userId);

    /**
     * Same lookup with an exclusive row lock held until the transaction ends.
     * Update and delete read the stored expense through this so the effect
     * they reverse is the committed one.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT e FROM Expense e WHERE e.id = :id AND e.user.id = :userId")
    Optional<Expense> findByIdAndUserIdForUpdate(@Param("id") Long id, @Param("userId") Long userId);

    /**
     * Expenses of a user created within [from, to], both inclusive.
     * Used by reporting only.
     */
    List<Expense> findByUserIdAndCreatedAtBetween(Long userId, Instant from, Instant to);

    boolean existsByAccountId(Long accountId);

    boolean existsByCategoryId(Long categoryId);

    /**
     * Sum of expense amounts booked against an account; null when there are none.
     * Reconciliation only, never on the write path.
     */
    @Query("SELECT SUM(e.amount) FROM Expense e WHERE e.account.id = :accountId")
    BigDecimal sumAmountByAccountId(@Param("accountId") Long accountId);
}
