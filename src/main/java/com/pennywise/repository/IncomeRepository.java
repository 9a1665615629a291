package com.pennywise.repository;

import com.pennywise.domain.Income;
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
 * Repository interface for Income entity. Writes go through IncomeService.
 */
@Repository
public interface IncomeRepository extends JpaRepository<Income, Long> {

    List<Income> findByUserIdOrderByCreatedAtDesc(Long userId);

    Optional<Income> findByIdAndUserId(Long id, Long userId);

    /**
     * Same lookup with an exclusive row lock held until the transaction ends.
     * Update and delete read the stored income through this so the effect
     * they reverse is the committed one.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT i FROM Income i WHERE i.id = :id AND i.user.id = :userId")
    Optional<Income> findByIdAndUserIdForUpdate(@Param("id") Long id, @Param("userId") Long userId);

    List<Income> findByUserIdAndCreatedAtBetween(Long userId, Instant from, Instant to);

    boolean existsByAccountId(Long accountId);

    @Query("SELECT SUM(i.amount) FROM Income i WHERE i.account.id = :accountId")
    BigDecimal sumAmountByAccountId(@Param("accountId") Long accountId);
}
