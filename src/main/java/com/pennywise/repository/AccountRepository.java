package com.pennywise.repository;

import com.pennywise.domain.Account;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Account entity: the account store.
 *
 * Custom Queries Explained:
 *
 * 1. adjustBalance(accountId, delta)
 *    WHY: The balance is a cached running total. Writing it as
 *         "balance = balance + :delta" lets concurrent deltas from different
 *         entries compose instead of clobbering each other (no read-modify-write).
 *    LOCKING: The UPDATE takes the row's write lock until commit.
 *    TRANSACTION: Must run inside the caller's transaction, together with the
 *         entry row write; AccountService enforces Propagation.MANDATORY.
 *    NOTE: Bulk JPQL update, bypasses the persistence context. Account instances
 *         already loaded keep their old balance value.
 *
 * 2. findAllByIdForUpdate(ids)
 *    WHY: Transfers read a balance, decide, then write two rows. Without a lock
 *         two transfers could both pass the funds check (time-of-check/time-of-use).
 *    LOCKING: PESSIMISTIC_WRITE (SELECT ... FOR UPDATE) on every requested row,
 *         acquired by one statement in ascending id order so two transfers on the
 *         same pair in swapped roles cannot deadlock.
 *    RELEASE: On commit or rollback of the enclosing transaction.
 *
 * 3. findBalanceById(accountId)
 *    WHY: Scalar read that always goes to the database, so it reflects deltas
 *         applied earlier in the same transaction.
 *
 * Design Notes:
 * - No @Transactional here (service layer manages transaction boundaries)
 * - System accounts are filtered out of every user-facing finder
 */
@Repository
public interface AccountRepository extends JpaRepository<Account, Long> {

    /**
     * Visible (non-system) accounts of a user, by name.
     */
    List<Account> findByUserIdAndSystemFalseOrderByNameAsc(Long userId);

    /**
     * A visible account, scoped to its owner.
     */
    Optional<Account> findByIdAndUserIdAndSystemFalse(Long id, Long userId);

    /**
     * The hidden external account of a user, if already provisioned.
     */
    Optional<Account> findByUserIdAndSystemTrue(Long userId);

    boolean existsByUserIdAndNameAndSystemFalse(Long userId, String name);

    boolean existsByUserIdAndNameAndSystemFalseAndIdNot(Long userId, String name, Long id);

    /**
     * Add a signed delta to an account balance.
     *
     * Example SQL generated:
     * UPDATE accounts SET balance = balance + ? WHERE id = ?
     *
     * @param accountId account to adjust
     * @param delta signed amount (negative debits, positive credits)
     * @return number of rows updated (0 when the account does not exist)
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Account a SET a.balance = a.balance + :delta WHERE a.id = :accountId")
    int adjustBalance(@Param("accountId") Long accountId, @Param("delta") BigDecimal delta);

    /**
     * Lock the given accounts for the rest of the current transaction.
     *
     * Example SQL generated:
     * SELECT * FROM accounts WHERE id IN (?, ?) ORDER BY id FOR UPDATE
     *
     * @param ids distinct account ids
     * @return locked accounts in ascending id order (missing ids are simply absent)
     * @throws org.springframework.dao.PessimisticLockingFailureException if the lock wait times out
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT a FROM Account a WHERE a.id IN :ids ORDER BY a.id ASC")
    List<Account> findAllByIdForUpdate(@Param("ids") Collection<Long> ids);

    /**
     * Current stored balance, bypassing any cached entity state.
     */
    @Query("SELECT a.balance FROM Account a WHERE a.id = :accountId")
    Optional<BigDecimal> findBalanceById(@Param("accountId") Long accountId);
}
