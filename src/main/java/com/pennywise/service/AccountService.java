package com.pennywise.service;

import com.pennywise.domain.Account;
import com.pennywise.domain.User;
import com.pennywise.exception.ConcurrencyTimeoutException;
import com.pennywise.exception.LedgerValidationException;
import com.pennywise.exception.ResourceNotFoundException;
import com.pennywise.repository.AccountRepository;
import com.pennywise.repository.ExpenseRepository;
import com.pennywise.repository.IncomeRepository;
import com.pennywise.repository.TransferRepository;
import com.pennywise.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Account store: account management plus the two balance primitives
 * every ledger mutation is built on.
 *
 * CRITICAL: Balances change ONLY through {@link #applyEffect} / {@link #adjustBalance}.
 * Both require an active transaction (Propagation.MANDATORY) so the delta
 * commits or rolls back together with the entry row that caused it.
 *
 * System accounts are invisible here: every user-facing lookup filters them out
 * and reports them as not found.
 */
@Service
@Transactional
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final AccountRepository accountRepository;
    private final UserRepository userRepository;
    private final ExpenseRepository expenseRepository;
    private final IncomeRepository incomeRepository;
    private final TransferRepository transferRepository;
    private final Clock clock;

    public AccountService(AccountRepository accountRepository,
                          UserRepository userRepository,
                          ExpenseRepository expenseRepository,
                          IncomeRepository incomeRepository,
                          TransferRepository transferRepository,
                          Clock clock) {
        this.accountRepository = accountRepository;
        this.userRepository = userRepository;
        this.expenseRepository = expenseRepository;
        this.incomeRepository = incomeRepository;
        this.transferRepository = transferRepository;
        this.clock = clock;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // ACCOUNT MANAGEMENT
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Create a regular account with a zero balance.
     *
     * @throws LedgerValidationException if the name is blank or already used by the user
     */
    public Account createAccount(Long userId, String name) {
        String trimmed = requireName(name);
        if (accountRepository.existsByUserIdAndNameAndSystemFalse(userId, trimmed)) {
            log.warn("Account name already in use - userId={}, name={}", userId, trimmed);
            throw new LedgerValidationException("name", "Account name already exists: " + trimmed);
        }
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));

        Account account = accountRepository.save(Account.regular(user, trimmed, clock.instant()));
        log.info("Account created - accountId={}, userId={}, name={}", account.getId(), userId, trimmed);
        return account;
    }

    @Transactional(readOnly = true)
    public List<Account> listAccounts(Long userId) {
        return accountRepository.findByUserIdAndSystemFalseOrderByNameAsc(userId);
    }

    /**
     * @throws ResourceNotFoundException if the account is missing, foreign or a system account
     */
    @Transactional(readOnly = true)
    public Account getAccount(Long userId, Long accountId) {
        return accountRepository.findByIdAndUserIdAndSystemFalse(accountId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Account", accountId));
    }

    public Account renameAccount(Long userId, Long accountId, String name) {
        Account account = getAccount(userId, accountId);
        String trimmed = requireName(name);
        if (accountRepository.existsByUserIdAndNameAndSystemFalseAndIdNot(userId, trimmed, accountId)) {
            throw new LedgerValidationException("name", "Account name already exists: " + trimmed);
        }
        account.rename(trimmed);
        log.info("Account renamed - accountId={}, name={}", accountId, trimmed);
        return accountRepository.save(account);
    }

    /**
     * Delete an account that no entry references any more.
     *
     * @throws LedgerValidationException if any expense, income or transfer still uses it
     */
    public void deleteAccount(Long userId, Long accountId) {
        Account account = getAccount(userId, accountId);
        if (expenseRepository.existsByAccountId(accountId)
                || incomeRepository.existsByAccountId(accountId)
                || transferRepository.existsByFromAccountIdOrToAccountId(accountId, accountId)) {
            log.warn("Account delete rejected, still referenced - accountId={}", accountId);
            throw new LedgerValidationException(
                    "Account " + accountId + " still has expenses, incomes or transfers");
        }
        accountRepository.delete(account);
        log.info("Account deleted - accountId={}, userId={}", accountId, userId);
    }

    /**
     * Resolve an account referenced by a ledger entry.
     *
     * @throws ResourceNotFoundException if no such account exists
     * @throws LedgerValidationException if it belongs to another user
     */
    @Transactional(readOnly = true)
    public Account resolveOwnedAccount(Long userId, Long accountId, String field) {
        if (accountId == null) {
            throw new LedgerValidationException(field, field + " is required");
        }
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account", accountId));
        if (!account.isOwnedBy(userId)) {
            log.warn("Foreign account referenced - userId={}, accountId={}", userId, accountId);
            throw new LedgerValidationException(field, "Account " + accountId + " does not belong to the user");
        }
        return account;
    }

    /**
     * Like {@link #resolveOwnedAccount} but also rejects system accounts.
     * Expenses and incomes may only be booked on regular accounts.
     */
    @Transactional(readOnly = true)
    public Account resolveRegularAccount(Long userId, Long accountId, String field) {
        Account account = resolveOwnedAccount(userId, accountId, field);
        if (account.isSystem()) {
            throw new LedgerValidationException(field, "System account cannot be used here: " + accountId);
        }
        return account;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // BALANCE PRIMITIVES (caller's transaction only)
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Apply every delta of the effect, in ascending account id order.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void applyEffect(BalanceEffect effect) {
        effect.deltas().forEach(this::adjustBalance);
    }

    /**
     * balance = balance + delta, as one relative UPDATE. Zero deltas are skipped.
     *
     * @throws ResourceNotFoundException if the account row does not exist
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void adjustBalance(Long accountId, BigDecimal delta) {
        if (delta.signum() == 0) {
            return;
        }
        int updated = accountRepository.adjustBalance(accountId, delta);
        if (updated == 0) {
            throw new ResourceNotFoundException("Account", accountId);
        }
        log.debug("Balance adjusted - accountId={}, delta={}", accountId, delta);
    }

    /**
     * Take exclusive row locks on all given accounts, held until the
     * enclosing transaction ends. Ids are deduplicated and locked in
     * ascending order by a single statement.
     *
     * @return locked accounts keyed by id, ascending
     * @throws ResourceNotFoundException if any id does not exist
     * @throws ConcurrencyTimeoutException if the locks are not granted in time
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Map<Long, Account> lockAccounts(Collection<Long> accountIds) {
        Set<Long> ids = new TreeSet<>(accountIds);
        if (ids.isEmpty()) {
            return Collections.emptyMap();
        }
        log.debug("Locking accounts {}", ids);

        List<Account> locked;
        try {
            locked = accountRepository.findAllByIdForUpdate(ids);
        } catch (PessimisticLockingFailureException e) {
            log.warn("Lock acquisition failed - accountIds={}, cause={}", ids, e.getMessage());
            throw new ConcurrencyTimeoutException("Could not lock accounts " + ids + ", retry the request", e);
        }

        Map<Long, Account> byId = new LinkedHashMap<>();
        locked.forEach(account -> byId.put(account.getId(), account));
        for (Long id : ids) {
            if (!byId.containsKey(id)) {
                throw new ResourceNotFoundException("Account", id);
            }
        }
        return byId;
    }

    /**
     * Stored balance as of now, read from the database rather than from any
     * loaded entity. Used for funds checks while the lock is held.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BigDecimal currentBalance(Long accountId) {
        return accountRepository.findBalanceById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account", accountId));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // RECONCILIATION (diagnostic, never on the write path)
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Recompute the account's balance from its entries and compare it with the cached value.
     */
    @Transactional(readOnly = true)
    public Reconciliation reconcile(Long userId, Long accountId) {
        Account account = getAccount(userId, accountId);
        BigDecimal stored = accountRepository.findBalanceById(accountId).orElse(account.getBalance());
        BigDecimal ledger = ledgerBalance(accountId);
        Reconciliation result = new Reconciliation(accountId, stored, ledger);
        if (!result.consistent()) {
            log.error("Balance drift detected - accountId={}, balance={}, ledger={}", accountId, stored, ledger);
        }
        return result;
    }

    /**
     * Σincome + Σtransfer-in − Σexpense − Σtransfer-out over persisted entries.
     */
    @Transactional(readOnly = true)
    public BigDecimal ledgerBalance(Long accountId) {
        return orZero(incomeRepository.sumAmountByAccountId(accountId))
                .add(orZero(transferRepository.sumAmountByToAccountId(accountId)))
                .subtract(orZero(expenseRepository.sumAmountByAccountId(accountId)))
                .subtract(orZero(transferRepository.sumAmountByFromAccountId(accountId)))
                .setScale(2);
    }

    public record Reconciliation(Long accountId, BigDecimal balance, BigDecimal ledgerBalance) {

        public boolean consistent() {
            return balance.compareTo(ledgerBalance) == 0;
        }
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new LedgerValidationException("name", "name must not be blank");
        }
        String trimmed = name.strip();
        if (trimmed.length() > 64) {
            throw new LedgerValidationException("name", "name must be at most 64 characters");
        }
        return trimmed;
    }
}
