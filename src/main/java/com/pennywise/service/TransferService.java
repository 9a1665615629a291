package com.pennywise.service;

import com.pennywise.domain.Account;
import com.pennywise.domain.Transfer;
import com.pennywise.exception.ConcurrencyTimeoutException;
import com.pennywise.exception.InsufficientFundsException;
import com.pennywise.exception.LedgerValidationException;
import com.pennywise.exception.ResourceNotFoundException;
import com.pennywise.repository.TransferRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;

/**
 * Service for transfers between two accounts of the same user.
 *
 * CRITICAL: Every mutating method MUST, inside one transaction:
 * 1. Validate fields (amount, distinct accounts, ownership, system account policy)
 * 2. Lock EVERY account involved (old and new sides) in ascending id order
 *    (update/delete lock the transfer row first and take the old sides from it)
 * 3. Reverse the stored transfer's effect (update/delete)
 * 4. Re-read the from-account balance and check funds (unless it is a system account)
 * 5. Apply the new effect and persist the row
 *
 * Lock order is by id, never by role, so A→B and B→A running at the same time
 * cannot deadlock. Step 4 happens only after step 2: no balance read used for
 * a decision is ever taken without the lock.
 *
 * A rejected funds check restores the reversed effect before throwing, so the
 * visible balances are exactly what they were before the request.
 */
@Service
@Transactional
public class TransferService {

    private static final Logger log = LoggerFactory.getLogger(TransferService.class);

    private final TransferRepository transferRepository;
    private final AccountService accountService;
    private final Clock clock;

    public TransferService(TransferRepository transferRepository,
                           AccountService accountService,
                           Clock clock) {
        this.transferRepository = transferRepository;
        this.accountService = accountService;
        this.clock = clock;
    }

    /**
     * Move money between two regular accounts of the user.
     *
     * @throws LedgerValidationException on invalid amount, identical accounts, foreign or system account
     * @throws ResourceNotFoundException if an account does not exist
     * @throws InsufficientFundsException if the from-account cannot cover the amount
     * @throws com.pennywise.exception.ConcurrencyTimeoutException if the accounts cannot be locked in time
     */
    public Transfer create(Long userId, Long fromAccountId, Long toAccountId, BigDecimal amount) {
        return create(userId, fromAccountId, toAccountId, amount, false);
    }

    /**
     * @param allowSystemOrigin when true the from-account may be the user's system account
     *                          (salary deposits). The to-account is never a system account.
     */
    public Transfer create(Long userId, Long fromAccountId, Long toAccountId, BigDecimal amount,
                           boolean allowSystemOrigin) {
        BigDecimal value = Amounts.requireValid(amount, "amount");
        requireDistinct(fromAccountId, toAccountId);
        Account from = accountService.resolveOwnedAccount(userId, fromAccountId, "fromAccountId");
        Account to = accountService.resolveOwnedAccount(userId, toAccountId, "toAccountId");
        checkSystemPolicy(from, to, allowSystemOrigin);

        accountService.lockAccounts(List.of(from.getId(), to.getId()));
        requireFunds(from, value);

        Transfer transfer = transferRepository.save(new Transfer(from.getUser(), from, to, value, clock.instant()));
        accountService.applyEffect(effectOf(transfer));

        log.info("Transfer created - transferId={}, from={}, to={}, amount={}, systemOrigin={}",
                transfer.getId(), from.getId(), to.getId(), value, from.isSystem());
        return transfer;
    }

    /**
     * Change a transfer. Null arguments keep the stored value.
     *
     * A transfer that already originates from the system account may keep that
     * origin; switching any side to a system account is rejected.
     *
     * @throws InsufficientFundsException if the new from-account cannot cover the new amount
     *         once the old transfer is reversed; balances are left untouched
     */
    public Transfer update(Long userId, Long transferId, Long fromAccountId, Long toAccountId, BigDecimal amount) {
        Transfer transfer = lockTransfer(userId, transferId);
        Account oldFrom = transfer.getFromAccount();
        Account oldTo = transfer.getToAccount();

        BigDecimal value = amount == null ? transfer.getAmount() : Amounts.requireValid(amount, "amount");
        Account from = fromAccountId == null
                ? oldFrom
                : accountService.resolveOwnedAccount(userId, fromAccountId, "fromAccountId");
        Account to = toAccountId == null
                ? oldTo
                : accountService.resolveOwnedAccount(userId, toAccountId, "toAccountId");
        requireDistinct(from.getId(), to.getId());
        boolean keepsSystemOrigin = oldFrom.isSystem() && from.getId().equals(oldFrom.getId());
        checkSystemPolicy(from, to, keepsSystemOrigin);

        accountService.lockAccounts(List.of(oldFrom.getId(), oldTo.getId(), from.getId(), to.getId()));

        BalanceEffect previous = effectOf(transfer);
        accountService.applyEffect(previous.negate());

        if (!from.isSystem()) {
            BigDecimal available = accountService.currentBalance(from.getId());
            if (available.compareTo(value) < 0) {
                accountService.applyEffect(previous);
                log.warn("Transfer update rejected, insufficient funds - transferId={}, accountId={}, available={}, requested={}",
                        transferId, from.getId(), available, value);
                throw new InsufficientFundsException(from.getId(), available, value);
            }
        }

        transfer.revise(from, to, value);
        Transfer saved = transferRepository.save(transfer);
        accountService.applyEffect(effectOf(saved));

        log.info("Transfer updated - transferId={}, from={}, to={}, amount={}",
                transferId, from.getId(), to.getId(), value);
        return saved;
    }

    /**
     * Delete a transfer and restore both balances.
     */
    public void delete(Long userId, Long transferId) {
        Transfer transfer = lockTransfer(userId, transferId);
        accountService.lockAccounts(List.of(transfer.getFromAccount().getId(), transfer.getToAccount().getId()));
        accountService.applyEffect(effectOf(transfer).negate());
        transferRepository.delete(transfer);
        log.info("Transfer deleted - transferId={}, returned {} to accountId={}",
                transferId, transfer.getAmount(), transfer.getFromAccount().getId());
    }

    @Transactional(readOnly = true)
    public List<Transfer> listTransfers(Long userId) {
        return transferRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    @Transactional(readOnly = true)
    public Transfer getTransfer(Long userId, Long transferId) {
        return transferRepository.findByIdAndUserId(transferId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Transfer", transferId));
    }

    /**
     * Load the transfer with its row locked, so a concurrent update or delete of
     * the same transfer waits and then sees the committed amount and accounts.
     */
    private Transfer lockTransfer(Long userId, Long transferId) {
        try {
            return transferRepository.findByIdAndUserIdForUpdate(transferId, userId)
                    .orElseThrow(() -> new ResourceNotFoundException("Transfer", transferId));
        } catch (PessimisticLockingFailureException e) {
            log.warn("Transfer lock failed - transferId={}, cause={}", transferId, e.getMessage());
            throw new ConcurrencyTimeoutException("Could not lock transfer " + transferId + ", retry the request", e);
        }
    }

    public BalanceEffect effectOf(Transfer transfer) {
        return BalanceEffect.transfer(
                transfer.getFromAccount().getId(), transfer.getToAccount().getId(), transfer.getAmount());
    }

    /**
     * Must be called with the from-account locked.
     */
    private void requireFunds(Account from, BigDecimal amount) {
        if (from.isSystem()) {
            return;
        }
        BigDecimal available = accountService.currentBalance(from.getId());
        if (available.compareTo(amount) < 0) {
            log.warn("Transfer rejected, insufficient funds - accountId={}, available={}, requested={}",
                    from.getId(), available, amount);
            throw new InsufficientFundsException(from.getId(), available, amount);
        }
    }

    private static void requireDistinct(Long fromAccountId, Long toAccountId) {
        if (fromAccountId == null) {
            throw new LedgerValidationException("fromAccountId", "fromAccountId is required");
        }
        if (toAccountId == null) {
            throw new LedgerValidationException("toAccountId", "toAccountId is required");
        }
        if (fromAccountId.equals(toAccountId)) {
            throw new LedgerValidationException("toAccountId", "From and to accounts must differ");
        }
    }

    private static void checkSystemPolicy(Account from, Account to, boolean allowSystemOrigin) {
        if (to.isSystem()) {
            throw new LedgerValidationException("toAccountId", "System account cannot receive transfers");
        }
        if (from.isSystem() && !allowSystemOrigin) {
            throw new LedgerValidationException("fromAccountId", "System account cannot be used for transfers");
        }
    }
}
