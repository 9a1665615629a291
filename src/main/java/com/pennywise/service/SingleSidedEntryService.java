package com.pennywise.service;

import com.pennywise.domain.SingleSidedEntry;
import com.pennywise.exception.ConcurrencyTimeoutException;
import com.pennywise.exception.ResourceNotFoundException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * Shared mutation protocol for entries that move money on one account.
 *
 * Subclasses validate and build the entry, then persist it through one of the
 * three methods below. Each method runs inside the subclass's transaction, so
 * the entry row and its balance delta commit or roll back together.
 *
 * No explicit account lock is taken: the relative balance UPDATE holds the
 * row's write lock until commit, and no funds check is made on this path.
 * Update and delete lock the entry row itself before reading the effect they
 * reverse, so two edits of the same entry run one after the other.
 *
 * @param <E> entry type
 */
public abstract class SingleSidedEntryService<E extends SingleSidedEntry> {

    protected final AccountService accountService;
    private final EntryDirection direction;

    protected SingleSidedEntryService(AccountService accountService, EntryDirection direction) {
        this.accountService = accountService;
        this.direction = direction;
    }

    protected abstract JpaRepository<E, Long> repository();

    /**
     * Locking lookup of one entry owned by the user.
     */
    protected abstract Optional<E> findForUpdate(Long entryId, Long userId);

    protected abstract String resourceName();

    /**
     * Load the user's entry with its row locked until the transaction ends.
     *
     * @throws ResourceNotFoundException if the entry does not exist or belongs to another user
     * @throws ConcurrencyTimeoutException if the row lock is not granted in time
     */
    protected E lockOwned(Long userId, Long entryId) {
        Optional<E> entry;
        try {
            entry = findForUpdate(entryId, userId);
        } catch (PessimisticLockingFailureException e) {
            throw new ConcurrencyTimeoutException(
                    "Could not lock " + resourceName() + " " + entryId + ", retry the request", e);
        }
        return entry.orElseThrow(() -> new ResourceNotFoundException(resourceName(), entryId));
    }

    public BalanceEffect effectOf(E entry) {
        return BalanceEffect.single(entry.getAccount().getId(), direction.signed(entry.getAmount()));
    }

    /**
     * Persist a new entry, then apply its effect once.
     */
    protected E applyAndSave(E entry) {
        E saved = repository().save(entry);
        accountService.applyEffect(effectOf(saved));
        return saved;
    }

    /**
     * Persist a revised entry, then apply effect(after) - effect(before).
     *
     * @param before effect captured before the entry was revised
     */
    protected E reapplyAndSave(BalanceEffect before, E entry) {
        E saved = repository().save(entry);
        accountService.applyEffect(effectOf(saved).minus(before));
        return saved;
    }

    /**
     * Reverse the entry's effect, then remove it.
     */
    protected void reverseAndDelete(E entry) {
        accountService.applyEffect(effectOf(entry).negate());
        repository().delete(entry);
    }
}
