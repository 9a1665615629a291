package com.pennywise.service;

import com.pennywise.domain.Account;
import com.pennywise.domain.Category;
import com.pennywise.domain.Expense;
import com.pennywise.exception.ResourceNotFoundException;
import com.pennywise.repository.ExpenseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Service for expense operations.
 *
 * CRITICAL: Every method that writes an expense MUST move the account balance
 * in the same transaction:
 * 1. Validate (amount, account ownership, category ownership, no system account)
 * 2. Lock the stored expense row and capture its effect (update and delete)
 * 3. Persist the expense row
 * 4. Apply the balance difference through AccountService
 */
@Service
@Transactional
public class ExpenseService extends SingleSidedEntryService<Expense> {

    private static final Logger log = LoggerFactory.getLogger(ExpenseService.class);

    private final ExpenseRepository expenseRepository;
    private final CategoryService categoryService;
    private final Clock clock;

    public ExpenseService(ExpenseRepository expenseRepository,
                          AccountService accountService,
                          CategoryService categoryService,
                          Clock clock) {
        super(accountService, EntryDirection.DEBIT);
        this.expenseRepository = expenseRepository;
        this.categoryService = categoryService;
        this.clock = clock;
    }

    @Override
    protected JpaRepository<Expense, Long> repository() {
        return expenseRepository;
    }

    @Override
    protected Optional<Expense> findForUpdate(Long entryId, Long userId) {
        return expenseRepository.findByIdAndUserIdForUpdate(entryId, userId);
    }

    @Override
    protected String resourceName() {
        return "Expense";
    }

    /**
     * Record an expense and debit its account.
     *
     * @return persisted expense
     * @throws com.pennywise.exception.LedgerValidationException on invalid amount or foreign/system account or category
     * @throws ResourceNotFoundException if the account or category does not exist
     */
    public Expense create(Long userId, Long accountId, Long categoryId, BigDecimal amount, String description) {
        BigDecimal value = Amounts.requireValid(amount, "amount");
        Account account = accountService.resolveRegularAccount(userId, accountId, "accountId");
        Category category = categoryService.resolveOwnedCategory(userId, categoryId);

        Expense expense = applyAndSave(new Expense(
                account.getUser(), account, category, value, description, clock.instant()));
        log.info("Expense created - expenseId={}, accountId={}, amount={}", expense.getId(), accountId, value);
        return expense;
    }

    /**
     * Change an expense. Null arguments keep the stored value.
     *
     * Moving the expense to another account refunds the old account in full
     * and debits the new one; otherwise only the amount difference is applied.
     */
    public Expense update(Long userId, Long expenseId, Long accountId, Long categoryId,
                          BigDecimal amount, String description) {
        Expense expense = lockOwned(userId, expenseId);
        BalanceEffect before = effectOf(expense);

        BigDecimal value = amount == null ? expense.getAmount() : Amounts.requireValid(amount, "amount");
        Account account = accountId == null
                ? expense.getAccount()
                : accountService.resolveRegularAccount(userId, accountId, "accountId");
        Category category = categoryId == null
                ? expense.getCategory()
                : categoryService.resolveOwnedCategory(userId, categoryId);
        String text = description == null ? expense.getDescription() : description;

        expense.revise(account, category, value, text, clock.instant());
        Expense saved = reapplyAndSave(before, expense);
        log.info("Expense updated - expenseId={}, accountId={}, amount={}", expenseId, account.getId(), value);
        return saved;
    }

    public void delete(Long userId, Long expenseId) {
        Expense expense = lockOwned(userId, expenseId);
        reverseAndDelete(expense);
        log.info("Expense deleted - expenseId={}, refunded {} to accountId={}",
                expenseId, expense.getAmount(), expense.getAccount().getId());
    }

    @Transactional(readOnly = true)
    public List<Expense> listExpenses(Long userId) {
        return expenseRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    @Transactional(readOnly = true)
    public Expense getExpense(Long userId, Long expenseId) {
        return expenseRepository.findByIdAndUserId(expenseId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Expense", expenseId));
    }
}
