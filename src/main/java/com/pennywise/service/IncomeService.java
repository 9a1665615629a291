package com.pennywise.service;

import com.pennywise.domain.Account;
import com.pennywise.domain.Income;
import com.pennywise.exception.ResourceNotFoundException;
import com.pennywise.repository.IncomeRepository;
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
 * Service for income operations. Same protocol as {@link ExpenseService},
 * credited instead of debited.
 */
@Service
@Transactional
public class IncomeService extends SingleSidedEntryService<Income> {

    private static final Logger log = LoggerFactory.getLogger(IncomeService.class);

    private final IncomeRepository incomeRepository;
    private final Clock clock;

    public IncomeService(IncomeRepository incomeRepository, AccountService accountService, Clock clock) {
        super(accountService, EntryDirection.CREDIT);
        this.incomeRepository = incomeRepository;
        this.clock = clock;
    }

    @Override
    protected JpaRepository<Income, Long> repository() {
        return incomeRepository;
    }

    @Override
    protected Optional<Income> findForUpdate(Long entryId, Long userId) {
        return incomeRepository.findByIdAndUserIdForUpdate(entryId, userId);
    }

    @Override
    protected String resourceName() {
        return "Income";
    }

    public Income create(Long userId, Long accountId, BigDecimal amount, String description) {
        BigDecimal value = Amounts.requireValid(amount, "amount");
        Account account = accountService.resolveRegularAccount(userId, accountId, "accountId");

        Income income = applyAndSave(new Income(account.getUser(), account, value, description, clock.instant()));
        log.info("Income created - incomeId={}, accountId={}, amount={}", income.getId(), accountId, value);
        return income;
    }

    /**
     * Null arguments keep the stored value.
     */
    public Income update(Long userId, Long incomeId, Long accountId, BigDecimal amount, String description) {
        Income income = lockOwned(userId, incomeId);
        BalanceEffect before = effectOf(income);

        BigDecimal value = amount == null ? income.getAmount() : Amounts.requireValid(amount, "amount");
        Account account = accountId == null
                ? income.getAccount()
                : accountService.resolveRegularAccount(userId, accountId, "accountId");
        String text = description == null ? income.getDescription() : description;

        income.revise(account, value, text, clock.instant());
        Income saved = reapplyAndSave(before, income);
        log.info("Income updated - incomeId={}, accountId={}, amount={}", incomeId, account.getId(), value);
        return saved;
    }

    public void delete(Long userId, Long incomeId) {
        Income income = lockOwned(userId, incomeId);
        reverseAndDelete(income);
        log.info("Income deleted - incomeId={}, withdrew {} from accountId={}",
                incomeId, income.getAmount(), income.getAccount().getId());
    }

    @Transactional(readOnly = true)
    public List<Income> listIncomes(Long userId) {
        return incomeRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    @Transactional(readOnly = true)
    public Income getIncome(Long userId, Long incomeId) {
        return incomeRepository.findByIdAndUserId(incomeId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Income", incomeId));
    }
}
