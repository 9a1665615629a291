package com.pennywise.service;

import com.pennywise.domain.Account;
import com.pennywise.domain.Transfer;
import com.pennywise.exception.LedgerValidationException;
import com.pennywise.exception.ResourceNotFoundException;
import com.pennywise.repository.AccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Salary deposits: transfers from the user's system account into one of
 * their regular accounts. The system account has no funds check, so a
 * salary always succeeds and drives the system balance negative.
 */
@Service
@Transactional
public class SalaryService {

    private static final Logger log = LoggerFactory.getLogger(SalaryService.class);

    private final AccountRepository accountRepository;
    private final SystemAccountProvisioner systemAccountProvisioner;
    private final TransferService transferService;

    public SalaryService(AccountRepository accountRepository,
                         SystemAccountProvisioner systemAccountProvisioner,
                         TransferService transferService) {
        this.accountRepository = accountRepository;
        this.systemAccountProvisioner = systemAccountProvisioner;
        this.transferService = transferService;
    }

    /**
     * @throws ResourceNotFoundException if the target is not a regular account of the user
     */
    public Transfer depositSalary(Long userId, Long toAccountId, BigDecimal amount) {
        Account target = requireTarget(userId, toAccountId);
        Account external = systemAccountProvisioner.getOrCreateSystemAccount(userId);

        Transfer transfer = transferService.create(userId, external.getId(), target.getId(), amount, true);
        log.info("Salary deposited - userId={}, accountId={}, amount={}", userId, target.getId(), transfer.getAmount());
        return transfer;
    }

    /**
     * Deposit an amount drawn uniformly from [min, max], rounded half-up to cents.
     *
     * @throws LedgerValidationException if max is below min
     */
    public Transfer depositRandomSalary(Long userId, Long toAccountId, BigDecimal min, BigDecimal max) {
        if (min == null || max == null) {
            throw new LedgerValidationException("min and max are required");
        }
        if (max.compareTo(min) < 0) {
            throw new LedgerValidationException("max", "max must be >= min");
        }
        BigDecimal fraction = BigDecimal.valueOf(ThreadLocalRandom.current().nextDouble());
        BigDecimal amount = min.add(max.subtract(min).multiply(fraction)).setScale(2, RoundingMode.HALF_UP);
        log.debug("Random salary drawn - min={}, max={}, amount={}", min, max, amount);
        return depositSalary(userId, toAccountId, amount);
    }

    private Account requireTarget(Long userId, Long toAccountId) {
        if (toAccountId == null) {
            throw new LedgerValidationException("accountId", "accountId is required");
        }
        return accountRepository.findByIdAndUserIdAndSystemFalse(toAccountId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Account", toAccountId));
    }
}
