package com.pennywise.service;

import com.pennywise.domain.Account;
import com.pennywise.domain.User;
import com.pennywise.exception.ResourceNotFoundException;
import com.pennywise.repository.AccountRepository;
import com.pennywise.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.Optional;

/**
 * Lazily provisions the hidden "external" account of each user.
 *
 * The system account is the origin of salary deposits: money entering the
 * tracked universe. It is exempt from funds checks and may go negative.
 *
 * CONCURRENCY:
 * Two requests may both miss the account and try to create it. Creation runs in
 * its own short transaction (REQUIRES_NEW) so the loser's unique-constraint
 * violation on (user_id, name, is_system) is contained there; the loser then
 * re-reads the row the winner committed. The caller's transaction is never
 * poisoned by the failed insert.
 */
@Service
public class SystemAccountProvisioner {

    private static final Logger log = LoggerFactory.getLogger(SystemAccountProvisioner.class);

    private final AccountRepository accountRepository;
    private final UserRepository userRepository;
    private final TransactionTemplate requiresNew;
    private final Clock clock;
    private final String systemAccountName;

    public SystemAccountProvisioner(AccountRepository accountRepository,
                                    UserRepository userRepository,
                                    PlatformTransactionManager transactionManager,
                                    Clock clock,
                                    @Value("${pennywise.system-account.name:External (System)}") String systemAccountName) {
        this.accountRepository = accountRepository;
        this.userRepository = userRepository;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
        this.systemAccountName = systemAccountName;
    }

    /**
     * Return the user's system account, creating it on first use.
     * Repeated and concurrent calls always yield the same account.
     *
     * @throws ResourceNotFoundException if the user does not exist
     */
    @Transactional
    public Account getOrCreateSystemAccount(Long userId) {
        Optional<Account> existing = accountRepository.findByUserIdAndSystemTrue(userId);
        if (existing.isPresent()) {
            return existing.get();
        }

        try {
            Long accountId = requiresNew.execute(status -> {
                User user = userRepository.findById(userId)
                        .orElseThrow(() -> new ResourceNotFoundException("User", userId));
                return accountRepository.saveAndFlush(
                        Account.system(user, systemAccountName, clock.instant())).getId();
            });
            log.info("System account provisioned - userId={}, accountId={}", userId, accountId);
        } catch (DataIntegrityViolationException e) {
            log.debug("System account for userId={} created concurrently, reusing it: {}",
                    userId, e.getMostSpecificCause().getMessage());
        }

        return accountRepository.findByUserIdAndSystemTrue(userId)
                .orElseThrow(() -> new IllegalStateException(
                        "System account missing after provisioning for user " + userId));
    }
}
