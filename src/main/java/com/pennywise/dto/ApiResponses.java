package com.pennywise.dto;

import com.pennywise.domain.Account;
import com.pennywise.domain.Category;
import com.pennywise.domain.Expense;
import com.pennywise.domain.Income;
import com.pennywise.domain.Transfer;
import com.pennywise.domain.User;
import com.pennywise.service.AccountService;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTOs for API endpoints.
 */
public class ApiResponses {

    /**
     * Registered user.
     */
    public static class UserResponse {
        private Long userId;
        private String username;
        private String email;
        private Instant createdAt;

        public UserResponse(User user) {
            this.userId = user.getId();
            this.username = user.getUsername();
            this.email = user.getEmail();
            this.createdAt = user.getCreatedAt();
        }

        // Getters
        public Long getUserId() { return userId; }
        public String getUsername() { return username; }
        public String getEmail() { return email; }
        public Instant getCreatedAt() { return createdAt; }
    }

    /**
     * Account with its cached balance.
     */
    public static class AccountResponse {
        private Long id;
        private String name;
        private BigDecimal balance;
        private Instant createdAt;

        public AccountResponse(Account account) {
            this.id = account.getId();
            this.name = account.getName();
            this.balance = account.getBalance();
            this.createdAt = account.getCreatedAt();
        }

        public Long getId() { return id; }
        public String getName() { return name; }
        public BigDecimal getBalance() { return balance; }
        public Instant getCreatedAt() { return createdAt; }
    }

    /**
     * Cached balance compared with the sum of the account's entries.
     */
    public static class ReconciliationResponse {
        private Long accountId;
        private BigDecimal balance;
        private BigDecimal ledgerBalance;
        private boolean consistent;

        public ReconciliationResponse(AccountService.Reconciliation reconciliation) {
            this.accountId = reconciliation.accountId();
            this.balance = reconciliation.balance();
            this.ledgerBalance = reconciliation.ledgerBalance();
            this.consistent = reconciliation.consistent();
        }

        public Long getAccountId() { return accountId; }
        public BigDecimal getBalance() { return balance; }
        public BigDecimal getLedgerBalance() { return ledgerBalance; }
        public boolean isConsistent() { return consistent; }
    }

    public static class CategoryResponse {
        private Long id;
        private String name;
        private Instant createdAt;
        private Instant updatedAt;

        public CategoryResponse(Category category) {
            this.id = category.getId();
            this.name = category.getName();
            this.createdAt = category.getCreatedAt();
            this.updatedAt = category.getUpdatedAt();
        }

        public Long getId() { return id; }
        public String getName() { return name; }
        public Instant getCreatedAt() { return createdAt; }
        public Instant getUpdatedAt() { return updatedAt; }
    }

    public static class ExpenseResponse {
        private Long id;
        private Long accountId;
        private String account;
        private Long categoryId;
        private String category;
        private BigDecimal amount;
        private String description;
        private Instant createdAt;
        private Instant updatedAt;

        public ExpenseResponse(Expense expense) {
            this.id = expense.getId();
            this.accountId = expense.getAccount().getId();
            this.account = expense.getAccount().getName();
            this.categoryId = expense.getCategory().getId();
            this.category = expense.getCategory().getName();
            this.amount = expense.getAmount();
            this.description = expense.getDescription();
            this.createdAt = expense.getCreatedAt();
            this.updatedAt = expense.getUpdatedAt();
        }

        public Long getId() { return id; }
        public Long getAccountId() { return accountId; }
        public String getAccount() { return account; }
        public Long getCategoryId() { return categoryId; }
        public String getCategory() { return category; }
        public BigDecimal getAmount() { return amount; }
        public String getDescription() { return description; }
        public Instant getCreatedAt() { return createdAt; }
        public Instant getUpdatedAt() { return updatedAt; }
    }

    public static class IncomeResponse {
        private Long id;
        private Long accountId;
        private String account;
        private BigDecimal amount;
        private String description;
        private Instant createdAt;
        private Instant updatedAt;

        public IncomeResponse(Income income) {
            this.id = income.getId();
            this.accountId = income.getAccount().getId();
            this.account = income.getAccount().getName();
            this.amount = income.getAmount();
            this.description = income.getDescription();
            this.createdAt = income.getCreatedAt();
            this.updatedAt = income.getUpdatedAt();
        }

        public Long getId() { return id; }
        public Long getAccountId() { return accountId; }
        public String getAccount() { return account; }
        public BigDecimal getAmount() { return amount; }
        public String getDescription() { return description; }
        public Instant getCreatedAt() { return createdAt; }
        public Instant getUpdatedAt() { return updatedAt; }
    }

    /**
     * Transfer response. systemOrigin marks salary deposits.
     */
    public static class TransferResponse {
        private Long id;
        private Long fromAccountId;
        private String fromAccount;
        private Long toAccountId;
        private String toAccount;
        private BigDecimal amount;
        private boolean systemOrigin;
        private Instant createdAt;

        public TransferResponse(Transfer transfer) {
            this.id = transfer.getId();
            this.fromAccountId = transfer.getFromAccount().getId();
            this.fromAccount = transfer.getFromAccount().getName();
            this.toAccountId = transfer.getToAccount().getId();
            this.toAccount = transfer.getToAccount().getName();
            this.amount = transfer.getAmount();
            this.systemOrigin = transfer.isFromSystem();
            this.createdAt = transfer.getCreatedAt();
        }

        public Long getId() { return id; }
        public Long getFromAccountId() { return fromAccountId; }
        public String getFromAccount() { return fromAccount; }
        public Long getToAccountId() { return toAccountId; }
        public String getToAccount() { return toAccount; }
        public BigDecimal getAmount() { return amount; }
        public boolean isSystemOrigin() { return systemOrigin; }
        public Instant getCreatedAt() { return createdAt; }
    }

    /**
     * Error response.
     */
    public static class ErrorResponse {
        private String error;
        private String message;
        private Instant timestamp;

        public ErrorResponse(String error, String message) {
            this.error = error;
            this.message = message;
            this.timestamp = Instant.now();
        }

        // Getters
        public String getError() { return error; }
        public String getMessage() { return message; }
        public Instant getTimestamp() { return timestamp; }
    }
}
