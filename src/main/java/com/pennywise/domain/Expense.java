package com.pennywise.domain;

import jakarta.persistence.*;
import org.hibernate.annotations.Check;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Expense entity: money spent from one account, classified by a category.
 *
 * Balance effect: -amount on {@link #getAccount()}.
 *
 * Unlike an append-only journal line, an expense is editable and deletable;
 * ExpenseService keeps the account balance in step with every change.
 * Fields change only through {@link #revise}.
 */
@Entity
@Table(
    name = "expenses",
    indexes = {
        @Index(name = "idx_expenses_user_created", columnList = "user_id,created_at"),
        @Index(name = "idx_expenses_account_id", columnList = "account_id"),
        @Index(name = "idx_expenses_category_id", columnList = "category_id")
    }
)
@Check(constraints = "amount > 0")
public class Expense implements SingleSidedEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private User user;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "account_id", nullable = false)
    private Account account;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "category_id", nullable = false)
    private Category category;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 1000)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Expense() {
    }

    public Expense(User user, Account account, Category category,
                   BigDecimal amount, String description, Instant createdAt) {
        this.user = Objects.requireNonNull(user, "user");
        this.account = Objects.requireNonNull(account, "account");
        this.category = Objects.requireNonNull(category, "category");
        this.amount = Objects.requireNonNull(amount, "amount");
        this.description = description == null ? "" : description;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    /**
     * Replace the mutable fields in one step. Callers must have captured
     * the previous balance effect before calling this.
     */
    public void revise(Account account, Category category, BigDecimal amount,
                       String description, Instant when) {
        this.account = Objects.requireNonNull(account, "account");
        this.category = Objects.requireNonNull(category, "category");
        this.amount = Objects.requireNonNull(amount, "amount");
        this.description = description == null ? "" : description;
        this.updatedAt = when;
    }

    @Override
    public Long getId() {
        return id;
    }

    @Override
    public User getUser() {
        return user;
    }

    @Override
    public Account getAccount() {
        return account;
    }

    public Category getCategory() {
        return category;
    }

    @Override
    public BigDecimal getAmount() {
        return amount;
    }

    public String getDescription() {
        return description;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Expense)) return false;
        Expense other = (Expense) o;
        return id != null && Objects.equals(id, other.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }

    @Override
    public String toString() {
        return "Expense{" +
                "id=" + id +
                ", accountId=" + (account != null ? account.getId() : null) +
                ", categoryId=" + (category != null ? category.getId() : null) +
                ", amount=" + amount +
                ", createdAt=" + createdAt +
                '}';
    }
}
