package com.pennywise.domain;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Account entity: a pot of money owned by one user, carrying a cached running balance.
 *
 * Critical financial rules:
 * - Balance is a materialized value, equal to the sum of the deltas of all
 *   persisted expenses, incomes and transfers referencing this account
 * - Balance has NO setter and is excluded from entity UPDATE statements;
 *   it changes only through AccountRepository.adjustBalance (balance = balance + delta)
 * - BigDecimal with 2 decimal places for all monetary values (never float/double)
 * - Name is unique per user among accounts with the same system flag
 *
 * System accounts:
 * - One per user, created lazily by SystemAccountProvisioner
 * - Model money entering or leaving the tracked universe (salary origin)
 * - Hidden from listings and exempt from overdraft checks
 */
@Entity
@Table(
    name = "accounts",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_accounts_user_name_system", columnNames = {"user_id", "name", "is_system"})
    },
    indexes = {
        @Index(name = "idx_accounts_user_id", columnList = "user_id")
    }
)
public class Account {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private User user;

    @Column(nullable = false, length = 64)
    private String name;

    /**
     * Current balance.
     * Precision: 12 total digits, 2 decimal places.
     */
    @Column(nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal balance;

    @Column(name = "is_system", nullable = false, updatable = false)
    private boolean system;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Account() {
    }

    private Account(User user, String name, boolean system, Instant createdAt) {
        if (user == null) {
            throw new IllegalArgumentException("User cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Account name cannot be blank");
        }
        this.user = user;
        this.name = name.strip();
        this.system = system;
        this.balance = BigDecimal.ZERO.setScale(2);
        this.createdAt = createdAt;
    }

    /**
     * Create a regular, user-visible account. Initial balance is zero.
     */
    public static Account regular(User user, String name, Instant createdAt) {
        return new Account(user, name, false, createdAt);
    }

    /**
     * Create the hidden external account of a user. Initial balance is zero.
     */
    public static Account system(User user, String name, Instant createdAt) {
        return new Account(user, name, true, createdAt);
    }

    public Long getId() {
        return id;
    }

    public User getUser() {
        return user;
    }

    public String getName() {
        return name;
    }

    /**
     * Balance as of the moment this instance was loaded.
     * Delta updates bypass the persistence context, so re-read
     * (AccountService.currentBalance) when an exact figure is needed mid-transaction.
     */
    public BigDecimal getBalance() {
        return balance;
    }

    public boolean isSystem() {
        return system;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isOwnedBy(Long userId) {
        return user.getId().equals(userId);
    }

    public void rename(String newName) {
        if (system) {
            throw new IllegalStateException("System account cannot be renamed");
        }
        if (newName == null || newName.isBlank()) {
            throw new IllegalArgumentException("Account name cannot be blank");
        }
        this.name = newName.strip();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Account)) return false;
        Account account = (Account) o;
        return id != null && Objects.equals(id, account.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }

    @Override
    public String toString() {
        return "Account{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", balance=" + balance +
                ", system=" + system +
                '}';
    }
}
