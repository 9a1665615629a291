package com.pennywise.domain;

import jakarta.persistence.*;
import org.hibernate.annotations.Check;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Transfer entity: money moved between two accounts of the same user.
 *
 * Balance effect: -amount on the from-account, +amount on the to-account.
 *
 * Critical financial rules:
 * - from and to must differ (also enforced by a CHECK constraint)
 * - from must hold enough funds unless it is a system account
 * - every mutation locks all participating accounts (TransferService)
 */
@Entity
@Table(
    name = "transfers",
    indexes = {
        @Index(name = "idx_transfers_user_created", columnList = "user_id,created_at"),
        @Index(name = "idx_transfers_from_account", columnList = "from_account_id"),
        @Index(name = "idx_transfers_to_account", columnList = "to_account_id")
    }
)
@Check(constraints = "amount > 0 AND from_account_id <> to_account_id")
public class Transfer {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private User user;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "from_account_id", nullable = false)
    private Account fromAccount;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "to_account_id", nullable = false)
    private Account toAccount;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Transfer() {
    }

    public Transfer(User user, Account fromAccount, Account toAccount, BigDecimal amount, Instant createdAt) {
        this.user = Objects.requireNonNull(user, "user");
        this.fromAccount = Objects.requireNonNull(fromAccount, "fromAccount");
        this.toAccount = Objects.requireNonNull(toAccount, "toAccount");
        this.amount = Objects.requireNonNull(amount, "amount");
        this.createdAt = createdAt;
    }

    public void revise(Account fromAccount, Account toAccount, BigDecimal amount) {
        this.fromAccount = Objects.requireNonNull(fromAccount, "fromAccount");
        this.toAccount = Objects.requireNonNull(toAccount, "toAccount");
        this.amount = Objects.requireNonNull(amount, "amount");
    }

    public Long getId() {
        return id;
    }

    public User getUser() {
        return user;
    }

    public Account getFromAccount() {
        return fromAccount;
    }

    public Account getToAccount() {
        return toAccount;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * True when money entered the tracked universe through this transfer (salary style).
     */
    public boolean isFromSystem() {
        return fromAccount.isSystem();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transfer)) return false;
        Transfer other = (Transfer) o;
        return id != null && Objects.equals(id, other.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }

    @Override
    public String toString() {
        return "Transfer{" +
                "id=" + id +
                ", fromAccountId=" + (fromAccount != null ? fromAccount.getId() : null) +
                ", toAccountId=" + (toAccount != null ? toAccount.getId() : null) +
                ", amount=" + amount +
                ", createdAt=" + createdAt +
                '}';
    }
}
