package com.pennywise.domain;

import jakarta.persistence.*;
import org.hibernate.annotations.Check;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Income entity: money received into one account.
 *
 * Balance effect: +amount on {@link #getAccount()}.
 */
@Entity
@Table(
    name = "incomes",
    indexes = {
        @Index(name = "idx_incomes_user_created", columnList = "user_id,created_at"),
        @Index(name = "idx_incomes_account_id", columnList = "account_id")
    }
)
@Check(constraints = "amount > 0")
public class Income implements SingleSidedEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private User user;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "account_id", nullable = false)
    private Account account;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 1000)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Income() {
    }

    public Income(User user, Account account, BigDecimal amount, String description, Instant createdAt) {
        this.user = Objects.requireNonNull(user, "user");
        this.account = Objects.requireNonNull(account, "account");
        this.amount = Objects.requireNonNull(amount, "amount");
        this.description = description == null ? "" : description;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public void revise(Account account, BigDecimal amount, String description, Instant when) {
        this.account = Objects.requireNonNull(account, "account");
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
        if (!(o instanceof Income)) return false;
        Income other = (Income) o;
        return id != null && Objects.equals(id, other.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }

    @Override
    public String toString() {
        return "Income{" +
                "id=" + id +
                ", accountId=" + (account != null ? account.getId() : null) +
                ", amount=" + amount +
                ", createdAt=" + createdAt +
                '}';
    }
}
