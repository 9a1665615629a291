package com.pennywise.service;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Signed balance deltas per account id, as produced by a ledger entry.
 *
 * An entry mutation is always applied as {@code effectOf(after).minus(effectOf(before))}:
 * - create: before is {@link #none()}
 * - delete: after is {@link #none()}
 * - update on the same account: a single difference on that account
 * - update that moves the entry: full reversal on the old account, full amount on the new one
 *
 * Immutable. Zero deltas are dropped, so an unchanged entry yields an empty effect.
 * Iteration order is ascending account id.
 */
public final class BalanceEffect {

    private static final BalanceEffect NONE = new BalanceEffect(new TreeMap<>());

    private final SortedMap<Long, BigDecimal> deltas;

    private BalanceEffect(TreeMap<Long, BigDecimal> deltas) {
        deltas.values().removeIf(delta -> delta.signum() == 0);
        this.deltas = Collections.unmodifiableSortedMap(deltas);
    }

    public static BalanceEffect none() {
        return NONE;
    }

    public static BalanceEffect single(Long accountId, BigDecimal delta) {
        Objects.requireNonNull(accountId, "accountId");
        Objects.requireNonNull(delta, "delta");
        TreeMap<Long, BigDecimal> map = new TreeMap<>();
        map.put(accountId, delta);
        return new BalanceEffect(map);
    }

    /**
     * -amount on the from-account, +amount on the to-account.
     */
    public static BalanceEffect transfer(Long fromAccountId, Long toAccountId, BigDecimal amount) {
        return single(fromAccountId, amount.negate()).plus(single(toAccountId, amount));
    }

    public BalanceEffect plus(BalanceEffect other) {
        TreeMap<Long, BigDecimal> merged = new TreeMap<>(deltas);
        other.deltas.forEach((accountId, delta) -> merged.merge(accountId, delta, BigDecimal::add));
        return new BalanceEffect(merged);
    }

    public BalanceEffect minus(BalanceEffect other) {
        return plus(other.negate());
    }

    public BalanceEffect negate() {
        TreeMap<Long, BigDecimal> negated = new TreeMap<>();
        deltas.forEach((accountId, delta) -> negated.put(accountId, delta.negate()));
        return new BalanceEffect(negated);
    }

    public SortedMap<Long, BigDecimal> deltas() {
        return deltas;
    }

    public BigDecimal deltaFor(Long accountId) {
        return deltas.getOrDefault(accountId, BigDecimal.ZERO);
    }

    public Set<Long> accountIds() {
        return deltas.keySet();
    }

    public boolean isEmpty() {
        return deltas.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BalanceEffect)) return false;
        BalanceEffect other = (BalanceEffect) o;
        if (!deltas.keySet().equals(other.deltas.keySet())) return false;
        for (Map.Entry<Long, BigDecimal> entry : deltas.entrySet()) {
            if (entry.getValue().compareTo(other.deltas.get(entry.getKey())) != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return deltas.keySet().hashCode();
    }

    @Override
    public String toString() {
        return "BalanceEffect" + deltas;
    }
}
