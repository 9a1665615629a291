package com.pennywise.service;

import com.pennywise.domain.Account;
import com.pennywise.domain.Category;
import com.pennywise.domain.Expense;
import com.pennywise.domain.Income;
import com.pennywise.domain.Transfer;
import com.pennywise.domain.User;

import java.lang.reflect.Field;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Entity builders for Mockito-based service tests. Ids and balances are
 * normally assigned by the database, so they are set through reflection here.
 */
final class Fixtures {

    static final Instant NOW = Instant.parse("2024-03-15T10:00:00Z");

    private Fixtures() {
    }

    static User user(Long id) {
        User user = new User("user" + id, "user" + id + "@test.com", "hash", NOW);
        setField(user, "id", id);
        return user;
    }

    static Account account(Long id, User user, String name, String balance) {
        Account account = Account.regular(user, name, NOW);
        setField(account, "id", id);
        setField(account, "balance", new BigDecimal(balance));
        return account;
    }

    static Account systemAccount(Long id, User user) {
        Account account = Account.system(user, "External (System)", NOW);
        setField(account, "id", id);
        return account;
    }

    static Category category(Long id, User user, String name) {
        Category category = new Category(user, name, NOW);
        setField(category, "id", id);
        return category;
    }

    static Expense expense(Long id, Account account, Category category, String amount) {
        Expense expense = new Expense(account.getUser(), account, category, new BigDecimal(amount), null, NOW);
        setField(expense, "id", id);
        return expense;
    }

    static Income income(Long id, Account account, String amount) {
        Income income = new Income(account.getUser(), account, new BigDecimal(amount), null, NOW);
        setField(income, "id", id);
        return income;
    }

    static Transfer transfer(Long id, Account from, Account to, String amount) {
        Transfer transfer = new Transfer(from.getUser(), from, to, new BigDecimal(amount), NOW);
        setField(transfer, "id", id);
        return transfer;
    }

    static Transfer transferAt(Long id, Account from, Account to, String amount, Instant createdAt) {
        Transfer transfer = new Transfer(from.getUser(), from, to, new BigDecimal(amount), createdAt);
        setField(transfer, "id", id);
        return transfer;
    }

    static void setField(Object entity, String name, Object value) {
        try {
            Field field = entity.getClass().getDeclaredField(name);
            field.setAccessible(true);
            field.set(entity, value);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot set " + name + " on " + entity.getClass().getSimpleName(), e);
        }
    }
}
