package com.pocketledger.core.store;

import com.pocketledger.core.model.Budget;
import com.pocketledger.core.model.DateRange;
import com.pocketledger.core.model.Transaction;
import com.pocketledger.core.model.TransactionFilter;
import com.pocketledger.core.model.User;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;

public interface Repository {
    void init();

    // Users
    long insertUser(String username, String passwordHash, Instant createdAt);

    Optional<User> findUserByUsername(String username);

    // Transactions
    /**
     * Inserts a row and returns its id. An id of 0 lets the store assign one; any other id is kept.
     */
    long insertTransaction(Transaction t);

    void updateTransaction(Transaction t);

    boolean deleteTransaction(long id);

    Optional<Transaction> findTransaction(long id);

    /**
     * Rows of one user matching the filter, by date ascending then id ascending.
     */
    List<Transaction> listTransactions(long userId, TransactionFilter filter);

    BigDecimal sumExpenses(long userId, String category, DateRange range);

    void deleteTransactionsOf(long userId);

    // Budgets
    Budget upsertBudget(long userId, String category, YearMonth period, BigDecimal threshold);

    Optional<Budget> findBudget(long userId, String category, YearMonth period);

    /**
     * Budgets of one user ordered by period then category; a null period lists every month.
     */
    List<Budget> listBudgets(long userId, YearMonth period);

    boolean deleteBudget(long userId, String category, YearMonth period);

    void deleteBudgetsOf(long userId);

    /**
     * Runs the work as one database transaction: committed if it returns, rolled back if it throws.
     */
    void inTransaction(Runnable work);
}
