package com.pocketledger.core.budget;

import com.pocketledger.core.auth.AuthService;
import com.pocketledger.core.error.NotFoundException;
import com.pocketledger.core.error.ValidationException;
import com.pocketledger.core.ledger.LedgerService;
import com.pocketledger.core.model.Budget;
import com.pocketledger.core.model.BudgetStatus;
import com.pocketledger.core.model.DateRange;
import com.pocketledger.core.model.Session;
import com.pocketledger.core.model.Transaction;
import com.pocketledger.core.store.Repository;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;

/**
 * Monthly category budgets. Whether a budget is exceeded is recomputed from the ledger on each read.
 */
@Service
public class BudgetService {
    private final Repository repo;

    public BudgetService(Repository repo) {
        this.repo = repo;
    }

    public Budget setBudget(Session session, String category, YearMonth period, BigDecimal threshold) {
        Session s = AuthService.require(session);
        String cat = category == null ? "" : category.trim();
        validate(cat, period, threshold);
        return repo.upsertBudget(s.userId(), cat, period, threshold);
    }

    public BudgetStatus checkBudget(Session session, String category, YearMonth period) {
        Session s = AuthService.require(session);
        String cat = category == null ? "" : category.trim();
        Budget b = repo.findBudget(s.userId(), cat, period)
                .orElseThrow(() -> new NotFoundException("No budget set for " + cat + " in " + period + "."));
        return statusOf(b);
    }

    public List<BudgetStatus> listBudgets(Session session, YearMonth period) {
        Session s = AuthService.require(session);
        return repo.listBudgets(s.userId(), period).stream().map(this::statusOf).toList();
    }

    public void deleteBudget(Session session, String category, YearMonth period) {
        Session s = AuthService.require(session);
        String cat = category == null ? "" : category.trim();
        if (!repo.deleteBudget(s.userId(), cat, period)) {
            throw new NotFoundException("No budget set for " + cat + " in " + period + ".");
        }
    }

    /**
     * Status of the budget covering an expense, present only when that budget is now exceeded.
     */
    public Optional<BudgetStatus> alertFor(Session session, Transaction t) {
        Session s = AuthService.require(session);
        if (!t.isExpense()) return Optional.empty();
        return repo.findBudget(s.userId(), t.category(), YearMonth.from(t.date()))
                .map(this::statusOf)
                .filter(BudgetStatus::exceeded);
    }

    private BudgetStatus statusOf(Budget b) {
        YearMonth p = b.period();
        BigDecimal spent = repo.sumExpenses(b.userId(), b.category(), new DateRange(p.atDay(1), p.atEndOfMonth()));
        return new BudgetStatus(b.category(), p, spent, b.threshold());
    }

    public static void validate(String category, YearMonth period, BigDecimal threshold) {
        if (category == null || category.isBlank()) throw new ValidationException("Category cannot be empty.");
        if (period == null) throw new ValidationException("Budget period is required.");
        if (threshold == null || threshold.signum() < 0) {
            throw new ValidationException("Budget amount cannot be negative.");
        }
        LedgerService.requireInRange(threshold, "Budget amount");
    }
}
