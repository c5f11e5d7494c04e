package com.pocketledger.core.report;

import com.pocketledger.core.auth.AuthService;
import com.pocketledger.core.error.ValidationException;
import com.pocketledger.core.model.CategoryTotal;
import com.pocketledger.core.model.DateRange;
import com.pocketledger.core.model.Report;
import com.pocketledger.core.model.ReportPeriod;
import com.pocketledger.core.model.Session;
import com.pocketledger.core.model.Transaction;
import com.pocketledger.core.model.TransactionFilter;
import com.pocketledger.core.store.Repository;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class ReportService {
    private static final Comparator<CategoryTotal> BY_TOTAL_DESC = Comparator
            .<CategoryTotal, BigDecimal>comparing(CategoryTotal::total, Comparator.reverseOrder())
            .thenComparing(CategoryTotal::category);

    private final Repository repo;

    public ReportService(Repository repo) {
        this.repo = repo;
    }

    public Report generateReport(Session session, ReportPeriod period, LocalDate referenceDate) {
        Session s = AuthService.require(session);
        if (period == null) throw new ValidationException("Invalid period. Use 'monthly' or 'yearly'.");
        if (referenceDate == null) throw new ValidationException("Reference date is required.");

        DateRange range = period.boundsFor(referenceDate);
        List<Transaction> rows = repo.listTransactions(s.userId(), TransactionFilter.between(range.from(), range.to()));

        BigDecimal income = BigDecimal.ZERO;
        BigDecimal expenses = BigDecimal.ZERO;
        Map<String, BigDecimal> byCategory = new HashMap<>();
        for (Transaction t : rows) {
            if (t.isExpense()) {
                expenses = expenses.add(t.amount());
                byCategory.merge(t.category(), t.amount(), BigDecimal::add);
            } else {
                income = income.add(t.amount());
            }
        }

        List<CategoryTotal> breakdown = byCategory.entrySet().stream()
                .map(e -> new CategoryTotal(e.getKey(), e.getValue()))
                .sorted(BY_TOTAL_DESC)
                .toList();
        return new Report(period, range, income, expenses, breakdown);
    }
}
