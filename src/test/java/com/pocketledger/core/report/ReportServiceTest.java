package com.pocketledger.core.report;

import com.pocketledger.TestStores;
import com.pocketledger.core.error.ValidationException;
import com.pocketledger.core.ledger.LedgerService;
import com.pocketledger.core.model.CategoryTotal;
import com.pocketledger.core.model.Report;
import com.pocketledger.core.model.ReportPeriod;
import com.pocketledger.core.model.Session;
import com.pocketledger.core.store.SqliteRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static com.pocketledger.core.model.TransactionType.EXPENSE;
import static com.pocketledger.core.model.TransactionType.INCOME;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportServiceTest {

    private ReportService reports;
    private LedgerService ledger;
    private Session alice;
    private Session bob;

    @BeforeEach
    void setUp() {
        SqliteRepository repo = TestStores.memoryRepository();
        reports = new ReportService(repo);
        ledger = new LedgerService(repo);
        alice = TestStores.user(repo, "alice");
        bob = TestStores.user(repo, "bob");
    }

    private void add(Session s, boolean income, String amount, String category, String date) {
        ledger.addTransaction(s, income ? INCOME : EXPENSE, new BigDecimal(amount), category, "", LocalDate.parse(date));
    }

    @Test
    void septemberExample() {
        add(alice, true, "5000", "Salary", "2025-09-01");
        add(alice, false, "600", "Food", "2025-09-05");
        add(alice, false, "300", "Travel", "2025-09-12");
        add(alice, false, "300", "Entertainment", "2025-09-20");

        Report r = reports.generateReport(alice, ReportPeriod.MONTHLY, LocalDate.of(2025, 9, 15));

        assertThat(r.range().from()).isEqualTo(LocalDate.of(2025, 9, 1));
        assertThat(r.range().to()).isEqualTo(LocalDate.of(2025, 9, 30));
        assertThat(r.totalIncome()).isEqualByComparingTo("5000.00");
        assertThat(r.totalExpenses()).isEqualByComparingTo("1200.00");
        assertThat(r.savings()).isEqualByComparingTo("3800.00");
        assertThat(r.expensesByCategory()).extracting(CategoryTotal::category)
                .containsExactly("Food", "Entertainment", "Travel");
        assertThat(r.expensesByCategory()).extracting(CategoryTotal::total)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("600"), new BigDecimal("300"), new BigDecimal("300"));
    }

    @Test
    void monthlyBoundsExcludeNeighbouringMonthsAndOtherUsers() {
        add(alice, false, "10", "Food", "2025-08-31");
        add(alice, false, "20", "Food", "2025-10-01");
        add(alice, false, "5", "Food", "2025-09-30");
        add(bob, false, "1000", "Food", "2025-09-10");

        Report r = reports.generateReport(alice, ReportPeriod.MONTHLY, LocalDate.of(2025, 9, 1));
        assertThat(r.totalExpenses()).isEqualByComparingTo("5");
    }

    @Test
    void yearlyCoversTheWholeCalendarYear() {
        add(alice, true, "100", "Salary", "2025-01-01");
        add(alice, false, "40", "Gifts", "2025-12-31");
        add(alice, false, "999", "Gifts", "2024-12-31");

        Report r = reports.generateReport(alice, ReportPeriod.YEARLY, LocalDate.of(2025, 6, 15));
        assertThat(r.range().from()).isEqualTo(LocalDate.of(2025, 1, 1));
        assertThat(r.range().to()).isEqualTo(LocalDate.of(2025, 12, 31));
        assertThat(r.totalIncome()).isEqualByComparingTo("100");
        assertThat(r.totalExpenses()).isEqualByComparingTo("40");
    }

    @Test
    void savingsMayBeNegativeAndIncomeIsNotInTheBreakdown() {
        add(alice, true, "100", "Salary", "2025-02-01");
        add(alice, false, "250.50", "Rent", "2025-02-03");

        Report r = reports.generateReport(alice, ReportPeriod.MONTHLY, LocalDate.of(2025, 2, 28));
        assertThat(r.savings()).isEqualByComparingTo("-150.50");
        assertThat(r.savings()).isEqualByComparingTo(r.totalIncome().subtract(r.totalExpenses()));
        assertThat(r.expensesByCategory()).extracting(CategoryTotal::category).containsExactly("Rent");
    }

    @Test
    void emptyPeriodYieldsZeroes() {
        Report r = reports.generateReport(alice, ReportPeriod.MONTHLY, LocalDate.of(2024, 2, 10));
        assertThat(r.range().to()).isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(r.totalIncome()).isEqualByComparingTo("0");
        assertThat(r.savings()).isEqualByComparingTo("0");
        assertThat(r.expensesByCategory()).isEmpty();
    }

    @Test
    void rejectsMissingPeriod() {
        assertThatThrownBy(() -> reports.generateReport(alice, null, LocalDate.of(2025, 1, 1)))
                .isInstanceOf(ValidationException.class);
    }
}
