package com.pocketledger.cli;

import com.pocketledger.core.auth.AuthService;
import com.pocketledger.core.backup.BackupService;
import com.pocketledger.core.budget.BudgetService;
import com.pocketledger.core.error.FinanceException;
import com.pocketledger.core.error.StorageException;
import com.pocketledger.core.error.ValidationException;
import com.pocketledger.core.ledger.LedgerService;
import com.pocketledger.core.model.Budget;
import com.pocketledger.core.model.BudgetStatus;
import com.pocketledger.core.model.CategoryTotal;
import com.pocketledger.core.model.Report;
import com.pocketledger.core.model.ReportPeriod;
import com.pocketledger.core.model.Session;
import com.pocketledger.core.model.Transaction;
import com.pocketledger.core.model.TransactionFilter;
import com.pocketledger.core.model.TransactionType;
import com.pocketledger.core.model.TransactionUpdate;
import com.pocketledger.core.report.ReportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Numbered text menu over the ledger, budget, report and backup services.
 */
@Component
public class MenuShell {
    private static final Logger log = LoggerFactory.getLogger(MenuShell.class);

    private static final String RULE_WIDE = "-".repeat(80);
    private static final String RULE_NARROW = "-".repeat(40);
    private static final DateTimeFormatter MONTH_NAME = DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final AuthService auth;
    private final LedgerService ledger;
    private final BudgetService budgets;
    private final ReportService reports;
    private final BackupService backups;
    private final Clock clock;

    public MenuShell(AuthService auth, LedgerService ledger, BudgetService budgets,
                     ReportService reports, BackupService backups, Clock clock) {
        this.auth = auth;
        this.ledger = ledger;
        this.budgets = budgets;
        this.reports = reports;
        this.backups = backups;
        this.clock = clock;
    }

    /**
     * Runs the menu until Exit or end of input.
     *
     * @return process exit code
     */
    public int run(Terminal term) {
        Session session = null;
        while (true) {
            printMenu(term);
            String choice;
            try {
                choice = term.prompt("Enter your choice (1-13): ");
            } catch (Terminal.EndOfInput eof) {
                term.println();
                return 0;
            }
            if (choice.equals("13")) {
                term.println("Thank you for using Pocket Ledger!");
                return 0;
            }
            try {
                session = dispatch(choice, session, term);
            } catch (Terminal.EndOfInput eof) {
                term.println();
                return 0;
            } catch (FinanceException e) {
                term.println("Error: " + e.getMessage());
            } catch (StorageException e) {
                log.error("Operation {} aborted", choice, e);
                term.println("Error: storage failure, operation aborted (" + e.getMessage() + ")");
            }
        }
    }

    private void printMenu(Terminal term) {
        term.println();
        term.println("=== Pocket Ledger ===");
        term.println("1. Register");
        term.println("2. Login");
        term.println("3. Add Income");
        term.println("4. Add Expense");
        term.println("5. View Transactions");
        term.println("6. Update Transaction");
        term.println("7. Delete Transaction");
        term.println("8. Generate Report");
        term.println("9. Set Budget");
        term.println("10. View Budgets");
        term.println("11. Backup Data");
        term.println("12. Restore Data");
        term.println("13. Exit");
        term.println("=====================");
    }

    /**
     * Handles one menu choice and returns the session in effect afterwards.
     */
    private Session dispatch(String choice, Session session, Terminal term) {
        switch (choice) {
            case "1" -> register(term);
            case "2" -> {
                return login(term);
            }
            case "3" -> addTransaction(session, TransactionType.INCOME, term);
            case "4" -> addTransaction(session, TransactionType.EXPENSE, term);
            case "5" -> viewTransactions(session, term);
            case "6" -> updateTransaction(session, term);
            case "7" -> deleteTransaction(session, term);
            case "8" -> generateReport(session, term);
            case "9" -> setBudget(session, term);
            case "10" -> viewBudgets(session, term);
            case "11" -> backup(session, term);
            case "12" -> restore(session, term);
            default -> term.println("Invalid choice. Please try again.");
        }
        return session;
    }

    private void register(Terminal term) {
        String username = term.prompt("Enter username: ");
        String password = term.secret("Enter password: ");
        auth.register(username, password);
        term.println("Registration successful!");
    }

    private Session login(Terminal term) {
        String username = term.prompt("Enter username: ");
        String password = term.secret("Enter password: ");
        Session s = auth.login(username, password);
        term.println("Welcome, " + s.username() + "!");
        return s;
    }

    private void addTransaction(Session session, TransactionType type, Terminal term) {
        AuthService.require(session);
        BigDecimal amount = parseAmount(term.prompt("Enter " + type.key() + " amount: "));
        String category = term.prompt("Enter category: ");
        String description = term.prompt("Enter description (optional): ");
        LocalDate date = parseDate(term.prompt("Enter date (YYYY-MM-DD, blank for today): "));

        long id = ledger.addTransaction(session, type, amount, category, description, date);
        term.println("Transaction added successfully! (ID: " + id + ")");

        budgets.alertFor(session, ledger.getTransaction(session, id)).ifPresent(st -> {
            term.println("Warning: You have exceeded your budget for " + st.category() + "!");
            term.println("Budget: " + Money.format(st.threshold()) + ", Spent: " + Money.format(st.spent()));
        });
    }

    private void viewTransactions(Session session, Terminal term) {
        AuthService.require(session);
        term.println();
        term.println("Filter options:");
        term.println("1. All transactions");
        term.println("2. By date range");
        term.println("3. By category");
        term.println("4. By type (income/expense)");
        String choice = term.prompt("Enter your choice (1-4): ");

        TransactionFilter filter = switch (choice) {
            case "2" -> TransactionFilter.between(
                    parseDate(term.prompt("Enter start date (YYYY-MM-DD): ")),
                    parseDate(term.prompt("Enter end date (YYYY-MM-DD): ")));
            case "3" -> TransactionFilter.byCategory(term.prompt("Enter category: "));
            case "4" -> TransactionFilter.byType(parseType(term.prompt("Enter type (income/expense): ")));
            default -> TransactionFilter.all();
        };

        List<Transaction> rows = ledger.listTransactions(session, filter);
        if (rows.isEmpty()) {
            term.println("No transactions found.");
            return;
        }
        term.println();
        term.println("Transactions:");
        term.println(RULE_WIDE);
        BigDecimal income = BigDecimal.ZERO;
        BigDecimal expense = BigDecimal.ZERO;
        for (Transaction t : rows) {
            term.println("ID: " + t.id() + " | " + t.date() + " | " + t.type().name() + " | "
                    + Money.format(t.amount()) + " | " + t.category() + " | " + t.description());
            if (t.isExpense()) expense = expense.add(t.amount());
            else income = income.add(t.amount());
        }
        term.println(RULE_WIDE);
        term.println("Total Income: " + Money.format(income) + " | Total Expense: " + Money.format(expense)
                + " | Net: " + Money.format(income.subtract(expense)));
    }

    private void updateTransaction(Session session, Terminal term) {
        AuthService.require(session);
        long id = parseId(term.prompt("Enter transaction ID to update: "));
        ledger.getTransaction(session, id);
        term.println("Leave field blank to keep current value:");
        String type = term.prompt("Enter new type (income/expense): ");
        String amount = term.prompt("Enter new amount: ");
        String category = term.prompt("Enter new category: ");
        String description = term.prompt("Enter new description: ");
        String date = term.prompt("Enter new date (YYYY-MM-DD): ");

        TransactionUpdate update = new TransactionUpdate(
                type.isEmpty() ? null : parseType(type),
                amount.isEmpty() ? null : parseAmount(amount),
                category.isEmpty() ? null : category,
                description.isEmpty() ? null : description,
                date.isEmpty() ? null : parseDate(date));
        ledger.updateTransaction(session, id, update);
        term.println("Transaction updated successfully!");
    }

    private void deleteTransaction(Session session, Terminal term) {
        AuthService.require(session);
        long id = parseId(term.prompt("Enter transaction ID to delete: "));
        ledger.deleteTransaction(session, id);
        term.println("Transaction deleted successfully!");
    }

    private void generateReport(Session session, Terminal term) {
        AuthService.require(session);
        String p = term.prompt("Enter period (monthly/yearly): ");
        ReportPeriod period = ReportPeriod.parse(p);
        if (period == null) throw new ValidationException("Invalid period. Use 'monthly' or 'yearly'.");
        LocalDate ref = parseDate(term.prompt("Enter reference date (YYYY-MM-DD, blank for today): "));

        Report r = reports.generateReport(session, period, ref);
        term.println();
        term.println("--- Financial Report (" + r.period().key() + ") ---");
        term.println("Period: " + r.range().from() + " to " + r.range().to());
        term.println("Total Income: " + Money.format(r.totalIncome()));
        term.println("Total Expenses: " + Money.format(r.totalExpenses()));
        term.println("Savings: " + Money.format(r.savings()));
        if (!r.expensesByCategory().isEmpty()) {
            term.println();
            term.println("Expenses by Category:");
            for (CategoryTotal c : r.expensesByCategory()) {
                term.println("  " + c.category() + ": " + Money.format(c.total()));
            }
        }
    }

    private void setBudget(Session session, Terminal term) {
        AuthService.require(session);
        String category = term.prompt("Enter category: ");
        BigDecimal amount = parseAmount(term.prompt("Enter budget amount: "));
        YearMonth period = parseMonth(term.prompt("Enter month (YYYY-MM, blank for current): "));

        Budget b = budgets.setBudget(session, category, period, amount);
        term.println("Budget for " + b.category() + " set to " + Money.format(b.threshold())
                + " for " + b.period().format(MONTH_NAME) + ".");
    }

    private void viewBudgets(Session session, Terminal term) {
        AuthService.require(session);
        YearMonth period = parseMonth(term.prompt("Enter month (YYYY-MM, blank for current): "));
        List<BudgetStatus> all = budgets.listBudgets(session, period);
        if (all.isEmpty()) {
            term.println("No budgets set for " + period.format(MONTH_NAME) + ".");
            return;
        }
        term.println();
        term.println("Budgets for " + period.format(MONTH_NAME) + ":");
        term.println(RULE_NARROW);
        for (BudgetStatus st : all) {
            String tail = st.exceeded()
                    ? "over by " + Money.format(st.remaining().negate())
                    : Money.format(st.remaining()) + " left";
            term.println(st.category() + ": " + Money.format(st.threshold())
                    + " (spent " + Money.format(st.spent()) + ", " + tail + ")");
        }
        term.println(RULE_NARROW);
    }

    private void backup(Session session, Terminal term) {
        AuthService.require(session);
        String name = term.prompt("Enter backup filename: ");
        if (name.isEmpty()) {
            name = "finance_backup_" + LocalDateTime.now(clock).format(BACKUP_STAMP) + ".json";
        }
        Path written = backups.backup(session, Path.of(name));
        term.println("Backup created successfully: " + written);
    }

    private void restore(Session session, Terminal term) {
        AuthService.require(session);
        String name = term.prompt("Enter backup filename: ");
        if (name.isEmpty()) throw new ValidationException("Backup filename is required.");
        backups.restore(session, Path.of(name));
        term.println("Data restored successfully!");
    }

    // ---------- input parsing ----------
    private static BigDecimal parseAmount(String s) {
        try {
            return new BigDecimal(s);
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid amount. Please enter a number.");
        }
    }

    private static long parseId(String s) {
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid transaction ID.");
        }
    }

    private static TransactionType parseType(String s) {
        TransactionType t = TransactionType.parse(s);
        if (t == null) throw new ValidationException("Transaction type must be 'income' or 'expense'.");
        return t;
    }

    private LocalDate parseDate(String s) {
        if (s.isEmpty()) return LocalDate.now(clock);
        try {
            return LocalDate.parse(s);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid date '" + s + "'. Use YYYY-MM-DD.");
        }
    }

    private YearMonth parseMonth(String s) {
        if (s.isEmpty()) return YearMonth.now(clock);
        try {
            return YearMonth.parse(s);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid month '" + s + "'. Use YYYY-MM.");
        }
    }
}
