package com.pocketledger.core.budget;

import com.pocketledger.TestStores;
import com.pocketledger.core.error.NotFoundException;
import com.pocketledger.core.error.ValidationException;
import com.pocketledger.core.ledger.LedgerService;
import com.pocketledger.core.model.BudgetStatus;
import com.pocketledger.core.model.Session;
import com.pocketledger.core.model.TransactionType;
import com.pocketledger.core.store.SqliteRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BudgetServiceTest {

    private static final YearMonth SEP = YearMonth.of(2025, 9);

    private BudgetService budgets;
    private LedgerService ledger;
    private Session alice;
    private Session bob;

    @BeforeEach
    void setUp() {
        SqliteRepository repo = TestStores.memoryRepository();
        budgets = new BudgetService(repo);
        ledger = new LedgerService(repo);
        alice = TestStores.user(repo, "alice");
        bob = TestStores.user(repo, "bob");
    }

    private long spend(Session s, String amount, String category, LocalDate date) {
        return ledger.addTransaction(s, TransactionType.EXPENSE, new BigDecimal(amount), category, "", date);
    }

    @Test
    void zeroThresholdWithNothingSpentIsNotExceeded() {
        budgets.setBudget(alice, "Food", SEP, BigDecimal.ZERO);

        BudgetStatus st = budgets.checkBudget(alice, "Food", SEP);
        assertThat(st.spent()).isEqualByComparingTo("0");
        assertThat(st.exceeded()).isFalse();
    }

    @Test
    void exceededOnlyWhenSpentIsStrictlyAboveThreshold() {
        budgets.setBudget(alice, "Food", SEP, new BigDecimal("100"));
        spend(alice, "60", "Food", SEP.atDay(3));
        spend(alice, "40", "Food", SEP.atDay(20));

        BudgetStatus atLimit = budgets.checkBudget(alice, "Food", SEP);
        assertThat(atLimit.spent()).isEqualByComparingTo("100");
        assertThat(atLimit.exceeded()).isFalse();
        assertThat(atLimit.remaining()).isEqualByComparingTo("0");

        spend(alice, "0.01", "Food", SEP.atEndOfMonth());
        assertThat(budgets.checkBudget(alice, "Food", SEP).exceeded()).isTrue();
    }

    @Test
    void onlyCountsExpensesOfThatCategoryMonthAndUser() {
        budgets.setBudget(alice, "Food", SEP, new BigDecimal("50"));
        spend(alice, "20", "Food", SEP.atDay(1));
        spend(alice, "500", "Travel", SEP.atDay(1));
        spend(alice, "500", "Food", SEP.minusMonths(1).atDay(31));
        spend(bob, "500", "Food", SEP.atDay(1));
        ledger.addTransaction(alice, TransactionType.INCOME, new BigDecimal("500"), "Food", "", SEP.atDay(2));

        assertThat(budgets.checkBudget(alice, "Food", SEP).spent()).isEqualByComparingTo("20");
    }

    @Test
    void statusFollowsLedgerChanges() {
        budgets.setBudget(alice, "Food", SEP, new BigDecimal("50"));
        long id = spend(alice, "80", "Food", SEP.atDay(5));
        assertThat(budgets.checkBudget(alice, "Food", SEP).exceeded()).isTrue();

        ledger.deleteTransaction(alice, id);
        assertThat(budgets.checkBudget(alice, "Food", SEP).exceeded()).isFalse();
    }

    @Test
    void setBudgetUpserts() {
        budgets.setBudget(alice, "Food", SEP, new BigDecimal("100"));
        budgets.setBudget(alice, "Food", SEP, new BigDecimal("250"));
        budgets.setBudget(alice, "Rent", SEP, new BigDecimal("900"));

        assertThat(budgets.listBudgets(alice, SEP))
                .extracting(BudgetStatus::category).containsExactly("Food", "Rent");
        assertThat(budgets.checkBudget(alice, "Food", SEP).threshold()).isEqualByComparingTo("250");
        assertThat(budgets.listBudgets(bob, SEP)).isEmpty();
    }

    @Test
    void rejectsNegativeThresholdAndUnknownBudgets() {
        assertThatThrownBy(() -> budgets.setBudget(alice, "Food", SEP, new BigDecimal("-1")))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> budgets.setBudget(alice, " ", SEP, BigDecimal.TEN))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> budgets.checkBudget(alice, "Food", SEP))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> budgets.deleteBudget(alice, "Food", SEP))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void deleteRemovesTheBudget() {
        budgets.setBudget(alice, "Food", SEP, BigDecimal.TEN);
        budgets.deleteBudget(alice, "Food", SEP);
        assertThatThrownBy(() -> budgets.checkBudget(alice, "Food", SEP)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void alertOnlyForExpensesThatPushABudgetOver() {
        budgets.setBudget(alice, "Food", SEP, new BigDecimal("100"));
        long under = spend(alice, "90", "Food", SEP.atDay(2));
        assertThat(budgets.alertFor(alice, ledger.getTransaction(alice, under))).isEmpty();

        long over = spend(alice, "20", "Food", SEP.atDay(3));
        assertThat(budgets.alertFor(alice, ledger.getTransaction(alice, over)))
                .hasValueSatisfying(st -> assertThat(st.spent()).isEqualByComparingTo("110"));

        long noBudget = spend(alice, "999", "Travel", SEP.atDay(3));
        assertThat(budgets.alertFor(alice, ledger.getTransaction(alice, noBudget))).isEmpty();
    }

    @Test
    void rejectsThresholdsOutOfRange() {
        assertThatThrownBy(() -> budgets.setBudget(alice, "Food", SEP, new BigDecimal("1E2000000000")))
                .isInstanceOf(ValidationException.class).hasMessageContaining("out of range");
        assertThatThrownBy(() -> budgets.setBudget(alice, "Food", SEP, new BigDecimal("0.00000000001")))
                .isInstanceOf(ValidationException.class);
        assertThat(budgets.listBudgets(alice, SEP)).isEmpty();
    }
}
