package com.pocketledger.core.store;

import com.pocketledger.core.error.StorageException;
import com.pocketledger.core.model.Budget;
import com.pocketledger.core.model.DateRange;
import com.pocketledger.core.model.Transaction;
import com.pocketledger.core.model.TransactionFilter;
import com.pocketledger.core.model.TransactionType;
import com.pocketledger.core.model.User;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class SqliteRepository implements Repository {

    private final Connection conn;

    public SqliteRepository(Connection conn) {
        this.conn = conn;
        init();
    }

    @Override
    public void init() {
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA foreign_keys = ON");
            st.executeUpdate("CREATE TABLE IF NOT EXISTS users (" +
                    "id INTEGER PRIMARY KEY AUTOINCREMENT," +
                    "username TEXT UNIQUE NOT NULL," +
                    "password TEXT NOT NULL," +
                    "created_at TEXT NOT NULL" +
                    ")");
            st.executeUpdate("CREATE TABLE IF NOT EXISTS transactions (" +
                    "id INTEGER PRIMARY KEY AUTOINCREMENT," +
                    "user_id INTEGER NOT NULL REFERENCES users(id)," +
                    "type TEXT NOT NULL CHECK(type IN ('income', 'expense'))," +
                    "amount TEXT NOT NULL," +
                    "category TEXT NOT NULL," +
                    "description TEXT," +
                    "date TEXT NOT NULL" +
                    ")");
            st.executeUpdate("CREATE INDEX IF NOT EXISTS idx_transactions_user_date ON transactions(user_id, date)");
            st.executeUpdate("CREATE TABLE IF NOT EXISTS budgets (" +
                    "id INTEGER PRIMARY KEY AUTOINCREMENT," +
                    "user_id INTEGER NOT NULL REFERENCES users(id)," +
                    "category TEXT NOT NULL," +
                    "year INTEGER NOT NULL," +
                    "month INTEGER NOT NULL," +
                    "threshold TEXT NOT NULL," +
                    "UNIQUE(user_id, category, year, month)" +
                    ")");
        } catch (SQLException e) {
            throw new StorageException(e);
        }
    }

    // ---------- Users ----------
    @Override
    public long insertUser(String username, String passwordHash, Instant createdAt) {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO users(username,password,created_at) VALUES(?,?,?)")) {
            ps.setString(1, username);
            ps.setString(2, passwordHash);
            ps.setString(3, createdAt.toString());
            ps.executeUpdate();
            return lastInsertId();
        } catch (SQLException e) {
            throw new StorageException(e);
        }
    }

    @Override
    public Optional<User> findUserByUsername(String username) {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM users WHERE username=?")) {
            ps.setString(1, username);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new User(
                        rs.getLong("id"),
                        rs.getString("username"),
                        rs.getString("password"),
                        Instant.parse(rs.getString("created_at"))
                ));
            }
        } catch (SQLException e) {
            throw new StorageException(e);
        }
    }

    // ---------- Transactions ----------
    @Override
    public long insertTransaction(Transaction t) {
        boolean explicitId = t.id() > 0;
        String sql = explicitId
                ? "INSERT INTO transactions(user_id,type,amount,category,description,date,id) VALUES(?,?,?,?,?,?,?)"
                : "INSERT INTO transactions(user_id,type,amount,category,description,date) VALUES(?,?,?,?,?,?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, t.userId());
            ps.setString(2, t.type().key());
            ps.setString(3, t.amount().toPlainString());
            ps.setString(4, t.category());
            ps.setString(5, t.description());
            ps.setString(6, t.date().toString());
            if (explicitId) ps.setLong(7, t.id());
            ps.executeUpdate();
            return explicitId ? t.id() : lastInsertId();
        } catch (SQLException e) {
            throw new StorageException(e);
        }
    }

    @Override
    public void updateTransaction(Transaction t) {
        try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE transactions SET type=?, amount=?, category=?, description=?, date=? WHERE id=? AND user_id=?")) {
            ps.setString(1, t.type().key());
            ps.setString(2, t.amount().toPlainString());
            ps.setString(3, t.category());
            ps.setString(4, t.description());
            ps.setString(5, t.date().toString());
            ps.setLong(6, t.id());
            ps.setLong(7, t.userId());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException(e);
        }
    }

    @Override
    public boolean deleteTransaction(long id) {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM transactions WHERE id=?")) {
            ps.setLong(1, id);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StorageException(e);
        }
    }

    @Override
    public Optional<Transaction> findTransaction(long id) {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM transactions WHERE id=?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(mapTransaction(rs));
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException(e);
        }
    }

    @Override
    public List<Transaction> listTransactions(long userId, TransactionFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT * FROM transactions WHERE user_id=?");
        List<String> params = new ArrayList<>();
        if (filter.dateFrom() != null) {
            sql.append(" AND date >= ?");
            params.add(filter.dateFrom().toString());
        }
        if (filter.dateTo() != null) {
            sql.append(" AND date <= ?");
            params.add(filter.dateTo().toString());
        }
        if (filter.category() != null) {
            sql.append(" AND category = ?");
            params.add(filter.category());
        }
        if (filter.type() != null) {
            sql.append(" AND type = ?");
            params.add(filter.type().key());
        }
        sql.append(" ORDER BY date ASC, id ASC");

        try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            ps.setLong(1, userId);
            for (int i = 0; i < params.size(); i++) ps.setString(i + 2, params.get(i));
            List<Transaction> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(mapTransaction(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException(e);
        }
    }

    @Override
    public BigDecimal sumExpenses(long userId, String category, DateRange range) {
        // amounts are decimal text, SQL SUM would go through REAL
        BigDecimal total = BigDecimal.ZERO;
        TransactionFilter f = new TransactionFilter(range.from(), range.to(), category, TransactionType.EXPENSE);
        for (Transaction t : listTransactions(userId, f)) total = total.add(t.amount());
        return total;
    }

    @Override
    public void deleteTransactionsOf(long userId) {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM transactions WHERE user_id=?")) {
            ps.setLong(1, userId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException(e);
        }
    }

    private Transaction mapTransaction(ResultSet rs) throws SQLException {
        String description = rs.getString("description");
        return new Transaction(
                rs.getLong("id"),
                rs.getLong("user_id"),
                TransactionType.parse(rs.getString("type")),
                new BigDecimal(rs.getString("amount")),
                rs.getString("category"),
                description == null ? "" : description,
                LocalDate.parse(rs.getString("date"))
        );
    }

    // ---------- Budgets ----------
    @Override
    public Budget upsertBudget(long userId, String category, YearMonth period, BigDecimal threshold) {
        String sql = "INSERT INTO budgets(user_id,category,year,month,threshold) VALUES(?,?,?,?,?) " +
                "ON CONFLICT(user_id,category,year,month) DO UPDATE SET threshold=excluded.threshold";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, userId);
            ps.setString(2, category);
            ps.setInt(3, period.getYear());
            ps.setInt(4, period.getMonthValue());
            ps.setString(5, threshold.toPlainString());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException(e);
        }
        return findBudget(userId, category, period)
                .orElseThrow(() -> new StorageException("Budget vanished after upsert: " + category, null));
    }

    @Override
    public Optional<Budget> findBudget(long userId, String category, YearMonth period) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT * FROM budgets WHERE user_id=? AND category=? AND year=? AND month=?")) {
            ps.setLong(1, userId);
            ps.setString(2, category);
            ps.setInt(3, period.getYear());
            ps.setInt(4, period.getMonthValue());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(mapBudget(rs));
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException(e);
        }
    }

    @Override
    public List<Budget> listBudgets(long userId, YearMonth period) {
        String sql = period == null
                ? "SELECT * FROM budgets WHERE user_id=? ORDER BY year ASC, month ASC, category ASC"
                : "SELECT * FROM budgets WHERE user_id=? AND year=? AND month=? ORDER BY category ASC";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, userId);
            if (period != null) {
                ps.setInt(2, period.getYear());
                ps.setInt(3, period.getMonthValue());
            }
            List<Budget> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(mapBudget(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException(e);
        }
    }

    @Override
    public boolean deleteBudget(long userId, String category, YearMonth period) {
        try (PreparedStatement ps = conn.prepareStatement(
                "DELETE FROM budgets WHERE user_id=? AND category=? AND year=? AND month=?")) {
            ps.setLong(1, userId);
            ps.setString(2, category);
            ps.setInt(3, period.getYear());
            ps.setInt(4, period.getMonthValue());
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StorageException(e);
        }
    }

    @Override
    public void deleteBudgetsOf(long userId) {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM budgets WHERE user_id=?")) {
            ps.setLong(1, userId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException(e);
        }
    }

    private Budget mapBudget(ResultSet rs) throws SQLException {
        return new Budget(
                rs.getLong("id"),
                rs.getLong("user_id"),
                rs.getString("category"),
                YearMonth.of(rs.getInt("year"), rs.getInt("month")),
                new BigDecimal(rs.getString("threshold"))
        );
    }

    // ---------- Unit of work ----------
    @Override
    public void inTransaction(Runnable work) {
        try {
            if (!conn.getAutoCommit()) {
                // already inside one
                work.run();
                return;
            }
            conn.setAutoCommit(false);
            try {
                work.run();
                conn.commit();
            } catch (RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException(e);
        }
    }

    private long lastInsertId() throws SQLException {
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }
}
