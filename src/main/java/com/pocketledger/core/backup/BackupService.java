package com.pocketledger.core.backup;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pocketledger.core.auth.AuthService;
import com.pocketledger.core.budget.BudgetService;
import com.pocketledger.core.error.AuthorizationException;
import com.pocketledger.core.error.FinanceException;
import com.pocketledger.core.error.FormatException;
import com.pocketledger.core.error.NotFoundException;
import com.pocketledger.core.error.StorageException;
import com.pocketledger.core.ledger.LedgerService;
import com.pocketledger.core.model.Budget;
import com.pocketledger.core.model.Session;
import com.pocketledger.core.model.Snapshot;
import com.pocketledger.core.model.Transaction;
import com.pocketledger.core.model.TransactionFilter;
import com.pocketledger.core.model.TransactionType;
import com.pocketledger.core.store.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Exports a user's ledger and budgets to a JSON snapshot and restores them all-or-nothing.
 */
@Service
public class BackupService {
    private static final Logger log = LoggerFactory.getLogger(BackupService.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
    private final Repository repo;
    private final Clock clock;

    public BackupService(Repository repo, Clock clock) {
        this.repo = repo;
        this.clock = clock;
    }

    public Snapshot export(Session session) {
        Session s = AuthService.require(session);
        List<Snapshot.TransactionEntry> txs = repo.listTransactions(s.userId(), TransactionFilter.all()).stream()
                .map(t -> new Snapshot.TransactionEntry(t.id(), t.type().key(), t.amount(), t.category(),
                        t.description(), t.date()))
                .toList();
        List<Snapshot.BudgetEntry> budgets = repo.listBudgets(s.userId(), null).stream()
                .map(b -> new Snapshot.BudgetEntry(b.category(), b.period().getYear(),
                        b.period().getMonthValue(), b.threshold()))
                .toList();
        return new Snapshot(Snapshot.CURRENT_VERSION, s.username(), clock.instant(), txs, budgets);
    }

    public Path backup(Session session, Path file) {
        Snapshot snap = export(session);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(file, toJson(snap));
        } catch (IOException e) {
            throw new StorageException("Cannot write backup " + file + ": " + e.getMessage(), e);
        }
        log.info("Backup of {} written to {} ({} transactions, {} budgets)",
                snap.username(), file, snap.transactions().size(), snap.budgets().size());
        return file;
    }

    public String toJson(Snapshot snap) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(snap);
        } catch (JsonProcessingException e) {
            throw new StorageException(e);
        }
    }

    public Snapshot parse(String json) {
        try {
            return requireContent(mapper.readValue(json, Snapshot.class));
        } catch (JsonProcessingException e) {
            throw new FormatException("Backup file is not a valid snapshot: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses raw file content; encoding errors are reported like any other malformed input.
     */
    public Snapshot parse(byte[] content) {
        try {
            return requireContent(mapper.readValue(content, Snapshot.class));
        } catch (JsonProcessingException e) {
            throw new FormatException("Backup file is not a valid snapshot: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new FormatException("Backup file is not a valid snapshot: " + e.getMessage(), e);
        }
    }

    private static Snapshot requireContent(Snapshot snap) {
        if (snap == null) throw new FormatException("Backup file is empty.");
        return snap;
    }

    public void restore(Session session, Path file) {
        if (!Files.isRegularFile(file)) throw new NotFoundException("Backup file not found: " + file);
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new StorageException("Cannot read backup " + file + ": " + e.getMessage(), e);
        }
        restore(session, parse(content));
    }

    /**
     * Replaces the user's transactions and budgets with the snapshot content. The snapshot is fully
     * validated first and applied in a single database transaction.
     */
    public void restore(Session session, Snapshot snap) {
        Session s = AuthService.require(session);
        if (snap.formatVersion() != Snapshot.CURRENT_VERSION) {
            throw new FormatException("Unsupported backup format version: " + snap.formatVersion());
        }
        if (snap.transactions() == null || snap.budgets() == null) {
            throw new FormatException("Backup must contain 'transactions' and 'budgets' arrays.");
        }
        if (snap.username() == null || snap.username().isBlank()) {
            throw new FormatException("Backup must name the user it belongs to.");
        }
        if (!s.username().equals(snap.username())) {
            throw new AuthorizationException("Backup file does not belong to the current user.");
        }
        List<Transaction> txs = toTransactions(s.userId(), snap.transactions());
        List<Budget> budgets = toBudgets(s.userId(), snap.budgets());

        repo.inTransaction(() -> {
            for (Transaction t : txs) {
                if (t.id() == 0) continue;
                repo.findTransaction(t.id())
                        .filter(existing -> existing.userId() != s.userId())
                        .ifPresent(existing -> {
                            throw new FormatException("Transaction id " + t.id() + " belongs to another user.");
                        });
            }
            repo.deleteTransactionsOf(s.userId());
            repo.deleteBudgetsOf(s.userId());
            for (Transaction t : txs) repo.insertTransaction(t);
            for (Budget b : budgets) repo.upsertBudget(s.userId(), b.category(), b.period(), b.threshold());
        });
        log.info("Restored {} transactions and {} budgets for {}", txs.size(), budgets.size(), s.username());
    }

    private List<Transaction> toTransactions(long userId, List<Snapshot.TransactionEntry> entries) {
        List<Transaction> out = new ArrayList<>();
        Set<Long> ids = new HashSet<>();
        for (int i = 0; i < entries.size(); i++) {
            Snapshot.TransactionEntry e = entries.get(i);
            if (e == null) throw new FormatException("Transaction #" + (i + 1) + " is null.");
            long id = e.id() == null ? 0L : e.id();
            if (id < 0 || (id > 0 && !ids.add(id))) {
                throw new FormatException("Transaction #" + (i + 1) + " has an invalid or duplicate id: " + id);
            }
            Transaction t = new Transaction(id, userId, TransactionType.parse(e.type()), e.amount(),
                    e.category() == null ? null : e.category().trim(),
                    e.description() == null ? "" : e.description(),
                    e.date());
            try {
                LedgerService.validate(t);
            } catch (FinanceException ex) {
                throw new FormatException("Transaction #" + (i + 1) + ": " + ex.getMessage(), ex);
            }
            out.add(t);
        }
        return out;
    }

    private List<Budget> toBudgets(long userId, List<Snapshot.BudgetEntry> entries) {
        List<Budget> out = new ArrayList<>();
        Set<String> keys = new HashSet<>();
        for (int i = 0; i < entries.size(); i++) {
            Snapshot.BudgetEntry e = entries.get(i);
            if (e == null || e.year() == null || e.month() == null) {
                throw new FormatException("Budget #" + (i + 1) + " is missing its period.");
            }
            YearMonth period;
            try {
                period = YearMonth.of(e.year(), e.month());
            } catch (DateTimeException ex) {
                throw new FormatException("Budget #" + (i + 1) + " has an invalid period.", ex);
            }
            String category = e.category() == null ? null : e.category().trim();
            try {
                BudgetService.validate(category, period, e.threshold());
            } catch (FinanceException ex) {
                throw new FormatException("Budget #" + (i + 1) + ": " + ex.getMessage(), ex);
            }
            if (!keys.add(category + "|" + period)) {
                throw new FormatException("Duplicate budget for " + category + " in " + period + ".");
            }
            out.add(new Budget(0L, userId, category, period, e.threshold()));
        }
        return out;
    }
}
