package com.pocketledger.core.ledger;

import com.pocketledger.core.auth.AuthService;
import com.pocketledger.core.error.AuthorizationException;
import com.pocketledger.core.error.NotFoundException;
import com.pocketledger.core.error.ValidationException;
import com.pocketledger.core.model.Session;
import com.pocketledger.core.model.Transaction;
import com.pocketledger.core.model.TransactionFilter;
import com.pocketledger.core.model.TransactionType;
import com.pocketledger.core.model.TransactionUpdate;
import com.pocketledger.core.store.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Service
public class LedgerService {
    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

    static final int MAX_INTEGER_DIGITS = 15;
    static final int MAX_SCALE = 10;

    private final Repository repo;

    public LedgerService(Repository repo) {
        this.repo = repo;
    }

    public long addTransaction(Session session, TransactionType type, BigDecimal amount,
                               String category, String description, LocalDate date) {
        Session s = AuthService.require(session);
        Transaction t = new Transaction(0L, s.userId(), type, amount,
                category == null ? null : category.trim(),
                description == null ? "" : description.trim(),
                date);
        validate(t);
        long id = repo.insertTransaction(t);
        log.debug("User {} added {} #{}", s.userId(), type.key(), id);
        return id;
    }

    public Transaction getTransaction(Session session, long id) {
        return requireOwned(AuthService.require(session), id);
    }

    public Transaction updateTransaction(Session session, long id, TransactionUpdate update) {
        Session s = AuthService.require(session);
        if (update == null || update.isEmpty()) throw new ValidationException("No updates provided.");
        Transaction current = requireOwned(s, id);
        Transaction next = update.applyTo(current);
        validate(next);
        repo.updateTransaction(next);
        return next;
    }

    public void deleteTransaction(Session session, long id) {
        Session s = AuthService.require(session);
        requireOwned(s, id);
        repo.deleteTransaction(id);
        log.debug("User {} deleted #{}", s.userId(), id);
    }

    public List<Transaction> listTransactions(Session session, TransactionFilter filter) {
        Session s = AuthService.require(session);
        TransactionFilter f = filter == null ? TransactionFilter.all() : filter;
        if (f.dateFrom() != null && f.dateTo() != null && f.dateFrom().isAfter(f.dateTo())) {
            throw new ValidationException("Start date must not be after end date.");
        }
        if (f.category() != null && f.category().isBlank()) {
            f = new TransactionFilter(f.dateFrom(), f.dateTo(), null, f.type());
        }
        return repo.listTransactions(s.userId(), f);
    }

    private Transaction requireOwned(Session s, long id) {
        Transaction t = repo.findTransaction(id)
                .orElseThrow(() -> new NotFoundException("Transaction " + id + " not found."));
        if (t.userId() != s.userId()) {
            log.warn("User {} tried to access transaction #{} of another user", s.userId(), id);
            throw new AuthorizationException("You don't have permission to access transaction " + id + ".");
        }
        return t;
    }

    /**
     * Bounds a decimal to at most 15 integer digits and 10 fractional digits.
     */
    public static void requireInRange(BigDecimal value, String label) {
        long integerDigits = (long) value.precision() - value.scale();
        if (integerDigits > MAX_INTEGER_DIGITS || value.scale() > MAX_SCALE) {
            throw new ValidationException(label + " is out of range (at most " + MAX_INTEGER_DIGITS
                    + " digits before and " + MAX_SCALE + " after the decimal point).");
        }
    }

    /**
     * Rules every stored transaction satisfies; shared with restore.
     */
    public static void validate(Transaction t) {
        if (t.type() == null) {
            throw new ValidationException("Transaction type must be 'income' or 'expense'.");
        }
        if (t.amount() == null || t.amount().signum() <= 0) {
            throw new ValidationException("Amount must be positive.");
        }
        requireInRange(t.amount(), "Amount");
        if (t.category() == null || t.category().isBlank()) {
            throw new ValidationException("Category cannot be empty.");
        }
        if (t.date() == null) {
            throw new ValidationException("Date is required.");
        }
    }
}
