package com.pocketledger.core.auth;

import com.pocketledger.core.crypto.PasswordHasher;
import com.pocketledger.core.error.AuthorizationException;
import com.pocketledger.core.error.ValidationException;
import com.pocketledger.core.model.Session;
import com.pocketledger.core.model.User;
import com.pocketledger.core.store.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Service
public class AuthService {
    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final Repository repo;
    private final PasswordHasher hasher;
    private final Clock clock;

    public AuthService(Repository repo, PasswordHasher hasher, Clock clock) {
        this.repo = repo;
        this.hasher = hasher;
        this.clock = clock;
    }

    public User register(String username, String password) {
        String name = username == null ? "" : username.trim();
        if (name.isEmpty() || password == null || password.isEmpty()) {
            throw new ValidationException("Username and password cannot be empty.");
        }
        if (repo.findUserByUsername(name).isPresent()) {
            throw new ValidationException("Username already exists. Please choose a different one.");
        }
        String hash = hasher.hash(password);
        Instant now = clock.instant();
        long id = repo.insertUser(name, hash, now);
        log.info("Registered user {} (id={})", name, id);
        return new User(id, name, hash, now);
    }

    public Session login(String username, String password) {
        String name = username == null ? "" : username.trim();
        User user = repo.findUserByUsername(name)
                .filter(u -> hasher.matches(password, u.passwordHash()))
                .orElse(null);
        if (user == null) {
            log.warn("Rejected login for {}", name);
            throw new AuthorizationException("Invalid username or password.");
        }
        return new Session(user.id(), user.username());
    }

    /**
     * Guard shared by every per-user operation.
     */
    public static Session require(Session session) {
        if (session == null) throw new AuthorizationException("Please log in first.");
        return session;
    }
}
