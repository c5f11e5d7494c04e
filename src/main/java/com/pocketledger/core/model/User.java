package com.pocketledger.core.model;

import java.time.Instant;

public record User(
        long id,
        String username,
        String passwordHash, // scrypt$<cost>$<salt>$<hash>
        Instant createdAt
) {
}
