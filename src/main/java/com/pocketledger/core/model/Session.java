package com.pocketledger.core.model;

/**
 * The logged-in user, passed explicitly to every ledger, budget, report and backup call.
 */
public record Session(long userId, String username) {
}
