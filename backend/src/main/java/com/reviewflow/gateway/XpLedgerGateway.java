package com.reviewflow.gateway;

import com.reviewflow.model.XpTransaction;
import com.reviewflow.model.XpTransactionType;

import java.util.Optional;
import java.util.UUID;

/**
 * XP ledger owned by the rewards side of the platform. Recording an entry also moves
 * the user's running XP totals by {@code amount}.
 */
public interface XpLedgerGateway {

    XpTransaction recordXpTransaction(UUID userId, int amount, XpTransactionType type, String description, UUID sourceId);

    /**
     * Atomically records the entry unless one with the same (user, type, source) already exists.
     *
     * @return the new entry, or empty when the key was already taken
     */
    Optional<XpTransaction> recordXpTransactionIfAbsent(UUID userId,
                                                        int amount,
                                                        XpTransactionType type,
                                                        String description,
                                                        UUID sourceId);

    boolean hasTransaction(UUID userId, XpTransactionType type, UUID sourceId);
}
