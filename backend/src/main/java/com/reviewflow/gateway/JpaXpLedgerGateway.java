package com.reviewflow.gateway;

import com.reviewflow.model.XpTransaction;
import com.reviewflow.model.XpTransactionType;
import com.reviewflow.repository.ReviewerRepository;
import com.reviewflow.repository.XpTransactionRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class JpaXpLedgerGateway implements XpLedgerGateway {

    private static final Logger log = LoggerFactory.getLogger(JpaXpLedgerGateway.class);

    private final XpTransactionRepository xpTransactionRepository;
    private final ReviewerRepository reviewerRepository;

    @Override
    @Transactional
    public XpTransaction recordXpTransaction(UUID userId,
                                             int amount,
                                             XpTransactionType type,
                                             String description,
                                             UUID sourceId) {
        XpTransaction transaction = newTransaction(userId, amount, type, description, sourceId);
        XpTransaction saved = xpTransactionRepository.saveAndFlush(transaction);
        applyToUserTotals(userId, amount, saved.getCreatedAt());
        return saved;
    }

    @Override
    @Transactional
    public Optional<XpTransaction> recordXpTransactionIfAbsent(UUID userId,
                                                               int amount,
                                                               XpTransactionType type,
                                                               String description,
                                                               UUID sourceId) {
        Objects.requireNonNull(sourceId, "sourceId is required for keyed ledger entries");
        XpTransaction transaction = newTransaction(userId, amount, type, description, sourceId);

        int inserted = xpTransactionRepository.insertIfAbsent(
                transaction.getId(),
                transaction.getUserId(),
                transaction.getAmount(),
                transaction.getType().name(),
                transaction.getDescription(),
                transaction.getSourceId(),
                transaction.getCreatedAt()
        );
        if (inserted == 0) {
            log.debug("Ledger entry {} for user {} and source {} already exists", type, userId, sourceId);
            return Optional.empty();
        }

        applyToUserTotals(userId, amount, transaction.getCreatedAt());
        return Optional.of(transaction);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasTransaction(UUID userId, XpTransactionType type, UUID sourceId) {
        return xpTransactionRepository.existsByUserIdAndTypeAndSourceId(userId, type, sourceId);
    }

    private void applyToUserTotals(UUID userId, int amount, OffsetDateTime at) {
        int updated = reviewerRepository.applyXpDelta(userId, amount, at);
        if (updated == 0) {
            throw new IllegalStateException("User not found for XP transaction: " + userId);
        }
    }

    private static XpTransaction newTransaction(UUID userId,
                                                int amount,
                                                XpTransactionType type,
                                                String description,
                                                UUID sourceId) {
        Objects.requireNonNull(userId, "userId is required");
        Objects.requireNonNull(type, "type is required");

        XpTransaction transaction = new XpTransaction();
        transaction.setId(UUID.randomUUID());
        transaction.setUserId(userId);
        transaction.setAmount(amount);
        transaction.setType(type);
        transaction.setDescription(description);
        transaction.setSourceId(sourceId);
        transaction.setCreatedAt(OffsetDateTime.now());
        return transaction;
    }
}
