package com.reviewflow.service;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.sql.SQLTransientException;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Decides whether a storage failure is worth retrying: connection drops, timeouts and
 * network hiccups are; constraint violations, bad SQL and business errors are not.
 */
@Component
public class TransientErrorClassifier implements Predicate<Throwable> {

    private static final List<String> TRANSIENT_MESSAGE_MARKERS = List.of(
            "connection reset",
            "connection refused",
            "connection terminated",
            "timeout",
            "timed out",
            "socket",
            "network",
            "fetch failed",
            "econnreset",
            "etimedout"
    );
    private static final int MAX_CAUSE_DEPTH = 16;

    @Override
    public boolean test(Throwable error) {
        return isTransient(error);
    }

    public boolean isTransient(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < MAX_CAUSE_DEPTH) {
            if (current instanceof TransientDataAccessException
                    || current instanceof DataAccessResourceFailureException
                    || current instanceof SQLTransientException
                    || current instanceof SocketException
                    || current instanceof SocketTimeoutException) {
                return true;
            }
            if (hasTransientMessage(current.getMessage())) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }

    private static boolean hasTransientMessage(String message) {
        if (message == null || message.isEmpty()) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        for (String marker : TRANSIENT_MESSAGE_MARKERS) {
            if (normalized.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
