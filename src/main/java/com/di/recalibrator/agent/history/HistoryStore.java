package com.di.recalibrator.agent.history;

import com.di.recalibrator.model.HistoryEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Append-only log of recalibration attempts and their follow-up events, scoped per horizon.
 * Readers only ever see committed entries.
 * Implementations: {@link JsonLinesHistoryStore} (default) and {@link InMemoryHistoryStore}.
 */
public interface HistoryStore {

    /**
     * Durably appends one entry. Returns only after the entry is committed.
     *
     * @throws com.di.recalibrator.exception.InfrastructureException if the append fails
     */
    void append(HistoryEntry entry);

    /** Committed entries for a horizon, oldest first. */
    List<HistoryEntry> entries(String horizon);

    default Optional<HistoryEntry> latest(String horizon) {
        List<HistoryEntry> all = entries(horizon);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }

    /** Latest ATTEMPT entry, whatever its decision. */
    default Optional<HistoryEntry> latestAttempt(String horizon) {
        List<HistoryEntry> all = entries(horizon);
        for (int i = all.size() - 1; i >= 0; i--) {
            if (all.get(i).isAttempt()) {
                return Optional.of(all.get(i));
            }
        }
        return Optional.empty();
    }

    /** Latest attempt that changed the live configuration. */
    default Optional<HistoryEntry> latestDeployment(String horizon) {
        List<HistoryEntry> all = entries(horizon);
        for (int i = all.size() - 1; i >= 0; i--) {
            if (all.get(i).isDeployment()) {
                return Optional.of(all.get(i));
            }
        }
        return Optional.empty();
    }

    /** Up to {@code limit} most recent entries, newest first. */
    default List<HistoryEntry> recent(String horizon, int limit) {
        List<HistoryEntry> all = entries(horizon);
        int from = Math.max(0, all.size() - limit);
        List<HistoryEntry> out = new ArrayList<>(all.subList(from, all.size()));
        Collections.reverse(out);
        return out;
    }
}
