package com.di.recalibrator.agent.history;

import com.di.recalibrator.model.HistoryEntry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of HistoryStore. Suitable for testing; nothing survives a restart.
 * When recalibrator.storage.history-store=jsonl (the default), JsonLinesHistoryStore is used instead.
 */
@Component
@ConditionalOnProperty(name = "recalibrator.storage.history-store", havingValue = "memory")
public class InMemoryHistoryStore implements HistoryStore {

    private final Map<String, List<HistoryEntry>> entriesByHorizon = new ConcurrentHashMap<>();

    @Override
    public void append(HistoryEntry entry) {
        if (entry == null || entry.getHorizon() == null) {
            throw new IllegalArgumentException("history entry must carry a horizon");
        }
        List<HistoryEntry> list = entriesByHorizon.computeIfAbsent(entry.getHorizon(), h -> new ArrayList<>());
        synchronized (list) {
            list.add(entry);
        }
    }

    @Override
    public List<HistoryEntry> entries(String horizon) {
        List<HistoryEntry> list = entriesByHorizon.get(horizon);
        if (list == null) {
            return List.of();
        }
        synchronized (list) {
            return List.copyOf(list);
        }
    }
}
