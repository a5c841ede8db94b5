package com.telcomax.assistant.eval;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Thread-safe store of cell outcomes keyed by {@link CellKey}. Each cell is written once.
 */
public class EvalGrid {

    private static final Comparator<CellKey> KEY_ORDER = Comparator
            .comparing(CellKey::chunk)
            .thenComparing(CellKey::retrieval)
            .thenComparing(CellKey::queryId);

    private final Map<CellKey, EvalCell> cells = new ConcurrentHashMap<>();

    public void put(EvalCell cell) {
        EvalCell previous = cells.putIfAbsent(cell.key(), cell);
        if (previous != null) {
            throw new IllegalStateException("Cell already recorded: " + cell.key());
        }
    }

    public Optional<EvalCell> get(CellKey key) {
        return Optional.ofNullable(cells.get(key));
    }

    public int size() {
        return cells.size();
    }

    /** All cells in chunk, retrieval, query order. */
    public List<EvalCell> cells() {
        return cells.values().stream()
                .sorted(Comparator.comparing(EvalCell::key, KEY_ORDER))
                .collect(Collectors.toList());
    }

    public List<EvalCell> succeeded(PairKey pair) {
        return cells().stream()
                .filter(c -> !c.isFailed() && c.key().pair().equals(pair))
                .collect(Collectors.toList());
    }

    public List<EvalCell> failed() {
        return cells().stream().filter(EvalCell::isFailed).collect(Collectors.toList());
    }
}
