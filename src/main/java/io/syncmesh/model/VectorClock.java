package io.syncmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable mapping of node id to a monotonically non-decreasing counter.
 *
 * <p>Missing entries read as zero, so {@code {a:1}} and {@code {a:1, b:0}} compare as
 * {@link ClockOrder#EQUAL}. {@link #merge(VectorClock)} is the component-wise maximum:
 * commutative, idempotent, and dominating both inputs.
 */
public final class VectorClock {
    private static final VectorClock EMPTY = new VectorClock(new TreeMap<>());

    private final Map<String, Long> entries;

    private VectorClock(TreeMap<String, Long> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static VectorClock empty() {
        return EMPTY;
    }

    public static VectorClock of(String nodeId, long counter) {
        return of(Map.of(nodeId, counter));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static VectorClock of(Map<String, ? extends Number> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, Long> copy = new TreeMap<>();
        for (Map.Entry<String, ? extends Number> e : raw.entrySet()) {
            if (e.getKey() == null || e.getKey().isBlank() || e.getValue() == null) {
                continue;
            }
            long value = e.getValue().longValue();
            if (value < 0L) {
                throw new IllegalArgumentException("Negative clock entry for node " + e.getKey());
            }
            copy.put(e.getKey(), value);
        }
        return new VectorClock(copy);
    }

    @JsonValue
    public Map<String, Long> entries() {
        return entries;
    }

    public long get(String nodeId) {
        Long value = entries.get(nodeId);
        return value == null ? 0L : value;
    }

    public VectorClock increment(String nodeId) {
        Objects.requireNonNull(nodeId, "nodeId");
        TreeMap<String, Long> next = new TreeMap<>(entries);
        next.put(nodeId, get(nodeId) + 1L);
        return new VectorClock(next);
    }

    public VectorClock merge(VectorClock other) {
        TreeMap<String, Long> next = new TreeMap<>(entries);
        for (Map.Entry<String, Long> e : other.entries.entrySet()) {
            next.merge(e.getKey(), e.getValue(), Math::max);
        }
        return new VectorClock(next);
    }

    public ClockOrder compare(VectorClock other) {
        Set<String> nodes = new TreeSet<>(entries.keySet());
        nodes.addAll(other.entries.keySet());
        boolean greater = false;
        boolean less = false;
        for (String node : nodes) {
            long mine = get(node);
            long theirs = other.get(node);
            if (mine > theirs) {
                greater = true;
            } else if (mine < theirs) {
                less = true;
            }
        }
        if (greater && less) {
            return ClockOrder.CONCURRENT;
        }
        if (greater) {
            return ClockOrder.AFTER;
        }
        return less ? ClockOrder.BEFORE : ClockOrder.EQUAL;
    }

    public boolean dominates(VectorClock other) {
        return compare(other) == ClockOrder.AFTER;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VectorClock other)) {
            return false;
        }
        return compare(other) == ClockOrder.EQUAL;
    }

    @Override
    public int hashCode() {
        int hash = 0;
        for (Map.Entry<String, Long> e : entries.entrySet()) {
            if (e.getValue() != 0L) {
                hash += e.getKey().hashCode() ^ Long.hashCode(e.getValue());
            }
        }
        return hash;
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
