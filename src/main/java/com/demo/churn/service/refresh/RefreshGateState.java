package com.demo.churn.service.refresh;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable snapshot of gate key to last successful run time (ISO-8601, UTC).
 * {@link #record} returns a new snapshot and leaves this one untouched.
 */
public final class RefreshGateState {

    private static final RefreshGateState EMPTY = new RefreshGateState(Map.of());

    private final Map<String, String> lastRuns;

    private RefreshGateState(Map<String, String> lastRuns) {
        this.lastRuns = Collections.unmodifiableMap(new TreeMap<>(lastRuns));
    }

    public static RefreshGateState empty() {
        return EMPTY;
    }

    public static RefreshGateState of(Map<String, String> lastRuns) {
        return lastRuns.isEmpty() ? EMPTY : new RefreshGateState(lastRuns);
    }

    /** Last recorded run for a key; empty when unknown or the stored value does not parse. */
    public Optional<Instant> lastRun(String key) {
        String iso = lastRuns.get(key);
        if (iso == null || iso.isBlank()) return Optional.empty();
        try {
            return Optional.of(OffsetDateTime.parse(iso).toInstant());
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(Instant.parse(iso));
            } catch (DateTimeParseException ignored) {
                return Optional.empty();
            }
        }
    }

    public RefreshGateState record(String key, Instant when) {
        Map<String, String> next = new TreeMap<>(lastRuns);
        next.put(key, OffsetDateTime.ofInstant(when, ZoneOffset.UTC).toString());
        return new RefreshGateState(next);
    }

    public Map<String, String> asMap() {
        return lastRuns;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RefreshGateState && ((RefreshGateState) o).lastRuns.equals(lastRuns);
    }

    @Override
    public int hashCode() {
        return lastRuns.hashCode();
    }

    @Override
    public String toString() {
        return "RefreshGateState" + lastRuns;
    }
}
