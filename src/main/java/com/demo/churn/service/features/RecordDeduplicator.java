package com.demo.churn.service.features;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Snapshot-date filtering and per-customer deduplication of source records. */
@Component
public class RecordDeduplicator {

    // Undated rows sort first so any dated snapshot replaces them.
    private static final Comparator<ChurnRecord> BY_SNAPSHOT = Comparator.comparing(
            (ChurnRecord r) -> r.hasSnapshotDate() ? r.asOfDate().trim() : null,
            Comparator.nullsFirst(Comparator.naturalOrder()));

    /**
     * Keeps the latest snapshot per customer. Equal dates resolve to the record that
     * came later from the source. Output is ordered by snapshot date.
     */
    public List<ChurnRecord> latestPerCustomer(List<ChurnRecord> records) {
        List<ChurnRecord> sorted = new ArrayList<>(records);
        sorted.sort(BY_SNAPSHOT);

        Map<Long, ChurnRecord> latest = new LinkedHashMap<>();
        for (ChurnRecord r : sorted) {
            latest.remove(r.customerId());
            latest.put(r.customerId(), r);
        }
        return new ArrayList<>(latest.values());
    }

    public List<ChurnRecord> filterAsOf(List<ChurnRecord> records, String asOf) {
        if (asOf == null || asOf.isBlank()) return records;
        String wanted = asOf.trim();
        return records.stream()
                .filter(r -> r.hasSnapshotDate() && r.asOfDate().trim().equals(wanted))
                .collect(Collectors.toList());
    }
}
