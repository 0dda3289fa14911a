package com.demo.churn.service.features;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecordDeduplicatorTest {

    private final RecordDeduplicator deduplicator = new RecordDeduplicator();

    private static ChurnRecord rec(long id, String date, int marker) {
        return new ChurnRecord(id, date, ChurnRecords.allNull(), marker);
    }

    @Test
    void latestPerCustomer_keepsLatestSnapshot() {
        List<ChurnRecord> out = deduplicator.latestPerCustomer(List.of(
                rec(7, "2024-03-01", 1),
                rec(7, "2024-01-01", 2)));

        assertThat(out).hasSize(1);
        assertThat(out.get(0).asOfDate()).isEqualTo("2024-03-01");
    }

    @Test
    void latestPerCustomer_datedRowBeatsUndatedRow() {
        List<ChurnRecord> out = deduplicator.latestPerCustomer(List.of(
                rec(7, "2024-01-01", 1),
                rec(7, null, 2),
                rec(8, "  ", 3)));

        assertThat(out).extracting(ChurnRecord::customerId).containsExactlyInAnyOrder(7L, 8L);
        assertThat(out).filteredOn(r -> r.customerId() == 7).extracting(ChurnRecord::label).containsExactly(1);
    }

    @Test
    void latestPerCustomer_equalDatesKeepLaterSourceRow() {
        List<ChurnRecord> out = deduplicator.latestPerCustomer(List.of(
                rec(7, "2024-01-01", 1),
                rec(7, "2024-01-01", 2)));

        assertThat(out).extracting(ChurnRecord::label).containsExactly(2);
    }

    @Test
    void filterAsOf_keepsOnlyMatchingSnapshot() {
        List<ChurnRecord> all = List.of(rec(1, "2024-01-01", 0), rec(2, "2024-02-01", 0), rec(3, null, 0));

        assertThat(deduplicator.filterAsOf(all, "2024-02-01")).extracting(ChurnRecord::customerId).containsExactly(2L);
        assertThat(deduplicator.filterAsOf(all, null)).hasSize(3);
    }
}
