package com.demo.churn.service;

import com.demo.churn.service.export.HeaderStyle;
import com.demo.churn.service.export.LoadMode;
import lombok.Builder;
import lombok.Value;

/** Per-run switches for {@link ChurnScoringService#run}. */
@Value
@Builder(toBuilder = true)
public class ScoringRunOptions {

    /** Row limit for the source query; null means all rows. */
    Integer top;
    /** Keep only rows with this snapshot date (yyyy-MM-dd). */
    String asOf;
    boolean keepAllRows;

    boolean forceRefresh;
    boolean skipRefresh;

    /** Prediction CSV, relative to the output directory, or null for none. */
    String csvOutput;
    /** CSV of the deduplicated source rows, relative to the output directory, or null for none. */
    String rawOutput;
    @Builder.Default
    HeaderStyle headers = HeaderStyle.FRIENDLY;

    boolean writeTable;
    @Builder.Default
    LoadMode loadMode = LoadMode.REPLACE;

    public static ScoringRunOptions defaults() {
        return ScoringRunOptions.builder().build();
    }
}
