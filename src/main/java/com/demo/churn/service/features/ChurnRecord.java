package com.demo.churn.service.features;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of the churn feature table: a customer at a snapshot date.
 *
 * @param customerId   customer identifier
 * @param asOfDate     snapshot date (t0) as yyyy-MM-dd, may be null or blank
 * @param features     raw feature values keyed by column name, as the source returned them
 * @param label        raw label value, or null when the source carried no label
 */
public record ChurnRecord(long customerId, String asOfDate, Map<String, Object> features, Object label) {

    public ChurnRecord {
        features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
    }

    public Object feature(String column) {
        return features.get(column);
    }

    /** Raw value of the renewal-grace flag, which the business rule reads directly. */
    public Object renewalGrace() {
        return features.get(ChurnFeature.IN_RENEWAL_GRACE.column());
    }

    public boolean hasSnapshotDate() {
        return asOfDate != null && !asOfDate.isBlank();
    }
}
