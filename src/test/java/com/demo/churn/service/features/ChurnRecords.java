package com.demo.churn.service.features;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/** Deterministic synthetic feature rows for tests. Churned customers have long recency and falling revenue. */
public final class ChurnRecords {

    private ChurnRecords() {}

    public static List<ChurnRecord> population(int n, long seed) {
        Random rnd = new Random(seed);
        List<ChurnRecord> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            boolean churned = i % 3 == 0;
            out.add(new ChurnRecord(1000 + i, "2024-03-01", features(rnd, churned), churned ? 1 : 0));
        }
        return out;
    }

    public static Map<String, Object> features(Random rnd, boolean churned) {
        Map<String, Object> f = new LinkedHashMap<>();
        double noise = rnd.nextGaussian();
        f.put("recency_days", churned ? 120 + 20 * rnd.nextDouble() : 15 + 20 * rnd.nextDouble());
        f.put("median_gap_days", 20 + 10 * rnd.nextDouble());
        f.put("p90_gap_days", 40 + 20 * rnd.nextDouble());
        f.put("cv_gap", 0.5 + 0.2 * noise);
        f.put("in_renewal_grace", rnd.nextInt(5) == 0);
        f.put("rev_180d", churned ? 1000 + 500 * rnd.nextDouble() : 8000 + 3000 * rnd.nextDouble());
        f.put("rev_returns_90d", 100 * rnd.nextDouble());
        f.put("invoices_90d", churned ? rnd.nextInt(2) : 5 + rnd.nextInt(6));
        f.put("credit_notes_90d", rnd.nextInt(3));
        f.put("orders_pos_30d", churned ? 0.0 : 500 + 200 * rnd.nextDouble());
        f.put("orders_neg_30d", -50 * rnd.nextDouble());
        f.put("backorder_qty_30d", rnd.nextInt(4));
        f.put("pct_change_3m", churned ? -40 + 10 * noise : 5 + 10 * noise);
        f.put("pct_change_6m", churned ? -30 + 10 * noise : 3 + 10 * noise);
        f.put("yoy_change_pct", 10 * noise);
        f.put("credit_notes_prev_month", rnd.nextInt(2));
        f.put("invoices_pos_prev_month", churned ? 0 : 1 + rnd.nextInt(3));
        f.put("credit_notes_ma3", rnd.nextDouble());
        f.put("threshold_days", 60 + 30 * rnd.nextDouble());
        f.put("is_maintenance_heavy", rnd.nextBoolean() ? 1 : 0);
        f.put("maint_cycle_days", 90 + 30 * rnd.nextDouble());
        f.put("severity_score", 10 * rnd.nextDouble());
        f.put("lateness_component", churned ? 0.8 : 0.1 + 0.1 * rnd.nextDouble());
        f.put("credits_component", 0.2 * rnd.nextDouble());
        f.put("trend_component", churned ? 0.6 : 0.1 * rnd.nextDouble());
        f.put("mitigator_component", churned ? 0.05 : 0.5 + 0.2 * rnd.nextDouble());
        return f;
    }

    public static Map<String, Object> allNull() {
        Map<String, Object> f = new LinkedHashMap<>();
        for (String c : ChurnFeature.columns()) f.put(c, null);
        return f;
    }
}
