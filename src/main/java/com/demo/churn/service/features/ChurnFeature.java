package com.demo.churn.service.features;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The fixed model feature schema. Declaration order is the column order of the
 * feature matrix, so do not reorder constants.
 *
 * <p>Each feature carries the direction in which it raises churn risk, the
 * friendly label used in reason phrases and the way its raw value is printed.
 */
public enum ChurnFeature {

    RECENCY_DAYS("recency_days", Direction.HIGH, "No purchases for", ValueFormat.DAYS),
    MEDIAN_GAP_DAYS("median_gap_days", Direction.HIGH, "Typical gap between purchases", ValueFormat.DAYS),
    P90_GAP_DAYS("p90_gap_days", Direction.HIGH, "Long purchase gaps (90th percentile)", ValueFormat.DAYS),
    CV_GAP("cv_gap", Direction.HIGH, "Irregular buying cadence", ValueFormat.GENERIC),
    IN_RENEWAL_GRACE("in_renewal_grace", Direction.FLAG, "In renewal grace period", ValueFormat.GENERIC),
    REV_180D("rev_180d", Direction.LOW, "Revenue in last 180 days", ValueFormat.MONEY),
    REV_RETURNS_90D("rev_returns_90d", Direction.HIGH, "Returns value in last 90 days", ValueFormat.MONEY),
    INVOICES_90D("invoices_90d", Direction.LOW, "Invoices in last 90 days", ValueFormat.COUNT),
    CREDIT_NOTES_90D("credit_notes_90d", Direction.HIGH, "Credit notes in last 90 days", ValueFormat.COUNT),
    ORDERS_POS_30D("orders_pos_30d", Direction.LOW, "Positive order value in last 30 days", ValueFormat.MONEY),
    ORDERS_NEG_30D("orders_neg_30d", Direction.HIGH, "Negative order value in last 30 days", ValueFormat.MONEY),
    BACKORDER_QTY_30D("backorder_qty_30d", Direction.HIGH, "Backorder quantity in last 30 days", ValueFormat.COUNT),
    PCT_CHANGE_3M("pct_change_3m", Direction.NEG, "Change vs prior 3 months", ValueFormat.PERCENT),
    PCT_CHANGE_6M("pct_change_6m", Direction.NEG, "Change vs prior 6 months", ValueFormat.PERCENT),
    YOY_CHANGE_PCT("yoy_change_pct", Direction.NEG, "Year-over-year change", ValueFormat.PERCENT),
    CREDIT_NOTES_PREV_MONTH("credit_notes_prev_month", Direction.HIGH, "Credit notes last month", ValueFormat.COUNT),
    INVOICES_POS_PREV_MONTH("invoices_pos_prev_month", Direction.LOW, "Invoices last month", ValueFormat.COUNT),
    CREDIT_NOTES_MA3("credit_notes_ma3", Direction.HIGH, "Credit notes per month (3-month average)", ValueFormat.PER_MONTH),
    THRESHOLD_DAYS("threshold_days", Direction.HIGH, "Days past expected purchase threshold", ValueFormat.DAYS),
    IS_MAINTENANCE_HEAVY("is_maintenance_heavy", Direction.FLAG, "Maintenance-heavy profile", ValueFormat.GENERIC),
    MAINT_CYCLE_DAYS("maint_cycle_days", Direction.HIGH, "Maintenance cycle length", ValueFormat.DAYS),
    SEVERITY_SCORE("severity_score", Direction.HIGH, "Issue severity score", ValueFormat.GENERIC),
    LATENESS_COMPONENT("lateness_component", Direction.HIGH, "Late purchase signal", ValueFormat.SIGNAL),
    CREDITS_COMPONENT("credits_component", Direction.HIGH, "Credits/returns signal", ValueFormat.SIGNAL),
    TREND_COMPONENT("trend_component", Direction.HIGH, "Negative trend signal", ValueFormat.SIGNAL),
    MITIGATOR_COMPONENT("mitigator_component", Direction.LOW, "Mitigating signals", ValueFormat.SIGNAL);

    /** Which side of a feature's value pushes churn risk up. */
    public enum Direction {
        /** Larger values increase risk. */
        HIGH,
        /** Smaller values increase risk. */
        LOW,
        /** Negative values increase risk. */
        NEG,
        /** Boolean flag, rendered as a fixed phrase when set. */
        FLAG
    }

    private static final List<ChurnFeature> SCHEMA = List.of(values());
    private static final Map<String, ChurnFeature> BY_COLUMN = Arrays.stream(values())
            .collect(Collectors.toMap(ChurnFeature::column, Function.identity()));

    private final String column;
    private final Direction direction;
    private final String label;
    private final ValueFormat format;

    ChurnFeature(String column, Direction direction, String label, ValueFormat format) {
        this.column = column;
        this.direction = direction;
        this.label = label;
        this.format = format;
    }

    public String column() { return column; }
    public Direction direction() { return direction; }
    public String label() { return label; }
    public ValueFormat format() { return format; }

    /** Label used when a LOW-direction feature is below average. */
    public String deficiencyLabel() {
        if (label.startsWith("Invoices")) return "Few invoices in last 90 days";
        if (label.startsWith("Positive order value")) return "Low positive order value (last 30 days)";
        if (label.startsWith("Revenue in")) return "Low recent revenue";
        if (label.startsWith("Mitigating")) return "Few mitigating signals";
        return label;
    }

    public static List<ChurnFeature> schema() {
        return SCHEMA;
    }

    public static List<String> columns() {
        return SCHEMA.stream().map(ChurnFeature::column).collect(Collectors.toList());
    }

    public static Optional<ChurnFeature> byColumn(String column) {
        return Optional.ofNullable(BY_COLUMN.get(column));
    }
}
