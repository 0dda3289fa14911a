package com.demo.churn.service.export;

import com.demo.churn.service.dto.ChurnPrediction;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Output columns of a scoring run. Constant order is the friendly layout; the
 * technical layout puts the business-rule and label columns first.
 */
public enum PredictionColumn {

    CUSTOMER_ID("Customer ID", "customer_id", 0, false, ChurnPrediction::getCustomerId),
    SNAPSHOT_DATE("Snapshot Date", "as_of_date_t0", 1, false, ChurnPrediction::getSnapshotDate),
    DAYS_SINCE_LAST_PURCHASE("Days Since Last Purchase (Today)", "days_since_last_purchase_today", 10, false,
            ChurnPrediction::getDaysSinceLastPurchaseToday),
    CHURNED_NOW("Churned Now (Business Rule)", "business_churn_now", 2, false, p -> p.isChurnedNow() ? 1 : 0),
    CHURNED_NOW_REASON("Why (Business Rule)", "business_churn_reason", 3, false, ChurnPrediction::getChurnedNowReason),
    ACTUAL_CHURNED("Churned Within 90 Days (Actual)", "actual_churned_90d_t0+90d", 4, true,
            ChurnPrediction::getActualChurned),
    ACTUAL_CHURN_REASON("Why They Churned (Actual)", "actual_churn_reason_t0", 5, true,
            ChurnPrediction::getActualChurnReason),
    PREDICTED_CHURN("Predicted to Churn (Next 90 Days)", "predicted_churn_90d_t0+90d", 6, false,
            ChurnPrediction::getPredictedChurn),
    CHURN_PROBABILITY_PCT("Churn Probability % (Next 90 Days)", "predicted_churn_probability_90d_pct_t0+90d", 8, false,
            ChurnPrediction::getChurnProbabilityPct),
    CHURN_PROBABILITY("Churn Probability (Next 90 Days)", "predicted_churn_probability_90d_t0+90d", 7, false,
            ChurnPrediction::getChurnProbability),
    PREDICTED_CHURN_REASON("Why At Risk (Predicted)", "predicted_churn_reason_t0", 9, false,
            ChurnPrediction::getPredictedChurnReason),
    CREATED_ON("Created On", "created_on", 11, false, ChurnPrediction::getCreatedOn);

    private static final Pattern TOKEN = Pattern.compile("[A-Za-z0-9]+");

    private final String friendlyHeader;
    private final String technicalHeader;
    private final int technicalOrder;
    private final boolean actualOnly;
    private final Function<ChurnPrediction, Object> extractor;

    PredictionColumn(String friendlyHeader, String technicalHeader, int technicalOrder, boolean actualOnly,
                     Function<ChurnPrediction, Object> extractor) {
        this.friendlyHeader = friendlyHeader;
        this.technicalHeader = technicalHeader;
        this.technicalOrder = technicalOrder;
        this.actualOnly = actualOnly;
        this.extractor = extractor;
    }

    public Object valueOf(ChurnPrediction p) {
        return extractor.apply(p);
    }

    /** Header after PascalCasing, e.g. "Churn Probability % (Next 90 Days)" becomes "ChurnProbabilityPctNext90Days". */
    public String header(HeaderStyle style) {
        return toPascal(style == HeaderStyle.TECHNICAL ? technicalHeader : friendlyHeader);
    }

    /** Table column name, which always follows the friendly header. */
    public String tableColumn() {
        return toPascal(friendlyHeader);
    }

    public static List<PredictionColumn> layout(HeaderStyle style, boolean includeActual) {
        Comparator<PredictionColumn> order = style == HeaderStyle.TECHNICAL
                ? Comparator.comparingInt(c -> c.technicalOrder)
                : Comparator.comparingInt(c -> c.ordinal());
        return Arrays.stream(values())
                .filter(c -> includeActual || !c.actualOnly)
                .sorted(order)
                .collect(Collectors.toList());
    }

    static String toPascal(String name) {
        Matcher m = TOKEN.matcher(name.replace("%", " Pct "));
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String t = m.group();
            if (t.chars().allMatch(Character::isDigit)) {
                sb.append(t);
            } else {
                sb.append(Character.toUpperCase(t.charAt(0))).append(t.substring(1).toLowerCase());
            }
        }
        return sb.toString();
    }
}
