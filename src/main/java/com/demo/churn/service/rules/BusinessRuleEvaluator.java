package com.demo.churn.service.rules;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Set;

/**
 * Rule-based churn as of today: a customer is churned after 90 days without a
 * purchase, or 120 days while in the renewal grace period. Does not look at the model.
 */
@Component
public class BusinessRuleEvaluator {

    public static final int BASE_THRESHOLD_DAYS = 90;
    public static final int GRACE_EXTENSION_DAYS = 30;

    private static final Set<String> TRUE_TEXT = Set.of("1", "true", "yes", "y", "on");

    public BusinessRuleOutcome evaluate(String lastPurchaseDate, boolean inGrace, LocalDate today) {
        return evaluateParsed(parseDate(lastPurchaseDate), inGrace, today);
    }

    public BusinessRuleOutcome evaluateParsed(LocalDate lastPurchaseDate, boolean inGrace, LocalDate today) {
        long days = lastPurchaseDate == null ? 0 : Math.max(0, ChronoUnit.DAYS.between(lastPurchaseDate, today));
        int threshold = BASE_THRESHOLD_DAYS + (inGrace ? GRACE_EXTENSION_DAYS : 0);
        boolean churned = days >= threshold;
        return new BusinessRuleOutcome(days, threshold, churned, reason(days, threshold, inGrace, churned));
    }

    private static String reason(long days, int threshold, boolean inGrace, boolean churned) {
        if (churned) {
            if (inGrace && threshold > BASE_THRESHOLD_DAYS) {
                return "No purchases for " + days + " days; Grace period exceeded";
            }
            return "No purchases for " + days + " days";
        }
        if (inGrace && days < threshold) {
            return "In renewal grace period (extra 30 days)";
        }
        if (days < BASE_THRESHOLD_DAYS) {
            return "Recent purchase within last 90 days";
        }
        return "Within adjusted threshold";
    }

    static LocalDate parseDate(String text) {
        if (text == null || text.isBlank()) return null;
        String s = text.trim();
        if (s.length() > 10) s = s.substring(0, 10);
        try {
            return LocalDate.parse(s);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /** Grace flag as stored in the feature table: bit, number or text. Missing means not in grace. */
    public static boolean isInGrace(Object raw) {
        if (raw == null) return false;
        if (raw instanceof Boolean) return (Boolean) raw;
        if (raw instanceof Number) {
            double d = ((Number) raw).doubleValue();
            return !Double.isNaN(d) && d != 0.0;
        }
        return TRUE_TEXT.contains(raw.toString().trim().toLowerCase(Locale.ROOT));
    }
}
