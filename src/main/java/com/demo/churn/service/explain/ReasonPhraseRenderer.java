package com.demo.churn.service.explain;

import com.demo.churn.service.features.ChurnFeature;
import com.demo.churn.service.features.ValueFormat;
import org.springframework.stereotype.Component;

/**
 * Turns one feature contribution into a short English phrase, or "" when the
 * feature does not point toward churn for this row.
 */
@Component
public class ReasonPhraseRenderer {

    private static final String RECENCY_PREFIX = "No purchases for";

    /**
     * @param raw raw feature value before imputation, NaN when missing
     * @param z   standardized value the model saw
     */
    public String describe(ChurnFeature feature, double raw, double z) {
        String label = feature.label();
        String valueText = feature.format().format(raw);

        switch (feature.direction()) {
            case FLAG:
                return isSet(raw) ? label : "";
            case NEG:
                return !Double.isNaN(raw) && raw < 0 ? label + " (" + valueText + ")" : "";
            case HIGH:
                if (z <= 0) return "";
                if (feature.format() == ValueFormat.SIGNAL) return label;
                if (label.startsWith(RECENCY_PREFIX)) return (label + " " + valueText).trim();
                return withValue(label, valueText);
            case LOW:
                if (z >= 0) return "";
                String base = feature.deficiencyLabel();
                if (feature.format() == ValueFormat.SIGNAL) return base;
                return withValue(base, valueText);
            default:
                return withValue(label, valueText);
        }
    }

    private static String withValue(String label, String valueText) {
        return valueText.isEmpty() ? label : label + " (" + valueText + ")";
    }

    private static boolean isSet(double raw) {
        return !Double.isNaN(raw) && raw != 0.0;
    }
}
