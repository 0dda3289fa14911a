package com.demo.churn.service.features;

import java.util.Locale;

/** How a raw feature value is printed inside a reason phrase. NaN always prints as "". */
public enum ValueFormat {

    DAYS {
        @Override
        String formatFinite(double v) {
            return String.format(Locale.US, "%d days", (long) Math.rint(v));
        }
    },
    COUNT {
        @Override
        String formatFinite(double v) {
            return String.format(Locale.US, "%,d", (long) Math.rint(v));
        }
    },
    PER_MONTH {
        @Override
        String formatFinite(double v) {
            return String.format(Locale.US, "%.2f per month", v);
        }
    },
    PERCENT {
        @Override
        String formatFinite(double v) {
            return String.format(Locale.US, "%+.1f%%", v);
        }
    },
    MONEY {
        @Override
        String formatFinite(double v) {
            if (v < 0) {
                return String.format(Locale.US, "-$%,.2f", Math.abs(v));
            }
            return String.format(Locale.US, "$%,.2f", v);
        }
    },
    GENERIC {
        @Override
        String formatFinite(double v) {
            double rounded = Math.rint(v);
            if (Math.abs(v - rounded) < 0.5) {
                return String.format(Locale.US, "%,d", (long) rounded);
            }
            return String.format(Locale.US, "%,.2f", v);
        }
    },
    /** Model signal components; printed like GENERIC but phrases show the label only. */
    SIGNAL {
        @Override
        String formatFinite(double v) {
            return GENERIC.formatFinite(v);
        }
    };

    public String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return "";
        }
        return formatFinite(value);
    }

    abstract String formatFinite(double value);
}
