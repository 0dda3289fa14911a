package com.demo.churn.service.features;

import com.demo.churn.service.error.SchemaException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Coerces raw feature values into the numeric matrix the model trains on.
 * Booleans become 1/0, anything that is not a number becomes NaN.
 */
@Component
public class FeatureNormalizer {

    public FeatureMatrix normalize(List<ChurnRecord> records) {
        return normalizeRows(records.stream().map(ChurnRecord::features).collect(Collectors.toList()));
    }

    public FeatureMatrix normalizeRows(List<Map<String, Object>> rows) {
        List<String> columns = ChurnFeature.columns();
        requireSchema(rows, columns);

        double[][] out = new double[rows.size()][columns.size()];
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = rows.get(i);
            for (int j = 0; j < columns.size(); j++) {
                out[i][j] = toDouble(row.get(columns.get(j)));
            }
        }
        return new FeatureMatrix(columns, out);
    }

    /** Binary labels; null or unparseable labels count as 0. */
    public int[] labels(List<ChurnRecord> records) {
        int[] out = new int[records.size()];
        for (int i = 0; i < out.length; i++) {
            double v = toDouble(records.get(i).label());
            out[i] = !Double.isNaN(v) && (long) v != 0 ? 1 : 0;
        }
        return out;
    }

    private void requireSchema(List<Map<String, Object>> rows, List<String> columns) {
        Set<String> missing = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            for (String c : columns) {
                if (!row.containsKey(c)) missing.add(c);
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaException(new ArrayList<>(missing));
        }
    }

    static double toDouble(Object raw) {
        if (raw == null) return Double.NaN;
        if (raw instanceof Boolean) return ((Boolean) raw) ? 1.0 : 0.0;
        double v;
        if (raw instanceof Number) {
            v = ((Number) raw).doubleValue();
        } else {
            String s = raw.toString().trim();
            if (s.isEmpty()) return Double.NaN;
            try {
                v = new BigDecimal(s).doubleValue();
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.isFinite(v) ? v : Double.NaN;
    }
}
