package com.demo.churn.service.features;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Numeric feature matrix, rows x schema columns. Missing or unparseable cells are NaN.
 * The backing array is copied in and out so callers cannot change a matrix after it was built.
 */
public final class FeatureMatrix {

    private final List<String> columns;
    private final double[][] values;

    public FeatureMatrix(List<String> columns, double[][] values) {
        this.columns = List.copyOf(columns);
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            if (values[i].length != columns.size()) {
                throw new IllegalArgumentException("Row " + i + " has " + values[i].length
                        + " values, expected " + columns.size());
            }
            this.values[i] = values[i].clone();
        }
    }

    public int rows() { return values.length; }
    public int cols() { return columns.size(); }
    public List<String> columns() { return columns; }

    public double get(int row, int col) {
        return values[row][col];
    }

    public double[] row(int row) {
        return values[row].clone();
    }

    public double[] column(int col) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) out[i] = values[i][col];
        return out;
    }

    public double[][] toArray() {
        double[][] out = new double[values.length][];
        for (int i = 0; i < values.length; i++) out[i] = values[i].clone();
        return out;
    }

    /** Rows as column-name maps, the same shape the normalizer accepts. */
    public List<Map<String, Object>> asRows() {
        List<Map<String, Object>> out = new ArrayList<>(values.length);
        for (double[] r : values) {
            Map<String, Object> m = new LinkedHashMap<>();
            for (int j = 0; j < columns.size(); j++) m.put(columns.get(j), r[j]);
            out.add(m);
        }
        return out;
    }
}
