package com.driftwatch.domain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Column view over a list of feature rows. A column counts as numeric when it holds
 * at least one number and no text.
 */
public final class FeatureFrame {

    private final List<Map<String, FieldValue>> rows;
    private final Map<String, List<FieldValue>> columns;

    private FeatureFrame(List<Map<String, FieldValue>> rows) {
        this.rows = rows;
        this.columns = new LinkedHashMap<>();
        Set<String> names = new LinkedHashSet<>();
        rows.forEach(r -> names.addAll(r.keySet()));
        for (String name : names) {
            List<FieldValue> values = new ArrayList<>(rows.size());
            for (Map<String, FieldValue> row : rows) {
                FieldValue v = row.get(name);
                values.add(v == null ? FieldValue.missing() : v);
            }
            columns.put(name, values);
        }
    }

    public static FeatureFrame of(List<Map<String, FieldValue>> rows) {
        return new FeatureFrame(rows == null ? List.of() : rows);
    }

    public int rowCount() {
        return rows.size();
    }

    public Set<String> columnNames() {
        return columns.keySet();
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public List<FieldValue> column(String name) {
        return columns.getOrDefault(name, List.of());
    }

    public List<String> numericColumns() {
        List<String> numeric = new ArrayList<>();
        columns.forEach((name, values) -> {
            boolean anyNumber = values.stream().anyMatch(FieldValue::isNumber);
            boolean anyText = values.stream().anyMatch(FieldValue::isText);
            if (anyNumber && !anyText) {
                numeric.add(name);
            }
        });
        return numeric;
    }

    /** Non-missing numeric values of the column, in row order. */
    public double[] values(String name) {
        return column(name).stream()
            .filter(FieldValue::isNumber)
            .mapToDouble(FieldValue::asDouble)
            .toArray();
    }

    public long missingCount(String name) {
        return column(name).stream().filter(v -> !v.isNumber()).count();
    }
}
