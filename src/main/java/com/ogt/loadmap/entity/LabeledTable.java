package com.ogt.loadmap.entity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tabla de supuestos con filas y columnas etiquetadas (uso del suelo × sector,
 * país × sector). Las celdas vacías quedan ausentes.
 */
public final class LabeledTable {

    private final List<String> rowKeys;
    private final List<String> columns;
    private final Map<String, Map<String, Double>> cells;

    private LabeledTable(List<String> rowKeys, List<String> columns, Map<String, Map<String, Double>> cells) {
        this.rowKeys = Collections.unmodifiableList(rowKeys);
        this.columns = Collections.unmodifiableList(columns);
        this.cells = cells;
    }

    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    public List<String> getRowKeys() {
        return rowKeys;
    }

    public List<String> getColumns() {
        return columns;
    }

    public boolean hasRow(String rowKey) {
        return cells.containsKey(rowKey);
    }

    public Optional<Double> find(String rowKey, String column) {
        Map<String, Double> row = cells.get(rowKey);
        return row == null ? Optional.empty() : Optional.ofNullable(row.get(column));
    }

    /** Valor o 0 si la celda está vacía. */
    public double valueOrZero(String rowKey, String column) {
        return find(rowKey, column).orElse(0.0);
    }

    public static final class Builder {

        private final List<String> columns;
        private final List<String> rowKeys = new ArrayList<>();
        private final Map<String, Map<String, Double>> cells = new LinkedHashMap<>();

        private Builder(List<String> columns) {
            this.columns = new ArrayList<>(columns);
        }

        public Builder row(String rowKey, Map<String, Double> values) {
            if (cells.containsKey(rowKey)) {
                throw new IllegalArgumentException("Fila duplicada en tabla de supuestos: " + rowKey);
            }
            Map<String, Double> row = new LinkedHashMap<>();
            values.forEach((column, value) -> {
                if (value != null) {
                    row.put(column, value);
                }
            });
            rowKeys.add(rowKey);
            cells.put(rowKey, Collections.unmodifiableMap(row));
            return this;
        }

        public LabeledTable build() {
            return new LabeledTable(new ArrayList<>(rowKeys), columns, Collections.unmodifiableMap(new LinkedHashMap<>(cells)));
        }
    }
}
