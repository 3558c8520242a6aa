package com.ogt.loadmap.entity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Estadísticas zonales: región → columna → conteo de píxeles / suma de valores.
 * Las columnas son fijas (población + categorías de uso del suelo).
 */
public final class ZonalStatisticsTable {

    public static final String POPULATION = "Population";

    private final String keyName;
    private final List<String> columns;
    private final Map<String, double[]> rows;

    private ZonalStatisticsTable(String keyName, List<String> columns, Map<String, double[]> rows) {
        this.keyName = keyName;
        this.columns = Collections.unmodifiableList(columns);
        this.rows = Collections.unmodifiableMap(rows);
    }

    public static Builder builder(String keyName, List<String> columns) {
        return new Builder(keyName, columns);
    }

    /** Nombre de la columna índice al persistir (Country, Country_part...). */
    public String getKeyName() {
        return keyName;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<String> regionIds() {
        return new ArrayList<>(rows.keySet());
    }

    public boolean contains(String regionId) {
        return rows.containsKey(regionId);
    }

    public double get(String regionId, String column) {
        double[] row = rows.get(regionId);
        if (row == null) {
            throw new NoSuchElementException("Región sin estadísticas: " + regionId);
        }
        int idx = columns.indexOf(column);
        if (idx < 0) {
            throw new NoSuchElementException("Columna inexistente: " + column);
        }
        return row[idx];
    }

    public Map<String, Double> row(String regionId) {
        double[] row = rows.get(regionId);
        if (row == null) {
            throw new NoSuchElementException("Región sin estadísticas: " + regionId);
        }
        Map<String, Double> result = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            result.put(columns.get(i), row[i]);
        }
        return result;
    }

    public static final class Builder {

        private final String keyName;
        private final List<String> columns;
        private final Map<String, double[]> rows = new LinkedHashMap<>();

        private Builder(String keyName, List<String> columns) {
            this.keyName = keyName;
            this.columns = new ArrayList<>(columns);
        }

        /**
         * Agrega una fila. Si la región ya existe (país entregado en varios
         * features) los valores se suman.
         */
        public Builder add(String regionId, double[] values) {
            if (values.length != columns.size()) {
                throw new IllegalArgumentException("Fila " + regionId + " con " + values.length
                        + " valores, se esperaban " + columns.size());
            }
            double[] existing = rows.get(regionId);
            if (existing == null) {
                rows.put(regionId, values.clone());
            } else {
                for (int i = 0; i < values.length; i++) {
                    existing[i] += values[i];
                }
            }
            return this;
        }

        public ZonalStatisticsTable build() {
            Map<String, double[]> copy = new LinkedHashMap<>();
            rows.forEach((k, v) -> copy.put(k, v.clone()));
            return new ZonalStatisticsTable(keyName, columns, copy);
        }
    }
}
