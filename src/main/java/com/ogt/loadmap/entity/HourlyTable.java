package com.ogt.loadmap.entity;

import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Tabla de series horarias indexada por una clave (país, sector o subregión).
 * Se usa para la carga total por país, los perfiles sectoriales normalizados y
 * la carga final por subregión. El orden de las columnas es el de inserción.
 */
@EqualsAndHashCode
public final class HourlyTable {

    private final Map<String, HourlySeries> columns;
    private final int hours;

    private HourlyTable(Map<String, HourlySeries> columns, int hours) {
        this.columns = Collections.unmodifiableMap(columns);
        this.hours = hours;
    }

    public static Builder builder(int hours) {
        return new Builder(hours);
    }

    public int getHours() {
        return hours;
    }

    public List<String> keys() {
        return new ArrayList<>(columns.keySet());
    }

    public boolean contains(String key) {
        return columns.containsKey(key);
    }

    public HourlySeries series(String key) {
        HourlySeries series = columns.get(key);
        if (series == null) {
            throw new NoSuchElementException("Columna inexistente: " + key);
        }
        return series;
    }

    /** Suma de todas las columnas para la hora indicada. */
    public double totalAt(int hour) {
        double total = 0.0;
        for (HourlySeries s : columns.values()) {
            total += s.get(hour);
        }
        return total;
    }

    /** Suma anual de cada columna, en el orden de la tabla. */
    public Map<String, Double> yearlyTotals() {
        Map<String, Double> totals = new LinkedHashMap<>();
        columns.forEach((key, series) -> totals.put(key, series.sum()));
        return totals;
    }

    public static final class Builder {

        private final int hours;
        private final Map<String, HourlySeries> columns = new LinkedHashMap<>();

        private Builder(int hours) {
            this.hours = hours;
        }

        public Builder put(String key, HourlySeries series) {
            if (series.length() != hours) {
                throw new IllegalArgumentException("La columna " + key + " tiene " + series.length()
                        + " horas, se esperaban " + hours);
            }
            if (columns.putIfAbsent(key, series) != null) {
                throw new IllegalArgumentException("Columna duplicada: " + key);
            }
            return this;
        }

        public HourlyTable build() {
            return new HourlyTable(new LinkedHashMap<>(columns), hours);
        }
    }
}
