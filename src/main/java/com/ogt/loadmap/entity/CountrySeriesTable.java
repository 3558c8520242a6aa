package com.ogt.loadmap.entity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Base de las tablas indexadas por (país, clave secundaria) → serie horaria.
 */
public abstract class CountrySeriesTable {

    private final Map<String, Map<String, HourlySeries>> series;
    private final int hours;

    protected CountrySeriesTable(Map<String, Map<String, HourlySeries>> series, int hours) {
        Map<String, Map<String, HourlySeries>> copy = new LinkedHashMap<>();
        series.forEach((country, bySecondary) ->
                copy.put(country, Collections.unmodifiableMap(new LinkedHashMap<>(bySecondary))));
        this.series = Collections.unmodifiableMap(copy);
        this.hours = hours;
    }

    public int getHours() {
        return hours;
    }

    public List<String> countries() {
        return new ArrayList<>(series.keySet());
    }

    public boolean containsCountry(String country) {
        return series.containsKey(country);
    }

    /** Claves secundarias en orden de aparición (sectores o unidades de uso del suelo). */
    public List<String> secondaryKeys() {
        Set<String> keys = new LinkedHashSet<>();
        series.values().forEach(m -> keys.addAll(m.keySet()));
        return new ArrayList<>(keys);
    }

    public List<String> secondaryKeys(String country) {
        Map<String, HourlySeries> bySecondary = series.get(country);
        if (bySecondary == null) {
            throw new NoSuchElementException("País desconocido: " + country);
        }
        return new ArrayList<>(bySecondary.keySet());
    }

    public HourlySeries series(String country, String secondary) {
        Map<String, HourlySeries> bySecondary = series.get(country);
        if (bySecondary == null) {
            throw new NoSuchElementException("País desconocido: " + country);
        }
        HourlySeries s = bySecondary.get(secondary);
        if (s == null) {
            throw new NoSuchElementException("Sin serie para " + country + "/" + secondary);
        }
        return s;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CountrySeriesTable that = (CountrySeriesTable) o;
        return hours == that.hours && series.equals(that.series);
    }

    @Override
    public int hashCode() {
        return series.hashCode() * 31 + hours;
    }

    /** Acumulador común de los builders de las subclases. */
    protected static final class Entries {

        private final int hours;
        private final Map<String, Map<String, HourlySeries>> series = new LinkedHashMap<>();

        Entries(int hours) {
            this.hours = hours;
        }

        void put(String country, String secondary, HourlySeries values) {
            if (values.length() != hours) {
                throw new IllegalArgumentException("Serie " + country + "/" + secondary + " con "
                        + values.length() + " horas, se esperaban " + hours);
            }
            Map<String, HourlySeries> bySecondary = series.computeIfAbsent(country, c -> new LinkedHashMap<>());
            if (bySecondary.putIfAbsent(secondary, values) != null) {
                throw new IllegalArgumentException("Serie duplicada: " + country + "/" + secondary);
            }
        }

        Map<String, Map<String, HourlySeries>> series() {
            return series;
        }

        int hours() {
            return hours;
        }
    }
}
