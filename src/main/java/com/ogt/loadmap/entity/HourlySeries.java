package com.ogt.loadmap.entity;

import java.util.Arrays;

/**
 * Serie horaria inmutable (normalmente 8760 valores).
 * Las operaciones devuelven siempre una serie nueva.
 */
public final class HourlySeries {

    private final double[] values;

    private HourlySeries(double[] values) {
        this.values = values;
    }

    public static HourlySeries of(double... values) {
        return new HourlySeries(values.clone());
    }

    public static HourlySeries zeros(int hours) {
        return new HourlySeries(new double[hours]);
    }

    public int length() {
        return values.length;
    }

    public double get(int hour) {
        return values[hour];
    }

    public double sum() {
        double total = 0.0;
        for (double v : values) {
            total += v;
        }
        return total;
    }

    public double[] toArray() {
        return values.clone();
    }

    public HourlySeries plus(HourlySeries other) {
        requireSameLength(other);
        double[] result = new double[values.length];
        for (int h = 0; h < values.length; h++) {
            result[h] = values[h] + other.values[h];
        }
        return new HourlySeries(result);
    }

    public HourlySeries times(double factor) {
        double[] result = new double[values.length];
        for (int h = 0; h < values.length; h++) {
            result[h] = values[h] * factor;
        }
        return new HourlySeries(result);
    }

    /**
     * Acumula {@code factor * this} en {@code target}. Usado por los agregadores
     * para no crear una serie intermedia por cada término.
     */
    public void addScaledTo(double[] target, double factor) {
        if (target.length != values.length) {
            throw new IllegalArgumentException("Longitudes distintas: " + target.length + " vs " + values.length);
        }
        if (factor == 0.0) {
            return;
        }
        for (int h = 0; h < values.length; h++) {
            target[h] += values[h] * factor;
        }
    }

    private void requireSameLength(HourlySeries other) {
        if (other.values.length != values.length) {
            throw new IllegalArgumentException("Longitudes distintas: " + values.length + " vs " + other.values.length);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HourlySeries)) return false;
        return Arrays.equals(values, ((HourlySeries) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "HourlySeries[" + values.length + " h, total=" + sum() + "]";
    }
}
