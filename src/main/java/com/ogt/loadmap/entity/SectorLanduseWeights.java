package com.ogt.loadmap.entity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Matriz normalizada sector × uso del suelo. Cada sector suma 1 sobre las
 * categorías (o 0 si el supuesto venía vacío). El sector residencial no forma
 * parte de la matriz: se asigna por población.
 */
public final class SectorLanduseWeights {

    public static final String RESIDENTIAL = "RES";

    private final List<String> sectors;
    private final List<String> landuseTypes;
    // weights[sector][landuse]
    private final double[][] weights;

    public SectorLanduseWeights(List<String> sectors, List<String> landuseTypes, double[][] weights) {
        if (weights.length != sectors.size()) {
            throw new IllegalArgumentException("Filas de pesos != sectores");
        }
        this.sectors = Collections.unmodifiableList(new ArrayList<>(sectors));
        this.landuseTypes = Collections.unmodifiableList(new ArrayList<>(landuseTypes));
        this.weights = new double[weights.length][];
        for (int s = 0; s < weights.length; s++) {
            if (weights[s].length != landuseTypes.size()) {
                throw new IllegalArgumentException("Pesos del sector " + sectors.get(s) + " incompletos");
            }
            this.weights[s] = weights[s].clone();
        }
    }

    /** Sectores con ponderación por uso del suelo (sin RES). */
    public List<String> getSectors() {
        return sectors;
    }

    public List<String> getLanduseTypes() {
        return landuseTypes;
    }

    public double weight(String sector, String landuse) {
        return weights[sectorIndex(sector)][landuseIndex(landuse)];
    }

    public double columnSum(String sector) {
        double sum = 0.0;
        for (double w : weights[sectorIndex(sector)]) {
            sum += w;
        }
        return sum;
    }

    /**
     * Conteo de píxeles ponderado: Σ_lu peso(sector, lu) × conteo(lu).
     * Las categorías ausentes en {@code counts} cuentan como 0.
     */
    public double weightedCount(String sector, Map<String, Double> counts) {
        double[] row = weights[sectorIndex(sector)];
        double total = 0.0;
        for (int lu = 0; lu < landuseTypes.size(); lu++) {
            Double count = counts.get(landuseTypes.get(lu));
            if (count != null) {
                total += row[lu] * count;
            }
        }
        return total;
    }

    private int sectorIndex(String sector) {
        int idx = sectors.indexOf(sector);
        if (idx < 0) {
            throw new NoSuchElementException("Sector sin pesos de uso del suelo: " + sector);
        }
        return idx;
    }

    private int landuseIndex(String landuse) {
        int idx = landuseTypes.indexOf(landuse);
        if (idx < 0) {
            throw new NoSuchElementException("Categoría de uso del suelo desconocida: " + landuse);
        }
        return idx;
    }
}
