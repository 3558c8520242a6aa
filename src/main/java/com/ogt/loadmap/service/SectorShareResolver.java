package com.ogt.loadmap.service;

import com.ogt.loadmap.entity.LabeledTable;
import com.ogt.loadmap.exception.MissingSectorShareException;

import java.util.Optional;

/**
 * Participación de cada sector en la demanda de un país, resuelta por capas:
 * fila del país → fila por defecto → error.
 */
public class SectorShareResolver {

    private final LabeledTable shares;
    private final String defaultKey;

    public SectorShareResolver(LabeledTable shares, String defaultKey) {
        this.shares = shares;
        this.defaultKey = defaultKey;
    }

    public String getDefaultKey() {
        return defaultKey;
    }

    /** Primera capa: la celda (país, sector). */
    public Optional<Double> primary(String country, String sector) {
        return shares.find(country, sector);
    }

    /** Segunda capa: la fila por defecto. */
    public Optional<Double> fallback(String sector) {
        return shares.find(defaultKey, sector);
    }

    public double resolve(String country, String sector) {
        return primary(country, sector)
                .or(() -> fallback(sector))
                .orElseThrow(() -> new MissingSectorShareException(country, sector));
    }

    /** True si al menos un sector del país sale de la fila por defecto. */
    public boolean usesFallback(String country, Iterable<String> sectors) {
        for (String sector : sectors) {
            if (primary(country, sector).isEmpty()) {
                return true;
            }
        }
        return false;
    }
}
