package com.ogt.loadmap.entity;

import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * Ráster a resumir por región: categórico (conteo de píxeles por categoría) o
 * continuo (suma de valores, p. ej. población).
 */
@Value
public class RasterLayer {

    public enum Kind { CATEGORICAL, CONTINUOUS }

    String name;
    RasterGrid grid;
    Kind kind;
    List<String> categories;

    public static RasterLayer categorical(RasterGrid grid, List<String> categories) {
        return new RasterLayer(grid.getName(), grid, Kind.CATEGORICAL, List.copyOf(categories));
    }

    public static RasterLayer continuous(String column, RasterGrid grid) {
        return new RasterLayer(column, grid, Kind.CONTINUOUS, Collections.emptyList());
    }

    /** Columnas que aporta a la tabla de estadísticas. */
    public List<String> columns() {
        return kind == Kind.CONTINUOUS ? List.of(name) : categories;
    }
}
