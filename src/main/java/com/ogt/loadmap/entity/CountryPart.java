package com.ogt.loadmap.entity;

import lombok.Value;
import org.locationtech.jts.geom.Geometry;

/**
 * Intersección de una subregión con un país: unidad atómica de la agregación.
 */
@Value
public class CountryPart {

    public static final char SEPARATOR = '_';

    String subregion;

    String country;

    Geometry geometry;

    public String getId() {
        return idOf(subregion, country);
    }

    public Region toRegion(int sourceIndex) {
        return Region.builder()
                .id(getId())
                .geometry(geometry)
                .country(country)
                .sourceIndex(sourceIndex)
                .build();
    }

    public static String idOf(String subregion, String country) {
        return subregion + SEPARATOR + country;
    }

    /**
     * Separa un id {@code <subregión>_<país>}. El país es lo que sigue al último
     * separador, así la subregión puede contener guiones bajos.
     *
     * @return par {subregión, país}
     */
    public static String[] parseId(String id) {
        int cut = id.lastIndexOf(SEPARATOR);
        if (cut <= 0 || cut == id.length() - 1) {
            throw new IllegalArgumentException("Id de parte de país inválido: " + id);
        }
        return new String[]{id.substring(0, cut), id.substring(cut + 1)};
    }
}
