package com.ogt.loadmap.entity;

import lombok.Builder;
import lombok.Value;
import org.locationtech.jts.geom.Geometry;

/**
 * Polígono de una región (país, subregión o parte de país).
 * La identidad es el {@code id}: código de país o nombre corto.
 */
@Value
@Builder(toBuilder = true)
public class Region {

    String id;

    Geometry geometry;

    /** Código del país padre; null para subregiones que pueden cruzar fronteras. */
    String country;

    /** Posición del feature en el archivo de origen. */
    int sourceIndex;
}
