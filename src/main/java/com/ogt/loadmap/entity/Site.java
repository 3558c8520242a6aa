package com.ogt.loadmap.entity;

import lombok.Builder;
import lombok.Value;

/**
 * Fila de la tabla de sitios del modelo (una por subregión).
 */
@Value
@Builder
public class Site {

    String name;
    int indexShapefile;
    double areaM2;
    double longitude;
    double latitude;
    int slacknode;

    @Builder.Default
    int syncarea = 1;

    @Builder.Default
    int ctrarea = 1;

    // Reservas: el modelo las completa, aquí quedan en 0
    double primpos;
    double primneg;
    double secpos;
    double secneg;
    double terpos;
    double terneg;
}
