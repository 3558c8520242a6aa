package com.ogt.loadmap.exception;

import lombok.Getter;

@Getter
public class MissingSectorShareException extends LoadmapException {

    private final String country;
    private final String sector;

    public MissingSectorShareException(String country, String sector) {
        super("No hay participación sectorial para " + country + "/" + sector
                + " ni en la fila del país ni en la fila por defecto");
        this.country = country;
        this.sector = sector;
    }
}
