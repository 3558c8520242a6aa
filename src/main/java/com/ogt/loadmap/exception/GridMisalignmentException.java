package com.ogt.loadmap.exception;

/**
 * Rásters o polígonos que no comparten la misma grilla / SRID. Siempre fatal.
 */
public class GridMisalignmentException extends LoadmapException {

    public GridMisalignmentException(String message) {
        super(message);
    }
}
