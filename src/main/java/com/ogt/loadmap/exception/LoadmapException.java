package com.ogt.loadmap.exception;

/**
 * Raíz de los errores del pipeline de desagregación.
 */
public class LoadmapException extends RuntimeException {

    public LoadmapException(String message) {
        super(message);
    }

    public LoadmapException(String message, Throwable cause) {
        super(message, cause);
    }
}
