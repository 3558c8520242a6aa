package com.ogt.loadmap.exception;

import java.nio.file.Path;

public class InputReadException extends LoadmapException {

    public InputReadException(Path path, String message) {
        super("Error leyendo " + path + ": " + message);
    }

    public InputReadException(Path path, Throwable cause) {
        super("Error leyendo " + path + ": " + cause.getMessage(), cause);
    }
}
