package com.ogt.loadmap.exception;

/**
 * Configuración o supuestos incoherentes (perfil faltante, categoría no numérica, etc.).
 */
public class ConfigurationException extends LoadmapException {

    public ConfigurationException(String message) {
        super(message);
    }
}
