package com.ogt.loadmap.service;

import com.ogt.loadmap.util.ProcessingWarnings;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.operation.valid.IsValidOp;
import org.locationtech.jts.operation.valid.TopologyValidationError;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
@Slf4j
public class GeometryValidationService {

    /**
     * Devuelve una geometría poligonal válida lista para el rasterizado y la
     * intersección, o vacío si no se puede usar.
     *
     * @param subject id de la región, para logs y advertencias
     */
    public Optional<Geometry> ensureValid(String subject, Geometry geom, ProcessingWarnings warnings) {
        if (geom == null || geom.isEmpty()) {
            skip(subject, "geometría vacía o ausente", warnings);
            return Optional.empty();
        }
        if (!(geom instanceof Polygonal)) {
            skip(subject, "geometría no poligonal (" + geom.getGeometryType() + ")", warnings);
            return Optional.empty();
        }

        // Validez topológica con IsValidOp
        IsValidOp validOp = new IsValidOp(geom);
        if (validOp.isValid()) {
            return Optional.of(geom);
        }

        TopologyValidationError error = validOp.getValidationError();
        String errorType = getErrorTypeName(error.getErrorType());
        log.warn("⚠️ Región {} con geometría inválida ({}): {}", subject, errorType, error.getMessage());

        // Intento de reparación con buffer(0)
        try {
            Geometry fixed = repair(geom);
            if (fixed.isValid() && !fixed.isEmpty() && fixed instanceof Polygonal) {
                log.info("✅ Geometría de {} reparada automáticamente usando buffer(0)", subject);
                warnings.add(ProcessingWarnings.REPAIRED_GEOMETRY, subject,
                        errorType + " reparado con buffer(0)");
                return Optional.of(fixed);
            }
        } catch (RuntimeException ex) {
            log.warn("⚠️ No se pudo reparar la geometría de {}: {}", subject, ex.getMessage());
        }
        skip(subject, errorType + " sin reparación posible", warnings);
        return Optional.empty();
    }

    /** buffer(0) conservando el SRID de la geometría original. */
    public Geometry repair(Geometry geom) {
        Geometry fixed = geom.buffer(0);
        fixed.setSRID(geom.getSRID());
        return fixed;
    }

    private void skip(String subject, String reason, ProcessingWarnings warnings) {
        log.warn("⚠️ Región {} descartada: {}", subject, reason);
        warnings.add(ProcessingWarnings.SKIPPED_GEOMETRY, subject, reason);
    }

    /**
     * Convierte el código numérico de error de JTS a un nombre legible.
     */
    private String getErrorTypeName(int errorType) {
        return switch (errorType) {
            case TopologyValidationError.ERROR -> "GENERIC_ERROR";
            case TopologyValidationError.REPEATED_POINT -> "REPEATED_POINT";
            case TopologyValidationError.HOLE_OUTSIDE_SHELL -> "HOLE_OUTSIDE_SHELL";
            case TopologyValidationError.NESTED_HOLES -> "NESTED_HOLES";
            case TopologyValidationError.DISCONNECTED_INTERIOR -> "DISCONNECTED_INTERIOR";
            case TopologyValidationError.SELF_INTERSECTION -> "SELF_INTERSECTION";
            case TopologyValidationError.RING_SELF_INTERSECTION -> "RING_SELF_INTERSECTION";
            case TopologyValidationError.NESTED_SHELLS -> "NESTED_SHELLS";
            case TopologyValidationError.DUPLICATE_RINGS -> "DUPLICATE_RINGS";
            case TopologyValidationError.TOO_FEW_POINTS -> "TOO_FEW_POINTS";
            case TopologyValidationError.INVALID_COORDINATE -> "INVALID_COORDINATE";
            case TopologyValidationError.RING_NOT_CLOSED -> "RING_NOT_CLOSED";
            default -> "UNKNOWN_ERROR_" + errorType;
        };
    }
}
