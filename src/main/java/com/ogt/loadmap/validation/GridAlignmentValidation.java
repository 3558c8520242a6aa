package com.ogt.loadmap.validation;

import com.ogt.loadmap.entity.RasterGrid;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class GridAlignmentValidation {
    private boolean valid;
    private String reference;
    private String candidate;
    private String errorMessage;
    private GridAlignmentType type;

    public enum GridAlignmentType {
        ALIGNED,
        DIMENSION_MISMATCH,
        ORIGIN_MISMATCH,
        RESOLUTION_MISMATCH,
        SRID_MISMATCH
    }

    /**
     * Compara dos rásters: deben compartir dimensiones, origen, resolución y SRID.
     */
    public static GridAlignmentValidation check(RasterGrid reference, RasterGrid candidate) {
        if (reference.getSrid() != candidate.getSrid()) {
            return invalid(reference, candidate.getName(), GridAlignmentType.SRID_MISMATCH,
                    "EPSG:" + reference.getSrid() + " vs EPSG:" + candidate.getSrid());
        }
        if (Double.compare(reference.getCellSize(), candidate.getCellSize()) != 0) {
            return invalid(reference, candidate.getName(), GridAlignmentType.RESOLUTION_MISMATCH,
                    "cellsize " + reference.getCellSize() + " vs " + candidate.getCellSize());
        }
        if (reference.getNcols() != candidate.getNcols() || reference.getNrows() != candidate.getNrows()) {
            return invalid(reference, candidate.getName(), GridAlignmentType.DIMENSION_MISMATCH,
                    reference.getNcols() + "x" + reference.getNrows() + " vs "
                            + candidate.getNcols() + "x" + candidate.getNrows());
        }
        if (!reference.isAlignedWith(candidate)) {
            return invalid(reference, candidate.getName(), GridAlignmentType.ORIGIN_MISMATCH,
                    "origen (" + reference.getXllCorner() + ", " + reference.getYllCorner() + ") vs ("
                            + candidate.getXllCorner() + ", " + candidate.getYllCorner() + ")");
        }
        return GridAlignmentValidation.builder()
                .valid(true)
                .reference(reference.getName())
                .candidate(candidate.getName())
                .type(GridAlignmentType.ALIGNED)
                .build();
    }

    /**
     * Una geometría sin SRID (0) se acepta; si lo tiene debe coincidir con el ráster.
     */
    public static GridAlignmentValidation checkSrid(RasterGrid reference, String regionId, int geometrySrid) {
        if (geometrySrid != 0 && geometrySrid != reference.getSrid()) {
            return invalid(reference, regionId, GridAlignmentType.SRID_MISMATCH,
                    "la región está en EPSG:" + geometrySrid + " y el ráster en EPSG:" + reference.getSrid());
        }
        return GridAlignmentValidation.builder()
                .valid(true)
                .reference(reference.getName())
                .candidate(regionId)
                .type(GridAlignmentType.ALIGNED)
                .build();
    }

    private static GridAlignmentValidation invalid(RasterGrid reference, String candidate,
                                                   GridAlignmentType type, String detail) {
        return GridAlignmentValidation.builder()
                .valid(false)
                .reference(reference.getName())
                .candidate(candidate)
                .type(type)
                .errorMessage(type + " entre " + reference.getName() + " y " + candidate + ": " + detail)
                .build();
    }
}
