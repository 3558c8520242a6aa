package com.ogt.loadmap.service;

import com.ogt.loadmap.entity.RasterGrid;
import com.ogt.loadmap.entity.RasterLayer;
import com.ogt.loadmap.entity.Region;
import com.ogt.loadmap.entity.ZonalStatisticsTable;
import com.ogt.loadmap.exception.ConfigurationException;
import com.ogt.loadmap.exception.GridMisalignmentException;
import com.ogt.loadmap.validation.GridAlignmentValidation;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.algorithm.locate.IndexedPointInAreaLocator;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Location;
import org.locationtech.jts.geom.Polygonal;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Estadísticas zonales ráster → polígono. Un píxel pertenece a la región si su
 * centro cae dentro del polígono. Un centro sobre el borde se asigna con una
 * regla semiabierta: cuenta sólo para el polígono que queda hacia +x/+y, así
 * que en una partición cada píxel cae en exactamente una región.
 */
@Service
@Slf4j
public class ZonalStatisticsService {

    /** Desplazamiento del desempate de bordes, en fracciones de celda. */
    private static final double NUDGE_X = 1e-7;
    private static final double NUDGE_Y = 1.3e-7;

    public ZonalStatisticsTable compute(String keyName, List<Region> regions, List<RasterLayer> layers,
                                        ProgressListener progress) {
        if (layers.isEmpty()) {
            throw new ConfigurationException("Se necesita al menos un ráster para las estadísticas zonales");
        }
        RasterGrid reference = layers.get(0).getGrid();
        validateAlignment(reference, layers, regions);

        List<String> columns = new ArrayList<>();
        layers.forEach(layer -> columns.addAll(layer.columns()));
        List<Map<Integer, Integer>> categoryIndexes = buildCategoryIndexes(layers, columns);

        log.info("📊 Estadísticas zonales de {} regiones sobre {} ({} columnas)",
                regions.size(), reference, columns.size());

        ZonalStatisticsTable.Builder table = ZonalStatisticsTable.builder(keyName, columns);
        int done = 0;
        int empty = 0;
        for (Region region : regions) {
            double[] row = new double[columns.size()];
            int pixels = reduceRegion(region.getGeometry(), reference, layers, categoryIndexes, row);
            if (pixels == 0) {
                empty++;
                log.debug("Región {} sin píxeles: fila en cero", region.getId());
            }
            table.add(region.getId(), row);
            progress.onProgress("Estadísticas zonales " + keyName, ++done, regions.size());
        }

        if (empty > 0) {
            log.warn("⚠️ {} regiones no cubren ningún centro de píxel (geometría degenerada o muy pequeña)", empty);
        }
        return table.build();
    }

    // ================================================================
    // Helpers
    // ================================================================

    private void validateAlignment(RasterGrid reference, List<RasterLayer> layers, List<Region> regions) {
        for (RasterLayer layer : layers.subList(1, layers.size())) {
            GridAlignmentValidation check = GridAlignmentValidation.check(reference, layer.getGrid());
            if (!check.isValid()) {
                throw new GridMisalignmentException(check.getErrorMessage());
            }
        }
        for (Region region : regions) {
            if (region.getGeometry() == null) continue;
            GridAlignmentValidation check =
                    GridAlignmentValidation.checkSrid(reference, region.getId(), region.getGeometry().getSRID());
            if (!check.isValid()) {
                throw new GridMisalignmentException(check.getErrorMessage());
            }
        }
    }

    /** Para cada capa categórica: valor entero del píxel → índice de columna. */
    private List<Map<Integer, Integer>> buildCategoryIndexes(List<RasterLayer> layers, List<String> columns) {
        List<Map<Integer, Integer>> indexes = new ArrayList<>();
        int offset = 0;
        for (RasterLayer layer : layers) {
            Map<Integer, Integer> index = new HashMap<>();
            if (layer.getKind() == RasterLayer.Kind.CATEGORICAL) {
                for (int i = 0; i < layer.getCategories().size(); i++) {
                    String category = layer.getCategories().get(i);
                    try {
                        index.put(Integer.parseInt(category.trim()), offset + i);
                    } catch (NumberFormatException e) {
                        throw new ConfigurationException("Categoría de uso del suelo no numérica: '" + category + "'");
                    }
                }
            } else {
                index.put(null, offset);
            }
            indexes.add(index);
            offset += layer.columns().size();
        }
        return indexes;
    }

    /**
     * Acumula en {@code row} los valores bajo la máscara de la región.
     *
     * @return cantidad de centros de píxel cubiertos
     */
    private int reduceRegion(Geometry geometry, RasterGrid reference, List<RasterLayer> layers,
                             List<Map<Integer, Integer>> categoryIndexes, double[] row) {
        if (geometry == null || geometry.isEmpty() || !(geometry instanceof Polygonal)) {
            return 0;
        }
        Envelope env = geometry.getEnvelopeInternal().intersection(reference.getEnvelope());
        if (env.isNull()) {
            return 0;
        }

        int colMin = Math.max(0, reference.colOf(env.getMinX()));
        int colMax = Math.min(reference.getNcols() - 1, reference.colOf(env.getMaxX()));
        int rowMin = Math.max(0, reference.rowOf(env.getMaxY()));
        int rowMax = Math.min(reference.getNrows() - 1, reference.rowOf(env.getMinY()));

        IndexedPointInAreaLocator locator = new IndexedPointInAreaLocator(geometry);
        Coordinate center = new Coordinate();
        Coordinate nudged = new Coordinate();
        double dx = reference.getCellSize() * NUDGE_X;
        double dy = reference.getCellSize() * NUDGE_Y;
        int covered = 0;

        for (int r = rowMin; r <= rowMax; r++) {
            center.y = reference.cellCenterY(r);
            for (int c = colMin; c <= colMax; c++) {
                center.x = reference.cellCenterX(c);
                int location = locator.locate(center);
                if (location == Location.EXTERIOR) continue;
                if (location == Location.BOUNDARY) {
                    nudged.x = center.x + dx;
                    nudged.y = center.y + dy;
                    if (locator.locate(nudged) != Location.INTERIOR) continue;
                }
                covered++;
                for (int l = 0; l < layers.size(); l++) {
                    accumulate(layers.get(l), categoryIndexes.get(l), r, c, row);
                }
            }
        }
        return covered;
    }

    private void accumulate(RasterLayer layer, Map<Integer, Integer> index, int r, int c, double[] row) {
        RasterGrid grid = layer.getGrid();
        double value = grid.value(r, c);
        if (grid.isNoData(value)) return;

        if (layer.getKind() == RasterLayer.Kind.CONTINUOUS) {
            row[index.get(null)] += value;
            return;
        }
        if (value != Math.rint(value)) return;
        Integer column = index.get((int) value);
        if (column != null) {
            row[column] += 1;
        }
    }
}
