package com.ogt.loadmap.service;

import com.ogt.loadmap.entity.CountryPart;
import com.ogt.loadmap.entity.Region;
import com.ogt.loadmap.util.ProcessingWarnings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.geom.TopologyException;
import org.locationtech.jts.geom.util.PolygonExtracter;
import org.locationtech.jts.index.strtree.STRtree;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Corta cada subregión por los países que toca. Las subregiones pueden cruzar
 * fronteras; las partes de país sí pertenecen a un único país.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CountryPartService {

    private final GeometryValidationService geometryValidationService;

    public List<CountryPart> split(List<Region> subregions, List<Region> countries,
                                   ProcessingWarnings warnings, ProgressListener progress) {
        STRtree index = new STRtree();
        for (int i = 0; i < countries.size(); i++) {
            index.insert(countries.get(i).getGeometry().getEnvelopeInternal(), i);
        }
        index.build();

        List<CountryPart> parts = new ArrayList<>();
        int done = 0;
        for (Region subregion : subregions) {
            Geometry subGeom = subregion.getGeometry();

            @SuppressWarnings("unchecked")
            List<Integer> candidates = new ArrayList<>(index.query(subGeom.getEnvelopeInternal()));
            candidates.sort(Comparator.naturalOrder());

            for (int candidate : candidates) {
                Region country = countries.get(candidate);
                if (!subGeom.intersects(country.getGeometry())) continue;

                Geometry intersection = polygonalPart(intersect(subregion, country, warnings));
                if (intersection.isEmpty() || intersection.getArea() == 0.0) {
                    log.debug("Intersección {} ∩ {} sin área, se omite", subregion.getId(), country.getId());
                    continue;
                }
                parts.add(new CountryPart(subregion.getId(), country.getId(), intersection));
            }
            progress.onProgress("Partes de país", ++done, subregions.size());
        }

        log.info("✂️ {} subregiones divididas en {} partes de país", subregions.size(), parts.size());
        return parts;
    }

    private Geometry intersect(Region subregion, Region country, ProcessingWarnings warnings) {
        try {
            return subregion.getGeometry().intersection(country.getGeometry());
        } catch (TopologyException e) {
            log.warn("⚠️ Error topológico en {} ∩ {}: {}. Reintentando con buffer(0)",
                    subregion.getId(), country.getId(), e.getMessage());
            warnings.add(ProcessingWarnings.REPAIRED_GEOMETRY, CountryPart.idOf(subregion.getId(), country.getId()),
                    "Intersección recalculada tras buffer(0)");
            return geometryValidationService.repair(subregion.getGeometry())
                    .intersection(geometryValidationService.repair(country.getGeometry()));
        }
    }

    /** Descarta líneas y puntos que deja la intersección en bordes compartidos. */
    private Geometry polygonalPart(Geometry geometry) {
        if (geometry instanceof Polygonal) {
            return geometry;
        }
        GeometryFactory factory = geometry.getFactory();
        @SuppressWarnings("unchecked")
        List<Polygon> polygons = PolygonExtracter.getPolygons(geometry);
        Geometry result = polygons.size() == 1
                ? polygons.get(0)
                : factory.createMultiPolygon(polygons.toArray(new Polygon[0]));
        result.setSRID(geometry.getSRID());
        return result;
    }
}
