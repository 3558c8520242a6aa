package com.ogt.loadmap.service;

import com.ogt.loadmap.entity.Region;
import com.ogt.loadmap.exception.InputReadException;
import com.ogt.loadmap.util.GeoJSONHelper;
import com.ogt.loadmap.util.ProcessingWarnings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lee los polígonos de países y subregiones desde GeoJSON y los deja
 * validados para las etapas espaciales.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RegionLoader {

    private final GeometryValidationService geometryValidationService;

    public List<Region> loadCountries(Path path, String countryField, int srid, ProcessingWarnings warnings) {
        return load(path, countryField, true, srid, warnings);
    }

    public List<Region> loadSubregions(Path path, String subregionField, int srid, ProcessingWarnings warnings) {
        return load(path, subregionField, false, srid, warnings);
    }

    private List<Region> load(Path path, String idField, boolean countryLevel, int srid,
                              ProcessingWarnings warnings) {
        List<GeoJSONHelper.Feature> features = GeoJSONHelper.readFeatureCollection(path, srid);
        List<Region> regions = new ArrayList<>();

        for (GeoJSONHelper.Feature feature : features) {
            String id = feature.property(idField);
            if (id == null || id.isBlank()) {
                log.warn("⚠️ Feature {} de {} sin propiedad '{}'", feature.getIndex(), path.getFileName(), idField);
                warnings.add(ProcessingWarnings.SKIPPED_GEOMETRY, "#" + feature.getIndex(),
                        "Feature sin propiedad " + idField + " en " + path.getFileName());
                continue;
            }
            id = id.trim();
            Optional<Geometry> geometry = geometryValidationService.ensureValid(id, feature.getGeometry(), warnings);
            if (geometry.isEmpty()) continue;

            regions.add(Region.builder()
                    .id(id)
                    .geometry(geometry.get())
                    .country(countryLevel ? id : null)
                    .sourceIndex(feature.getIndex())
                    .build());
        }

        if (regions.isEmpty()) {
            throw new InputReadException(path, "no contiene polígonos utilizables con la propiedad " + idField);
        }
        log.info("📍 {} regiones leídas de {}", regions.size(), path.getFileName());
        return regions;
    }
}
