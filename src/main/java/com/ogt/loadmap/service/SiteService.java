package com.ogt.loadmap.service;

import com.ogt.loadmap.entity.RasterGrid;
import com.ogt.loadmap.entity.RasterLayer;
import com.ogt.loadmap.entity.Region;
import com.ogt.loadmap.entity.Site;
import com.ogt.loadmap.entity.ZonalStatisticsTable;
import com.ogt.loadmap.exception.ConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Point;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.ProjCoordinate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Tabla de sitios del modelo: una fila por subregión con área, centroide y
 * clasificación onshore / offshore.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SiteService {

    /** Cilíndrica equivalente de Lambert sobre el elipsoide GRS80. */
    public static final String EQUAL_AREA_PROJ = "+proj=cea +ellps=GRS80 +units=m +no_defs";

    private static final CRSFactory CRS_FACTORY = new CRSFactory();
    private static final CoordinateReferenceSystem LON_LAT =
            CRS_FACTORY.createFromParameters("LONLAT", "+proj=longlat +ellps=GRS80 +no_defs");
    private static final CoordinateReferenceSystem EQUAL_AREA =
            CRS_FACTORY.createFromParameters("CEA", EQUAL_AREA_PROJ);

    public static final String OFFSHORE_SUFFIX = "_offshore";

    private static final String LAND = "land";
    private static final String SEA = "sea";

    private final ZonalStatisticsService zonalStatisticsService;

    /**
     * @param landMask máscara de tierra, opcional
     * @param seaMask  máscara de mar, opcional (ambas o ninguna)
     */
    public List<Site> generate(List<Region> subregions, RasterGrid landMask, RasterGrid seaMask) {
        if ((landMask == null) != (seaMask == null)) {
            throw new ConfigurationException("Las máscaras de tierra y mar se configuran juntas o ninguna");
        }
        ZonalStatisticsTable maskSums = null;
        if (landMask != null) {
            maskSums = zonalStatisticsService.compute("Site", subregions,
                    List.of(RasterLayer.continuous(LAND, landMask), RasterLayer.continuous(SEA, seaMask)),
                    ProgressListener.NONE);
        } else {
            log.info("ℹ️ Sin máscaras de tierra/mar: todos los sitios se consideran onshore");
        }

        List<Site> sites = new ArrayList<>();
        int offshore = 0;
        for (Region region : subregions) {
            String name = region.getId();
            if (maskSums != null && maskSums.get(name, SEA) > maskSums.get(name, LAND)) {
                name = name + OFFSHORE_SUFFIX;
                offshore++;
            }
            Point centroid = region.getGeometry().getCentroid();
            sites.add(Site.builder()
                    .name(name)
                    .indexShapefile(region.getSourceIndex())
                    .areaM2(equalAreaM2(region.getGeometry()))
                    .longitude(centroid.getX())
                    .latitude(centroid.getY())
                    .slacknode(sites.isEmpty() ? 1 : 0)
                    .build());
        }

        log.info("📌 {} sitios generados ({} offshore)", sites.size(), offshore);
        return sites;
    }

    /**
     * Área en m² en {@link #EQUAL_AREA_PROJ}. Las coordenadas se leen como
     * lon/lat en grados.
     */
    public static double equalAreaM2(Geometry lonLat) {
        // BasicCoordinateTransform guarda estado interno: uno por llamada
        CoordinateTransform transform = new CoordinateTransformFactory().createTransform(LON_LAT, EQUAL_AREA);
        ProjCoordinate source = new ProjCoordinate();
        ProjCoordinate target = new ProjCoordinate();

        Geometry projected = lonLat.copy();
        projected.apply(new CoordinateSequenceFilter() {
            @Override
            public void filter(CoordinateSequence seq, int i) {
                source.x = seq.getX(i);
                source.y = seq.getY(i);
                transform.transform(source, target);
                seq.setOrdinate(i, CoordinateSequence.X, target.x);
                seq.setOrdinate(i, CoordinateSequence.Y, target.y);
            }

            @Override
            public boolean isDone() {
                return false;
            }

            @Override
            public boolean isGeometryChanged() {
                return true;
            }
        });
        return projected.getArea();
    }
}
