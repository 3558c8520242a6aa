package com.ogt.loadmap.service;

import com.ogt.loadmap.entity.RasterGrid;
import com.ogt.loadmap.entity.Site;
import com.ogt.loadmap.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ogt.loadmap.Fixtures.grid;
import static com.ogt.loadmap.Fixtures.rect;
import static com.ogt.loadmap.Fixtures.subregion;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SiteServiceTest {

    private final SiteService service = new SiteService(new ZonalStatisticsService());

    private final RasterGrid land = grid("land", new double[][]{
            {1, 1, 0, 0},
            {1, 1, 1, 0}
    });

    private final RasterGrid sea = grid("sea", new double[][]{
            {0, 0, 1, 1},
            {0, 0, 0, 1}
    });

    @Test
    void buildsOneSitePerSubregionWithOffshoreSuffix() {
        List<Site> sites = service.generate(List.of(
                subregion("North", rect(0, 0, 2, 2), 0),
                subregion("Bay", rect(2, 0, 4, 2), 1)), land, sea);

        assertEquals(2, sites.size());
        assertEquals("North", sites.get(0).getName());
        assertEquals("Bay" + SiteService.OFFSHORE_SUFFIX, sites.get(1).getName());
        assertEquals(1, sites.get(0).getSlacknode());
        assertEquals(0, sites.get(1).getSlacknode());
        assertEquals(1, sites.get(1).getIndexShapefile());
        assertEquals(1, sites.get(1).getSyncarea());
        assertEquals(1, sites.get(1).getCtrarea());
        assertEquals(0.0, sites.get(1).getTerneg());
        assertEquals(1.0, sites.get(0).getLongitude(), 1e-12);
        assertEquals(1.0, sites.get(0).getLatitude(), 1e-12);
    }

    @Test
    void withoutMasksEverySiteIsOnshore() {
        List<Site> sites = service.generate(List.of(subregion("Bay", rect(2, 0, 4, 2), 0)), null, null);

        assertEquals("Bay", sites.get(0).getName());
    }

    @Test
    void onlyOneMaskIsAConfigurationError() {
        assertThrows(ConfigurationException.class,
                () -> service.generate(List.of(subregion("Bay", rect(2, 0, 4, 2), 0)), land, null));
    }

    @Test
    void areaUsesEllipsoidalEqualAreaProjection() {
        // valores de +proj=cea +ellps=GRS80 para celdas de 1°×1°
        assertEquals(1.2308463894e10, SiteService.equalAreaM2(rect(10, 0, 11, 1)), 1e5);
        assertEquals(6.123140879e9, SiteService.equalAreaM2(rect(10, 60, 11, 61)), 1e5);
    }

    @Test
    void areaDoesNotTouchTheInputGeometry() {
        var cell = rect(10, 0, 11, 1);
        SiteService.equalAreaM2(cell);

        assertEquals(1.0, cell.getArea(), 1e-12);
    }
}
