package com.ogt.loadmap.service;

import com.ogt.loadmap.entity.HourlySeries;
import com.ogt.loadmap.entity.HourlyTable;
import com.ogt.loadmap.entity.LabeledTable;
import com.ogt.loadmap.entity.LoadPerUnitTable;
import com.ogt.loadmap.entity.SectorLanduseWeights;
import com.ogt.loadmap.entity.SectoralLoadTable;
import com.ogt.loadmap.entity.ZonalStatisticsTable;
import com.ogt.loadmap.util.ProcessingWarnings;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.ogt.loadmap.entity.ZonalStatisticsTable.POPULATION;
import static org.junit.jupiter.api.Assertions.assertEquals;

class SubregionAggregationServiceTest {

    private static final List<String> LANDUSE = List.of("type1", "type2");
    private static final List<String> COLUMNS = List.of(POPULATION, "type1", "type2");

    private final SubregionAggregationService service = new SubregionAggregationService();
    private final SectoralDisaggregationService sectoralService = new SectoralDisaggregationService();

    /** Dos países: A (100 por hora, IND 0.6 / RES 0.4) y B (50 por hora, IND 0.4 / RES 0.6). */
    private LoadPerUnitTable twoCountryPerUnit() {
        HourlyTable loads = HourlyTable.builder(2)
                .put("A", HourlySeries.of(100, 100))
                .put("B", HourlySeries.of(50, 50))
                .build();
        HourlyTable profiles = HourlyTable.builder(2)
                .put("IND", HourlySeries.of(1, 1))
                .put("RES", HourlySeries.of(1, 1))
                .build();
        SectorShareResolver shares = new SectorShareResolver(LabeledTable.builder(List.of("IND", "RES"))
                .row("A", Map.of("IND", 0.6, "RES", 0.4))
                .row("B", Map.of("IND", 0.4, "RES", 0.6))
                .build(), "Default");
        SectoralLoadTable sectoral = sectoralService.disaggregate(loads, profiles, shares, List.of("IND", "RES"),
                new ProcessingWarnings(), ProgressListener.NONE);

        SectorLanduseWeights weights = new SectorLanduseWeights(List.of("IND"), LANDUSE, new double[][]{{0.8, 0.2}});
        ZonalStatisticsTable countryStats = ZonalStatisticsTable.builder("Country", COLUMNS)
                .add("A", new double[]{1000, 10, 5})
                .add("B", new double[]{500, 4, 2})
                .build();
        return sectoralService.loadPerUnit(sectoral, weights, countryStats, new ProcessingWarnings(), ProgressListener.NONE);
    }

    @Test
    void twoCountryExampleSplitsLoadProportionally() {
        // S1 = todo A + mitad de B; S2 = la otra mitad de B
        ZonalStatisticsTable parts = ZonalStatisticsTable.builder("Country_part", COLUMNS)
                .add("S1_A", new double[]{1000, 10, 5})
                .add("S1_B", new double[]{250, 2, 1})
                .add("S2_B", new double[]{250, 2, 1})
                .build();

        HourlyTable result = service.aggregate(parts, twoCountryPerUnit(), LANDUSE,
                new ProcessingWarnings(), ProgressListener.NONE);

        assertEquals(List.of("S1", "S2"), result.keys());
        assertEquals(125.0, result.series("S1").get(0), 1e-9);
        assertEquals(25.0, result.series("S2").get(0), 1e-9);
    }

    @Test
    void closedSystemConservesTotalLoadEveryHour() {
        ZonalStatisticsTable parts = ZonalStatisticsTable.builder("Country_part", COLUMNS)
                .add("North_A", new double[]{300, 7, 1})
                .add("South_A", new double[]{700, 3, 4})
                .add("South_B", new double[]{100, 1, 2})
                .add("East_B", new double[]{400, 3, 0})
                .build();

        HourlyTable result = service.aggregate(parts, twoCountryPerUnit(), LANDUSE,
                new ProcessingWarnings(), ProgressListener.NONE);

        for (int h = 0; h < result.getHours(); h++) {
            assertEquals(150.0, result.totalAt(h), 1e-9);
        }
    }

    @Test
    void partsOfUnknownCountriesAreDroppedWithWarning() {
        ZonalStatisticsTable parts = ZonalStatisticsTable.builder("Country_part", COLUMNS)
                .add("S1_A", new double[]{1000, 10, 5})
                .add("S1_XK", new double[]{999, 99, 9})
                .add("S3_XK", new double[]{1, 1, 1})
                .build();
        ProcessingWarnings warnings = new ProcessingWarnings();

        HourlyTable result = service.aggregate(parts, twoCountryPerUnit(), LANDUSE, warnings, ProgressListener.NONE);

        assertEquals(List.of("S1"), result.keys());
        assertEquals(100.0, result.series("S1").get(0), 1e-9);
        assertEquals(2, warnings.count(ProcessingWarnings.DROPPED_COUNTRY_PART));
    }

    @Test
    void equalPopulationWithoutLanduseGetsEqualResidentialShare() {
        ZonalStatisticsTable parts = ZonalStatisticsTable.builder("Country_part", COLUMNS)
                .add("West_A", new double[]{500, 0, 0})
                .add("East_A", new double[]{500, 0, 0})
                .build();

        HourlyTable result = service.aggregate(parts, twoCountryPerUnit(), LANDUSE,
                new ProcessingWarnings(), ProgressListener.NONE);

        assertEquals(result.series("West").get(0), result.series("East").get(0), 1e-12);
        assertEquals(20.0, result.series("East").get(0), 1e-9);
    }

    @Test
    void subregionNamesMayContainUnderscores() {
        ZonalStatisticsTable parts = ZonalStatisticsTable.builder("Country_part", COLUMNS)
                .add("Baden_Wurttemberg_A", new double[]{1000, 10, 5})
                .build();

        HourlyTable result = service.aggregate(parts, twoCountryPerUnit(), LANDUSE,
                new ProcessingWarnings(), ProgressListener.NONE);

        assertEquals(List.of("Baden_Wurttemberg"), result.keys());
    }
}
