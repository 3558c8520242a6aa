package com.ogt.loadmap.repository.codec;

import com.ogt.loadmap.entity.HourlySeries;
import com.ogt.loadmap.entity.HourlyTable;
import com.ogt.loadmap.entity.LoadPerUnitTable;
import com.ogt.loadmap.entity.SectoralLoadTable;
import com.ogt.loadmap.entity.Site;
import com.ogt.loadmap.entity.ZonalStatisticsTable;
import com.ogt.loadmap.exception.InputReadException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.ogt.loadmap.entity.ZonalStatisticsTable.POPULATION;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TableCodecTest {

    @Test
    void hourlyTableUsesSemicolonsAndDecimalComma(@TempDir Path tempDir) throws Exception {
        Path path = tempDir.resolve("load_regions.csv");
        HourlyTable table = HourlyTable.builder(2)
                .put("S1", HourlySeries.of(1.5, 0.1 + 0.2))
                .put("S2", HourlySeries.of(3.0, 1e-9))
                .build();

        new HourlyTableCodec().write(table, path);

        List<String> lines = Files.readAllLines(path);
        assertEquals("t;S1;S2", lines.get(0));
        assertEquals("1;1,5;3,0", lines.get(1));
        assertEquals(table, new HourlyTableCodec().read(path));
    }

    @Test
    void hourlyTableWithoutIndexColumnIsAccepted(@TempDir Path tempDir) throws Exception {
        Path path = tempDir.resolve("profiles.csv");
        Files.writeString(path, "\uFEFFIND;RES\n0,5;1\n0,25;2\n");

        HourlyTable table = new HourlyTableCodec().read(path);

        assertEquals(List.of("IND", "RES"), table.keys());
        assertEquals(0.25, table.series("IND").get(1));
    }

    @Test
    void sectoralTableHasTwoHeaderRows(@TempDir Path tempDir) throws Exception {
        Path path = tempDir.resolve("df_sector.csv");
        SectoralLoadTable table = SectoralLoadTable.builder(2)
                .put("DE", "IND", HourlySeries.of(60, 1.0 / 7.0))
                .put("DE", "RES", HourlySeries.of(40, 2))
                .put("FR", "IND", HourlySeries.of(20, 3))
                .build();

        new SectoralLoadCodec().write(table, path);

        List<String> lines = Files.readAllLines(path);
        assertEquals("Country;DE;DE;FR", lines.get(0));
        assertEquals("Sector;IND;RES;IND", lines.get(1));
        assertEquals(table, new SectoralLoadCodec().read(path));
    }

    @Test
    void perUnitTableHasOneRowPerCountryAndUnit(@TempDir Path tempDir) throws Exception {
        Path path = tempDir.resolve("load_landuse.csv");
        LoadPerUnitTable table = LoadPerUnitTable.builder(3)
                .put("DE", "10", HourlySeries.of(0.1, 0.2, 0.3))
                .put("DE", "RES", HourlySeries.of(0.04, 0.04, 0.04))
                .build();

        new LoadPerUnitCodec().write(table, path);

        assertEquals("Country;Land use;1;2;3", Files.readAllLines(path).get(0));
        assertEquals(table, new LoadPerUnitCodec().read(path));
    }

    @Test
    void zonalStatisticsKeepKeyNameAndColumns(@TempDir Path tempDir) throws Exception {
        Path path = tempDir.resolve("stats_countries.csv");
        ZonalStatisticsTable table = ZonalStatisticsTable.builder("Country", List.of(POPULATION, "10", "20"))
                .add("DE", new double[]{83_000_000.5, 12, 0})
                .build();

        new ZonalStatisticsCodec().write(table, path);
        ZonalStatisticsTable read = new ZonalStatisticsCodec().read(path);

        assertEquals("Country", read.getKeyName());
        assertEquals(table.getColumns(), read.getColumns());
        assertEquals(table.row("DE"), read.row("DE"));
    }

    @Test
    void yearlyTotalsAreLongFormat(@TempDir Path tempDir) throws Exception {
        Path path = tempDir.resolve("load_sector.csv");
        Map<String, Map<String, Double>> totals = new LinkedHashMap<>();
        totals.put("DE", new LinkedHashMap<>(Map.of("IND", 1234.5)));

        new YearlyLoadCodec().write(totals, path);

        assertEquals(List.of("Country;Sector;Load in MWh", "DE;IND;1234,5"), Files.readAllLines(path));
        assertEquals(totals, new YearlyLoadCodec().read(path));
    }

    @Test
    void siteTableRoundTripsEveryColumn(@TempDir Path tempDir) throws Exception {
        Path path = tempDir.resolve("sites.csv");
        List<Site> sites = List.of(
                Site.builder().name("North").indexShapefile(0).areaM2(1.2e10).longitude(1).latitude(2).slacknode(1).build(),
                Site.builder().name("Bay_offshore").indexShapefile(3).areaM2(5e9).longitude(-1.5).latitude(0.25).build());

        new SiteTableCodec().write(sites, path);

        assertTrue(Files.readAllLines(path).get(0).startsWith("Name;Index_shapefile;Area_m2;Longitude;Latitude"));
        assertEquals(sites, new SiteTableCodec().read(path));
    }

    @Test
    void malformedNumberReportsTheFile(@TempDir Path tempDir) throws Exception {
        Path path = tempDir.resolve("broken.csv");
        Files.writeString(path, "t;S1\n1;abc\n");

        InputReadException ex = assertThrows(InputReadException.class, () -> new HourlyTableCodec().read(path));
        assertTrue(ex.getMessage().contains("broken.csv"));
    }
}
