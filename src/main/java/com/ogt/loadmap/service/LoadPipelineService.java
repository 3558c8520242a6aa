package com.ogt.loadmap.service;

import com.ogt.loadmap.config.LoadmapProperties;
import com.ogt.loadmap.entity.CountryPart;
import com.ogt.loadmap.entity.HourlyTable;
import com.ogt.loadmap.entity.LoadPerUnitTable;
import com.ogt.loadmap.entity.RasterGrid;
import com.ogt.loadmap.entity.RasterLayer;
import com.ogt.loadmap.entity.Region;
import com.ogt.loadmap.entity.SectorLanduseWeights;
import com.ogt.loadmap.entity.SectoralLoadTable;
import com.ogt.loadmap.entity.Site;
import com.ogt.loadmap.entity.ZonalStatisticsTable;
import com.ogt.loadmap.exception.ConfigurationException;
import com.ogt.loadmap.repository.StageCache;
import com.ogt.loadmap.repository.StageMetadata;
import com.ogt.loadmap.repository.codec.HourlyTableCodec;
import com.ogt.loadmap.repository.codec.LoadPerUnitCodec;
import com.ogt.loadmap.repository.codec.SectoralLoadCodec;
import com.ogt.loadmap.repository.codec.SiteTableCodec;
import com.ogt.loadmap.repository.codec.YearlyLoadCodec;
import com.ogt.loadmap.repository.codec.ZonalStatisticsCodec;
import com.ogt.loadmap.util.AsciiGridReader;
import com.ogt.loadmap.util.AssumptionTableReader;
import com.ogt.loadmap.util.ProcessingWarnings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.ogt.loadmap.entity.ZonalStatisticsTable.POPULATION;

/**
 * Orquesta la cadena completa. Cada etapa tabular pasa por el caché de
 * archivos; las entradas pesadas (rásters, polígonos) se leen sólo si alguna
 * etapa tiene que recalcularse.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoadPipelineService {

    public static final String STAGE_COUNTRY_STATS = "stats_countries";
    public static final String STAGE_SECTORAL = "load_sector_hourly";
    public static final String STAGE_YEARLY = "load_sector_yearly";
    public static final String STAGE_PER_UNIT = "load_landuse";
    public static final String STAGE_PART_STATS = "stats_country_parts";
    public static final String STAGE_SUBREGIONS = "load_regions";
    public static final String STAGE_SITES = "sites";

    private final LoadmapProperties properties;
    private final StageCache stageCache;
    private final RegionLoader regionLoader;
    private final ZonalStatisticsService zonalStatisticsService;
    private final SectorLanduseWeightService weightService;
    private final SectoralDisaggregationService sectoralService;
    private final CountryPartService countryPartService;
    private final SubregionAggregationService aggregationService;
    private final SiteService siteService;

    public PipelineResult run(ProgressListener progress) {
        ProcessingWarnings warnings = new ProcessingWarnings();
        RunInputs inputs = new RunInputs(warnings);
        List<String> sectors = properties.getLoad().getSectors();

        log.info("🚀 Iniciando desagregación de carga: {} → {} ({})",
                properties.getRegionName(), properties.getSubregionsName(), properties.getYear());

        // 1. Pesos sector / uso del suelo
        progress.onProgress("Pesos sector/uso del suelo", 0, 1);
        SectorLanduseWeights weights = weightService.normalize(
                AssumptionTableReader.read(requireInput(properties.getInputs().getAssumptionsLanduse(), "assumptions-landuse")),
                sectors, warnings);
        List<String> landuseTypes = weights.getLanduseTypes();
        progress.onProgress("Pesos sector/uso del suelo", 1, 1);

        // 2. Estadísticas zonales por país
        ZonalStatisticsTable countryStats = stageCache.getOrCompute(
                properties.statsCountriesPath(), new ZonalStatisticsCodec(),
                () -> zonalStatisticsService.compute("Country", inputs.countries(), inputs.layers(landuseTypes), progress),
                metadata(STAGE_COUNTRY_STATS, landuseTypes,
                        paths("countries", properties.getInputs().getCountries(),
                                "landuse_raster", properties.getInputs().getLanduseRaster(),
                                "population_raster", properties.getInputs().getPopulationRaster())));

        // 3. Carga horaria por país y sector
        SectoralLoadTable sectoralLoad = stageCache.getOrCompute(
                properties.sectoralLoadPath(), new SectoralLoadCodec(),
                () -> sectoralService.disaggregate(
                        inputs.hourly(properties.getInputs().getLoadTimeseries(), "load-timeseries"),
                        inputs.hourly(properties.getInputs().getSectorProfiles(), "sector-profiles"),
                        new SectorShareResolver(
                                AssumptionTableReader.read(requireInput(properties.getInputs().getSectorShares(), "sector-shares")),
                                properties.getLoad().getDefaultSectorShares()),
                        sectors, warnings, progress),
                metadata(STAGE_SECTORAL, landuseTypes,
                        paths("load_timeseries", properties.getInputs().getLoadTimeseries(),
                                "sector_profiles", properties.getInputs().getSectorProfiles(),
                                "sector_shares", properties.getInputs().getSectorShares())));

        // 4. Totales anuales por sector
        stageCache.getOrCompute(
                properties.yearlyLoadPath(), new YearlyLoadCodec(),
                sectoralLoad::yearlyTotals,
                metadata(STAGE_YEARLY, landuseTypes, paths("sectoral_load", properties.sectoralLoadPath())));

        // 5. Carga por unidad de uso del suelo y por habitante
        LoadPerUnitTable perUnit = stageCache.getOrCompute(
                properties.loadPerUnitPath(), new LoadPerUnitCodec(),
                () -> sectoralService.loadPerUnit(sectoralLoad, weights, countryStats, warnings, progress),
                metadata(STAGE_PER_UNIT, landuseTypes,
                        paths("sectoral_load", properties.sectoralLoadPath(),
                                "stats_countries", properties.statsCountriesPath(),
                                "assumptions_landuse", properties.getInputs().getAssumptionsLanduse())));

        // 6-7. Partes de país y sus estadísticas
        ZonalStatisticsTable partStats = stageCache.getOrCompute(
                properties.statsCountryPartsPath(), new ZonalStatisticsCodec(),
                () -> zonalStatisticsService.compute("Country_part", inputs.countryPartRegions(progress),
                        inputs.layers(landuseTypes), progress),
                metadata(STAGE_PART_STATS, landuseTypes,
                        paths("countries", properties.getInputs().getCountries(),
                                "subregions", properties.getInputs().getSubregions(),
                                "landuse_raster", properties.getInputs().getLanduseRaster(),
                                "population_raster", properties.getInputs().getPopulationRaster())));

        // 8. Carga horaria por subregión
        HourlyTable subregionLoad = stageCache.getOrCompute(
                properties.subregionLoadPath(), new HourlyTableCodec(),
                () -> aggregationService.aggregate(partStats, perUnit, landuseTypes, warnings, progress),
                metadata(STAGE_SUBREGIONS, landuseTypes,
                        paths("stats_country_parts", properties.statsCountryPartsPath(),
                                "load_landuse", properties.loadPerUnitPath())));

        // 9. Tabla de sitios
        List<Site> sites = stageCache.getOrCompute(
                properties.sitesPath(), new SiteTableCodec(),
                () -> siteService.generate(inputs.subregions(), inputs.landMask(), inputs.seaMask()),
                metadata(STAGE_SITES, landuseTypes,
                        paths("subregions", properties.getInputs().getSubregions())));

        if (warnings.hasWarnings()) {
            log.warn("⚠️ Corrida terminada con advertencias:\n{}", warnings.getSummary());
        }
        log.info("🏁 Desagregación completada: {} subregiones, {} sitios", subregionLoad.keys().size(), sites.size());

        return PipelineResult.builder()
                .output(STAGE_COUNTRY_STATS, properties.statsCountriesPath())
                .output(STAGE_SECTORAL, properties.sectoralLoadPath())
                .output(STAGE_YEARLY, properties.yearlyLoadPath())
                .output(STAGE_PER_UNIT, properties.loadPerUnitPath())
                .output(STAGE_PART_STATS, properties.statsCountryPartsPath())
                .output(STAGE_SUBREGIONS, properties.subregionLoadPath())
                .output(STAGE_SITES, properties.sitesPath())
                .subregionLoad(subregionLoad)
                .sites(sites)
                .warnings(warnings)
                .build();
    }

    // ================================================================
    // Helpers
    // ================================================================

    private StageMetadata metadata(String stage, List<String> landuseTypes, Map<String, Path> inputs) {
        StageMetadata.StageMetadataBuilder builder = StageMetadata.builder()
                .stage(stage)
                .parameter("region_name", properties.getRegionName())
                .parameter("subregions_name", properties.getSubregionsName())
                .parameter("year", properties.getYear())
                .parameter("sectors", properties.getLoad().getSectors())
                .parameter("landuse_types", landuseTypes)
                .parameter("srid", properties.getSrid());
        inputs.forEach((name, path) -> builder.input(name, path != null ? path.toString() : ""));
        return builder.build();
    }

    /** Pares nombre/ruta; admite rutas no configuradas (null). */
    private static Map<String, Path> paths(Object... nameAndPath) {
        Map<String, Path> result = new LinkedHashMap<>();
        for (int i = 0; i < nameAndPath.length; i += 2) {
            result.put((String) nameAndPath[i], (Path) nameAndPath[i + 1]);
        }
        return result;
    }

    private static Path requireInput(Path path, String key) {
        if (path == null) {
            throw new ConfigurationException("Falta configurar loadmap.inputs." + key);
        }
        return path;
    }

    /**
     * Entradas de una corrida, leídas la primera vez que una etapa las pide.
     */
    private final class RunInputs {

        private final ProcessingWarnings warnings;
        private List<Region> countries;
        private List<Region> subregions;
        private RasterGrid landuse;
        private RasterGrid population;

        private RunInputs(ProcessingWarnings warnings) {
            this.warnings = warnings;
        }

        List<Region> countries() {
            if (countries == null) {
                countries = regionLoader.loadCountries(
                        requireInput(properties.getInputs().getCountries(), "countries"),
                        properties.getFields().getCountry(), properties.getSrid(), warnings);
            }
            return countries;
        }

        List<Region> subregions() {
            if (subregions == null) {
                subregions = regionLoader.loadSubregions(
                        requireInput(properties.getInputs().getSubregions(), "subregions"),
                        properties.getFields().getSubregion(), properties.getSrid(), warnings);
            }
            return subregions;
        }

        List<RasterLayer> layers(List<String> landuseTypes) {
            if (population == null) {
                population = AsciiGridReader.read(
                        requireInput(properties.getInputs().getPopulationRaster(), "population-raster"),
                        POPULATION, properties.getSrid());
            }
            if (landuse == null) {
                landuse = AsciiGridReader.read(
                        requireInput(properties.getInputs().getLanduseRaster(), "landuse-raster"),
                        "landuse", properties.getSrid());
            }
            return List.of(RasterLayer.continuous(POPULATION, population),
                    RasterLayer.categorical(landuse, landuseTypes));
        }

        List<Region> countryPartRegions(ProgressListener progress) {
            List<CountryPart> parts = countryPartService.split(subregions(), countries(), warnings, progress);
            List<Region> regions = new ArrayList<>(parts.size());
            for (int i = 0; i < parts.size(); i++) {
                regions.add(parts.get(i).toRegion(i));
            }
            return regions;
        }

        HourlyTable hourly(Path path, String key) {
            return new HourlyTableCodec().read(requireInput(path, key));
        }

        RasterGrid landMask() {
            Path path = properties.getInputs().getLandRaster();
            return path != null ? AsciiGridReader.read(path, "land", properties.getSrid()) : null;
        }

        RasterGrid seaMask() {
            Path path = properties.getInputs().getSeaRaster();
            return path != null ? AsciiGridReader.read(path, "sea", properties.getSrid()) : null;
        }
    }
}
