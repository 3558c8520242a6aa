package com.ogt.loadmap.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "loadmap")
public class LoadmapProperties {

    // Parámetros de procedencia (van a los sidecars JSON)
    private String regionName = "Europe";
    private String subregionsName = "Subregions";
    private Integer year = 2015;

    /** SRID común de rásters y polígonos. */
    private int srid = 4326;

    @NotNull
    private Path outputDir = Path.of("output");

    private boolean runOnStartup = false;

    @Valid
    private Inputs inputs = new Inputs();

    @Valid
    private Fields fields = new Fields();

    @Valid
    private Load load = new Load();

    @Data
    public static class Inputs {
        private Path countries;
        private Path subregions;
        private Path landuseRaster;
        private Path populationRaster;
        // Máscaras opcionales para clasificar sitios onshore / offshore
        private Path landRaster;
        private Path seaRaster;
        private Path loadTimeseries;
        private Path sectorProfiles;
        private Path assumptionsLanduse;
        private Path sectorShares;
    }

    @Data
    public static class Fields {
        @NotBlank
        private String country = "GID_0";
        @NotBlank
        private String subregion = "NAME_SHORT";
    }

    @Data
    public static class Load {
        @NotEmpty
        private List<String> sectors = new ArrayList<>(List.of("COM", "IND", "AGR", "RES"));
        @NotBlank
        private String defaultSectorShares = "Default";
    }

    // ================================================================
    // Rutas fijas de salida
    // ================================================================

    public Path statsCountriesPath() {
        return outputDir.resolve("stats_countries.csv");
    }

    public Path sectoralLoadPath() {
        return outputDir.resolve("df_sector.csv");
    }

    public Path yearlyLoadPath() {
        return outputDir.resolve("load_sector.csv");
    }

    public Path loadPerUnitPath() {
        return outputDir.resolve("load_landuse.csv");
    }

    public Path statsCountryPartsPath() {
        return outputDir.resolve("stats_country_parts.csv");
    }

    public Path subregionLoadPath() {
        return outputDir.resolve("load_regions.csv");
    }

    public Path sitesPath() {
        return outputDir.resolve("sites.csv");
    }
}
