package com.ogt.loadmap.service;

import com.ogt.loadmap.entity.HourlySeries;
import com.ogt.loadmap.entity.HourlyTable;
import com.ogt.loadmap.entity.LoadPerUnitTable;
import com.ogt.loadmap.entity.SectorLanduseWeights;
import com.ogt.loadmap.entity.SectoralLoadTable;
import com.ogt.loadmap.entity.ZonalStatisticsTable;
import com.ogt.loadmap.exception.ConfigurationException;
import com.ogt.loadmap.util.ProcessingWarnings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static com.ogt.loadmap.entity.SectorLanduseWeights.RESIDENTIAL;
import static com.ogt.loadmap.entity.ZonalStatisticsTable.POPULATION;

@Service
@Slf4j
public class SectoralDisaggregationService {

    /**
     * Reparte la carga horaria de cada país entre sectores.
     * <p>
     * raw[c,s,h] = perfil[s,h] × participación(c,s); luego cada hora se
     * re-normaliza para que la suma de sectores sea exactamente la carga
     * original del país.
     */
    public SectoralLoadTable disaggregate(HourlyTable countryLoads, HourlyTable profiles,
                                          SectorShareResolver shares, List<String> sectors,
                                          ProcessingWarnings warnings, ProgressListener progress) {
        validateInputs(countryLoads, profiles, sectors);

        int hours = countryLoads.getHours();
        List<String> countries = countryLoads.keys();
        SectoralLoadTable.Builder table = SectoralLoadTable.builder(hours);
        int done = 0;

        for (String country : countries) {
            if (shares.usesFallback(country, sectors)) {
                log.warn("⚠️ País {} sin participaciones sectoriales propias: se usa '{}'", country, shares.getDefaultKey());
                warnings.add(ProcessingWarnings.DEFAULT_SECTOR_SHARES, country,
                        "Participaciones sectoriales tomadas de la fila " + shares.getDefaultKey());
            }

            // Paso 1: perfiles × participación
            double[][] raw = new double[sectors.size()][];
            for (int s = 0; s < sectors.size(); s++) {
                String sector = sectors.get(s);
                raw[s] = profiles.series(sector).times(shares.resolve(country, sector)).toArray();
            }

            // Paso 2: re-normalización horaria contra la carga real
            HourlySeries total = countryLoads.series(country);
            double[][] scaled = new double[sectors.size()][hours];
            int evenHours = 0;
            for (int h = 0; h < hours; h++) {
                double rawSum = 0.0;
                for (double[] r : raw) {
                    rawSum += r[h];
                }
                for (int s = 0; s < sectors.size(); s++) {
                    scaled[s][h] = rawSum != 0.0
                            ? raw[s][h] / rawSum * total.get(h)
                            : total.get(h) / sectors.size();
                }
                if (rawSum == 0.0) evenHours++;
            }
            if (evenHours > 0) {
                log.warn("⚠️ País {}: {} horas con perfiles sectoriales en cero; la carga se reparte en partes iguales",
                        country, evenHours);
                warnings.add(ProcessingWarnings.ZERO_SECTOR_PROFILE, country,
                        evenHours + " horas repartidas en partes iguales entre sectores");
            }

            for (int s = 0; s < sectors.size(); s++) {
                table.put(country, sectors.get(s), HourlySeries.of(scaled[s]));
            }
            progress.onProgress("Carga sectorial por país", ++done, countries.size());
        }

        log.info("🏭 Carga sectorial calculada para {} países y {} sectores", countries.size(), sectors.size());
        return table.build();
    }

    /**
     * Carga horaria por unidad de uso del suelo y por habitante.
     * <ul>
     *   <li>RES: carga residencial / población del país.</li>
     *   <li>Categoría lu: Σ_s peso(s,lu) × carga(s) / conteo ponderado(s).</li>
     * </ul>
     * Un denominador nulo aporta cero.
     */
    public LoadPerUnitTable loadPerUnit(SectoralLoadTable sectoral, SectorLanduseWeights weights,
                                        ZonalStatisticsTable countryStats, ProcessingWarnings warnings,
                                        ProgressListener progress) {
        TreeSet<String> countrySet = new TreeSet<>(countryStats.regionIds());
        countrySet.retainAll(sectoral.countries());
        List<String> countries = new ArrayList<>(countrySet);

        int hours = sectoral.getHours();
        List<String> landuseTypes = weights.getLanduseTypes();
        LoadPerUnitTable.Builder table = LoadPerUnitTable.builder(hours);
        int done = 0;

        for (String country : countries) {
            Map<String, Double> counts = countryStats.row(country);

            double[][] perLanduse = new double[landuseTypes.size()][hours];
            for (String sector : weights.getSectors()) {
                double weightedCount = weights.weightedCount(sector, counts);
                if (weightedCount == 0.0) {
                    guardZero(country, sector, warnings);
                    continue;
                }
                HourlySeries sectorLoad = sectoral.series(country, sector);
                for (int lu = 0; lu < landuseTypes.size(); lu++) {
                    double factor = weights.weight(sector, landuseTypes.get(lu)) / weightedCount;
                    sectorLoad.addScaledTo(perLanduse[lu], factor);
                }
            }
            for (int lu = 0; lu < landuseTypes.size(); lu++) {
                table.put(country, landuseTypes.get(lu), HourlySeries.of(perLanduse[lu]));
            }

            double population = counts.getOrDefault(POPULATION, 0.0);
            if (population == 0.0) {
                guardZero(country, RESIDENTIAL, warnings);
                table.put(country, RESIDENTIAL, HourlySeries.zeros(hours));
            } else {
                table.put(country, RESIDENTIAL, sectoral.series(country, RESIDENTIAL).times(1.0 / population));
            }
            progress.onProgress("Carga por unidad de uso del suelo", ++done, countries.size());
        }

        log.info("🧮 Carga por unidad calculada para {} países ({} categorías + {})",
                countries.size(), landuseTypes.size(), RESIDENTIAL);
        return table.build();
    }

    // ================================================================
    // Helpers
    // ================================================================

    private void validateInputs(HourlyTable countryLoads, HourlyTable profiles, List<String> sectors) {
        if (!sectors.contains(RESIDENTIAL)) {
            throw new ConfigurationException("La lista de sectores debe incluir " + RESIDENTIAL);
        }
        for (String sector : sectors) {
            if (!profiles.contains(sector)) {
                throw new ConfigurationException("No hay perfil de carga para el sector " + sector);
            }
        }
        if (profiles.getHours() != countryLoads.getHours()) {
            throw new ConfigurationException("Los perfiles tienen " + profiles.getHours()
                    + " horas y la carga por país " + countryLoads.getHours());
        }
    }

    private void guardZero(String country, String sector, ProcessingWarnings warnings) {
        log.warn("⚠️ País {}: denominador nulo para {}; su aporte por unidad queda en cero", country, sector);
        warnings.add(ProcessingWarnings.ZERO_DENOMINATOR, country + "/" + sector,
                "Sin píxeles ni población para repartir la carga; aporte cero");
    }
}
