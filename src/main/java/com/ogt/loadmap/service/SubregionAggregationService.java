package com.ogt.loadmap.service;

import com.ogt.loadmap.entity.CountryPart;
import com.ogt.loadmap.entity.HourlySeries;
import com.ogt.loadmap.entity.HourlyTable;
import com.ogt.loadmap.entity.LoadPerUnitTable;
import com.ogt.loadmap.entity.ZonalStatisticsTable;
import com.ogt.loadmap.util.ProcessingWarnings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import static com.ogt.loadmap.entity.SectorLanduseWeights.RESIDENTIAL;
import static com.ogt.loadmap.entity.ZonalStatisticsTable.POPULATION;

@Service
@Slf4j
public class SubregionAggregationService {

    /**
     * Carga horaria por subregión: cada parte de país multiplica sus conteos
     * (población y píxeles por categoría) por la carga por unidad de su país,
     * y las partes se suman por subregión.
     */
    public HourlyTable aggregate(ZonalStatisticsTable partStats, LoadPerUnitTable perUnit,
                                 List<String> landuseTypes, ProcessingWarnings warnings,
                                 ProgressListener progress) {
        int hours = perUnit.getHours();
        Map<String, double[]> bySubregion = new TreeMap<>();
        TreeSet<String> droppedCountries = new TreeSet<>();
        List<String> partIds = partStats.regionIds();
        int done = 0;

        for (String partId : partIds) {
            String[] key = CountryPart.parseId(partId);
            String subregion = key[0];
            String country = key[1];

            if (!perUnit.containsCountry(country)) {
                log.debug("Parte {} sin carga por unidad para {}, se descarta", partId, country);
                warnings.add(ProcessingWarnings.DROPPED_COUNTRY_PART, partId,
                        "País " + country + " sin serie de carga; la parte no aporta a " + subregion);
                droppedCountries.add(country);
                progress.onProgress("Carga por subregión", ++done, partIds.size());
                continue;
            }

            Map<String, Double> counts = partStats.row(partId);
            double[] acc = bySubregion.computeIfAbsent(subregion, s -> new double[hours]);
            perUnit.series(country, RESIDENTIAL).addScaledTo(acc, counts.getOrDefault(POPULATION, 0.0));
            for (String landuse : landuseTypes) {
                perUnit.series(country, landuse).addScaledTo(acc, counts.getOrDefault(landuse, 0.0));
            }
            progress.onProgress("Carga por subregión", ++done, partIds.size());
        }

        if (!droppedCountries.isEmpty()) {
            log.warn("⚠️ Partes de país descartadas por falta de datos de carga para: {}", droppedCountries);
        }

        HourlyTable.Builder table = HourlyTable.builder(hours);
        bySubregion.forEach((subregion, values) -> table.put(subregion, HourlySeries.of(values)));
        log.info("🗺️ Carga horaria agregada en {} subregiones", bySubregion.size());
        return table.build();
    }
}
