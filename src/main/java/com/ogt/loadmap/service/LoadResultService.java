package com.ogt.loadmap.service;

import com.ogt.loadmap.config.LoadmapProperties;
import com.ogt.loadmap.dto.SectorLoadDTO;
import com.ogt.loadmap.dto.SubregionLoadDTO;
import com.ogt.loadmap.entity.HourlySeries;
import com.ogt.loadmap.entity.HourlyTable;
import com.ogt.loadmap.repository.codec.HourlyTableCodec;
import com.ogt.loadmap.repository.codec.YearlyLoadCodec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Consulta de los resultados ya guardados en el directorio de salida.
 * Vacío si la etapa todavía no se ejecutó.
 */
@Service
@RequiredArgsConstructor
public class LoadResultService {

    private final LoadmapProperties properties;

    public Optional<List<SubregionLoadDTO>> getSubregionLoads() {
        Path path = properties.subregionLoadPath();
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        HourlyTable table = new HourlyTableCodec().read(path);
        List<SubregionLoadDTO> result = new ArrayList<>();
        for (String subregion : table.keys()) {
            HourlySeries series = table.series(subregion);
            int peak = 0;
            for (int h = 1; h < series.length(); h++) {
                if (series.get(h) > series.get(peak)) peak = h;
            }
            result.add(SubregionLoadDTO.builder()
                    .subregion(subregion)
                    .yearlyLoadMWh(series.sum())
                    .peakLoadMW(series.length() > 0 ? series.get(peak) : 0.0)
                    .peakHour(series.length() > 0 ? peak + 1 : null)
                    .build());
        }
        return Optional.of(result);
    }

    public Optional<List<SectorLoadDTO>> getSectorLoads() {
        Path path = properties.yearlyLoadPath();
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        Map<String, Map<String, Double>> totals = new YearlyLoadCodec().read(path);
        List<SectorLoadDTO> result = new ArrayList<>();
        totals.forEach((country, bySector) -> bySector.forEach((sector, load) ->
                result.add(SectorLoadDTO.builder()
                        .country(country)
                        .sector(sector)
                        .yearlyLoadMWh(load)
                        .build())));
        return Optional.of(result);
    }
}
