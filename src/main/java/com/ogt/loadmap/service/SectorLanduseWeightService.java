package com.ogt.loadmap.service;

import com.ogt.loadmap.entity.LabeledTable;
import com.ogt.loadmap.entity.SectorLanduseWeights;
import com.ogt.loadmap.exception.ConfigurationException;
import com.ogt.loadmap.util.ProcessingWarnings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static com.ogt.loadmap.entity.SectorLanduseWeights.RESIDENTIAL;

@Service
@Slf4j
public class SectorLanduseWeightService {

    /**
     * Normaliza la tabla de supuestos (uso del suelo × sector) por sector.
     * Se conservan los sectores presentes a la vez en los supuestos y en la
     * configuración; RES nunca se pondera por uso del suelo.
     */
    public SectorLanduseWeights normalize(LabeledTable assumptions, List<String> configuredSectors,
                                          ProcessingWarnings warnings) {
        List<String> landuseTypes = assumptions.getRowKeys();
        if (landuseTypes.isEmpty()) {
            throw new ConfigurationException("La tabla de supuestos de uso del suelo no tiene filas");
        }
        for (String landuse : landuseTypes) {
            if (!landuse.trim().matches("-?\\d+")) {
                throw new ConfigurationException("Categoría de uso del suelo no numérica: '" + landuse + "'");
            }
        }

        Set<String> shared = new TreeSet<>(assumptions.getColumns());
        shared.retainAll(configuredSectors);
        shared.remove(RESIDENTIAL);

        Set<String> available = new LinkedHashSet<>(shared);
        available.add(RESIDENTIAL);
        Set<String> missing = new TreeSet<>(configuredSectors);
        missing.removeAll(available);
        if (!missing.isEmpty()) {
            log.warn("⚠️ Los siguientes sectores no están en los supuestos de uso del suelo: {}", missing);
            missing.forEach(s -> warnings.add(ProcessingWarnings.MISSING_SECTOR, s,
                    "Sector configurado sin columna en los supuestos de uso del suelo; su carga no se asigna espacialmente"));
        }

        List<String> sectors = new ArrayList<>(shared);
        double[][] weights = new double[sectors.size()][landuseTypes.size()];
        for (int s = 0; s < sectors.size(); s++) {
            String sector = sectors.get(s);
            double sum = 0.0;
            for (int lu = 0; lu < landuseTypes.size(); lu++) {
                weights[s][lu] = assumptions.valueOrZero(landuseTypes.get(lu), sector);
                sum += weights[s][lu];
            }
            if (sum == 0.0) {
                log.warn("⚠️ El sector {} tiene todos sus coeficientes en cero; sus pesos quedan en cero", sector);
                warnings.add(ProcessingWarnings.EMPTY_SECTOR_WEIGHTS, sector, "Coeficientes de uso del suelo en cero");
                continue;
            }
            for (int lu = 0; lu < landuseTypes.size(); lu++) {
                weights[s][lu] /= sum;
            }
        }

        log.info("⚖️ Pesos sector/uso del suelo: sectores {} sobre {} categorías", sectors, landuseTypes.size());
        return new SectorLanduseWeights(sectors, landuseTypes, weights);
    }
}
