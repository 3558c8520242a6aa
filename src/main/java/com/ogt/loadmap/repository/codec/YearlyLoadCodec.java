package com.ogt.loadmap.repository.codec;

import com.ogt.loadmap.exception.InputReadException;
import com.ogt.loadmap.util.CsvTables;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Demanda anual por país y sector: {@code Country;Sector;Load in MWh}.
 */
public class YearlyLoadCodec implements TableCodec<Map<String, Map<String, Double>>> {

    static final String LOAD_HEADER = "Load in MWh";

    @Override
    public Map<String, Map<String, Double>> read(Path path) {
        List<List<String>> rows = CsvTables.readRows(path);
        if (rows.isEmpty()) {
            throw new InputReadException(path, "tabla anual vacía");
        }
        Map<String, Map<String, Double>> totals = new LinkedHashMap<>();
        for (List<String> row : rows.subList(1, rows.size())) {
            if (row.size() != 3) {
                throw new InputReadException(path, "se esperaban 3 columnas");
            }
            totals.computeIfAbsent(row.get(0), c -> new LinkedHashMap<>())
                    .put(row.get(1), CsvTables.parse(row.get(2), path));
        }
        return totals;
    }

    @Override
    public void write(Map<String, Map<String, Double>> totals, Path path) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        rows.add(List.of(SectoralLoadCodec.COUNTRY_HEADER, SectoralLoadCodec.SECTOR_HEADER, LOAD_HEADER));
        totals.forEach((country, bySector) ->
                bySector.forEach((sector, load) -> rows.add(List.of(country, sector, CsvTables.format(load)))));
        CsvTables.writeRows(path, rows);
    }
}
