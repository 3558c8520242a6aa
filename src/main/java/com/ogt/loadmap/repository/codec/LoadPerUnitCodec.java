package com.ogt.loadmap.repository.codec;

import com.ogt.loadmap.entity.HourlySeries;
import com.ogt.loadmap.entity.LoadPerUnitTable;
import com.ogt.loadmap.exception.InputReadException;
import com.ogt.loadmap.util.CsvTables;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Una fila por (país, unidad): {@code Country;Land use;1;2;...;N}.
 */
public class LoadPerUnitCodec implements TableCodec<LoadPerUnitTable> {

    static final String UNIT_HEADER = "Land use";

    @Override
    public LoadPerUnitTable read(Path path) {
        List<List<String>> rows = CsvTables.readRows(path);
        if (rows.isEmpty()) {
            throw new InputReadException(path, "tabla de carga por unidad vacía");
        }
        int hours = rows.get(0).size() - 2;
        LoadPerUnitTable.Builder builder = LoadPerUnitTable.builder(hours);
        for (List<String> row : rows.subList(1, rows.size())) {
            if (row.size() != hours + 2) {
                throw new InputReadException(path, "fila incompleta para " + row.get(0) + "/" + row.get(1));
            }
            double[] values = new double[hours];
            for (int h = 0; h < hours; h++) {
                values[h] = CsvTables.parse(row.get(h + 2), path);
            }
            builder.put(row.get(0), row.get(1), HourlySeries.of(values));
        }
        return builder.build();
    }

    @Override
    public void write(LoadPerUnitTable table, Path path) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        List<String> header = new ArrayList<>(table.getHours() + 2);
        header.add(SectoralLoadCodec.COUNTRY_HEADER);
        header.add(UNIT_HEADER);
        for (int h = 1; h <= table.getHours(); h++) {
            header.add(String.valueOf(h));
        }
        rows.add(header);
        for (String country : table.countries()) {
            for (String unit : table.secondaryKeys(country)) {
                HourlySeries series = table.series(country, unit);
                List<String> row = new ArrayList<>(table.getHours() + 2);
                row.add(country);
                row.add(unit);
                for (int h = 0; h < series.length(); h++) {
                    row.add(CsvTables.format(series.get(h)));
                }
                rows.add(row);
            }
        }
        CsvTables.writeRows(path, rows);
    }
}
