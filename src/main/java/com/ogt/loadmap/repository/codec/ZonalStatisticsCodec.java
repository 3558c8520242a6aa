package com.ogt.loadmap.repository.codec;

import com.ogt.loadmap.entity.ZonalStatisticsTable;
import com.ogt.loadmap.exception.InputReadException;
import com.ogt.loadmap.util.CsvTables;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code <clave>;Population;1;2;...}, una fila por región.
 */
public class ZonalStatisticsCodec implements TableCodec<ZonalStatisticsTable> {

    @Override
    public ZonalStatisticsTable read(Path path) {
        List<List<String>> rows = CsvTables.readRows(path);
        if (rows.isEmpty()) {
            throw new InputReadException(path, "tabla de estadísticas vacía");
        }
        List<String> header = rows.get(0);
        List<String> columns = header.subList(1, header.size());
        ZonalStatisticsTable.Builder builder = ZonalStatisticsTable.builder(header.get(0), columns);
        for (List<String> row : rows.subList(1, rows.size())) {
            if (row.size() != header.size()) {
                throw new InputReadException(path, "fila incompleta para " + row.get(0));
            }
            double[] values = new double[columns.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = CsvTables.parse(row.get(i + 1), path);
            }
            builder.add(row.get(0), values);
        }
        return builder.build();
    }

    @Override
    public void write(ZonalStatisticsTable table, Path path) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        List<String> header = new ArrayList<>();
        header.add(table.getKeyName());
        header.addAll(table.getColumns());
        rows.add(header);
        for (String id : table.regionIds()) {
            List<String> row = new ArrayList<>();
            row.add(id);
            for (String column : table.getColumns()) {
                row.add(CsvTables.format(table.get(id, column)));
            }
            rows.add(row);
        }
        CsvTables.writeRows(path, rows);
    }
}
