package com.ogt.loadmap.repository.codec;

import com.ogt.loadmap.entity.HourlySeries;
import com.ogt.loadmap.entity.HourlyTable;
import com.ogt.loadmap.exception.InputReadException;
import com.ogt.loadmap.util.CsvTables;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Una columna por clave, una fila por hora. Al leer se ignora una columna
 * índice inicial ({@code t}, {@code hour} o encabezado vacío); al escribir se
 * agrega como {@code t} = 1..N.
 */
public class HourlyTableCodec implements TableCodec<HourlyTable> {

    public static final String INDEX_COLUMN = "t";

    private static final Set<String> INDEX_NAMES = Set.of("", "t", "hour", "hours", "index");

    @Override
    public HourlyTable read(Path path) {
        List<List<String>> rows = CsvTables.readRows(path);
        if (rows.isEmpty()) {
            throw new InputReadException(path, "tabla horaria vacía");
        }
        List<String> header = rows.get(0);
        int first = INDEX_NAMES.contains(header.get(0).toLowerCase(Locale.ROOT)) ? 1 : 0;
        int hours = rows.size() - 1;
        int width = header.size() - first;

        double[][] columns = new double[width][hours];
        for (int h = 0; h < hours; h++) {
            List<String> row = rows.get(h + 1);
            if (row.size() != header.size()) {
                throw new InputReadException(path, "la fila " + (h + 2) + " tiene " + row.size()
                        + " celdas, el encabezado " + header.size());
            }
            for (int c = 0; c < width; c++) {
                columns[c][h] = CsvTables.parse(row.get(c + first), path);
            }
        }

        HourlyTable.Builder builder = HourlyTable.builder(hours);
        for (int c = 0; c < width; c++) {
            builder.put(header.get(c + first), HourlySeries.of(columns[c]));
        }
        return builder.build();
    }

    @Override
    public void write(HourlyTable table, Path path) throws IOException {
        List<String> keys = table.keys();
        List<List<String>> rows = new ArrayList<>(table.getHours() + 1);

        List<String> header = new ArrayList<>(keys.size() + 1);
        header.add(INDEX_COLUMN);
        header.addAll(keys);
        rows.add(header);

        List<HourlySeries> series = new ArrayList<>(keys.size());
        keys.forEach(k -> series.add(table.series(k)));
        for (int h = 0; h < table.getHours(); h++) {
            List<String> row = new ArrayList<>(keys.size() + 1);
            row.add(String.valueOf(h + 1));
            for (HourlySeries s : series) {
                row.add(CsvTables.format(s.get(h)));
            }
            rows.add(row);
        }
        CsvTables.writeRows(path, rows);
    }
}
