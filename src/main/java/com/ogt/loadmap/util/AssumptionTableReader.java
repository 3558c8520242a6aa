package com.ogt.loadmap.util;

import com.ogt.loadmap.entity.LabeledTable;
import com.ogt.loadmap.exception.InputReadException;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Tablas de supuestos (uso del suelo × sector, país × sector): primera fila
 * encabezado, primera columna clave de fila. Acepta .csv, .xlsx y .xls.
 */
public final class AssumptionTableReader {

    private AssumptionTableReader() {}

    public static LabeledTable read(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        List<List<String>> rows = fileName.endsWith(".xlsx") || fileName.endsWith(".xls")
                ? SpreadsheetTables.readRows(path)
                : CsvTables.readRows(path);
        if (rows.isEmpty()) {
            throw new InputReadException(path, "la tabla está vacía");
        }

        List<String> header = rows.get(0);
        if (header.size() < 2) {
            throw new InputReadException(path, "se esperaban al menos una columna clave y una de valores");
        }
        List<String> columns = header.subList(1, header.size());
        LabeledTable.Builder table = LabeledTable.builder(columns);

        for (List<String> row : rows.subList(1, rows.size())) {
            if (row.isEmpty() || row.get(0).isBlank()) continue;
            Map<String, Double> values = new LinkedHashMap<>();
            for (int c = 0; c < columns.size(); c++) {
                String raw = c + 1 < row.size() ? row.get(c + 1) : null;
                try {
                    values.put(columns.get(c), CsvTables.parseNullable(raw));
                } catch (NumberFormatException e) {
                    throw new InputReadException(path, "valor no numérico '" + raw + "' en la fila " + row.get(0));
                }
            }
            try {
                table.row(row.get(0).trim(), values);
            } catch (IllegalArgumentException e) {
                throw new InputReadException(path, e.getMessage());
            }
        }
        return table.build();
    }
}
