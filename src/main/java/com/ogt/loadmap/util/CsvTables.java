package com.ogt.loadmap.util;

import com.ogt.loadmap.exception.InputReadException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Dialecto CSV de las tablas intermedias: separador {@code ;} y coma decimal.
 * Los números se escriben con {@link Double#toString(double)}, de modo que una
 * tabla releída es bit a bit igual a la escrita.
 */
public final class CsvTables {

    public static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setDelimiter(';')
            .setRecordSeparator("\n")
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .build();

    private CsvTables() {}

    /** Lee todas las filas (incluidos los encabezados) como listas de texto. */
    public static List<List<String>> readRows(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new InputReadException(path, "el archivo no existe");
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = new CSVParser(reader, FORMAT)) {
            List<List<String>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                List<String> row = new ArrayList<>(record.size());
                record.forEach(value -> row.add(stripBom(value)));
                rows.add(row);
            }
            return rows;
        } catch (IOException e) {
            throw new InputReadException(path, e);
        }
    }

    /** Escribe filas ya formateadas, creando el directorio padre si hace falta. */
    public static void writeRows(Path path, List<List<String>> rows) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, FORMAT)) {
            for (List<String> row : rows) {
                printer.printRecord(row);
            }
        }
    }

    public static String format(double value) {
        return Double.toString(value).replace('.', ',');
    }

    /**
     * Interpreta un número con coma o punto decimal. Celda vacía → null.
     */
    public static Double parseNullable(String raw) {
        if (raw == null) return null;
        String value = raw.trim();
        if (value.isEmpty() || "nan".equalsIgnoreCase(value)) return null;
        return Double.parseDouble(value.replace(',', '.'));
    }

    public static double parse(String raw, Path source) {
        Double value;
        try {
            value = parseNullable(raw);
        } catch (NumberFormatException e) {
            throw new InputReadException(source, "valor no numérico '" + raw + "'");
        }
        if (value == null) {
            throw new InputReadException(source, "celda vacía donde se esperaba un número");
        }
        return value;
    }

    private static String stripBom(String value) {
        return !value.isEmpty() && value.charAt(0) == '\uFEFF' ? value.substring(1) : value;
    }
}
