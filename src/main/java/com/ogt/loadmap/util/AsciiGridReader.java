package com.ogt.loadmap.util;

import com.ogt.loadmap.entity.RasterGrid;
import com.ogt.loadmap.exception.InputReadException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Lector de rásters ESRI ASCII grid (.asc).
 *
 * <pre>
 * ncols 4
 * nrows 3
 * xllcorner 0.0
 * yllcorner 0.0
 * cellsize 1.0
 * NODATA_value -9999
 * 1 1 2 2
 * ...
 * </pre>
 *
 * Acepta también {@code xllcenter}/{@code yllcenter}. La primera fila de datos
 * es la más al norte.
 */
@Slf4j
public final class AsciiGridReader {

    private static final double DEFAULT_NODATA = -9999.0;

    private AsciiGridReader() {}

    public static RasterGrid read(Path path, String name, int srid) {
        if (!Files.isRegularFile(path)) {
            throw new InputReadException(path, "el ráster no existe");
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Map<String, String> header = new HashMap<>();
            String line;
            String firstDataLine = null;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty()) continue;
                if (!Character.isLetter(trimmed.charAt(0))) {
                    firstDataLine = trimmed;
                    break;
                }
                String[] parts = trimmed.split("\\s+");
                if (parts.length != 2) {
                    throw new InputReadException(path, "encabezado inválido '" + trimmed + "'");
                }
                header.put(parts[0].toLowerCase(Locale.ROOT), parts[1]);
            }

            int ncols = Integer.parseInt(required(header, "ncols", path));
            int nrows = Integer.parseInt(required(header, "nrows", path));
            double cellSize = Double.parseDouble(required(header, "cellsize", path));
            double xll = corner(header, "xll", cellSize, path);
            double yll = corner(header, "yll", cellSize, path);
            double noData = header.containsKey("nodata_value")
                    ? Double.parseDouble(header.get("nodata_value"))
                    : DEFAULT_NODATA;

            double[] values = new double[ncols * nrows];
            int filled = 0;
            line = firstDataLine;
            while (line != null) {
                for (String token : line.trim().split("\\s+")) {
                    if (token.isEmpty()) continue;
                    if (filled >= values.length) {
                        throw new InputReadException(path, "más celdas que ncols × nrows");
                    }
                    values[filled++] = Double.parseDouble(token);
                }
                line = reader.readLine();
            }
            if (filled != values.length) {
                throw new InputReadException(path, "se leyeron " + filled + " celdas de " + values.length);
            }

            RasterGrid grid = new RasterGrid(name, ncols, nrows, xll, yll, cellSize, noData, srid, values);
            log.info("🗺️ Ráster leído: {} ({})", grid, path.getFileName());
            return grid;
        } catch (IOException | NumberFormatException e) {
            throw new InputReadException(path, e);
        }
    }

    private static String required(Map<String, String> header, String key, Path path) {
        String value = header.get(key);
        if (value == null) {
            throw new InputReadException(path, "falta '" + key + "' en el encabezado");
        }
        return value;
    }

    private static double corner(Map<String, String> header, String prefix, double cellSize, Path path) {
        if (header.containsKey(prefix + "corner")) {
            return Double.parseDouble(header.get(prefix + "corner"));
        }
        if (header.containsKey(prefix + "center")) {
            return Double.parseDouble(header.get(prefix + "center")) - cellSize / 2.0;
        }
        throw new InputReadException(path, "falta '" + prefix + "corner' en el encabezado");
    }
}
