package com.ogt.loadmap.repository.codec;

import com.ogt.loadmap.entity.HourlySeries;
import com.ogt.loadmap.entity.SectoralLoadTable;
import com.ogt.loadmap.exception.InputReadException;
import com.ogt.loadmap.util.CsvTables;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Dos filas de encabezado ({@code Country;...} y {@code Sector;...}) y una fila
 * por hora. La primera columna es el índice horario.
 */
public class SectoralLoadCodec implements TableCodec<SectoralLoadTable> {

    static final String COUNTRY_HEADER = "Country";
    static final String SECTOR_HEADER = "Sector";

    @Override
    public SectoralLoadTable read(Path path) {
        List<List<String>> rows = CsvTables.readRows(path);
        if (rows.size() < 2) {
            throw new InputReadException(path, "faltan las filas de encabezado");
        }
        List<String> countries = rows.get(0);
        List<String> sectors = rows.get(1);
        if (countries.size() != sectors.size()) {
            throw new InputReadException(path, "encabezados de distinto largo");
        }
        int width = countries.size() - 1;
        int hours = rows.size() - 2;
        double[][] columns = new double[width][hours];
        for (int h = 0; h < hours; h++) {
            List<String> row = rows.get(h + 2);
            if (row.size() != countries.size()) {
                throw new InputReadException(path, "fila horaria " + (h + 1) + " incompleta");
            }
            for (int c = 0; c < width; c++) {
                columns[c][h] = CsvTables.parse(row.get(c + 1), path);
            }
        }
        SectoralLoadTable.Builder builder = SectoralLoadTable.builder(hours);
        for (int c = 0; c < width; c++) {
            builder.put(countries.get(c + 1), sectors.get(c + 1), HourlySeries.of(columns[c]));
        }
        return builder.build();
    }

    @Override
    public void write(SectoralLoadTable table, Path path) throws IOException {
        List<String> countryHeader = new ArrayList<>();
        List<String> sectorHeader = new ArrayList<>();
        List<HourlySeries> series = new ArrayList<>();
        countryHeader.add(COUNTRY_HEADER);
        sectorHeader.add(SECTOR_HEADER);
        for (String country : table.countries()) {
            for (String sector : table.secondaryKeys(country)) {
                countryHeader.add(country);
                sectorHeader.add(sector);
                series.add(table.series(country, sector));
            }
        }

        List<List<String>> rows = new ArrayList<>(table.getHours() + 2);
        rows.add(countryHeader);
        rows.add(sectorHeader);
        for (int h = 0; h < table.getHours(); h++) {
            List<String> row = new ArrayList<>(series.size() + 1);
            row.add(String.valueOf(h + 1));
            for (HourlySeries s : series) {
                row.add(CsvTables.format(s.get(h)));
            }
            rows.add(row);
        }
        CsvTables.writeRows(path, rows);
    }
}
