package com.ogt.loadmap.repository.codec;

import com.ogt.loadmap.entity.Site;
import com.ogt.loadmap.exception.InputReadException;
import com.ogt.loadmap.util.CsvTables;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class SiteTableCodec implements TableCodec<List<Site>> {

    static final List<String> HEADER = List.of(
            "Name", "Index_shapefile", "Area_m2", "Longitude", "Latitude", "slacknode",
            "syncarea", "ctrarea", "primpos", "primneg", "secpos", "secneg", "terpos", "terneg");

    @Override
    public List<Site> read(Path path) {
        List<List<String>> rows = CsvTables.readRows(path);
        if (rows.isEmpty() || !rows.get(0).equals(HEADER)) {
            throw new InputReadException(path, "encabezado de sitios inesperado");
        }
        List<Site> sites = new ArrayList<>();
        for (List<String> row : rows.subList(1, rows.size())) {
            if (row.size() != HEADER.size()) {
                throw new InputReadException(path, "fila de sitio incompleta: " + row.get(0));
            }
            sites.add(Site.builder()
                    .name(row.get(0))
                    .indexShapefile(Integer.parseInt(row.get(1)))
                    .areaM2(CsvTables.parse(row.get(2), path))
                    .longitude(CsvTables.parse(row.get(3), path))
                    .latitude(CsvTables.parse(row.get(4), path))
                    .slacknode(Integer.parseInt(row.get(5)))
                    .syncarea(Integer.parseInt(row.get(6)))
                    .ctrarea(Integer.parseInt(row.get(7)))
                    .primpos(CsvTables.parse(row.get(8), path))
                    .primneg(CsvTables.parse(row.get(9), path))
                    .secpos(CsvTables.parse(row.get(10), path))
                    .secneg(CsvTables.parse(row.get(11), path))
                    .terpos(CsvTables.parse(row.get(12), path))
                    .terneg(CsvTables.parse(row.get(13), path))
                    .build());
        }
        return sites;
    }

    @Override
    public void write(List<Site> sites, Path path) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        rows.add(HEADER);
        for (Site s : sites) {
            rows.add(List.of(
                    s.getName(),
                    String.valueOf(s.getIndexShapefile()),
                    CsvTables.format(s.getAreaM2()),
                    CsvTables.format(s.getLongitude()),
                    CsvTables.format(s.getLatitude()),
                    String.valueOf(s.getSlacknode()),
                    String.valueOf(s.getSyncarea()),
                    String.valueOf(s.getCtrarea()),
                    CsvTables.format(s.getPrimpos()),
                    CsvTables.format(s.getPrimneg()),
                    CsvTables.format(s.getSecpos()),
                    CsvTables.format(s.getSecneg()),
                    CsvTables.format(s.getTerpos()),
                    CsvTables.format(s.getTerneg())));
        }
        CsvTables.writeRows(path, rows);
    }
}
