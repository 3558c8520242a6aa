package com.ogt.loadmap;

import com.ogt.loadmap.entity.RasterGrid;
import com.ogt.loadmap.entity.Region;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;

import java.util.Arrays;

/**
 * Geometrías y grillas pequeñas para los tests.
 */
public final class Fixtures {

    public static final int SRID = 4326;
    public static final GeometryFactory FACTORY = new GeometryFactory(new PrecisionModel(), SRID);

    private Fixtures() {}

    public static Geometry rect(double minX, double minY, double maxX, double maxY) {
        return FACTORY.toGeometry(new Envelope(minX, maxX, minY, maxY));
    }

    public static Region country(String id, Geometry geometry, int index) {
        return Region.builder().id(id).geometry(geometry).country(id).sourceIndex(index).build();
    }

    public static Region subregion(String id, Geometry geometry, int index) {
        return Region.builder().id(id).geometry(geometry).sourceIndex(index).build();
    }

    /** Grilla de celdas de 1×1 con origen en (0,0); las filas van de norte a sur. */
    public static RasterGrid grid(String name, double[][] rows) {
        int nrows = rows.length;
        int ncols = rows[0].length;
        double[] values = new double[nrows * ncols];
        for (int r = 0; r < nrows; r++) {
            System.arraycopy(rows[r], 0, values, r * ncols, ncols);
        }
        return new RasterGrid(name, ncols, nrows, 0.0, 0.0, 1.0, -9999.0, SRID, values);
    }

    public static RasterGrid constant(String name, int ncols, int nrows, double value) {
        double[][] rows = new double[nrows][ncols];
        for (double[] row : rows) {
            Arrays.fill(row, value);
        }
        return grid(name, rows);
    }
}
