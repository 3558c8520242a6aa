package com.ogt.loadmap.entity;

import lombok.AccessLevel;
import lombok.Getter;
import org.locationtech.jts.geom.Envelope;

/**
 * Grilla ráster de sólo lectura. La fila 0 es la más al norte, igual que en
 * los archivos ESRI ASCII grid.
 */
@Getter
public final class RasterGrid {

    private final String name;
    private final int ncols;
    private final int nrows;
    private final double xllCorner;
    private final double yllCorner;
    private final double cellSize;
    private final double noData;
    private final int srid;

    // fila mayor: values[row * ncols + col]
    @Getter(AccessLevel.NONE)
    private final double[] values;

    public RasterGrid(String name, int ncols, int nrows, double xllCorner, double yllCorner,
                      double cellSize, double noData, int srid, double[] values) {
        if (ncols <= 0 || nrows <= 0) {
            throw new IllegalArgumentException("Dimensiones inválidas: " + ncols + "x" + nrows);
        }
        if (cellSize <= 0) {
            throw new IllegalArgumentException("cellsize debe ser positivo: " + cellSize);
        }
        if (values.length != ncols * nrows) {
            throw new IllegalArgumentException("Se esperaban " + (ncols * nrows) + " celdas, hay " + values.length);
        }
        this.name = name;
        this.ncols = ncols;
        this.nrows = nrows;
        this.xllCorner = xllCorner;
        this.yllCorner = yllCorner;
        this.cellSize = cellSize;
        this.noData = noData;
        this.srid = srid;
        this.values = values.clone();
    }

    public double value(int row, int col) {
        return values[row * ncols + col];
    }

    public boolean isNoData(double value) {
        return Double.isNaN(value) || value == noData;
    }

    public double cellCenterX(int col) {
        return xllCorner + (col + 0.5) * cellSize;
    }

    public double cellCenterY(int row) {
        return yllCorner + (nrows - row - 0.5) * cellSize;
    }

    /** Columna que contiene la coordenada x, sin recortar a la grilla. */
    public int colOf(double x) {
        return (int) Math.floor((x - xllCorner) / cellSize);
    }

    /** Fila que contiene la coordenada y, sin recortar a la grilla. */
    public int rowOf(double y) {
        return nrows - 1 - (int) Math.floor((y - yllCorner) / cellSize);
    }

    public Envelope getEnvelope() {
        return new Envelope(xllCorner, xllCorner + ncols * cellSize, yllCorner, yllCorner + nrows * cellSize);
    }

    /**
     * Misma referencia geográfica: dimensiones, origen, resolución y SRID.
     */
    public boolean isAlignedWith(RasterGrid other) {
        return ncols == other.ncols
                && nrows == other.nrows
                && Double.compare(xllCorner, other.xllCorner) == 0
                && Double.compare(yllCorner, other.yllCorner) == 0
                && Double.compare(cellSize, other.cellSize) == 0
                && srid == other.srid;
    }

    @Override
    public String toString() {
        return "RasterGrid[" + name + " " + ncols + "x" + nrows + " @" + cellSize + " EPSG:" + srid + "]";
    }
}
