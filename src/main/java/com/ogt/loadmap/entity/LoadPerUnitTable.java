package com.ogt.loadmap.entity;

/**
 * Carga horaria atribuible a una unidad (un píxel de una categoría de uso del
 * suelo, o un habitante para RES) dentro de cada país.
 */
public final class LoadPerUnitTable extends CountrySeriesTable {

    private LoadPerUnitTable(Entries entries) {
        super(entries.series(), entries.hours());
    }

    public static Builder builder(int hours) {
        return new Builder(hours);
    }

    public static final class Builder {

        private final Entries entries;

        private Builder(int hours) {
            this.entries = new Entries(hours);
        }

        public Builder put(String country, String unit, HourlySeries series) {
            entries.put(country, unit, series);
            return this;
        }

        public LoadPerUnitTable build() {
            return new LoadPerUnitTable(entries);
        }
    }
}
