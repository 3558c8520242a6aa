package com.ogt.loadmap.entity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Carga horaria por (país, sector). Para cada hora la suma de los sectores de
 * un país es igual a su carga total original.
 */
public final class SectoralLoadTable extends CountrySeriesTable {

    private SectoralLoadTable(Entries entries) {
        super(entries.series(), entries.hours());
    }

    public static Builder builder(int hours) {
        return new Builder(hours);
    }

    /** Suma de los sectores de un país en la hora dada. */
    public double countryTotalAt(String country, int hour) {
        double total = 0.0;
        for (String sector : secondaryKeys(country)) {
            total += series(country, sector).get(hour);
        }
        return total;
    }

    /** Demanda anual por país → sector. */
    public Map<String, Map<String, Double>> yearlyTotals() {
        Map<String, Map<String, Double>> totals = new LinkedHashMap<>();
        for (String country : countries()) {
            Map<String, Double> bySector = new LinkedHashMap<>();
            for (String sector : secondaryKeys(country)) {
                bySector.put(sector, series(country, sector).sum());
            }
            totals.put(country, bySector);
        }
        return totals;
    }

    public static final class Builder {

        private final Entries entries;

        private Builder(int hours) {
            this.entries = new Entries(hours);
        }

        public Builder put(String country, String sector, HourlySeries series) {
            entries.put(country, sector, series);
            return this;
        }

        public SectoralLoadTable build() {
            return new SectoralLoadTable(entries);
        }
    }
}
