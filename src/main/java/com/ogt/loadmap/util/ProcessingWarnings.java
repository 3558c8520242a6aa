package com.ogt.loadmap.util;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registro de condiciones recuperables de una corrida (sectores faltantes,
 * partes de país descartadas, geometrías reparadas...). Nunca se descartan en
 * silencio: se loguean y quedan aquí para el job.
 */
@Data
public class ProcessingWarnings {

    public static final String MISSING_SECTOR = "MISSING_SECTOR";
    public static final String EMPTY_SECTOR_WEIGHTS = "EMPTY_SECTOR_WEIGHTS";
    public static final String DEFAULT_SECTOR_SHARES = "DEFAULT_SECTOR_SHARES";
    public static final String ZERO_SECTOR_PROFILE = "ZERO_SECTOR_PROFILE";
    public static final String ZERO_DENOMINATOR = "ZERO_DENOMINATOR";
    public static final String DROPPED_COUNTRY_PART = "DROPPED_COUNTRY_PART";
    public static final String REPAIRED_GEOMETRY = "REPAIRED_GEOMETRY";
    public static final String SKIPPED_GEOMETRY = "SKIPPED_GEOMETRY";

    private List<Warning> warnings = new ArrayList<>();
    private Map<String, Integer> warningCounts = new LinkedHashMap<>();

    @Data
    public static class Warning {
        private String type;
        private String subject;
        private String message;

        public Warning(String type, String subject, String message) {
            this.type = type;
            this.subject = subject;
            this.message = message;
        }
    }

    public void add(String type, String subject, String message) {
        warnings.add(new Warning(type, subject, message));
        warningCounts.merge(type, 1, Integer::sum);
    }

    public int getWarningCount() {
        return warnings.size();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public int count(String type) {
        return warningCounts.getOrDefault(type, 0);
    }

    public List<String> messages() {
        return warnings.stream().map(w -> w.type + " " + w.subject + ": " + w.message).toList();
    }

    public String getSummary() {
        if (warnings.isEmpty()) {
            return "Sin advertencias";
        }

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Total de advertencias: %d%n", warnings.size()));

        warningCounts.forEach((type, count) ->
                sb.append(String.format("- %s: %d%n", type, count))
        );

        sb.append(String.format("%nPrimeras advertencias:%n"));
        warnings.stream()
                .limit(5)
                .forEach(w -> sb.append(String.format("%s: %s%n", w.subject, w.message)));

        if (warnings.size() > 5) {
            sb.append(String.format("... y %d más%n", warnings.size() - 5));
        }

        return sb.toString();
    }
}
