package com.ogt.loadmap.service;

import com.ogt.loadmap.entity.LabeledTable;
import com.ogt.loadmap.exception.MissingSectorShareException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SectorShareResolverTest {

    private SectorShareResolver resolver(boolean withDefault) {
        Map<String, Double> partial = new HashMap<>();
        partial.put("IND", 0.3);
        partial.put("RES", null);
        LabeledTable.Builder table = LabeledTable.builder(List.of("IND", "RES"))
                .row("DE", Map.of("IND", 0.6, "RES", 0.4))
                .row("FR", partial);
        if (withDefault) {
            table.row("Default", Map.of("IND", 0.5, "RES", 0.5));
        }
        return new SectorShareResolver(table.build(), "Default");
    }

    @Test
    void countryRowWins() {
        assertEquals(0.6, resolver(true).resolve("DE", "IND"));
    }

    @Test
    void emptyCellFallsBackToDefaultRow() {
        SectorShareResolver resolver = resolver(true);

        assertEquals(0.3, resolver.resolve("FR", "IND"));
        assertEquals(0.5, resolver.resolve("FR", "RES"));
        assertTrue(resolver.usesFallback("FR", List.of("IND", "RES")));
        assertFalse(resolver.usesFallback("DE", List.of("IND", "RES")));
    }

    @Test
    void unknownCountryUsesDefaultRow() {
        assertEquals(0.5, resolver(true).resolve("PL", "IND"));
    }

    @Test
    void missingEverywhereThrows() {
        MissingSectorShareException ex = assertThrows(MissingSectorShareException.class,
                () -> resolver(false).resolve("PL", "IND"));
        assertEquals("PL", ex.getCountry());
        assertEquals("IND", ex.getSector());
    }
}
