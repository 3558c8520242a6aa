package com.ogt.loadmap.util;

import com.ogt.loadmap.exception.InputReadException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Polygon;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeoJSONHelperTest {

    @Test
    void readsGeometryAndPropertiesWithConfiguredSrid(@TempDir Path tempDir) throws Exception {
        Path path = tempDir.resolve("countries.geojson");
        Files.writeString(path, "{\"type\":\"FeatureCollection\",\"features\":["
                + "{\"type\":\"Feature\",\"properties\":{\"GID_0\":\"DEU\",\"pop\":83},"
                + "\"geometry\":{\"type\":\"Polygon\",\"coordinates\":[[[0,0],[1,0],[1,1],[0,1],[0,0]]]}},"
                + "{\"type\":\"Feature\",\"properties\":{\"GID_0\":\"XXX\"},\"geometry\":null}]}");

        List<GeoJSONHelper.Feature> features = GeoJSONHelper.readFeatureCollection(path, 4326);

        assertEquals(2, features.size());
        GeoJSONHelper.Feature first = features.get(0);
        assertEquals(0, first.getIndex());
        assertEquals("DEU", first.property("GID_0"));
        assertEquals("83", first.property("pop"));
        assertTrue(first.getGeometry() instanceof Polygon);
        assertEquals(4326, first.getGeometry().getSRID());
        assertEquals(1.0, first.getGeometry().getArea(), 1e-12);
        assertNull(features.get(1).getGeometry());
        assertNull(first.property("missing"));
    }

    @Test
    void rejectsAnythingButAFeatureCollection(@TempDir Path tempDir) throws Exception {
        Path path = tempDir.resolve("point.geojson");
        Files.writeString(path, "{\"type\":\"Point\",\"coordinates\":[0,0]}");

        assertThrows(InputReadException.class, () -> GeoJSONHelper.readFeatureCollection(path, 4326));
    }
}
