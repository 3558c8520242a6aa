package com.ogt.loadmap.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ogt.loadmap.exception.InputReadException;
import lombok.Value;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Lectura de FeatureCollections GeoJSON: la geometría con JTS y las
 * propiedades con Jackson.
 */
public final class GeoJSONHelper {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private GeoJSONHelper() {}

    /** Feature tal como viene del archivo; la geometría puede ser null. */
    @Value
    public static class Feature {
        int index;
        Geometry geometry;
        Map<String, Object> properties;

        public String property(String name) {
            Object value = properties.get(name);
            return value != null ? value.toString() : null;
        }
    }

    public static List<Feature> readFeatureCollection(Path path, int srid) {
        if (!Files.isRegularFile(path)) {
            throw new InputReadException(path, "el archivo GeoJSON no existe");
        }
        try {
            JsonNode root = MAPPER.readTree(path.toFile());
            return parseFeatureCollection(root, srid, path);
        } catch (IOException e) {
            throw new InputReadException(path, e);
        }
    }

    static List<Feature> parseFeatureCollection(JsonNode root, int srid, Path source) {
        if (root == null || !"FeatureCollection".equals(root.path("type").asText())) {
            throw new InputReadException(source, "se esperaba un FeatureCollection");
        }
        GeoJsonReader reader = new GeoJsonReader(new GeometryFactory(new PrecisionModel(), srid));
        List<Feature> features = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root.path("features")) {
            Geometry geometry = null;
            JsonNode geomNode = node.get("geometry");
            if (geomNode != null && !geomNode.isNull()) {
                try {
                    geometry = reader.read(geomNode.toString());
                    geometry.setSRID(srid);
                } catch (ParseException e) {
                    throw new InputReadException(source, "geometría inválida en el feature " + index + ": " + e.getMessage());
                }
            }
            Map<String, Object> properties = node.hasNonNull("properties")
                    ? MAPPER.convertValue(node.get("properties"), new TypeReference<Map<String, Object>>() {})
                    : Collections.emptyMap();
            features.add(new Feature(index, geometry, properties));
            index++;
        }
        return features;
    }
}
