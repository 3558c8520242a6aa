package com.ogt.loadmap.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ogt.loadmap.entity.HourlySeries;
import com.ogt.loadmap.entity.HourlyTable;
import com.ogt.loadmap.exception.LoadmapException;
import com.ogt.loadmap.repository.codec.HourlyTableCodec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileStageCacheTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
    private final FileStageCache cache = new FileStageCache(new MetadataSidecarWriter(objectMapper, clock));

    private final StageMetadata metadata = StageMetadata.builder()
            .stage("load_regions")
            .parameter("year", 2015)
            .parameter("sectors", List.of("IND", "RES"))
            .input("countries", "input/countries.geojson")
            .build();

    private HourlyTable table() {
        return HourlyTable.builder(3)
                .put("S1", HourlySeries.of(0.1, 1.0 / 3.0, 125.0))
                .put("S2", HourlySeries.of(2.5e-7, 0.0, -1.0))
                .build();
    }

    @Test
    void computesOnceAndThenReadsTheFile(@TempDir Path tempDir) {
        Path output = tempDir.resolve("out/load_regions.csv");
        AtomicInteger computations = new AtomicInteger();

        HourlyTable first = cache.getOrCompute(output, new HourlyTableCodec(), () -> {
            computations.incrementAndGet();
            return table();
        }, metadata);
        HourlyTable second = cache.getOrCompute(output, new HourlyTableCodec(), () -> {
            computations.incrementAndGet();
            return table();
        }, metadata);

        assertEquals(1, computations.get());
        assertEquals(first, second, "la tabla releída es idéntica bit a bit");
        assertTrue(Files.exists(output));
    }

    @Test
    void writesMetadataSidecarNextToTheOutput(@TempDir Path tempDir) throws Exception {
        Path output = tempDir.resolve("load_regions.csv");

        cache.getOrCompute(output, new HourlyTableCodec(), this::table, metadata);

        Path sidecar = MetadataSidecarWriter.sidecarOf(output);
        assertEquals(tempDir.resolve("load_regions.json"), sidecar);
        JsonNode json = objectMapper.readTree(sidecar.toFile());
        assertEquals("load_regions.csv", json.get("file").asText());
        assertEquals("load_regions", json.get("stage").asText());
        assertEquals("2024-01-01T00:00:00Z", json.get("createdAt").asText());
        assertEquals(2015, json.get("parameters").get("year").asInt());
        assertEquals("input/countries.geojson", json.get("inputs").get("countries").asText());
    }

    @Test
    void failedWriteLeavesNoFileBehind(@TempDir Path tempDir) {
        Path output = tempDir.resolve("load_regions.csv");
        HourlyTableCodec truncating = new HourlyTableCodec() {
            @Override
            public void write(HourlyTable table, Path path) throws IOException {
                Files.writeString(path, "t;S1;S2\n1;0.1;2.5E-7\n");
                throw new IOException("disco lleno");
            }
        };

        assertThrows(LoadmapException.class, () -> cache.getOrCompute(output, truncating, this::table, metadata));
        assertFalse(Files.exists(output));
        assertFalse(Files.exists(output.resolveSibling("load_regions.csv.tmp")));

        HourlyTable retried = cache.getOrCompute(output, new HourlyTableCodec(), this::table, metadata);

        assertEquals(3, retried.getHours());
        assertEquals(table(), cache.getOrCompute(output, new HourlyTableCodec(), () -> {
            throw new AssertionError("no debería recalcular");
        }, metadata));
    }

    @Test
    void existingFileIsNeverRecomputed(@TempDir Path tempDir) throws Exception {
        Path output = tempDir.resolve("load_regions.csv");
        Files.writeString(output, "t;S9\n1;7,5\n");

        HourlyTable result = cache.getOrCompute(output, new HourlyTableCodec(), () -> {
            throw new AssertionError("no debería recalcular");
        }, metadata);

        assertEquals(List.of("S9"), result.keys());
        assertEquals(7.5, result.series("S9").get(0));
    }
}
