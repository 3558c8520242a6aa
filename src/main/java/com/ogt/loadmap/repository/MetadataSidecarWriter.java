package com.ogt.loadmap.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Escribe {@code <salida>.json} junto a cada tabla producida.
 */
@Component
@RequiredArgsConstructor
public class MetadataSidecarWriter {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public static Path sidecarOf(Path output) {
        String fileName = output.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return output.resolveSibling(base + ".json");
    }

    public Path write(Path output, StageMetadata metadata) throws IOException {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("file", output.getFileName().toString());
        content.put("stage", metadata.getStage());
        content.put("createdAt", clock.instant().toString());
        content.put("parameters", metadata.getParameters());
        content.put("inputs", metadata.getInputs());

        Path sidecar = sidecarOf(output);
        if (sidecar.getParent() != null) {
            Files.createDirectories(sidecar.getParent());
        }
        objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .writeValue(sidecar.toFile(), content);
        return sidecar;
    }
}
