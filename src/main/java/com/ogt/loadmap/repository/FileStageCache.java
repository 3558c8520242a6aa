package com.ogt.loadmap.repository;

import com.ogt.loadmap.exception.LoadmapException;
import com.ogt.loadmap.repository.codec.TableCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.Supplier;

@Repository
@RequiredArgsConstructor
@Slf4j
public class FileStageCache implements StageCache {

    private final MetadataSidecarWriter sidecarWriter;

    @Override
    public <T> T getOrCompute(Path output, TableCodec<T> codec, Supplier<T> compute, StageMetadata metadata) {
        if (Files.exists(output)) {
            log.info("♻️ [{}] Usando resultado existente: {}", metadata.getStage(), output);
            return codec.read(output);
        }

        log.info("▶️ [{}] Calculando {}", metadata.getStage(), output.getFileName());
        T result = compute.get();

        Path temp = output.resolveSibling(output.getFileName() + ".tmp");
        try {
            if (output.getParent() != null) {
                Files.createDirectories(output.getParent());
            }
            codec.write(result, temp);
            sidecarWriter.write(output, metadata);
            // el archivo final sólo aparece completo: su existencia marca la etapa como hecha
            Files.move(temp, output, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new LoadmapException("No se pudo guardar " + output + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            deleteQuietly(temp);
            throw e;
        }
        log.info("✅ [{}] Archivo guardado: {}", metadata.getStage(), output);
        return result;
    }

    private void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("⚠️ No se pudo borrar el temporal {}: {}", temp, e.getMessage());
        }
    }
}
