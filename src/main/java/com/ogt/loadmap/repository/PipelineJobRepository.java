package com.ogt.loadmap.repository;

import com.ogt.loadmap.entity.PipelineJob;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Jobs en memoria: el estado de las corridas no sobrevive a un reinicio, los
 * resultados sí (quedan en el directorio de salida).
 * <p>
 * Guarda y devuelve copias: el worker modifica su propia instancia y la
 * publica con {@link #save}, los hilos HTTP sólo ven instantáneas completas.
 */
@Repository
public class PipelineJobRepository {

    private final Map<UUID, PipelineJob> jobs = new ConcurrentHashMap<>();

    public PipelineJob save(PipelineJob job) {
        if (job.getId() == null) {
            job.setId(UUID.randomUUID());
        }
        jobs.put(job.getId(), job.copy());
        return job;
    }

    public Optional<PipelineJob> findById(UUID id) {
        return Optional.ofNullable(jobs.get(id)).map(PipelineJob::copy);
    }

    public List<PipelineJob> findAll() {
        List<PipelineJob> all = new ArrayList<>();
        jobs.values().forEach(job -> all.add(job.copy()));
        all.sort(Comparator.comparing(PipelineJob::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())));
        return all;
    }

    public boolean existsActive() {
        return jobs.values().stream()
                .anyMatch(j -> "PENDING".equals(j.getStatus()) || "PROCESSING".equals(j.getStatus()));
    }
}
