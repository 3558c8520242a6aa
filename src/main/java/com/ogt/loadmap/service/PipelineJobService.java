package com.ogt.loadmap.service;

import com.ogt.loadmap.entity.PipelineJob;
import com.ogt.loadmap.repository.PipelineJobRepository;
import com.ogt.loadmap.worker.PipelineWorker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineJobService {

    private final PipelineJobRepository jobRepository;
    private final PipelineWorker pipelineWorker;

    /**
     * Registra un job PENDING y lo entrega al worker asíncrono. Las corridas
     * escriben en el mismo directorio de salida, así que sólo puede haber una
     * activa a la vez.
     *
     * @throws IllegalStateException si ya hay un job pendiente o en proceso
     */
    public synchronized UUID queueRun() {
        if (jobRepository.existsActive()) {
            throw new IllegalStateException("Ya hay una corrida del pipeline en curso");
        }

        PipelineJob job = PipelineJob.builder()
                .status("PENDING")
                .createdAt(LocalDateTime.now())
                .build();
        jobRepository.save(job);

        pipelineWorker.process(job.getId());

        log.info("🚀 Corrida encolada. Job ID: {}", job.getId());
        return job.getId();
    }

    public Optional<PipelineJob> getJob(UUID jobId) {
        return jobRepository.findById(jobId);
    }

    public List<PipelineJob> getJobs() {
        return jobRepository.findAll();
    }
}
