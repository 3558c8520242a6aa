package com.ogt.loadmap.worker;

import com.ogt.loadmap.entity.PipelineJob;
import com.ogt.loadmap.repository.PipelineJobRepository;
import com.ogt.loadmap.service.LoadPipelineService;
import com.ogt.loadmap.service.PipelineResult;
import com.ogt.loadmap.service.ProgressListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.UUID;

@Component
@RequiredArgsConstructor
@Slf4j
public class PipelineWorker {

    private final PipelineJobRepository jobRepository;
    private final LoadPipelineService pipelineService;
    private final ProgressListener progressListener;

    @Async
    public void process(UUID jobId) {
        log.info("▶️ [Pipeline Worker] Recibido job: {}", jobId);

        PipelineJob job = jobRepository.findById(jobId).orElse(null);
        if (job == null) {
            log.error("❌ Job inexistente: {}", jobId);
            return;
        }

        try {
            job.setStatus("PROCESSING");
            job.setStartedAt(LocalDateTime.now());
            jobRepository.save(job);

            PipelineResult result = pipelineService.run(trackingStage(job));
            completeJob(job, result);
            log.info("✅ Corrida completada. Subregiones: {}", job.getSubregionCount());

        } catch (Exception e) {
            log.error("❌ Error crítico en la corrida {}", jobId, e);
            handleRunError(job, e);
        }
    }

    /** Publica la etapa en curso y delega el avance al listener configurado. */
    private ProgressListener trackingStage(PipelineJob job) {
        return (stage, done, total) -> {
            if (!stage.equals(job.getCurrentStage())) {
                job.setCurrentStage(stage);
                jobRepository.save(job);
            }
            progressListener.onProgress(stage, done, total);
        };
    }

    private void completeJob(PipelineJob job, PipelineResult result) {
        job.setStatus("COMPLETED");
        job.setCurrentStage(null);
        job.setSubregionCount(result.getSubregionLoad().keys().size());
        job.setWarnings(new ArrayList<>(result.getWarnings().messages()));
        job.setWarningSummary(result.getWarnings().getSummary());
        job.setCompletedAt(LocalDateTime.now());
        jobRepository.save(job);
    }

    private void handleRunError(PipelineJob job, Exception e) {
        job.setStatus("FAILED");
        job.setErrorMessage(e.getMessage());
        job.setCompletedAt(LocalDateTime.now());
        jobRepository.save(job);
    }
}
