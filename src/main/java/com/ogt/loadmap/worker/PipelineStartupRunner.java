package com.ogt.loadmap.worker;

import com.ogt.loadmap.service.PipelineJobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Encola una corrida al arrancar ({@code loadmap.run-on-startup=true}). Pasa
 * por {@link PipelineJobService} como cualquier otra, así un POST /jobs
 * recibido mientras corre se rechaza.
 */
@Component
@ConditionalOnProperty(prefix = "loadmap", name = "run-on-startup", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class PipelineStartupRunner implements CommandLineRunner {

    private final PipelineJobService jobService;

    @Override
    public void run(String... args) {
        UUID jobId = jobService.queueRun();
        log.info("▶️ Corrida de inicio encolada. Job ID: {}", jobId);
    }
}
