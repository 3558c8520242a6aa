package com.ogt.loadmap.repository;

import com.ogt.loadmap.entity.PipelineJob;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineJobRepositoryTest {

    private final PipelineJobRepository repository = new PipelineJobRepository();

    @Test
    void changesAreVisibleOnlyAfterSave() {
        PipelineJob job = PipelineJob.builder().status("PENDING").createdAt(LocalDateTime.now()).build();
        UUID id = repository.save(job).getId();
        assertNotNull(id);

        job.setStatus("PROCESSING");
        job.getWarnings().add("S1_XK: país sin serie de carga");
        assertEquals("PENDING", repository.findById(id).orElseThrow().getStatus());
        assertTrue(repository.findById(id).orElseThrow().getWarnings().isEmpty());

        repository.save(job);
        assertEquals("PROCESSING", repository.findById(id).orElseThrow().getStatus());
        assertEquals(1, repository.findById(id).orElseThrow().getWarnings().size());
    }

    @Test
    void readersCannotAlterTheStoredJob() {
        UUID id = repository.save(PipelineJob.builder().status("PENDING").build()).getId();

        repository.findById(id).orElseThrow().setStatus("COMPLETED");
        repository.findAll().get(0).setStatus("FAILED");

        assertEquals("PENDING", repository.findById(id).orElseThrow().getStatus());
        assertTrue(repository.existsActive());
    }

    @Test
    void finishedJobsAreNotActive() {
        repository.save(PipelineJob.builder().status("COMPLETED").build());
        repository.save(PipelineJob.builder().status("FAILED").build());

        assertFalse(repository.existsActive());
    }
}
