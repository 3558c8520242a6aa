package com.ogt.loadmap.worker;

import com.ogt.loadmap.entity.HourlySeries;
import com.ogt.loadmap.entity.HourlyTable;
import com.ogt.loadmap.entity.PipelineJob;
import com.ogt.loadmap.exception.ConfigurationException;
import com.ogt.loadmap.repository.PipelineJobRepository;
import com.ogt.loadmap.service.LoadPipelineService;
import com.ogt.loadmap.service.PipelineResult;
import com.ogt.loadmap.service.ProgressListener;
import com.ogt.loadmap.util.ProcessingWarnings;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PipelineWorkerTest {

    private final PipelineJobRepository repository = new PipelineJobRepository();
    private final LoadPipelineService pipeline = mock(LoadPipelineService.class);
    private final PipelineWorker worker = new PipelineWorker(repository, pipeline, ProgressListener.NONE);

    private UUID pendingJob() {
        return repository.save(PipelineJob.builder()
                .status("PENDING")
                .createdAt(LocalDateTime.now())
                .build()).getId();
    }

    @Test
    void successfulRunCompletesJobWithWarnings() {
        ProcessingWarnings warnings = new ProcessingWarnings();
        warnings.add(ProcessingWarnings.DROPPED_COUNTRY_PART, "S1_XK", "País XK sin serie de carga");
        PipelineResult result = PipelineResult.builder()
                .subregionLoad(HourlyTable.builder(1)
                        .put("S1", HourlySeries.of(1))
                        .put("S2", HourlySeries.of(2))
                        .build())
                .sites(List.of())
                .warnings(warnings)
                .build();
        when(pipeline.run(any())).thenReturn(result);
        UUID id = pendingJob();

        worker.process(id);

        PipelineJob job = repository.findById(id).orElseThrow();
        assertEquals("COMPLETED", job.getStatus());
        assertEquals(2, job.getSubregionCount());
        assertEquals(1, job.getWarnings().size());
        assertNotNull(job.getStartedAt());
        assertNotNull(job.getCompletedAt());
    }

    @Test
    void failingRunMarksJobFailedWithMessage() {
        when(pipeline.run(any())).thenThrow(new ConfigurationException("Falta configurar loadmap.inputs.countries"));
        UUID id = pendingJob();

        worker.process(id);

        PipelineJob job = repository.findById(id).orElseThrow();
        assertEquals("FAILED", job.getStatus());
        assertEquals("Falta configurar loadmap.inputs.countries", job.getErrorMessage());
    }

    @Test
    void progressUpdatesCurrentStage() {
        UUID id = pendingJob();
        when(pipeline.run(any())).thenAnswer(invocation -> {
            ProgressListener listener = invocation.getArgument(0);
            listener.onProgress("Estadísticas zonales Country", 1, 2);
            assertEquals("Estadísticas zonales Country", repository.findById(id).orElseThrow().getCurrentStage());
            throw new IllegalStateException("corte");
        });

        worker.process(id);

        assertEquals("FAILED", repository.findById(id).orElseThrow().getStatus());
    }

    @Test
    void unknownJobIsIgnored() {
        worker.process(UUID.randomUUID());

        verify(pipeline, never()).run(any());
    }
}
