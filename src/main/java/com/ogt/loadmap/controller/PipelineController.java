package com.ogt.loadmap.controller;

import com.ogt.loadmap.dto.SectorLoadDTO;
import com.ogt.loadmap.dto.SubregionLoadDTO;
import com.ogt.loadmap.entity.PipelineJob;
import com.ogt.loadmap.service.LoadResultService;
import com.ogt.loadmap.service.PipelineJobService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/loadmap")
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineJobService jobService;
    private final LoadResultService resultService;

    // Corridas
    @PostMapping("/jobs")
    public ResponseEntity<?> startRun() {
        try {
            UUID jobId = jobService.queueRun();
            return ResponseEntity.ok(jobId);
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/jobs")
    public ResponseEntity<List<PipelineJob>> getAllJobs() {
        return ResponseEntity.ok(jobService.getJobs());
    }

    @GetMapping("/jobs/{id}")
    public ResponseEntity<PipelineJob> getJob(@PathVariable UUID id) {
        return ResponseEntity.of(jobService.getJob(id));
    }

    // Resultados
    @GetMapping("/subregions")
    public ResponseEntity<List<SubregionLoadDTO>> getSubregionLoads() {
        return ResponseEntity.of(resultService.getSubregionLoads());
    }

    @GetMapping("/sectors")
    public ResponseEntity<List<SectorLoadDTO>> getSectorLoads() {
        return ResponseEntity.of(resultService.getSectorLoads());
    }
}
