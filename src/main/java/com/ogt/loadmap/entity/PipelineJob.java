package com.ogt.loadmap.entity;

import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder(toBuilder = true)
public class PipelineJob {

    private UUID id;

    private String status; // PENDING, PROCESSING, COMPLETED, FAILED

    private String currentStage;

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    private String warningSummary;

    private String errorMessage;

    private Integer subregionCount;

    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    public PipelineJob copy() {
        return toBuilder().warnings(warnings != null ? new ArrayList<>(warnings) : new ArrayList<>()).build();
    }
}
