package com.ogt.loadmap.service;

import com.ogt.loadmap.entity.HourlyTable;
import com.ogt.loadmap.entity.Site;
import com.ogt.loadmap.util.ProcessingWarnings;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class PipelineResult {

    /** Nombre de etapa → archivo producido o reutilizado. */
    @Singular
    Map<String, Path> outputs;

    HourlyTable subregionLoad;

    List<Site> sites;

    ProcessingWarnings warnings;
}
