package com.ogt.loadmap.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SubregionLoadDTO {
    private String subregion;
    private Double yearlyLoadMWh;
    private Double peakLoadMW;
    private Integer peakHour; // 1..N, como la columna t del CSV
}
