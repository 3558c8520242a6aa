package com.ogt.loadmap.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SectorLoadDTO {
    private String country;
    private String sector;
    private Double yearlyLoadMWh;
}
