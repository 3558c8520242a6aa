package com.ogt.loadmap.repository;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Parámetros de procedencia que acompañan a cada tabla en su sidecar JSON.
 */
@Value
@Builder
public class StageMetadata {

    String stage;

    @Singular
    Map<String, Object> parameters;

    @Singular
    Map<String, String> inputs;
}
