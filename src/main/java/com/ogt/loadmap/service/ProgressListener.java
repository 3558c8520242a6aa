package com.ogt.loadmap.service;

/**
 * Observador de avance. Se invoca por región o por país, nunca por píxel.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (stage, done, total) -> { };

    void onProgress(String stage, int done, int total);
}
