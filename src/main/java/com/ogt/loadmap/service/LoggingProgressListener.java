package com.ogt.loadmap.service;

import lombok.extern.slf4j.Slf4j;

/**
 * Loguea el avance en pasos de ~10 % para no inundar el log.
 */
@Slf4j
public class LoggingProgressListener implements ProgressListener {

    @Override
    public void onProgress(String stage, int done, int total) {
        if (total <= 0) return;
        int step = Math.max(1, total / 10);
        if (done == total || done % step == 0) {
            log.info("⏳ {}: {}/{} ({}%)", stage, done, total, (done * 100) / total);
        } else {
            log.debug("{}: {}/{}", stage, done, total);
        }
    }
}
