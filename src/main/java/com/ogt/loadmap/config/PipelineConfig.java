package com.ogt.loadmap.config;

import com.ogt.loadmap.service.LoggingProgressListener;
import com.ogt.loadmap.service.ProgressListener;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PipelineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProgressListener progressListener() {
        return new LoggingProgressListener();
    }
}
