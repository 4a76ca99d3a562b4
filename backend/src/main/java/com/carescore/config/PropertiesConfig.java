package com.carescore.config;

import com.carescore.service.scoring.ScoringBands;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Binds {@code carescore.*} (resilience, analytics, events) and {@code carescore.scoring.*}
 * (tool score bands) from application.yml.
 */
@Configuration
@EnableConfigurationProperties({
    CareScoreProperties.class,
    ScoringBands.class
})
@Slf4j
public class PropertiesConfig {

    public PropertiesConfig() {
        log.info("Enabled configuration classes: CareScoreProperties, ScoringBands");
    }
}
