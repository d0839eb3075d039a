package com.example.indexanalytics;

import com.example.indexanalytics.config.AnalyticsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

@Slf4j
@SpringBootApplication
public class IndexAnalyticsApplication {

    private final AnalyticsProperties properties;

    public IndexAnalyticsApplication(AnalyticsProperties properties) {
        this.properties = properties;
    }

    public static void main(String[] args) {
        SpringApplication.run(IndexAnalyticsApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        log.info("🚀 Index analytics ready: GARCH kinds {}, learners {}, min observations {}",
                properties.getGarch().getModelKinds(),
                properties.getEnsemble().getLearners(),
                properties.getMinObservations());
    }
}
