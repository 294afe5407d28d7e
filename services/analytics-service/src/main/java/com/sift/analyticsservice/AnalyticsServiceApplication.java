package com.sift.analyticsservice;

import com.sift.analyticsservice.config.AnalyticsProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Spring Boot host of the Sift analytics subsystem.
 *
 * <p>Wires the aggregation engine and the search kinds, exposes the client-label filter used by
 * the search routes and an info endpoint under {@code /api/v1/analytics}.
 */
@SpringBootApplication
@EnableConfigurationProperties(AnalyticsProperties.class)
public class AnalyticsServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AnalyticsServiceApplication.class, args);
        log.info("Sift analytics service started");
    }
}
