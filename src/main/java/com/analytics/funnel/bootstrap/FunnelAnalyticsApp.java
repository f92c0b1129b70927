package com.analytics.funnel.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Funnel Analytics - Application Entry Point.
 * <p>
 * Computes funnel and goal conversion over a website event log stored in
 * PostgreSQL, with optional attribution to each session's first referrer.
 * </p>
 *
 * <pre>
 * Architecture: Hexagonal (Ports & Adapters)
 * Pattern:      Match → Progress → Aggregate
 * Tech:         Spring Boot 3.2 + JDBC + PostgreSQL
 * </pre>
 */
@SpringBootApplication(scanBasePackages = "com.analytics.funnel")
@ConfigurationPropertiesScan(basePackages = "com.analytics.funnel.bootstrap.config")
public class FunnelAnalyticsApp {

    public static void main(String[] args) {
        SpringApplication.run(FunnelAnalyticsApp.class, args);
    }
}
