package com.analytics.funnel.bootstrap.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import com.analytics.funnel.adapters.out.registry.JsonReferrerRegistry;
import com.analytics.funnel.application.port.out.AnalysisObserver;
import com.analytics.funnel.application.port.out.EventLogStore;
import com.analytics.funnel.application.port.out.FunnelDefinitionStore;
import com.analytics.funnel.application.port.out.ReferrerRegistry;
import com.analytics.funnel.application.service.FilterCompiler;
import com.analytics.funnel.application.service.FunnelAnalyticsService;
import com.analytics.funnel.application.service.FunnelProgressionEngine;
import com.analytics.funnel.application.service.MetricsAggregator;
import com.analytics.funnel.application.service.ReferrerAttribution;
import com.analytics.funnel.application.service.ReferrerCanonicalizer;
import com.analytics.funnel.application.service.StepMatcher;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Application-level bean configuration.
 * <p>
 * Wires application services with adapter implementations via constructor
 * injection. Services carry no Spring annotations.
 * </p>
 */
@Configuration
public class ApplicationConfig {

    /**
     * Jackson ObjectMapper used for stored definitions, the referrer registry
     * and result serialization.
     */
    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Bounded pool running the per-step event queries of one analysis.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService stepQueryExecutor(FunnelProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "step-query-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.getQueryParallelism()), threadFactory);
    }

    @Bean
    public ReferrerRegistry referrerRegistry(ResourceLoader resourceLoader, ObjectMapper objectMapper,
            FunnelProperties properties) {
        return JsonReferrerRegistry.load(resourceLoader.getResource(properties.getReferrerRegistry()), objectMapper);
    }

    // Stateless domain services.

    @Bean
    public FilterCompiler filterCompiler() {
        return new FilterCompiler();
    }

    @Bean
    public FunnelProgressionEngine funnelProgressionEngine() {
        return new FunnelProgressionEngine();
    }

    @Bean
    public MetricsAggregator metricsAggregator() {
        return new MetricsAggregator();
    }

    @Bean
    public StepMatcher stepMatcher(EventLogStore eventLogStore, ExecutorService stepQueryExecutor,
            FunnelProperties properties) {
        return new StepMatcher(eventLogStore, stepQueryExecutor, properties.getPageViewEventName());
    }

    @Bean
    public ReferrerCanonicalizer referrerCanonicalizer(ReferrerRegistry referrerRegistry) {
        return new ReferrerCanonicalizer(referrerRegistry);
    }

    @Bean
    public ReferrerAttribution referrerAttribution(FunnelProgressionEngine progressionEngine,
            MetricsAggregator metricsAggregator,
            ReferrerCanonicalizer referrerCanonicalizer) {
        return new ReferrerAttribution(progressionEngine, metricsAggregator, referrerCanonicalizer);
    }

    /**
     * FunnelAnalyticsService, the core use-case implementation.
     * Wired with all outbound port implementations via DI.
     */
    @Bean
    public FunnelAnalyticsService funnelAnalyticsService(
            FunnelDefinitionStore definitionStore,
            EventLogStore eventLogStore,
            FilterCompiler filterCompiler,
            StepMatcher stepMatcher,
            FunnelProgressionEngine progressionEngine,
            MetricsAggregator metricsAggregator,
            ReferrerAttribution referrerAttribution,
            AnalysisObserver analysisObserver,
            Clock clock,
            FunnelProperties properties) {
        return new FunnelAnalyticsService(
                definitionStore, eventLogStore, filterCompiler, stepMatcher, progressionEngine,
                metricsAggregator, referrerAttribution, analysisObserver, clock,
                properties.getDefaultRangeDays(), properties.getPageViewEventName());
    }
}
