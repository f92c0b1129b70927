package com.analytics.funnel.bootstrap.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "funnel")
public class FunnelProperties {

    private String pageViewEventName = "screen_view";
    private int defaultRangeDays = 30;
    private int queryParallelism = 4;
    private String referrerRegistry = "classpath:referrers.json";

    public String getPageViewEventName() {
        return pageViewEventName;
    }

    public void setPageViewEventName(String pageViewEventName) {
        this.pageViewEventName = pageViewEventName;
    }

    public int getDefaultRangeDays() {
        return defaultRangeDays;
    }

    public void setDefaultRangeDays(int defaultRangeDays) {
        this.defaultRangeDays = defaultRangeDays;
    }

    public int getQueryParallelism() {
        return queryParallelism;
    }

    public void setQueryParallelism(int queryParallelism) {
        this.queryParallelism = queryParallelism;
    }

    public String getReferrerRegistry() {
        return referrerRegistry;
    }

    public void setReferrerRegistry(String referrerRegistry) {
        this.referrerRegistry = referrerRegistry;
    }
}
