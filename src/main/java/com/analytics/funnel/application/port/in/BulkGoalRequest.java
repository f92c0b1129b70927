package com.analytics.funnel.application.port.in;

import java.util.List;

/**
 * Request to analyze several goals of one website over the same date range.
 */
public final class BulkGoalRequest {

    private final String websiteId;
    private final List<String> goalIds;
    private final String startDate;
    private final String endDate;

    public BulkGoalRequest(String websiteId, List<String> goalIds, String startDate, String endDate) {
        if (websiteId == null || websiteId.isBlank()) {
            throw new IllegalArgumentException("websiteId cannot be null or blank");
        }
        if (goalIds == null || goalIds.isEmpty()) {
            throw new IllegalArgumentException("goalIds cannot be null or empty");
        }
        this.websiteId = websiteId;
        this.goalIds = List.copyOf(goalIds);
        this.startDate = startDate;
        this.endDate = endDate;
    }

    public String getWebsiteId() {
        return websiteId;
    }

    public List<String> getGoalIds() {
        return goalIds;
    }

    public String getStartDate() {
        return startDate;
    }

    public String getEndDate() {
        return endDate;
    }
}
