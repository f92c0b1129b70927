package com.analytics.funnel.application.port.in;

/**
 * Request to analyze one funnel or goal of a website.
 * <p>
 * Dates are optional YYYY-MM-DD strings; unless both are given the default
 * trailing window is used. {@code websiteDomain} is the tracked site's own
 * hostname, used to treat self-referrals as direct traffic.
 * </p>
 */
public final class AnalysisRequest {

    private final String websiteId;
    private final String definitionId;
    private final String startDate;
    private final String endDate;
    private final String websiteDomain;

    public AnalysisRequest(String websiteId, String definitionId, String startDate,
            String endDate, String websiteDomain) {
        if (websiteId == null || websiteId.isBlank()) {
            throw new IllegalArgumentException("websiteId cannot be null or blank");
        }
        if (definitionId == null || definitionId.isBlank()) {
            throw new IllegalArgumentException("definitionId cannot be null or blank");
        }
        this.websiteId = websiteId;
        this.definitionId = definitionId;
        this.startDate = startDate;
        this.endDate = endDate;
        this.websiteDomain = websiteDomain;
    }

    public static AnalysisRequest of(String websiteId, String definitionId, String startDate, String endDate) {
        return new AnalysisRequest(websiteId, definitionId, startDate, endDate, null);
    }

    public String getWebsiteId() {
        return websiteId;
    }

    public String getDefinitionId() {
        return definitionId;
    }

    /** @return requested start date, may be null */
    public String getStartDate() {
        return startDate;
    }

    /** @return requested end date, may be null */
    public String getEndDate() {
        return endDate;
    }

    /** @return the site's own hostname, may be null */
    public String getWebsiteDomain() {
        return websiteDomain;
    }

    @Override
    public String toString() {
        return "AnalysisRequest{websiteId='" + websiteId + "', definitionId='" + definitionId
                + "', startDate=" + startDate + ", endDate=" + endDate + "}";
    }
}
