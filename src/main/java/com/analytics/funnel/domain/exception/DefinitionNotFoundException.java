package com.analytics.funnel.domain.exception;

import com.analytics.funnel.domain.valueobject.DefinitionKind;

/**
 * Thrown when a funnel or goal definition does not exist for the website.
 */
public class DefinitionNotFoundException extends RuntimeException {

    private final DefinitionKind kind;
    private final String websiteId;
    private final String definitionId;

    public DefinitionNotFoundException(DefinitionKind kind, String websiteId, String definitionId) {
        super((kind.isGoal() ? "Goal" : "Funnel") + " not found: " + definitionId);
        this.kind = kind;
        this.websiteId = websiteId;
        this.definitionId = definitionId;
    }

    public DefinitionKind getKind() {
        return kind;
    }

    public String getWebsiteId() {
        return websiteId;
    }

    public String getDefinitionId() {
        return definitionId;
    }
}
