package com.analytics.funnel.domain.valueobject;

/**
 * Kind of analysis definition.
 * <p>
 * A GOAL is the degenerate single-step funnel.
 * </p>
 */
public enum DefinitionKind {

    FUNNEL,
    GOAL;

    public boolean isGoal() {
        return this == GOAL;
    }
}
