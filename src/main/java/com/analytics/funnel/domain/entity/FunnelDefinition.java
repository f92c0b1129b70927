package com.analytics.funnel.domain.entity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import com.analytics.funnel.domain.valueobject.DefinitionKind;

/**
 * Immutable funnel or goal definition consumed by one analysis.
 * <p>
 * <b>Invariants:</b>
 * </p>
 * <ul>
 * <li>id, websiteId and name are non-blank</li>
 * <li>steps are sorted by index and their indexes are exactly 1..K</li>
 * <li>a FUNNEL has at least 2 steps, a GOAL exactly 1</li>
 * <li>filters is never null (empty list if not provided)</li>
 * </ul>
 */
public final class FunnelDefinition {

    private final String id;
    private final String websiteId;
    private final String name;
    private final DefinitionKind kind;
    private final List<FunnelStep> steps;
    private final List<Filter> filters;
    private final Instant createdAt;
    private final boolean ignoreHistoricData;

    public FunnelDefinition(String id, String websiteId, String name, DefinitionKind kind,
            List<FunnelStep> steps, List<Filter> filters,
            Instant createdAt, boolean ignoreHistoricData) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (websiteId == null || websiteId.isBlank()) {
            throw new IllegalArgumentException("websiteId cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("definition " + id + " has no steps");
        }

        List<FunnelStep> sorted = new ArrayList<>(steps);
        sorted.sort(Comparator.comparingInt(FunnelStep::getIndex));
        for (int i = 0; i < sorted.size(); i++) {
            if (sorted.get(i).getIndex() != i + 1) {
                throw new IllegalArgumentException(
                        "definition " + id + " step indexes must be 1.." + sorted.size());
            }
        }
        if (kind.isGoal() && sorted.size() != 1) {
            throw new IllegalArgumentException("goal " + id + " must have exactly one step");
        }
        if (!kind.isGoal() && sorted.size() < 2) {
            throw new IllegalArgumentException("funnel " + id + " must have at least two steps");
        }

        this.id = id;
        this.websiteId = websiteId;
        this.name = name != null && !name.isBlank() ? name : id;
        this.kind = kind;
        this.steps = Collections.unmodifiableList(sorted);
        this.filters = filters != null
                ? Collections.unmodifiableList(new ArrayList<>(filters))
                : Collections.emptyList();
        this.createdAt = createdAt;
        this.ignoreHistoricData = ignoreHistoricData;
    }

    // ─────────────────── Factory Methods ───────────────────

    public static FunnelDefinition funnel(String id, String websiteId, String name,
            List<FunnelStep> steps, List<Filter> filters) {
        return new FunnelDefinition(id, websiteId, name, DefinitionKind.FUNNEL, steps, filters, null, false);
    }

    public static FunnelDefinition goal(String id, String websiteId, FunnelStep step, List<Filter> filters) {
        return new FunnelDefinition(id, websiteId, step.getName(), DefinitionKind.GOAL,
                List.of(step), filters, null, false);
    }

    // ─────────────────── Behavior Methods ───────────────────

    /** @return number of steps K */
    public int stepCount() {
        return steps.size();
    }

    /**
     * @param stepNumber 1-based step number
     * @return the step at that position
     */
    public FunnelStep step(int stepNumber) {
        return steps.get(stepNumber - 1);
    }

    public boolean isGoal() {
        return kind.isGoal();
    }

    // ─────────────────── Getters ───────────────────

    public String getId() {
        return id;
    }

    public String getWebsiteId() {
        return websiteId;
    }

    public String getName() {
        return name;
    }

    public DefinitionKind getKind() {
        return kind;
    }

    public List<FunnelStep> getSteps() {
        return steps;
    }

    public List<Filter> getFilters() {
        return filters;
    }

    /** @return creation time, or null if unknown */
    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isIgnoreHistoricData() {
        return ignoreHistoricData;
    }

    // ─────────────────── Identity ───────────────────

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        FunnelDefinition that = (FunnelDefinition) o;
        return id.equals(that.id) && websiteId.equals(that.websiteId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, websiteId);
    }

    @Override
    public String toString() {
        return "FunnelDefinition{id='" + id + "', kind=" + kind + ", steps=" + steps.size()
                + ", filters=" + filters.size() + "}";
    }
}
