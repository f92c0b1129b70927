package com.analytics.funnel.domain.entity;

import java.util.Objects;

import com.analytics.funnel.domain.valueobject.StepType;

/**
 * One stage of a funnel.
 * <p>
 * <b>Invariants:</b>
 * </p>
 * <ul>
 * <li>index is 1-based and defines the required order</li>
 * <li>type and target are non-null; target is non-blank</li>
 * <li>name defaults to the target when not provided</li>
 * </ul>
 */
public final class FunnelStep {

    private final int index;
    private final StepType type;
    private final String target;
    private final String name;

    public FunnelStep(int index, StepType type, String target, String name) {
        if (index < 1) {
            throw new IllegalArgumentException("step index must be >= 1, got " + index);
        }
        if (type == null) {
            throw new IllegalArgumentException("step type cannot be null");
        }
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("step target cannot be null or blank");
        }
        this.index = index;
        this.type = type;
        this.target = target;
        this.name = name != null && !name.isBlank() ? name : target;
    }

    public int getIndex() {
        return index;
    }

    public StepType getType() {
        return type;
    }

    public String getTarget() {
        return target;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        FunnelStep that = (FunnelStep) o;
        return index == that.index && type == that.type
                && target.equals(that.target) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, type, target, name);
    }

    @Override
    public String toString() {
        return "FunnelStep{index=" + index + ", type=" + type + ", target='" + target + "'}";
    }
}
