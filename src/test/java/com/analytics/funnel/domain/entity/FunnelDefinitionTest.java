package com.analytics.funnel.domain.entity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.analytics.funnel.domain.valueobject.StepType;

class FunnelDefinitionTest {

    @Test
    void stepsAreSortedByIndex() {
        FunnelDefinition funnel = FunnelDefinition.funnel("f-1", "site-1", "Checkout",
                List.of(new FunnelStep(2, StepType.EVENT, "pay", null),
                        new FunnelStep(1, StepType.PAGE_VIEW, "/cart", null)),
                null);

        assertEquals("/cart", funnel.step(1).getTarget());
        assertEquals("pay", funnel.step(2).getName());
        assertTrue(funnel.getFilters().isEmpty());
    }

    @Test
    void stepIndexesMustBeContiguous() {
        assertThrows(IllegalArgumentException.class, () -> FunnelDefinition.funnel("f-1", "site-1", "Gap",
                List.of(new FunnelStep(1, StepType.EVENT, "a", null),
                        new FunnelStep(3, StepType.EVENT, "c", null)),
                List.of()));
    }

    @Test
    void funnelNeedsTwoStepsAndGoalExactlyOne() {
        assertThrows(IllegalArgumentException.class, () -> FunnelDefinition.funnel("f-1", "site-1", "Short",
                List.of(new FunnelStep(1, StepType.EVENT, "a", null)), List.of()));

        FunnelDefinition goal = FunnelDefinition.goal("g-1", "site-1",
                new FunnelStep(1, StepType.EVENT, "purchase", null), List.of());
        assertTrue(goal.isGoal());
        assertEquals(1, goal.stepCount());
        assertEquals("purchase", goal.getName());
    }

    @Test
    void stepTypeParsesCamelAndSnakeCase() {
        assertEquals(StepType.PAGE_VIEW, StepType.parse("pageView"));
        assertEquals(StepType.PAGE_VIEW, StepType.parse("page_view"));
        assertEquals(StepType.CUSTOM, StepType.parse("custom"));
        assertThrows(IllegalArgumentException.class, () -> StepType.parse("click"));
    }
}
