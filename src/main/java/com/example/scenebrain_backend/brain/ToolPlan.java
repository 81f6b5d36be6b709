package com.example.scenebrain_backend.brain;

import java.util.List;
import java.util.Optional;

/**
 * Ordered selections for one request. Most requests carry a single step.
 */
public record ToolPlan(List<ToolSelection> steps, String reasoning) {

    public static final int MAX_STEPS = 5;

    public ToolPlan {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("a plan needs at least one step");
        }
        if (steps.size() > MAX_STEPS) {
            throw new IllegalArgumentException("a plan has at most " + MAX_STEPS + " steps");
        }
        steps = List.copyOf(steps);
    }

    public static ToolPlan single(ToolSelection selection, String reasoning) {
        return new ToolPlan(List.of(selection), reasoning);
    }

    public ToolSelection first() {
        return steps.get(0);
    }

    public boolean isMultiStep() {
        return steps.size() > 1;
    }

    /**
     * Complexity of the first edit step, used for audit and routing logs.
     */
    public Optional<EditComplexity> complexity() {
        return steps.stream()
                .filter(ToolSelection.Edit.class::isInstance)
                .map(s -> ((ToolSelection.Edit) s).complexity())
                .findFirst();
    }
}
