package com.mathrok.engine.solver;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only list of steps in the order they were taken. Not thread safe; one trace per solve call.
 */
public class StepTrace {

    private final List<SolutionStep> steps = new ArrayList<>();

    public StepTrace add(String id, StepOperation operation, String description, String before, String after,
            String explanation) {
        steps.add(new SolutionStep(id, description, operation, before, after, explanation));
        return this;
    }

    public StepTrace add(SolutionStep step) {
        steps.add(step);
        return this;
    }

    public StepTrace addAll(List<SolutionStep> more) {
        steps.addAll(more);
        return this;
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public int size() {
        return steps.size();
    }

    public SolutionStep last() {
        if (steps.isEmpty()) {
            throw new IllegalStateException("No steps recorded");
        }
        return steps.get(steps.size() - 1);
    }

    public List<SolutionStep> steps() {
        return List.copyOf(steps);
    }
}
