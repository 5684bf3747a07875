package com.payguard.agent.escalation;

import java.util.List;

/**
 * Result of one transition: the state before and after, and how each response step went.
 */
public record EscalationOutcome(
        EscalationState previous,
        EscalationState current,
        ResponseAction action,
        List<StepResult> steps
) {
    public EscalationOutcome {
        steps = steps != null ? List.copyOf(steps) : List.of();
    }

    public boolean executed(ResponseStep step) {
        return steps.stream().anyMatch(s -> s.step() == step);
    }

    public boolean succeeded(ResponseStep step) {
        return steps.stream().anyMatch(s -> s.step() == step && s.success());
    }

    public List<StepResult> failedSteps() {
        return steps.stream().filter(s -> !s.success()).toList();
    }

    public record StepResult(
            ResponseStep step,
            boolean success,
            String detail
    ) {}
}
