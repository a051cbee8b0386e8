package com.taskdeck.agent.runtime;

import lombok.Getter;

/**
 * Thrown when a bounded agent run hits one of its hard ceilings.
 * The run is aborted rather than truncated.
 */
@Getter
public class AgentBudgetExceededException extends RuntimeException {

    public enum Budget {
        TOOL_STEPS("tool steps"),
        TOKENS("tokens");

        private final String label;

        Budget(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Budget budget;
    private final int limit;
    private final int observed;

    public AgentBudgetExceededException(Budget budget, int limit, int observed) {
        super(String.format("Agent exceeded %s budget (limit %d, reached %d)", budget.label(), limit, observed));
        this.budget = budget;
        this.limit = limit;
        this.observed = observed;
    }
}
