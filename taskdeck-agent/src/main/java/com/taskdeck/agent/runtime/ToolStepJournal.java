package com.taskdeck.agent.runtime;

import com.taskdeck.agent.tools.AgentTool;

import java.util.Optional;

/**
 * Durable record of tool invocations made during an agent run.
 *
 * <p>
 * When a run is re-entered after a crash, an invocation whose step key is
 * already journaled returns the recorded result instead of running the tool
 * again.
 * </p>
 */
public interface ToolStepJournal {

    Optional<AgentTool.ToolResult> lookup(String stepKey);

    void record(String stepKey, AgentTool.ToolResult result);

    /** Journal that remembers nothing. */
    ToolStepJournal NOOP = new ToolStepJournal() {
        @Override
        public Optional<AgentTool.ToolResult> lookup(String stepKey) {
            return Optional.empty();
        }

        @Override
        public void record(String stepKey, AgentTool.ToolResult result) {
        }
    };
}
