package com.taskdeck.agent.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.taskdeck.agent.models.ModelProvider;
import com.taskdeck.agent.tools.AgentTool;
import com.taskdeck.agent.tools.ToolRegistry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Tool-calling agent loop with hard ceilings.
 *
 * <p>
 * Runs user message → LLM → tool calls → LLM → ... → final response, counting
 * every tool invocation and every token reported by the provider. The run
 * aborts with {@link AgentBudgetExceededException} before the invocation that
 * would exceed the step ceiling, and as soon as accumulated usage passes the
 * token ceiling.
 * </p>
 */
@Slf4j
public class BoundedAgentRunner {

    public static final int DEFAULT_MAX_TOOL_STEPS = 25;
    public static final int DEFAULT_MAX_TOKENS = 100_000;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final ModelProvider provider;
    private final String model;
    private final int maxToolSteps;
    private final int maxTokens;
    private final int maxOutputTokens;

    public BoundedAgentRunner(ModelProvider provider, String model) {
        this(provider, model, DEFAULT_MAX_TOOL_STEPS, DEFAULT_MAX_TOKENS, 4096);
    }

    public BoundedAgentRunner(ModelProvider provider, String model, int maxToolSteps, int maxTokens,
            int maxOutputTokens) {
        if (maxToolSteps < 0 || maxTokens <= 0) {
            throw new IllegalArgumentException("Agent budgets must be positive");
        }
        this.provider = provider;
        this.model = model;
        this.maxToolSteps = maxToolSteps;
        this.maxTokens = maxTokens;
        this.maxOutputTokens = maxOutputTokens;
    }

    public int getMaxToolSteps() {
        return maxToolSteps;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    /**
     * Run the loop to completion on the calling thread.
     *
     * @throws AgentBudgetExceededException when a ceiling is hit
     * @throws AgentRunException            when the model call fails
     */
    public AgentRunResult run(AgentRunRequest request) {
        if (provider == null) {
            throw new AgentRunException("No model provider configured");
        }
        ToolRegistry tools = request.getTools() != null ? request.getTools() : new ToolRegistry();
        ToolStepJournal journal = request.getJournal() != null ? request.getJournal() : ToolStepJournal.NOOP;

        List<ModelProvider.ChatMessage> messages = new ArrayList<>();
        messages.add(ModelProvider.ChatMessage.user(request.getUserMessage()));

        int invocations = 0;
        int tokensUsed = 0;
        int turns = 0;

        while (true) {
            turns++;
            ModelProvider.ChatRequest chatRequest = ModelProvider.ChatRequest.builder()
                    .runId(request.getRunId())
                    .model(model)
                    .messages(messages)
                    .maxTokens(maxOutputTokens)
                    .tools(tools.toDefinitions())
                    .systemPrompt(request.getSystemPrompt())
                    .build();

            ModelProvider.ChatResponse response = callModel(chatRequest);

            if (response.getUsage() != null) {
                tokensUsed += response.getUsage().total();
            }
            if (tokensUsed > maxTokens) {
                log.warn("Run {} exceeded token budget: {}/{}", request.getRunId(), tokensUsed, maxTokens);
                throw new AgentBudgetExceededException(AgentBudgetExceededException.Budget.TOKENS,
                        maxTokens, tokensUsed);
            }

            String content = response.text();

            if (!response.hasToolUses()) {
                log.debug("Run {} finished after {} turns, {} tool calls, {} tokens",
                        request.getRunId(), turns, invocations, tokensUsed);
                return AgentRunResult.builder()
                        .finalText(content)
                        .toolInvocations(invocations)
                        .tokensUsed(tokensUsed)
                        .turns(turns)
                        .build();
            }

            messages.add(ModelProvider.ChatMessage.assistant(content, response.getToolUses()));

            for (ModelProvider.ToolUse toolUse : response.getToolUses()) {
                if (invocations >= maxToolSteps) {
                    log.warn("Run {} exceeded tool step budget ({})", request.getRunId(), maxToolSteps);
                    throw new AgentBudgetExceededException(AgentBudgetExceededException.Budget.TOOL_STEPS,
                            maxToolSteps, invocations + 1);
                }
                invocations++;

                String stepKey = stepKey(invocations, toolUse);
                Optional<AgentTool.ToolResult> recorded = journal.lookup(stepKey);
                AgentTool.ToolResult toolResult;
                if (recorded.isPresent()) {
                    log.debug("Replaying journaled tool step {}", stepKey);
                    toolResult = recorded.get();
                } else {
                    toolResult = executeTool(toolUse, request);
                    journal.record(stepKey, toolResult);
                }

                messages.add(ModelProvider.ChatMessage.toolResult(toolUse.getId(), toolResult.toModelContent()));
            }
        }
    }

    private ModelProvider.ChatResponse callModel(ModelProvider.ChatRequest chatRequest) {
        try {
            ModelProvider.ChatResponse response = provider.chat(chatRequest).join();
            if (response == null) {
                throw new AgentRunException("Model returned no response");
            }
            return response;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new AgentRunException("LLM call failed: " + cause.getMessage(), cause);
        }
    }

    private AgentTool.ToolResult executeTool(ModelProvider.ToolUse toolUse, AgentRunRequest request) {
        Optional<AgentTool> tool = request.getTools() != null
                ? request.getTools().get(toolUse.getName())
                : Optional.empty();
        if (tool.isEmpty()) {
            return AgentTool.ToolResult.fail("Unknown tool: " + toolUse.getName());
        }

        try {
            JsonNode params = MAPPER.valueToTree(toolUse.getInput());
            AgentTool.ToolContext toolCtx = AgentTool.ToolContext.builder()
                    .parameters(params)
                    .agentId(request.getAgentId())
                    .runId(request.getRunId())
                    .build();
            return tool.get().execute(toolCtx).join();
        } catch (Exception e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.error("Tool {} execution failed: {}", toolUse.getName(), cause.getMessage(), cause);
            return AgentTool.ToolResult.fail("Execution error: " + cause.getMessage());
        }
    }

    /**
     * Step key of one invocation: its position in the run, the tool name and a
     * hash of the canonical input.
     */
    static String stepKey(int index, ModelProvider.ToolUse toolUse) {
        String input;
        try {
            input = MAPPER.writeValueAsString(toolUse.getInput());
        } catch (JsonProcessingException e) {
            input = String.valueOf(toolUse.getInput());
        }
        return "tool-" + index + ":" + toolUse.getName() + ":" + Integer.toHexString(input.hashCode());
    }

    // --- Data types ---

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AgentRunRequest {
        private String runId;
        private String agentId;
        private String systemPrompt;
        private String userMessage;
        private ToolRegistry tools;
        private ToolStepJournal journal;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AgentRunResult {
        private String finalText;
        private int toolInvocations;
        private int tokensUsed;
        private int turns;
    }
}
