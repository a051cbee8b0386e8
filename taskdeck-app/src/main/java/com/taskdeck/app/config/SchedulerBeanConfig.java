package com.taskdeck.app.config;

import com.taskdeck.agent.models.AnthropicProvider;
import com.taskdeck.agent.runtime.BoundedAgentRunner;
import com.taskdeck.common.config.ConfigPaths;
import com.taskdeck.common.config.ConfigService;
import com.taskdeck.common.config.TaskdeckConfig;
import com.taskdeck.scheduler.ScheduledJobService;
import com.taskdeck.scheduler.action.ActionDispatcher;
import com.taskdeck.scheduler.action.AgentTaskAction;
import com.taskdeck.scheduler.action.NotifyAction;
import com.taskdeck.scheduler.action.WebhookAction;
import com.taskdeck.scheduler.poller.JobPoller;
import com.taskdeck.scheduler.store.FileJobStore;
import com.taskdeck.scheduler.store.JobStore;
import com.taskdeck.scheduler.tools.JobToolset;
import com.taskdeck.scheduler.workflow.ExecutorWorkflowLauncher;
import com.taskdeck.scheduler.workflow.FailureCircuitBreaker;
import com.taskdeck.scheduler.workflow.WorkflowRunner;
import com.taskdeck.scheduler.workspace.ActivityLog;
import com.taskdeck.scheduler.workspace.AgentDirectory;
import com.taskdeck.scheduler.workspace.ConversationStore;
import com.taskdeck.scheduler.workspace.MemoryIndex;
import com.taskdeck.scheduler.workspace.NotificationSink;
import com.taskdeck.scheduler.workspace.TaskStore;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.AgentProfile;
import com.taskdeck.scheduler.workspace.inmemory.InMemoryActivityLog;
import com.taskdeck.scheduler.workspace.inmemory.InMemoryAgentDirectory;
import com.taskdeck.scheduler.workspace.inmemory.InMemoryConversationStore;
import com.taskdeck.scheduler.workspace.inmemory.InMemoryMemoryIndex;
import com.taskdeck.scheduler.workspace.inmemory.InMemoryNotificationSink;
import com.taskdeck.scheduler.workspace.inmemory.InMemoryTaskStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Spring configuration for the scheduler: store, workspace collaborators,
 * actions, workflow runner and poller.
 */
@Slf4j
@Configuration
public class SchedulerBeanConfig {

    /** Launch queue slots per worker thread. */
    private static final int QUEUE_PER_WORKER = 8;

    @Value("${taskdeck.config:}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        Path path = configPath == null || configPath.isBlank()
                ? ConfigPaths.resolveConfigPath()
                : Path.of(configPath);
        return new ConfigService(path);
    }

    @Bean
    public TaskdeckConfig taskdeckConfig(ConfigService configService) {
        return configService.loadConfig();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JobStore jobStore(TaskdeckConfig config) {
        Path storePath = ConfigPaths.resolveStorePath(config);
        log.info("Using job store {}", storePath);
        return new FileJobStore(storePath);
    }

    // --- Workspace collaborators ---

    @Bean
    public ConversationStore conversationStore(Clock clock) {
        return new InMemoryConversationStore(clock);
    }

    @Bean
    public NotificationSink notificationSink(Clock clock) {
        return new InMemoryNotificationSink(clock);
    }

    @Bean
    public TaskStore taskStore(Clock clock) {
        return new InMemoryTaskStore(clock);
    }

    @Bean
    public MemoryIndex memoryIndex() {
        return new InMemoryMemoryIndex();
    }

    @Bean
    public AgentDirectory agentDirectory(TaskdeckConfig config) {
        InMemoryAgentDirectory directory = new InMemoryAgentDirectory();
        for (TaskdeckConfig.AgentProfileConfig agent : config.getAgents()) {
            directory.register(AgentProfile.builder()
                    .id(agent.getId())
                    .name(agent.getName() != null ? agent.getName() : agent.getId())
                    .ownerName(agent.getOwnerName())
                    .timezone(agent.getTimezone() != null
                            ? agent.getTimezone()
                            : config.getScheduler().getDefaultTimezone())
                    .email(agent.getEmail())
                    .persona(agent.getPersona())
                    .build());
        }
        if (config.getAgents().isEmpty()) {
            log.warn("No agent profiles configured, agent_task jobs will fail");
        } else {
            log.info("Registered {} agent profiles", config.getAgents().size());
        }
        return directory;
    }

    @Bean
    public ActivityLog activityLog(Clock clock) {
        return new InMemoryActivityLog(clock);
    }

    // --- Scheduling ---

    @Bean
    public ScheduledJobService scheduledJobService(JobStore jobStore, TaskdeckConfig config, Clock clock) {
        return new ScheduledJobService(jobStore, config.getScheduler().getDefaultTimezone(), clock);
    }

    @Bean
    public ActionDispatcher actionDispatcher(TaskdeckConfig config, ConversationStore conversations,
            NotificationSink notifications, TaskStore tasks, MemoryIndex memory, AgentDirectory agents,
            ActivityLog activity, ScheduledJobService jobs, Clock clock) {
        TaskdeckConfig.WebhookConfig webhook = config.getWebhook();
        return new ActionDispatcher(
                new NotifyAction(conversations, notifications, tasks),
                agentTaskAction(config.getAgent(), agents, conversations, notifications, activity,
                        new JobToolset(memory, tasks, jobs), clock),
                new WebhookAction(Duration.ofSeconds(webhook.getConnectTimeoutSeconds()),
                        Duration.ofSeconds(webhook.getReadTimeoutSeconds())));
    }

    private AgentTaskAction agentTaskAction(TaskdeckConfig.AgentConfig agent, AgentDirectory agents,
            ConversationStore conversations, NotificationSink notifications, ActivityLog activity,
            JobToolset toolset, Clock clock) {
        String apiKey = agent.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            apiKey = System.getenv("ANTHROPIC_API_KEY");
        }
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("No model API key configured, agent_task jobs will fail");
            return null;
        }
        AnthropicProvider provider = new AnthropicProvider(apiKey, agent.getBaseUrl());
        BoundedAgentRunner runner = new BoundedAgentRunner(provider, agent.getModel(),
                agent.getMaxToolSteps(), agent.getMaxTokens(), agent.getMaxOutputTokens());
        log.info("Agent tasks enabled (model {}, max {} tool steps, {} tokens)",
                agent.getModel(), agent.getMaxToolSteps(), agent.getMaxTokens());
        return new AgentTaskAction(agents, conversations, notifications, activity, runner, toolset, clock);
    }

    @Bean
    public FailureCircuitBreaker failureCircuitBreaker(JobStore jobStore, TaskdeckConfig config, Clock clock) {
        return new FailureCircuitBreaker(jobStore, config.getScheduler().getFailureThreshold(), clock);
    }

    @Bean
    public WorkflowRunner workflowRunner(JobStore jobStore, ActionDispatcher dispatcher,
            FailureCircuitBreaker breaker, TaskdeckConfig config, Clock clock) {
        return new WorkflowRunner(jobStore, dispatcher, breaker,
                Duration.ofMinutes(config.getScheduler().getLeaseMinutes()), clock);
    }

    @Bean
    public ExecutorWorkflowLauncher workflowLauncher(WorkflowRunner runner, TaskdeckConfig config) {
        int workers = config.getScheduler().getWorkerThreads();
        return new ExecutorWorkflowLauncher(runner, workers, workers * QUEUE_PER_WORKER);
    }

    @Bean
    public JobPoller jobPoller(JobStore jobStore, ExecutorWorkflowLauncher launcher, ActivityLog activity,
            TaskdeckConfig config, Clock clock) {
        return new JobPoller(jobStore, launcher, activity, config.getScheduler().getBatchSize(), clock);
    }
}
