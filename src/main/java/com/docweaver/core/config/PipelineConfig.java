package com.docweaver.core.config;

import com.docweaver.core.assembly.DocumentAssembler;
import com.docweaver.core.assembly.MarkdownDocumentAssembler;
import com.docweaver.core.engine.GenerationRequestValidator;
import com.docweaver.core.engine.PipelineOrchestrator;
import com.docweaver.core.events.EventBus;
import com.docweaver.core.executor.ConcurrencyBudget;
import com.docweaver.core.executor.RetryPolicy;
import com.docweaver.core.executor.StageExecutor;
import com.docweaver.core.gateway.AgentBackend;
import com.docweaver.core.gateway.AgentErrorClassifier;
import com.docweaver.core.gateway.AgentGateway;
import com.docweaver.core.gateway.AgentRole;
import com.docweaver.core.gateway.HttpAgentBackend;
import com.docweaver.core.graph.DocumentPipeline;
import com.docweaver.core.graph.PipelineGraph;
import com.docweaver.core.metrics.DocweaverMetrics;
import com.docweaver.core.model.ImageStyle;
import com.docweaver.core.state.TaskStateStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the pipeline engine from {@link DocweaverProperties}.
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService docweaverScheduler(DocweaverProperties properties) {
        var counter = new AtomicInteger();
        return Executors.newScheduledThreadPool(properties.getExecution().getSchedulerThreads(), r -> {
            Thread t = new Thread(r, "docweaver-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public PipelineGraph pipelineGraph(DocweaverProperties properties) {
        var pipeline = properties.getPipeline();
        return DocumentPipeline.create(pipeline.getResearchQuestions(), pipeline.getStageWeights(),
                pipeline.getAssemblyWeight());
    }

    @Bean
    public ConcurrencyBudget globalBudget(DocweaverProperties properties, DocweaverMetrics metrics) {
        var budget = new ConcurrencyBudget("global", properties.getConcurrency().getBudget());
        metrics.registerBudgetGauge(budget::inFlight);
        return budget;
    }

    @Bean
    public RetryPolicy retryPolicy(DocweaverProperties properties) {
        var retry = properties.getRetry();
        return new RetryPolicy(retry.getMaxAttempts(), Duration.ofMillis(retry.getInitialDelayMs()),
                retry.getMultiplier(), Duration.ofMillis(retry.getMaxDelayMs()), null);
    }

    @Bean
    public AgentGateway agentGateway(DocweaverProperties properties, AgentErrorClassifier classifier,
                                     DocweaverMetrics metrics, ObjectMapper objectMapper) {
        Map<AgentRole, AgentBackend> backends = new EnumMap<>(AgentRole.class);
        for (var role : AgentRole.values()) {
            var agent = properties.getAgents().get(role.wireName());
            if (agent == null || agent.getEndpoint() == null || agent.getEndpoint().isBlank()) {
                log.warn("No endpoint configured for agent role '{}'; calls will fail", role.wireName());
                continue;
            }
            backends.put(role, new HttpAgentBackend(role, URI.create(agent.getEndpoint()),
                    Duration.ofSeconds(agent.getTimeoutSeconds()), objectMapper));
            log.info("Agent role '{}' bound to {}", role.wireName(), agent.getEndpoint());
        }
        return new AgentGateway(backends, classifier, metrics);
    }

    @Bean
    public StageExecutor stageExecutor(AgentGateway gateway, ConcurrencyBudget globalBudget, RetryPolicy retryPolicy,
                                       ScheduledExecutorService docweaverScheduler, DocweaverProperties properties,
                                       DocweaverMetrics metrics) {
        return new StageExecutor(gateway, globalBudget, retryPolicy, docweaverScheduler,
                Duration.ofSeconds(properties.getExecution().getUnitTimeoutSeconds()), metrics);
    }

    @Bean
    @ConditionalOnMissingBean(DocumentAssembler.class)
    public DocumentAssembler documentAssembler(DocweaverProperties properties,
                                               ScheduledExecutorService docweaverScheduler) {
        return new MarkdownDocumentAssembler(Path.of(properties.getOutput().getDirectory()), docweaverScheduler);
    }

    @Bean
    public GenerationRequestValidator generationRequestValidator(DocweaverProperties properties) {
        String style = properties.getPipeline().getDefaultImageStyle();
        ImageStyle defaultStyle = ImageStyle.parse(style).orElseThrow(() -> new IllegalStateException(
                "docweaver.pipeline.default-image-style is not a known style: " + style));
        return new GenerationRequestValidator(properties.getPipeline().getDefaultMaxSections(),
                properties.getConcurrency().getDefaultTaskBudget(), defaultStyle);
    }

    @Bean
    public PipelineOrchestrator pipelineOrchestrator(PipelineGraph graph, TaskStateStore store, StageExecutor executor,
                                                     DocumentAssembler assembler, GenerationRequestValidator validator,
                                                     EventBus eventBus, DocweaverMetrics metrics,
                                                     ScheduledExecutorService docweaverScheduler,
                                                     DocweaverProperties properties) {
        var orchestrator = new PipelineOrchestrator(graph, store, executor, assembler, validator, eventBus, metrics,
                docweaverScheduler, Duration.ofSeconds(properties.getExecution().getAssemblyTimeoutSeconds()));
        orchestrator.failOrphanedTasks();
        return orchestrator;
    }
}
