package com.docweaver.core.config;

import com.docweaver.core.graph.DocumentPipeline;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "docweaver")
public class DocweaverProperties {

    private Concurrency concurrency = new Concurrency();
    private Retry retry = new Retry();
    private Execution execution = new Execution();
    private Pipeline pipeline = new Pipeline();
    private Map<String, Agent> agents = new LinkedHashMap<>();
    private Store store = new Store();
    private Output output = new Output();

    public Concurrency getConcurrency() { return concurrency; }
    public void setConcurrency(Concurrency concurrency) { this.concurrency = concurrency; }
    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }
    public Execution getExecution() { return execution; }
    public void setExecution(Execution execution) { this.execution = execution; }
    public Pipeline getPipeline() { return pipeline; }
    public void setPipeline(Pipeline pipeline) { this.pipeline = pipeline; }
    public Map<String, Agent> getAgents() { return agents; }
    public void setAgents(Map<String, Agent> agents) { this.agents = agents; }
    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }
    public Output getOutput() { return output; }
    public void setOutput(Output output) { this.output = output; }

    public static class Concurrency {
        /** Ceiling on units in flight across every task. */
        private int budget = 4;
        /** Per-task ceiling used when a request does not set one. */
        private int defaultTaskBudget = 2;

        public int getBudget() { return budget; }
        public void setBudget(int budget) { this.budget = budget; }
        public int getDefaultTaskBudget() { return defaultTaskBudget; }
        public void setDefaultTaskBudget(int defaultTaskBudget) { this.defaultTaskBudget = defaultTaskBudget; }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private long initialDelayMs = 500;
        private double multiplier = 2.0;
        private long maxDelayMs = 8000;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public long getInitialDelayMs() { return initialDelayMs; }
        public void setInitialDelayMs(long initialDelayMs) { this.initialDelayMs = initialDelayMs; }
        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }
        public long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }
    }

    public static class Execution {
        private int unitTimeoutSeconds = 120;
        private int assemblyTimeoutSeconds = 60;
        private int schedulerThreads = 4;

        public int getUnitTimeoutSeconds() { return unitTimeoutSeconds; }
        public void setUnitTimeoutSeconds(int unitTimeoutSeconds) { this.unitTimeoutSeconds = unitTimeoutSeconds; }
        public int getAssemblyTimeoutSeconds() { return assemblyTimeoutSeconds; }
        public void setAssemblyTimeoutSeconds(int assemblyTimeoutSeconds) { this.assemblyTimeoutSeconds = assemblyTimeoutSeconds; }
        public int getSchedulerThreads() { return schedulerThreads; }
        public void setSchedulerThreads(int schedulerThreads) { this.schedulerThreads = schedulerThreads; }
    }

    public static class Pipeline {
        private List<String> researchQuestions = new ArrayList<>(DocumentPipeline.DEFAULT_RESEARCH_QUESTIONS);
        private String defaultImageStyle = "abstract";
        private Map<String, Double> stageWeights = new LinkedHashMap<>(Map.of(
                DocumentPipeline.RESEARCH, 1.0,
                DocumentPipeline.STRUCTURE, 1.0,
                DocumentPipeline.WRITE, 3.0,
                DocumentPipeline.IMAGE, 1.0));
        private double assemblyWeight = 1.0;
        private int defaultMaxSections = 8;

        public List<String> getResearchQuestions() { return researchQuestions; }
        public void setResearchQuestions(List<String> researchQuestions) { this.researchQuestions = researchQuestions; }
        public String getDefaultImageStyle() { return defaultImageStyle; }
        public void setDefaultImageStyle(String defaultImageStyle) { this.defaultImageStyle = defaultImageStyle; }
        public Map<String, Double> getStageWeights() { return stageWeights; }
        public void setStageWeights(Map<String, Double> stageWeights) { this.stageWeights = stageWeights; }
        public double getAssemblyWeight() { return assemblyWeight; }
        public void setAssemblyWeight(double assemblyWeight) { this.assemblyWeight = assemblyWeight; }
        public int getDefaultMaxSections() { return defaultMaxSections; }
        public void setDefaultMaxSections(int defaultMaxSections) { this.defaultMaxSections = defaultMaxSections; }
    }

    /**
     * Collaborator binding for one agent role. An empty endpoint leaves the role unbound.
     */
    public static class Agent {
        private String endpoint = "";
        private int timeoutSeconds = 90;

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Store {
        /** When set, tasks are persisted to PostgreSQL instead of memory. */
        private String jdbcUrl = "";
        private String username = "";
        private String password = "";
        /** Tags the rows this instance creates; only those are failed as orphans on restart. */
        private String instanceId = "";

        public String getJdbcUrl() { return jdbcUrl; }
        public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
        public String getInstanceId() { return instanceId; }
        public void setInstanceId(String instanceId) { this.instanceId = instanceId; }
    }

    public static class Output {
        private String directory = "./output";

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
    }
}
