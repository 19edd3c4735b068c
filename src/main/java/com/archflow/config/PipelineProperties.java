package com.archflow.config;

import com.archflow.core.llm.ModelRole;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "archflow")
public class PipelineProperties {

    private Graph graph = new Graph();
    private Pool pool = new Pool();
    private Cache cache = new Cache();
    private History history = new History();

    public Graph getGraph() { return graph; }
    public void setGraph(Graph graph) { this.graph = graph; }
    public Pool getPool() { return pool; }
    public void setPool(Pool pool) { this.pool = pool; }
    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }
    public History getHistory() { return history; }
    public void setHistory(History history) { this.history = history; }

    public static class Graph {
        private int maxRevisions = 1;
        private int nodeMaxRetries = 2;
        private Duration nodeTimeout = Duration.ofSeconds(120);
        private Duration retryInitialBackoff = Duration.ofSeconds(1);
        private double retryMultiplier = 2.0;
        private Duration retryMaxBackoff = Duration.ofSeconds(10);

        public int getMaxRevisions() { return maxRevisions; }
        public void setMaxRevisions(int maxRevisions) { this.maxRevisions = maxRevisions; }
        public int getNodeMaxRetries() { return nodeMaxRetries; }
        public void setNodeMaxRetries(int nodeMaxRetries) { this.nodeMaxRetries = nodeMaxRetries; }
        public Duration getNodeTimeout() { return nodeTimeout; }
        public void setNodeTimeout(Duration nodeTimeout) { this.nodeTimeout = nodeTimeout; }
        public Duration getRetryInitialBackoff() { return retryInitialBackoff; }
        public void setRetryInitialBackoff(Duration retryInitialBackoff) { this.retryInitialBackoff = retryInitialBackoff; }
        public double getRetryMultiplier() { return retryMultiplier; }
        public void setRetryMultiplier(double retryMultiplier) { this.retryMultiplier = retryMultiplier; }
        public Duration getRetryMaxBackoff() { return retryMaxBackoff; }
        public void setRetryMaxBackoff(Duration retryMaxBackoff) { this.retryMaxBackoff = retryMaxBackoff; }
    }

    public static class Pool {
        private int mainSize = 10;
        private int creativeSize = 5;
        private int miniSize = 10;
        /** Cap on concurrently live temporary clients per role; negative means unbounded. */
        private int maxTemporary = -1;
        private Duration temporaryWait = Duration.ofSeconds(5);
        private Duration drainTimeout = Duration.ofSeconds(30);
        private Model main = new Model("gpt-4o", 0.7);
        private Model creative = new Model("gpt-4o", 0.9);
        private Model mini = new Model("gpt-4o-mini", 0.7);

        public int getMainSize() { return mainSize; }
        public void setMainSize(int mainSize) { this.mainSize = mainSize; }
        public int getCreativeSize() { return creativeSize; }
        public void setCreativeSize(int creativeSize) { this.creativeSize = creativeSize; }
        public int getMiniSize() { return miniSize; }
        public void setMiniSize(int miniSize) { this.miniSize = miniSize; }
        public int getMaxTemporary() { return maxTemporary; }
        public void setMaxTemporary(int maxTemporary) { this.maxTemporary = maxTemporary; }
        public Duration getTemporaryWait() { return temporaryWait; }
        public void setTemporaryWait(Duration temporaryWait) { this.temporaryWait = temporaryWait; }
        public Duration getDrainTimeout() { return drainTimeout; }
        public void setDrainTimeout(Duration drainTimeout) { this.drainTimeout = drainTimeout; }
        public Model getMain() { return main; }
        public void setMain(Model main) { this.main = main; }
        public Model getCreative() { return creative; }
        public void setCreative(Model creative) { this.creative = creative; }
        public Model getMini() { return mini; }
        public void setMini(Model mini) { this.mini = mini; }

        public int sizeFor(ModelRole role) {
            return switch (role) {
                case MAIN -> mainSize;
                case CREATIVE -> creativeSize;
                case MINI -> miniSize;
            };
        }

        public Model modelFor(ModelRole role) {
            return switch (role) {
                case MAIN -> main;
                case CREATIVE -> creative;
                case MINI -> mini;
            };
        }
    }

    public static class Model {
        private String name;
        private double temperature;

        public Model() {
        }

        public Model(String name, double temperature) {
            this.name = name;
            this.temperature = temperature;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }
    }

    public static class Cache {
        private Duration ttl = Duration.ofHours(24);
        private boolean selective = true;
        private String store = "memory";
        private String keyPrefix = "archflow:design:";

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }
        public boolean isSelective() { return selective; }
        public void setSelective(boolean selective) { this.selective = selective; }
        public String getStore() { return store; }
        public void setStore(String store) { this.store = store; }
        public String getKeyPrefix() { return keyPrefix; }
        public void setKeyPrefix(String keyPrefix) { this.keyPrefix = keyPrefix; }
    }

    public static class History {
        private Duration timeout = Duration.ofSeconds(5);
        private int maxResults = 20;
        private int minFeedback = 3;

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public int getMaxResults() { return maxResults; }
        public void setMaxResults(int maxResults) { this.maxResults = maxResults; }
        public int getMinFeedback() { return minFeedback; }
        public void setMinFeedback(int minFeedback) { this.minFeedback = minFeedback; }
    }
}
