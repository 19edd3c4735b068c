package com.archflow.config;

import com.archflow.core.cache.DesignCache;
import com.archflow.core.cache.FingerprintCacheStore;
import com.archflow.core.cache.InMemoryFingerprintCacheStore;
import com.archflow.core.cache.RedisFingerprintCacheStore;
import com.archflow.core.graph.GraphExecutor;
import com.archflow.core.history.HistoricalFeedbackStore;
import com.archflow.core.history.HistoricalLearningService;
import com.archflow.core.history.InMemoryFeedbackStore;
import com.archflow.core.llm.ModelClientFactory;
import com.archflow.core.llm.SpringAiModelClientFactory;
import com.archflow.core.llm.TransientServiceException;
import com.archflow.core.logging.MdcAwareExecutorService;
import com.archflow.core.metrics.PipelineMetrics;
import com.archflow.core.nodes.AgentRuntime;
import com.archflow.core.pool.ModelClientPool;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.retry.backoff.ExponentialRandomBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Bean wiring for the orchestration engine. The pool and the worker executor are
 * owned here and drained on context shutdown.
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

    @Bean
    @ConditionalOnMissingBean
    public ModelClientFactory modelClientFactory(ChatModel chatModel, PipelineProperties properties) {
        return new SpringAiModelClientFactory(chatModel, properties.getPool());
    }

    @Bean(destroyMethod = "shutdown")
    public ModelClientPool modelClientPool(ModelClientFactory factory, PipelineProperties properties,
                                           PipelineMetrics metrics) {
        return new ModelClientPool(factory, properties.getPool(), metrics);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService pipelineExecutor() {
        return new MdcAwareExecutorService("archflow-worker");
    }

    /**
     * Node-level retry: exponential backoff with jitter, transient model failures only.
     */
    @Bean
    public RetryTemplate nodeRetryTemplate(PipelineProperties properties) {
        PipelineProperties.Graph graph = properties.getGraph();
        RetryTemplate retryTemplate = new RetryTemplate();

        ExponentialRandomBackOffPolicy backOffPolicy = new ExponentialRandomBackOffPolicy();
        backOffPolicy.setInitialInterval(graph.getRetryInitialBackoff().toMillis());
        backOffPolicy.setMultiplier(graph.getRetryMultiplier());
        backOffPolicy.setMaxInterval(graph.getRetryMaxBackoff().toMillis());
        retryTemplate.setBackOffPolicy(backOffPolicy);

        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(graph.getNodeMaxRetries() + 1,
                Map.of(TransientServiceException.class, true));
        retryTemplate.setRetryPolicy(retryPolicy);

        return retryTemplate;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "archflow.cache", name = "store", havingValue = "redis")
    public FingerprintCacheStore redisFingerprintCacheStore(StringRedisTemplate redisTemplate,
                                                            ObjectMapper objectMapper,
                                                            PipelineProperties properties) {
        return new RedisFingerprintCacheStore(redisTemplate, objectMapper, properties.getCache().getKeyPrefix());
    }

    @Bean
    @ConditionalOnMissingBean(FingerprintCacheStore.class)
    public FingerprintCacheStore inMemoryFingerprintCacheStore() {
        return new InMemoryFingerprintCacheStore();
    }

    @Bean
    public DesignCache designCache(FingerprintCacheStore store, PipelineProperties properties,
                                   PipelineMetrics metrics, Clock clock) {
        return new DesignCache(store, properties.getCache(), metrics, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public HistoricalFeedbackStore historicalFeedbackStore() {
        return new InMemoryFeedbackStore();
    }

    @Bean
    public HistoricalLearningService historicalLearningService(HistoricalFeedbackStore store,
                                                               PipelineProperties properties,
                                                               ExecutorService pipelineExecutor) {
        return new HistoricalLearningService(store, properties.getHistory(), pipelineExecutor);
    }

    @Bean
    public AgentRuntime agentRuntime(ModelClientPool pool, RetryTemplate nodeRetryTemplate,
                                     PipelineProperties properties, PipelineMetrics metrics,
                                     HistoricalLearningService history) {
        return new AgentRuntime(pool, nodeRetryTemplate, properties.getGraph().getNodeTimeout(), metrics, history);
    }

    @Bean
    public GraphExecutor graphExecutor(ExecutorService pipelineExecutor, PipelineProperties properties) {
        return new GraphExecutor(pipelineExecutor, properties.getGraph().getMaxRevisions());
    }
}
