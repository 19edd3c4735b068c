package com.archflow.core.nodes;

import com.archflow.core.history.HistoricalLearningService;
import com.archflow.core.metrics.PipelineMetrics;
import com.archflow.core.pool.ModelClientPool;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;

/**
 * Collaborators shared by every agent node.
 *
 * @param pool          pooled chat-completion clients
 * @param retryTemplate node-level retry policy for transient model failures
 * @param callTimeout   deadline for one model call
 * @param metrics       pipeline metrics
 * @param history       historical-feedback context for the design node
 */
public record AgentRuntime(
        ModelClientPool pool,
        RetryTemplate retryTemplate,
        Duration callTimeout,
        PipelineMetrics metrics,
        HistoricalLearningService history
) {}
