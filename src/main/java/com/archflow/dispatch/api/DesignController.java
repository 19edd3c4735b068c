package com.archflow.dispatch.api;

import com.archflow.core.cache.CacheStats;
import com.archflow.core.cache.DesignCache;
import com.archflow.core.engine.PipelineService;
import com.archflow.core.engine.RunHandle;
import com.archflow.core.model.PipelineResult;
import com.archflow.core.pool.ModelClientPool;
import com.archflow.core.pool.PoolStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;

/**
 * REST controller for design runs plus pool and cache introspection.
 */
@RestController
@RequestMapping("/api/v1/designs")
public class DesignController {

    private static final Logger log = LoggerFactory.getLogger(DesignController.class);

    private final PipelineService pipelineService;
    private final SseStreamingService sseStreamingService;
    private final ModelClientPool modelClientPool;
    private final DesignCache designCache;

    public DesignController(PipelineService pipelineService,
                            SseStreamingService sseStreamingService,
                            ModelClientPool modelClientPool,
                            DesignCache designCache) {
        this.pipelineService = pipelineService;
        this.sseStreamingService = sseStreamingService;
        this.modelClientPool = modelClientPool;
        this.designCache = designCache;
    }

    /**
     * POST /api/v1/designs : Run the pipeline and wait for the result.
     */
    @PostMapping
    public ResponseEntity<DesignResponse> design(@RequestBody DesignSubmissionRequest request) {
        RunHandle handle = pipelineService.submit(request.toDesignRequest());
        log.info("Accepted design run {} (cached={}, attached={})",
                handle.runId(), handle.isCached(), handle.isAttached());
        PipelineResult result = handle.await();
        return ResponseEntity.status(statusFor(result)).body(DesignResponse.from(result));
    }

    /**
     * POST /api/v1/designs/stream : Run the pipeline and stream its events as SSE.
     */
    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestBody DesignSubmissionRequest request) {
        RunHandle handle = pipelineService.submit(request.toDesignRequest());
        return sseStreamingService.createEmitter(handle);
    }

    @GetMapping("/pool")
    public PoolStats poolStats() {
        return modelClientPool.stats();
    }

    @GetMapping("/cache")
    public CacheStats cacheStats() {
        return designCache.stats();
    }

    @DeleteMapping("/cache")
    public Map<String, Object> clearCache() {
        designCache.clear();
        log.info("Design cache cleared");
        return Map.of("cleared", true);
    }

    @DeleteMapping("/cache/expired")
    public Map<String, Object> clearExpired() {
        return Map.of("removed", designCache.clearExpired());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    static HttpStatus statusFor(PipelineResult result) {
        return switch (result.outcome()) {
            case COMPLETE -> HttpStatus.OK;
            case CANCELLED -> HttpStatus.SERVICE_UNAVAILABLE;
            case ERROR -> switch (result.errorKind()) {
                case REVISION_LIMIT_EXCEEDED -> HttpStatus.UNPROCESSABLE_ENTITY;
                case TRANSIENT_SERVICE_ERROR, PERMANENT_SERVICE_ERROR -> HttpStatus.BAD_GATEWAY;
                default -> HttpStatus.INTERNAL_SERVER_ERROR;
            };
        };
    }
}
