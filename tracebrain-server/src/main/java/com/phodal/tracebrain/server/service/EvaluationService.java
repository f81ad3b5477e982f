package com.phodal.tracebrain.server.service;

import com.phodal.tracebrain.evaluation.TraceEvaluator;
import com.phodal.tracebrain.model.Trace;
import com.phodal.tracebrain.schema.AiEvaluation;
import com.phodal.tracebrain.server.config.TraceBrainProperties;
import com.phodal.tracebrain.store.TraceStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs AI evaluation of traces off the request thread and stores the result on the trace.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EvaluationService {

    private final TraceStore traceStore;
    private final TraceEvaluator traceEvaluator;
    private final TraceBrainProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * Check the trace exists, then evaluate it in the background.
     *
     * @throws com.phodal.tracebrain.error.NotFoundException for an unknown trace
     */
    public void submit(String traceId, String judgeModel) {
        traceStore.get(traceId);
        Mono.fromRunnable(() -> evaluateNow(traceId, judgeModel))
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        ignored -> { },
                        error -> log.error("Evaluation of trace {} failed: {}", traceId, error.getMessage()));
    }

    /**
     * Evaluate synchronously and merge the result into the trace attributes.
     */
    public AiEvaluation evaluateNow(String traceId, String judgeModel) {
        try {
            Trace trace = traceStore.get(traceId);
            AiEvaluation evaluation = traceEvaluator.evaluate(trace, judgeModel);
            traceStore.updateAttributes(traceId, TraceEvaluator.toAttributes(evaluation),
                    properties.requestDeadline());
            record("success");
            log.info("Trace {} evaluated: rating={}, confidence={}, status={}",
                    traceId, evaluation.rating(), evaluation.confidence(), evaluation.status());
            return evaluation;
        } catch (RuntimeException e) {
            record("failure");
            throw e;
        }
    }

    private void record(String outcome) {
        meterRegistry.counter("tracebrain.evaluations", "outcome", outcome).increment();
    }
}
