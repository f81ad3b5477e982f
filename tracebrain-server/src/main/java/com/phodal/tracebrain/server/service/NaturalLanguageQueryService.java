package com.phodal.tracebrain.server.service;

import com.phodal.tracebrain.error.DeadlineExceededException;
import com.phodal.tracebrain.error.TranslationFailedException;
import com.phodal.tracebrain.query.QueryResult;
import com.phodal.tracebrain.query.QueryTranslator;
import com.phodal.tracebrain.query.StructuredQuery;
import com.phodal.tracebrain.query.StructuredQueryExecutor;
import com.phodal.tracebrain.server.config.TraceBrainProperties;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Answers a plain-language question by translating it into a structured query and running it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NaturalLanguageQueryService {

    private final QueryTranslator queryTranslator;
    private final StructuredQueryExecutor queryExecutor;
    private final TraceBrainProperties properties;
    private final MeterRegistry meterRegistry;

    public QueryResult answer(String question) {
        StructuredQuery query;
        try {
            query = queryTranslator.translate(question, properties.requestDeadline());
        } catch (TranslationFailedException e) {
            record("translation_failed");
            throw e;
        } catch (DeadlineExceededException e) {
            record("timeout");
            throw e;
        }
        QueryResult result = queryExecutor.execute(query);
        record("success");
        return result;
    }

    private void record(String outcome) {
        meterRegistry.counter("tracebrain.nlq", "outcome", outcome).increment();
    }
}
