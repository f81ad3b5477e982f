package com.phodal.tracebrain.llm;

import com.phodal.tracebrain.error.DeadlineExceededException;
import com.phodal.tracebrain.error.ProviderException;
import com.phodal.tracebrain.error.ValidationException;
import com.phodal.tracebrain.store.Deadline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Runs a blocking model call off the caller thread with a timeout, and retries with
 * exponential backoff when the provider fails, times out, or answers with something
 * the parser rejects.
 */
public class ModelInvoker {
    private static final Logger log = LoggerFactory.getLogger(ModelInvoker.class);

    private final RetryPolicy policy;

    public ModelInvoker(RetryPolicy policy) {
        this.policy = policy;
    }

    public <T> T invoke(String operation, LanguageModelProvider provider, String prompt,
                        CompletionOptions options, Function<String, T> parser) {
        return invoke(operation, provider, prompt, options, parser, Deadline.none());
    }

    /**
     * Call the provider and parse its answer. All attempts together, backoff included,
     * stay within {@code deadline}.
     *
     * @param operation label used in logs and errors
     * @param parser turns the raw completion into a result; throws {@link ValidationException} on bad output
     * @throws ProviderException once all attempts failed
     * @throws DeadlineExceededException when the deadline passes first
     */
    public <T> T invoke(String operation, LanguageModelProvider provider, String prompt,
                        CompletionOptions options, Function<String, T> parser, Deadline deadline) {
        deadline.check(operation);
        Mono<T> call = Mono.fromCallable(() -> parser.apply(provider.complete(prompt, options)))
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(policy.timeout())
            .retryWhen(Retry.backoff(policy.maxRetries(), policy.initialBackoff())
                .maxBackoff(policy.maxBackoff())
                .filter(ModelInvoker::isRetryable)
                .doBeforeRetry(signal -> log.warn("{} attempt {} via {} failed: {}",
                    operation, signal.totalRetries() + 1, provider.name(), signal.failure().getMessage()))
                .onRetryExhaustedThrow((backoff, signal) -> signal.failure()));
        if (deadline.expiresAt() != null) {
            call = call.timeout(deadline.remaining(), Mono.error(() -> new DeadlineExceededException(operation)));
        }

        try {
            return call.block();
        } catch (RuntimeException e) {
            Throwable failure = Exceptions.unwrap(e);
            if (failure instanceof DeadlineExceededException deadlineExceeded) {
                log.warn("{} via {} gave up: {}", operation, provider.name(), failure.getMessage());
                throw deadlineExceeded;
            }
            log.error("{} via {} failed: {}", operation, provider.name(), failure.getMessage());
            throw toProviderException(operation, failure);
        }
    }

    static boolean isRetryable(Throwable error) {
        if (error instanceof ProviderException provider) {
            return provider.isRetryable();
        }
        return error instanceof TimeoutException || error instanceof ValidationException;
    }

    private ProviderException toProviderException(String operation, Throwable failure) {
        if (failure instanceof ProviderException provider) {
            return provider;
        }
        if (failure instanceof TimeoutException) {
            return new ProviderException(operation + " timed out after " + policy.timeout(), failure);
        }
        if (failure instanceof ValidationException) {
            return new ProviderException(operation + " returned an unusable answer: " + failure.getMessage(), failure);
        }
        return new ProviderException(operation + " failed: " + failure.getMessage(), false, failure);
    }
}
