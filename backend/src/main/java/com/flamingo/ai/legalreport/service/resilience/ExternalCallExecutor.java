package com.flamingo.ai.legalreport.service.resilience;

import com.flamingo.ai.legalreport.exception.ExternalServiceException;
import com.flamingo.ai.legalreport.exception.InputDocumentException;
import com.flamingo.ai.legalreport.exception.PipelineException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs every OCR, LLM, embedding and vector store call under a Resilience4j {@link Retry} wrapped
 * around a {@link TimeLimiter}.
 *
 * <p>Failure mapping after the last attempt:
 *
 * <ul>
 *   <li>{@link InputDocumentException} is never retried and is rethrown as is.
 *   <li>{@link com.flamingo.ai.legalreport.exception.StructuredOutputParseException} is retried,
 *       then rethrown as is so callers can decide whether it is fatal.
 *   <li>Anything else, timeouts included, becomes an {@link ExternalServiceException}.
 * </ul>
 */
@Component
@Slf4j
public class ExternalCallExecutor {

  private final TimeLimiterRegistry timeLimiterRegistry;
  private final Executor executor;
  private final MeterRegistry meterRegistry;
  private final Map<ExternalCapability, Retry> retries = new EnumMap<>(ExternalCapability.class);

  public ExternalCallExecutor(
      RetryRegistry retryRegistry,
      TimeLimiterRegistry timeLimiterRegistry,
      @Qualifier("externalCallPool") Executor executor,
      MeterRegistry meterRegistry) {
    this.timeLimiterRegistry = timeLimiterRegistry;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
    for (ExternalCapability capability : ExternalCapability.values()) {
      retries.put(capability, createRetry(retryRegistry, capability));
    }
  }

  /**
   * Executes {@code call} with retry and timeout.
   *
   * @param capability which capability is being called; selects the resilience instances
   * @param description short label for logs, usually the document name
   * @param call the external call
   * @return the call's result
   */
  public <T> T call(ExternalCapability capability, String description, Supplier<T> call) {
    TimeLimiter timeLimiter = timeLimiterRegistry.timeLimiter(capability.instanceName());
    Callable<T> limited =
        timeLimiter.decorateFutureSupplier(
            () -> CompletableFuture.supplyAsync(call, executor));
    Callable<T> retried = Retry.decorateCallable(retries.get(capability), limited);

    try {
      return retried.call();
    } catch (PipelineException e) {
      if (!(e instanceof InputDocumentException)) {
        recordFailure(capability, description, e);
      }
      throw e;
    } catch (Exception e) {
      recordFailure(capability, description, e);
      throw new ExternalServiceException(
          capability.instanceName(),
          capability.instanceName() + " call failed for " + description + ": " + describe(e),
          e);
    }
  }

  private Retry createRetry(RetryRegistry registry, ExternalCapability capability) {
    RetryConfig base =
        registry
            .find(capability.instanceName())
            .map(Retry::getRetryConfig)
            .orElse(registry.getDefaultConfig());
    RetryConfig config =
        RetryConfig.from(base).ignoreExceptions(InputDocumentException.class).build();
    Retry retry = Retry.of(capability.instanceName(), config);
    retry
        .getEventPublisher()
        .onRetry(
            event -> {
              log.warn(
                  "Retrying {} call (attempt {}): {}",
                  capability.instanceName(),
                  event.getNumberOfRetryAttempts(),
                  event.getLastThrowable() != null ? describe(event.getLastThrowable()) : "");
              meterRegistry
                  .counter("external.call.retry", "capability", capability.instanceName())
                  .increment();
            });
    return retry;
  }

  private void recordFailure(ExternalCapability capability, String description, Throwable e) {
    log.error(
        "{} call failed for {} after retries: {}",
        capability.instanceName(),
        description,
        describe(e));
    meterRegistry
        .counter("external.call.failure", "capability", capability.instanceName())
        .increment();
  }

  private static String describe(Throwable e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
