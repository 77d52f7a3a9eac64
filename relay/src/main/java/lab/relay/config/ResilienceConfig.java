package lab.relay.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lab.relay.common.BridgeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Retry policy for idempotent chain reads (gas price fetch, confirmation lookups, fee estimates).
 *
 * Mutating financial operations (mint submission, compensation, relayer withdrawal) are never
 * decorated with this policy: a failure there surfaces to the caller immediately.
 */
@Configuration
@Slf4j
public class ResilienceConfig {

    public static final String CHAIN_READ = "chainRead";

    @Bean
    public RetryRegistry retryRegistry(RelayProperties properties) {
        RelayProperties.RetryPolicy policy = properties.getRetry();
        RetryConfig idempotentReads = RetryConfig.custom()
                .maxAttempts(policy.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        policy.getInitialDelay().toMillis(),
                        2.0,
                        policy.getMaxDelay().toMillis()))
                .retryOnException(ResilienceConfig::isTransient)
                .build();

        RetryRegistry registry = RetryRegistry.of(idempotentReads);
        registry.retry(CHAIN_READ, idempotentReads);
        log.info(
                "event=resilience.retry.configured name={} maxAttempts={} initialDelayMs={} maxDelayMs={}",
                CHAIN_READ,
                policy.getMaxAttempts(),
                policy.getInitialDelay().toMillis(),
                policy.getMaxDelay().toMillis()
        );
        return registry;
    }

    @Bean
    public Retry chainReadRetry(RetryRegistry retryRegistry) {
        Retry retry = retryRegistry.retry(CHAIN_READ);
        retry.getEventPublisher().onRetry(event -> log.warn(
                "event=resilience.retry.attempt name={} attempt={} waitMs={} error={}",
                event.getName(),
                event.getNumberOfRetryAttempts(),
                event.getWaitInterval().toMillis(),
                event.getLastThrowable() == null ? null : event.getLastThrowable().getMessage()
        ));
        return retry;
    }

    // Only infrastructure failures are worth another attempt; domain rejections are final.
    static boolean isTransient(Throwable error) {
        if (error instanceof BridgeException bridgeException) {
            return bridgeException.isRetryable();
        }
        return error instanceof IOException
                || error instanceof UncheckedIOException
                || error instanceof ResourceAccessException;
    }
}
