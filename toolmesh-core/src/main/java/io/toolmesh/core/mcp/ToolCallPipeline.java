package io.toolmesh.core.mcp;

import io.toolmesh.core.model.ToolErrorKind;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BiPredicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Timeout and retry plumbing for asynchronous remote operations.
 *
 * <p>{@link #withTimeout} races an operation against a timer. {@link #retrying} re-invokes an operation supplier, so
 * every attempt builds its own timeout window; retries are never nested inside a single window.
 */
public final class ToolCallPipeline implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ToolCallPipeline.class);

    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    public ToolCallPipeline() {
        this(Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "toolmesh-pipeline");
            thread.setDaemon(true);
            return thread;
        }), true);
    }

    public ToolCallPipeline(ScheduledExecutorService scheduler) {
        this(scheduler, false);
    }

    private ToolCallPipeline(ScheduledExecutorService scheduler, boolean ownsScheduler) {
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
    }

    public <T> CompletableFuture<T> withTimeout(
        Supplier<CompletableFuture<T>> operation,
        long timeoutMs,
        String label,
        String serverId
    ) {
        CompletableFuture<T> result = new CompletableFuture<>();
        ScheduledFuture<?> timer;
        try {
            timer = scheduler.schedule(
                () -> result.completeExceptionally(new ToolServerException(
                    ToolErrorKind.TIMEOUT,
                    label + " (timeout after " + timeoutMs + "ms)",
                    serverId,
                    null
                )),
                timeoutMs,
                TimeUnit.MILLISECONDS
            );
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new ToolServerException(
                ToolErrorKind.UNKNOWN, label + " rejected: pipeline is closed", serverId, null, e));
            return result;
        }

        start(operation).whenComplete((value, error) -> {
            timer.cancel(false);
            if (error != null) {
                result.completeExceptionally(ErrorClassifier.unwrap(error));
            } else {
                result.complete(value);
            }
        });
        return result;
    }

    /**
     * Runs {@code operation} until it produces an outcome that {@code retryable} rejects or the policy runs out of
     * attempts. The predicate sees either the value or the failure of the latest attempt (the other is null).
     */
    public <T> CompletableFuture<Attempted<T>> retrying(
        Supplier<CompletableFuture<T>> operation,
        RetryPolicy policy,
        BiPredicate<T, Throwable> retryable
    ) {
        CompletableFuture<Attempted<T>> result = new CompletableFuture<>();
        attempt(operation, policy, retryable, 1, result);
        return result;
    }

    public CompletableFuture<Void> delay(long delayMs) {
        if (delayMs <= 0) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> elapsed = new CompletableFuture<>();
        try {
            scheduler.schedule(() -> elapsed.complete(null), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            elapsed.completeExceptionally(e);
        }
        return elapsed;
    }

    @Override
    public void close() {
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    private <T> void attempt(
        Supplier<CompletableFuture<T>> operation,
        RetryPolicy policy,
        BiPredicate<T, Throwable> retryable,
        int attempt,
        CompletableFuture<Attempted<T>> result
    ) {
        start(operation).whenComplete((value, error) -> {
            Throwable cause = error == null ? null : ErrorClassifier.unwrap(error);
            boolean retry = attempt < policy.maxAttempts() && retryable.test(value, cause);
            if (!retry) {
                if (cause != null) {
                    result.completeExceptionally(cause);
                } else {
                    result.complete(new Attempted<>(value, attempt));
                }
                return;
            }

            long waitMs = policy.delayBeforeAttempt(attempt + 1);
            LOG.debug("Retrying operation (attempt {}/{}) in {}ms", attempt + 1, policy.maxAttempts(), waitMs);
            delay(waitMs).whenComplete((ignored, delayError) -> {
                if (delayError != null) {
                    if (cause != null) {
                        result.completeExceptionally(cause);
                    } else {
                        result.complete(new Attempted<>(value, attempt));
                    }
                    return;
                }
                attempt(operation, policy, retryable, attempt + 1, result);
            });
        });
    }

    private static <T> CompletableFuture<T> start(Supplier<CompletableFuture<T>> operation) {
        try {
            CompletableFuture<T> started = operation.get();
            if (started == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("operation returned no future"));
            }
            return started;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public record Attempted<T>(T value, int attempts) {
    }
}
