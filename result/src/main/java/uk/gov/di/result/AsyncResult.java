package uk.gov.di.result;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import uk.gov.di.result.helpers.ExecutorHelper;
import uk.gov.di.result.services.ConfigurationService;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

public final class AsyncResult<S, F> {

    private static final Logger LOG = LogManager.getLogger(AsyncResult.class);

    private final CompletableFuture<Result<S, F>> pending;

    private AsyncResult(CompletableFuture<Result<S, F>> pending) {
        this.pending = pending;
    }

    public static <S, F> AsyncResult<S, F> completed(Result<S, F> result) {
        Objects.requireNonNull(result, "result");
        return new AsyncResult<>(CompletableFuture.completedFuture(result));
    }

    public static <S, F> AsyncResult<S, F> of(CompletionStage<? extends Result<S, F>> stage) {
        Objects.requireNonNull(stage, "stage");
        return new AsyncResult<>(
                stage.<Result<S, F>>thenApply(
                                result ->
                                        Objects.requireNonNull(
                                                result, "Completion stage produced null"))
                        .toCompletableFuture());
    }

    public static <S, F> AsyncResult<S, F> supplyAsync(
            Supplier<? extends Result<S, F>> producer, Executor executor) {
        Objects.requireNonNull(producer, "producer");
        Objects.requireNonNull(executor, "executor");
        return new AsyncResult<>(
                CompletableFuture.<Result<S, F>>supplyAsync(
                        () -> {
                            try {
                                return Objects.requireNonNull(
                                        producer.get(), "Async result producer returned null");
                            } catch (RuntimeException e) {
                                LOG.error("Async result producer failed", e);
                                throw e;
                            }
                        },
                        executor));
    }

    /** Runs {@code producer} on the executor configured through {@link ConfigurationService}. */
    public static <S, F> AsyncResult<S, F> supplyAsync(Supplier<? extends Result<S, F>> producer) {
        return supplyAsync(producer, DefaultExecutor.INSTANCE);
    }

    /** Waits for all results and keeps the first failure in iteration order. */
    public static <S, F> AsyncResult<List<S>, F> unwrapAll(
            Iterable<? extends AsyncResult<S, F>> values) {
        Objects.requireNonNull(values, "values");
        List<CompletableFuture<Result<S, F>>> futures = new ArrayList<>();
        for (AsyncResult<S, F> value : values) {
            futures.add(value.pending);
        }
        return new AsyncResult<>(
                CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                        .thenApply(
                                ignored -> {
                                    List<Result<S, F>> results = new ArrayList<>();
                                    futures.forEach(future -> results.add(future.join()));
                                    return Results.unwrapAll(results);
                                }));
    }

    public <R> CompletableFuture<R> resolve(
            Function<? super S, ? extends R> onSuccess,
            Function<? super F, ? extends R> onFailure) {
        Objects.requireNonNull(onSuccess, "onSuccess");
        Objects.requireNonNull(onFailure, "onFailure");
        return pending.thenApply(result -> result.<R>resolve(onSuccess, onFailure));
    }

    public CompletableFuture<Boolean> isSuccess() {
        return pending.thenApply(Result::isSuccess);
    }

    public CompletableFuture<Boolean> isFailure() {
        return pending.thenApply(Result::isFailure);
    }

    public CompletableFuture<S> unwrapOr(S defaultValue) {
        return pending.thenApply(result -> result.or(defaultValue));
    }

    public CompletableFuture<S> unwrapOr(Supplier<? extends S> defaultFactory) {
        Objects.requireNonNull(defaultFactory, "defaultFactory");
        return pending.thenApply(result -> result.or(defaultFactory));
    }

    public CompletableFuture<S> unwrapOr(Function<? super F, ? extends S> defaultFromFailure) {
        Objects.requireNonNull(defaultFromFailure, "defaultFromFailure");
        return pending.thenApply(result -> result.or(defaultFromFailure));
    }

    public <R> AsyncResult<R, F> bind(Function<? super S, ? extends R> onSuccess) {
        Objects.requireNonNull(onSuccess, "onSuccess");
        return new AsyncResult<>(pending.thenApply(result -> result.<R>bind(onSuccess)));
    }

    public <R, R2> AsyncResult<R, R2> bind(
            Function<? super S, ? extends R> onSuccess,
            Function<? super F, ? extends R2> onFailure) {
        Objects.requireNonNull(onSuccess, "onSuccess");
        Objects.requireNonNull(onFailure, "onFailure");
        return new AsyncResult<>(
                pending.thenApply(result -> result.<R, R2>bind(onSuccess, onFailure)));
    }

    public <R> AsyncResult<R, F> bindToResult(
            Function<? super S, ? extends Result<R, F>> onSuccess) {
        Objects.requireNonNull(onSuccess, "onSuccess");
        return new AsyncResult<>(pending.thenApply(result -> result.<R>bindToResult(onSuccess)));
    }

    public <R> AsyncResult<R, F> bindAsync(
            Function<? super S, ? extends CompletionStage<? extends R>> onSuccess) {
        Objects.requireNonNull(onSuccess, "onSuccess");
        return new AsyncResult<>(
                pending.thenCompose(
                        result ->
                                result.<CompletionStage<Result<R, F>>>resolve(
                                        success ->
                                                onSuccess
                                                        .apply(success)
                                                        .thenApply(
                                                                value ->
                                                                        Result.<R, F>success(
                                                                                value)),
                                        failure ->
                                                CompletableFuture.completedFuture(
                                                        Result.<R, F>failure(failure)))));
    }

    public <R> AsyncResult<R, F> bindToAsyncResult(
            Function<? super S, ? extends AsyncResult<R, F>> onSuccess) {
        Objects.requireNonNull(onSuccess, "onSuccess");
        return new AsyncResult<>(
                pending.thenCompose(
                        result ->
                                result.<CompletionStage<Result<R, F>>>resolve(
                                        success -> onSuccess.apply(success).toCompletableFuture(),
                                        failure ->
                                                CompletableFuture.completedFuture(
                                                        Result.<R, F>failure(failure)))));
    }

    public <F2> AsyncResult<S, F2> mapFailure(Function<? super F, ? extends F2> onFailure) {
        Objects.requireNonNull(onFailure, "onFailure");
        return new AsyncResult<>(pending.thenApply(result -> result.<F2>mapFailure(onFailure)));
    }

    public AsyncResult<S, F> onSuccess(Consumer<? super S> action) {
        Objects.requireNonNull(action, "action");
        return new AsyncResult<>(pending.thenApply(result -> result.onSuccess(action)));
    }

    public AsyncResult<S, F> onFailure(Consumer<? super F> action) {
        Objects.requireNonNull(action, "action");
        return new AsyncResult<>(pending.thenApply(result -> result.onFailure(action)));
    }

    /** A copy of the pending computation; completing or cancelling it leaves this unaffected. */
    public CompletableFuture<Result<S, F>> toCompletableFuture() {
        return pending.copy();
    }

    /** Blocks until the computation completes. */
    public Result<S, F> join() {
        return pending.join();
    }

    @Override
    public String toString() {
        if (!pending.isDone()) {
            return "AsyncResult[pending]";
        }
        return pending.isCompletedExceptionally()
                ? "AsyncResult[completed exceptionally]"
                : "AsyncResult[" + pending.join() + "]";
    }

    private static final class DefaultExecutor {
        private static final Executor INSTANCE =
                ExecutorHelper.createDefaultExecutor(ConfigurationService.getInstance());
    }
}
