package uk.gov.di.result;

import uk.gov.di.result.exceptions.ResultUnwrapException;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

public sealed interface Result<S, F> permits Success, Failure, LazyResult {

    static <S, F> Result<S, F> success(S value) {
        return new Success<>(value);
    }

    static <S, F> Result<S, F> failure(F value) {
        return new Failure<>(value);
    }

    /**
     * Folds the result, invoking exactly one of the two functions.
     *
     * @return the value returned by whichever function was invoked
     */
    <R> R resolve(
            Function<? super S, ? extends R> onSuccess,
            Function<? super F, ? extends R> onFailure);

    default boolean isSuccess() {
        return resolve(success -> true, failure -> false);
    }

    default boolean isFailure() {
        return !isSuccess();
    }

    default S unwrap() {
        return this.<S>resolve(
                success -> success,
                failure -> {
                    throw new ResultUnwrapException("No success value present in Failure");
                });
    }

    default F unwrapError() {
        return this.<F>resolve(
                success -> {
                    throw new ResultUnwrapException("No failure value present in Success");
                },
                failure -> failure);
    }

    default <R> Result<R, F> bind(Function<? super S, ? extends R> onSuccess) {
        Objects.requireNonNull(onSuccess, "onSuccess");
        return this.<Result<R, F>>resolve(
                success -> new Success<>(onSuccess.apply(success)),
                failure -> new Failure<>(failure));
    }

    default <R, R2> Result<R, R2> bind(
            Function<? super S, ? extends R> onSuccess,
            Function<? super F, ? extends R2> onFailure) {
        Objects.requireNonNull(onSuccess, "onSuccess");
        Objects.requireNonNull(onFailure, "onFailure");
        return this.<Result<R, R2>>resolve(
                success -> new Success<>(onSuccess.apply(success)),
                failure -> new Failure<>(onFailure.apply(failure)));
    }

    default <R> Result<R, F> bindToResult(
            Function<? super S, ? extends Result<R, F>> onSuccess) {
        Objects.requireNonNull(onSuccess, "onSuccess");
        return this.<Result<R, F>>resolve(onSuccess, failure -> new Failure<>(failure));
    }

    default S or(S defaultValue) {
        return resolve(success -> success, failure -> defaultValue);
    }

    default S or(Supplier<? extends S> defaultFactory) {
        Objects.requireNonNull(defaultFactory, "defaultFactory");
        return resolve(success -> success, failure -> defaultFactory.get());
    }

    default S or(Function<? super F, ? extends S> defaultFromFailure) {
        Objects.requireNonNull(defaultFromFailure, "defaultFromFailure");
        return resolve(success -> success, defaultFromFailure);
    }

    default <F2> Result<S, F2> mapFailure(Function<? super F, ? extends F2> onFailure) {
        Objects.requireNonNull(onFailure, "onFailure");
        return this.<Result<S, F2>>resolve(
                success -> new Success<>(success),
                failure -> new Failure<>(onFailure.apply(failure)));
    }

    default <F2> Result<S, F2> changeFailure(F2 newValue) {
        return mapFailure(failure -> newValue);
    }

    default <F2> Result<S, F2> changeFailureWith(Supplier<? extends F2> newValue) {
        Objects.requireNonNull(newValue, "newValue");
        return mapFailure(failure -> newValue.get());
    }

    /** Downgrades a success whose value does not satisfy {@code predicate}. */
    default Result<S, F> retainIf(Predicate<? super S> predicate, F replaceWith) {
        Objects.requireNonNull(predicate, "predicate");
        return this.<S>bindToResult(
                success ->
                        predicate.test(success)
                                ? new Success<>(success)
                                : new Failure<>(replaceWith));
    }

    default Result<S, F> retainNotNull(F replaceWith) {
        return retainIf(Objects::nonNull, replaceWith);
    }

    default Result<S, F> onSuccess(Consumer<? super S> action) {
        Objects.requireNonNull(action, "action");
        resolve(
                success -> {
                    action.accept(success);
                    return null;
                },
                failure -> null);
        return this;
    }

    default Result<S, F> onFailure(Consumer<? super F> action) {
        Objects.requireNonNull(action, "action");
        resolve(
                success -> null,
                failure -> {
                    action.accept(failure);
                    return null;
                });
        return this;
    }

    /**
     * Hands the success value to {@code receiver} if there is one.
     *
     * @return whether {@code receiver} was called
     */
    default boolean tryGetSuccess(Consumer<? super S> receiver) {
        Objects.requireNonNull(receiver, "receiver");
        return resolve(
                success -> {
                    receiver.accept(success);
                    return true;
                },
                failure -> false);
    }

    default boolean tryGetFailure(Consumer<? super F> receiver) {
        Objects.requireNonNull(receiver, "receiver");
        return resolve(
                success -> false,
                failure -> {
                    receiver.accept(failure);
                    return true;
                });
    }

    default LazyResult<S, F> makeLazy() {
        return LazyResult.of(() -> this);
    }

    default AsyncResult<S, F> toAsyncResult() {
        return AsyncResult.completed(this);
    }
}
