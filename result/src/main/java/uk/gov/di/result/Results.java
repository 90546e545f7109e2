package uk.gov.di.result;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/** Operations over results that cannot be expressed as instance methods of {@link Result}. */
public final class Results {

    private Results() {}

    public static <S, F> Result<S, F> squash(Result<Result<S, F>, F> result) {
        Objects.requireNonNull(result, "result");
        return result.bindToResult(Function.identity());
    }

    /** Returns whichever value is present, typed as the nearest common supertype. */
    public static <T> T either(Result<? extends T, ? extends T> result) {
        Objects.requireNonNull(result, "result");
        return result.<T>resolve(success -> success, failure -> failure);
    }

    public static <S, F> Stream<S> selectSuccess(Iterable<? extends Result<S, F>> values) {
        Objects.requireNonNull(values, "values");
        return StreamSupport.stream(values.spliterator(), false)
                .filter(Result::isSuccess)
                .map(result -> result.unwrap());
    }

    public static <S, F> Stream<F> selectFailure(Iterable<? extends Result<S, F>> values) {
        Objects.requireNonNull(values, "values");
        return StreamSupport.stream(values.spliterator(), false)
                .filter(Result::isFailure)
                .map(result -> result.unwrapError());
    }

    /**
     * Collects every success value in order, or returns the first failure encountered. Nothing
     * after the first failure is inspected.
     */
    public static <S, F> Result<List<S>, F> unwrapAll(Iterable<? extends Result<S, F>> values) {
        Objects.requireNonNull(values, "values");
        List<S> successes = new ArrayList<>();
        for (Result<S, F> value : values) {
            if (value.isFailure()) {
                return Result.failure(value.unwrapError());
            }
            successes.add(value.unwrap());
        }
        return Result.success(successes);
    }

    public static <S, F extends Throwable> S unwrapOrThrow(Result<S, F> result) throws F {
        Objects.requireNonNull(result, "result");
        if (result.isFailure()) {
            throw Objects.requireNonNull(result.unwrapError(), "failure");
        }
        return result.unwrap();
    }

    public static <S> Result<S, Exception> wrapCheckedInResult(Callable<S> func) {
        Objects.requireNonNull(func, "func");
        try {
            return Result.success(func.call());
        } catch (Exception e) {
            return Result.failure(e);
        }
    }
}
