package uk.gov.di.result;

import java.util.Objects;
import java.util.function.Function;

public record Failure<S, F>(F value) implements Result<S, F> {

    @Override
    public <R> R resolve(
            Function<? super S, ? extends R> onSuccess,
            Function<? super F, ? extends R> onFailure) {
        Objects.requireNonNull(onSuccess, "onSuccess");
        Objects.requireNonNull(onFailure, "onFailure");
        return onFailure.apply(value);
    }
}
