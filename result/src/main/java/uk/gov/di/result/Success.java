package uk.gov.di.result;

import java.util.Objects;
import java.util.function.Function;

public record Success<S, F>(S value) implements Result<S, F> {

    @Override
    public <R> R resolve(
            Function<? super S, ? extends R> onSuccess,
            Function<? super F, ? extends R> onFailure) {
        Objects.requireNonNull(onSuccess, "onSuccess");
        Objects.requireNonNull(onFailure, "onFailure");
        return onSuccess.apply(value);
    }
}
