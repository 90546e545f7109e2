package uk.gov.di.result;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/** A {@link Result} whose producer runs at most once, on first use. */
public final class LazyResult<S, F> implements Result<S, F> {

    private static final Logger LOG = LogManager.getLogger(LazyResult.class);

    private volatile Result<S, F> value;
    private volatile Throwable producerFailure;
    private Supplier<? extends Result<S, F>> producer;

    private LazyResult(Supplier<? extends Result<S, F>> producer) {
        this.producer = producer;
    }

    public static <S, F> LazyResult<S, F> of(Supplier<? extends Result<S, F>> producer) {
        Objects.requireNonNull(producer, "producer");
        return new LazyResult<>(producer);
    }

    public boolean isForced() {
        return value != null || producerFailure != null;
    }

    @Override
    public <R> R resolve(
            Function<? super S, ? extends R> onSuccess,
            Function<? super F, ? extends R> onFailure) {
        Objects.requireNonNull(onSuccess, "onSuccess");
        Objects.requireNonNull(onFailure, "onFailure");
        return force().resolve(onSuccess, onFailure);
    }

    @Override
    public LazyResult<S, F> makeLazy() {
        return this;
    }

    private Result<S, F> force() {
        Result<S, F> result = value;
        if (result == null) {
            synchronized (this) {
                result = value;
                if (result == null) {
                    if (producerFailure != null) {
                        throw rethrow(producerFailure);
                    }
                    LOG.debug("Forcing lazy result");
                    try {
                        result =
                                Objects.requireNonNull(
                                        producer.get(), "Lazy result producer returned null");
                    } catch (RuntimeException | Error e) {
                        LOG.debug("Lazy result producer threw {}", e.getClass().getSimpleName());
                        producerFailure = e;
                        producer = null;
                        throw e;
                    }
                    value = result;
                    producer = null;
                }
            }
        }
        return result;
    }

    private static RuntimeException rethrow(Throwable failure) {
        if (failure instanceof Error) {
            throw (Error) failure;
        }
        return (RuntimeException) failure;
    }

    @Override
    public String toString() {
        Result<S, F> result = value;
        if (result != null) {
            return "LazyResult[" + result + "]";
        }
        return producerFailure != null ? "LazyResult[producer failed]" : "LazyResult[unforced]";
    }
}
