package uk.gov.di.result.collections;

import uk.gov.di.result.Result;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Stream;

import static java.lang.String.format;

/**
 * Adapts collections, streams and maps into {@link Result}s. A missing source is reported as a
 * failure rather than thrown; a missing predicate is a programming error.
 */
public final class CollectionResults {

    private CollectionResults() {}

    public static <K, V> Result<V, String> tryGetValueAsResult(Map<K, V> map, K key) {
        if (map == null) {
            return Result.failure("Could not get value from null map");
        }
        if (!map.containsKey(key)) {
            return Result.failure(format("Map does not contain key: %s", key));
        }
        return Result.success(map.get(key));
    }

    /** Stops iterating as soon as a second element is seen. */
    public static <T> Result<T, CollectionError> singleAsResult(Iterable<T> values) {
        if (values == null) {
            return Result.failure(CollectionError.IS_NULL);
        }
        return single(values.iterator());
    }

    public static <T> Result<T, CollectionError> singleAsResult(
            Iterable<T> values, Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        if (values == null) {
            return Result.failure(CollectionError.IS_NULL);
        }
        return singleMatching(values.iterator(), predicate);
    }

    /** Pulls at most two elements from {@code values}. */
    public static <T> Result<T, CollectionError> singleAsResult(Stream<T> values) {
        if (values == null) {
            return Result.failure(CollectionError.IS_NULL);
        }
        return single(values.limit(2).iterator());
    }

    public static <T> Result<T, CollectionError> singleAsResult(
            Stream<T> values, Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        if (values == null) {
            return Result.failure(CollectionError.IS_NULL);
        }
        return singleMatching(values.iterator(), predicate);
    }

    private static <T> Result<T, CollectionError> single(Iterator<T> iterator) {
        if (!iterator.hasNext()) {
            return Result.failure(CollectionError.IS_EMPTY);
        }
        T first = iterator.next();
        if (iterator.hasNext()) {
            return Result.failure(CollectionError.MULTIPLE_MATCHING_ITEMS);
        }
        return Result.success(first);
    }

    private static <T> Result<T, CollectionError> singleMatching(
            Iterator<T> iterator, Predicate<? super T> predicate) {
        if (!iterator.hasNext()) {
            return Result.failure(CollectionError.IS_EMPTY);
        }
        T match = null;
        boolean found = false;
        while (iterator.hasNext()) {
            T candidate = iterator.next();
            if (predicate.test(candidate)) {
                if (found) {
                    return Result.failure(CollectionError.MULTIPLE_MATCHING_ITEMS);
                }
                match = candidate;
                found = true;
            }
        }
        return found
                ? Result.success(match)
                : Result.failure(CollectionError.NO_MATCHING_ITEMS);
    }
}
