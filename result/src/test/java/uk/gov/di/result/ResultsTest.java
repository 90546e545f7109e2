package uk.gov.di.result;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ResultsTest {

    @Nested
    class SquashTests {
        @Test
        void aSuccessOfASuccessShouldSquashToTheInnerResult() {
            Result<Integer, String> result = Result.success(9);
            Result<Result<Integer, String>, String> nestedResult = Result.success(result);

            var squashed = Results.squash(nestedResult);

            assertThat(squashed, sameInstance(result));
        }

        @Test
        void aSuccessOfAFailureShouldSquashToTheInnerFailure() {
            Result<Integer, String> result = Result.failure("inner");
            Result<Result<Integer, String>, String> nestedResult = Result.success(result);

            assertThat(Results.squash(nestedResult).unwrapError(), equalTo("inner"));
        }

        @Test
        void anOuterFailureShouldSquashToItself() {
            var failure = "bad things";
            Result<Result<Integer, String>, String> nestedResult = Result.failure(failure);

            assertThat(Results.squash(nestedResult).unwrapError(), equalTo(failure));
        }

        @Test
        void shouldRejectANullResult() {
            assertThrows(NullPointerException.class, () -> Results.squash(null));
        }
    }

    @Nested
    class EitherTests {
        @Test
        void shouldReturnTheSuccessValueOfASameTypedResult() {
            Result<String, String> success = Result.success("left");

            String value = Results.either(success);

            assertThat(value, equalTo("left"));
        }

        @Test
        void shouldReturnTheFailureValueOfASameTypedResult() {
            Result<String, String> failure = Result.failure("right");

            String value = Results.either(failure);

            assertThat(value, equalTo("right"));
        }

        @Test
        void shouldReturnTheCommonSupertypeOfAMixedResult() {
            Result<Integer, Long> failure = Result.failure(3L);

            Number value = Results.either(failure);

            assertEquals(3L, value);
        }

        @Test
        void shouldRejectANullResult() {
            assertThrows(NullPointerException.class, () -> Results.either(null));
        }
    }

    @Nested
    class SelectTests {
        private final List<Result<Integer, String>> results =
                List.of(
                        Result.success(1),
                        Result.failure("first"),
                        Result.success(2),
                        Result.failure("second"));

        @Test
        void selectSuccessShouldReturnTheSuccessValuesInOrder() {
            var successes = Results.selectSuccess(results).collect(Collectors.toList());

            assertThat(successes, contains(1, 2));
        }

        @Test
        void selectFailureShouldReturnTheFailureValuesInOrder() {
            var failures = Results.selectFailure(results).collect(Collectors.toList());

            assertThat(failures, contains("first", "second"));
        }

        @Test
        void selectSuccessShouldNotIterateUntilConsumed() {
            var visited = new ArrayList<Result<Integer, String>>();
            Iterable<Result<Integer, String>> tracking =
                    () -> {
                        Iterator<Result<Integer, String>> iterator = results.iterator();
                        return new Iterator<>() {
                            @Override
                            public boolean hasNext() {
                                return iterator.hasNext();
                            }

                            @Override
                            public Result<Integer, String> next() {
                                var next = iterator.next();
                                visited.add(next);
                                return next;
                            }
                        };
                    };

            var stream = Results.selectSuccess(tracking);
            assertEquals(0, visited.size());

            var first = stream.findFirst();
            assertThat(first.orElseThrow(), equalTo(1));
            assertEquals(1, visited.size());
        }

        @Test
        void shouldRejectANullSequence() {
            assertThrows(NullPointerException.class, () -> Results.selectSuccess(null));
            assertThrows(NullPointerException.class, () -> Results.selectFailure(null));
        }
    }

    @Nested
    class UnwrapAllTests {
        @Test
        void shouldTransformAListOfSuccessesIntoASuccessOfAList() {
            List<Result<Integer, String>> results =
                    List.of(Result.success(1), Result.success(2), Result.success(3));

            assertEquals(Result.success(List.of(1, 2, 3)), Results.unwrapAll(results));
        }

        @Test
        void shouldReturnTheFirstFailureInTheList() {
            List<Result<Integer, String>> results =
                    List.of(
                            Result.success(1),
                            Result.failure("firstFailure"),
                            Result.success(2),
                            Result.failure("secondFailure"));

            assertEquals(Result.failure("firstFailure"), Results.unwrapAll(results));
        }

        @Test
        void shouldNotInspectResultsAfterTheFirstFailure() {
            List<Result<Integer, String>> results =
                    List.of(
                            Result.failure("firstFailure"),
                            LazyResult.of(
                                    () -> {
                                        throw new AssertionError("Shouldn't be hit!");
                                    }));

            assertEquals(Result.failure("firstFailure"), Results.unwrapAll(results));
        }

        @Test
        void shouldRejectANullSequence() {
            assertThrows(NullPointerException.class, () -> Results.unwrapAll(null));
        }

        @Test
        void anEmptyListShouldBeASuccessOfAnEmptyList() {
            List<Result<Integer, String>> results = List.of();

            assertEquals(Result.success(List.of()), Results.unwrapAll(results));
        }
    }

    @Nested
    class UnwrapOrThrowTests {
        @Test
        void shouldReturnTheSuccessValue() throws IOException {
            Result<String, IOException> success = Result.success("value");

            assertThat(Results.unwrapOrThrow(success), equalTo("value"));
        }

        @Test
        void shouldThrowTheFailureValue() {
            var exception = new IOException("disk on fire");
            Result<String, IOException> failure = Result.failure(exception);

            var thrown = assertThrows(IOException.class, () -> Results.unwrapOrThrow(failure));

            assertThat(thrown, sameInstance(exception));
        }

        @Test
        void shouldRejectAFailureWithoutAnException() {
            Result<String, IOException> failure = Result.failure(null);

            var thrown =
                    assertThrows(NullPointerException.class, () -> Results.unwrapOrThrow(failure));

            assertThat(thrown.getMessage(), equalTo("failure"));
        }
    }

    @Nested
    class WrapCheckedInResultTests {
        @Test
        void shouldCaptureTheReturnedValueAsASuccess() {
            var result = Results.wrapCheckedInResult(() -> "value");

            assertEquals(Result.success("value"), result);
        }

        @Test
        void shouldCaptureAThrownExceptionAsAFailure() {
            var result =
                    Results.<String>wrapCheckedInResult(
                            () -> {
                                throw new IOException("disk on fire");
                            });

            assertThat(result.unwrapError(), instanceOf(IOException.class));
            assertThat(result.unwrapError().getMessage(), equalTo("disk on fire"));
        }
    }
}
