package uk.gov.di.result.sharedtest.matchers;

import org.hamcrest.Description;
import org.hamcrest.TypeSafeMatcher;
import uk.gov.di.result.Result;

import java.util.Objects;

public class ResultMatcher<S, F> extends TypeSafeMatcher<Result<S, F>> {

    private final boolean expectSuccess;
    private final Object expectedValue;

    private ResultMatcher(boolean expectSuccess, Object expectedValue) {
        this.expectSuccess = expectSuccess;
        this.expectedValue = expectedValue;
    }

    @Override
    protected boolean matchesSafely(Result<S, F> item) {
        return item.resolve(
                success -> expectSuccess && Objects.equals(expectedValue, success),
                failure -> !expectSuccess && Objects.equals(expectedValue, failure));
    }

    @Override
    public void describeTo(Description description) {
        description
                .appendText(expectSuccess ? "a success with value " : "a failure with value ")
                .appendValue(expectedValue);
    }

    @Override
    protected void describeMismatchSafely(Result<S, F> item, Description description) {
        item.resolve(
                success -> description.appendText("was a success with value ").appendValue(success),
                failure ->
                        description.appendText("was a failure with value ").appendValue(failure));
    }

    public static <S, F> ResultMatcher<S, F> successWithValue(S value) {
        return new ResultMatcher<>(true, value);
    }

    public static <S, F> ResultMatcher<S, F> failureWithValue(F value) {
        return new ResultMatcher<>(false, value);
    }
}
