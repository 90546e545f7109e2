package uk.gov.di.result.exceptions;

public class ResultUnwrapException extends IllegalStateException {
    public ResultUnwrapException(String message) {
        super(message);
    }
}
