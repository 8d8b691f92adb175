package com.feeledger.error;

/**
 * Structural failure raised inside the calculation engine and converted to an
 * error {@link Result} at its boundary.
 */
public class FeeCalculationException extends RuntimeException {

    private final ErrorCode errorCode;

    public FeeCalculationException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
