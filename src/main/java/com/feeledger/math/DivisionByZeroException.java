package com.feeledger.math;

public class DivisionByZeroException extends ArithmeticException {

    public DivisionByZeroException(String message) {
        super(message);
    }
}
