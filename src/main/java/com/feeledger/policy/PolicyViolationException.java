package com.feeledger.policy;

import com.feeledger.error.ErrorCode;
import com.feeledger.error.FeeCalculationException;

public class PolicyViolationException extends FeeCalculationException {

    public PolicyViolationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public PolicyViolationException(String message) {
        super(ErrorCode.INVALID_POLICY, message);
    }
}
