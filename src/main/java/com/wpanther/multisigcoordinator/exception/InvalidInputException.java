package com.wpanther.multisigcoordinator.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidInputException extends MultisigException {

    public static final String INVALID_STATUS = "INVALID_STATUS";
    public static final String THRESHOLD_MISMATCH = "THRESHOLD_MISMATCH";
    public static final String INVALID_PAYLOAD = "INVALID_PAYLOAD";

    public InvalidInputException(String errorCode, String message) {
        super(errorCode, message);
    }

    public InvalidInputException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static InvalidInputException invalidStatus(String raw) {
        return new InvalidInputException(INVALID_STATUS, "Invalid status: " + raw);
    }

    public static InvalidInputException thresholdMismatch(int requested, int walletThreshold) {
        return new InvalidInputException(THRESHOLD_MISMATCH,
                "Requested threshold " + requested + " does not match wallet threshold " + walletThreshold);
    }
}
