package com.wpanther.multisigcoordinator.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The operation is not legal for the entity's current status
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class InvalidStateException extends MultisigException {

    public static final String NOT_PENDING = "NOT_PENDING";
    public static final String NOT_READY = "NOT_READY";
    public static final String NOT_BROADCAST = "NOT_BROADCAST";
    public static final String ALREADY_TERMINAL = "ALREADY_TERMINAL";

    public InvalidStateException(String errorCode, String message) {
        super(errorCode, message);
    }

    public static InvalidStateException notPending(String proposalId, Object status) {
        return new InvalidStateException(NOT_PENDING,
                "Cannot sign proposal " + proposalId + " with status: " + status);
    }

    public static InvalidStateException notReady(String proposalId, Object status) {
        return new InvalidStateException(NOT_READY,
                "Cannot broadcast proposal " + proposalId + " with status: " + status);
    }

    public static InvalidStateException notBroadcast(String id, Object status) {
        return new InvalidStateException(NOT_BROADCAST,
                "Cannot confirm " + id + " with status: " + status);
    }

    public static InvalidStateException alreadyTerminal(String proposalId, Object status) {
        return new InvalidStateException(ALREADY_TERMINAL,
                "Proposal " + proposalId + " is already " + status);
    }
}
