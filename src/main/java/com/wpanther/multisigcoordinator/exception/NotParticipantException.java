package com.wpanther.multisigcoordinator.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.FORBIDDEN)
public class NotParticipantException extends MultisigException {

    public static final String NOT_PARTICIPANT = "NOT_PARTICIPANT";

    public NotParticipantException(String signer, String spendingConditionId) {
        super(NOT_PARTICIPANT, "PKH " + signer + " is not a participant of wallet " + spendingConditionId);
    }
}
