package com.wpanther.multisigcoordinator.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class NotFoundException extends MultisigException {

    public static final String WALLET_NOT_FOUND = "WALLET_NOT_FOUND";
    public static final String PROPOSAL_NOT_FOUND = "PROPOSAL_NOT_FOUND";
    public static final String HISTORY_NOT_FOUND = "HISTORY_NOT_FOUND";

    public NotFoundException(String errorCode, String message) {
        super(errorCode, message);
    }

    public static NotFoundException wallet(String spendingConditionId) {
        return new NotFoundException(WALLET_NOT_FOUND,
                "Wallet with spending condition " + spendingConditionId + " not found");
    }

    public static NotFoundException proposal(String proposalId) {
        return new NotFoundException(PROPOSAL_NOT_FOUND, "Proposal " + proposalId + " not found");
    }

    public static NotFoundException history(String historyId) {
        return new NotFoundException(HISTORY_NOT_FOUND, "History entry " + historyId + " not found");
    }
}
