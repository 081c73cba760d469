package com.wpanther.multisigcoordinator.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ConflictException extends MultisigException {

    public static final String WALLET_EXISTS = "WALLET_EXISTS";
    public static final String TX_ID_EXISTS = "TX_ID_EXISTS";
    public static final String ALREADY_SIGNED = "ALREADY_SIGNED";

    public ConflictException(String errorCode, String message) {
        super(errorCode, message);
    }

    public ConflictException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static ConflictException walletExists(String spendingConditionId) {
        return walletExists(spendingConditionId, null);
    }

    public static ConflictException walletExists(String spendingConditionId, Throwable cause) {
        return new ConflictException(WALLET_EXISTS,
                "A wallet with spending condition " + spendingConditionId + " already exists", cause);
    }

    public static ConflictException txIdExists(String txId) {
        return txIdExists(txId, null);
    }

    public static ConflictException txIdExists(String txId, Throwable cause) {
        return new ConflictException(TX_ID_EXISTS,
                "A proposal with transaction ID " + txId + " already exists", cause);
    }

    public static ConflictException alreadySigned(String proposalId, String signer) {
        return alreadySigned(proposalId, signer, null);
    }

    public static ConflictException alreadySigned(String proposalId, String signer, Throwable cause) {
        return new ConflictException(ALREADY_SIGNED,
                "PKH " + signer + " has already signed proposal " + proposalId, cause);
    }
}
