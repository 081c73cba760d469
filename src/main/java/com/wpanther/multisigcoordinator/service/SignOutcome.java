package com.wpanther.multisigcoordinator.service;

import lombok.Value;

/**
 * Result of an accepted signature
 */
@Value
public class SignOutcome {

    long signatureCount;

    // True only for the signature that moved the proposal from pending to ready
    boolean becameReady;
}
