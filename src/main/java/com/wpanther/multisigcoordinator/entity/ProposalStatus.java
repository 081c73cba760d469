package com.wpanther.multisigcoordinator.entity;

import com.fasterxml.jackson.annotation.JsonValue;
import com.wpanther.multisigcoordinator.exception.InvalidInputException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Lifecycle of a spend proposal.
 * PENDING -> READY -> BROADCAST -> CONFIRMED, with EXPIRED reachable from any non-terminal state.
 */
public enum ProposalStatus {
    PENDING("pending"),
    READY("ready"),
    BROADCAST("broadcast"),
    CONFIRMED("confirmed"),
    EXPIRED("expired");

    private final String value;

    ProposalStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == CONFIRMED || this == EXPIRED;
    }

    public boolean canTransitionTo(ProposalStatus target) {
        switch (this) {
            case PENDING:
                return target == READY || target == EXPIRED;
            case READY:
                return target == BROADCAST || target == EXPIRED;
            case BROADCAST:
                return target == CONFIRMED || target == EXPIRED;
            default:
                return false;
        }
    }

    /**
     * Parses a status filter supplied by a client. Matching ignores case.
     *
     * @throws InvalidInputException if the value names no known status
     */
    public static ProposalStatus fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw InvalidInputException.invalidStatus(raw);
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(status -> status.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> InvalidInputException.invalidStatus(raw));
    }
}
