package com.wpanther.multisigcoordinator.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Recipient and amount of one output of a spend, kept for display
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutputSummary {

    @NotBlank(message = "Recipient is required")
    private String recipient;

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount must not be negative")
    private Long amount;
}
