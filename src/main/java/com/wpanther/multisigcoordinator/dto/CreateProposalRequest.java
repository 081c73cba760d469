package com.wpanther.multisigcoordinator.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateProposalRequest {

    @NotBlank(message = "Transaction ID is required")
    private String txId;

    @NotBlank(message = "Spending condition ID is required")
    private String spendingConditionId;

    @NotBlank(message = "Proposer PKH is required")
    private String proposer;

    // Optional; when present it must equal the wallet's threshold
    @Min(value = 1, message = "Threshold must be at least 1")
    private Integer threshold;

    @NotBlank(message = "Unsigned payload is required")
    private String unsignedPayload;

    @NotBlank(message = "Signing context is required")
    private String signingContext;

    @NotBlank(message = "Spend conditions are required")
    private String spendConditions;

    @NotNull(message = "Total input value is required")
    @PositiveOrZero(message = "Total input value must not be negative")
    private Long totalInputValue;

    @NotNull(message = "Outputs are required")
    private List<@Valid OutputSummary> outputs;

    @NotBlank(message = "Proposer signed payload is required")
    private String proposerSignedPayload;
}
