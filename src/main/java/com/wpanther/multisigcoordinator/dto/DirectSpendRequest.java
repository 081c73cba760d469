package com.wpanther.multisigcoordinator.dto;

import jakarta.validation.Valid;
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
public class DirectSpendRequest {

    @NotBlank(message = "Transaction ID is required")
    private String txId;

    @NotBlank(message = "Spending condition ID is required")
    private String spendingConditionId;

    @NotBlank(message = "Signer PKH is required")
    private String signer;

    @NotNull(message = "Total input value is required")
    @PositiveOrZero(message = "Total input value must not be negative")
    private Long totalInputValue;

    @NotNull(message = "Outputs are required")
    private List<@Valid OutputSummary> outputs;
}
