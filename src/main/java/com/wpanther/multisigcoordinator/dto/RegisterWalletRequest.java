package com.wpanther.multisigcoordinator.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterWalletRequest {

    @NotBlank(message = "Spending condition ID is required")
    private String spendingConditionId;

    @NotNull(message = "Threshold is required")
    @Min(value = 1, message = "Threshold must be at least 1")
    private Integer threshold;

    // Not compared with threshold or with the participant list
    @NotNull(message = "Total signers is required")
    @Min(value = 1, message = "Total signers must be at least 1")
    private Integer totalSigners;

    @NotEmpty(message = "At least one participant is required")
    private List<@NotBlank(message = "Participant PKH must not be blank") String> participants;

    @NotBlank(message = "Creator PKH is required")
    private String createdBy;
}
