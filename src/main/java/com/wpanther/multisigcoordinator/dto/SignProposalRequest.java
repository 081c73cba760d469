package com.wpanther.multisigcoordinator.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignProposalRequest {

    @NotBlank(message = "Signer PKH is required")
    private String signer;

    @NotBlank(message = "Signed payload is required")
    private String signedPayload;
}
