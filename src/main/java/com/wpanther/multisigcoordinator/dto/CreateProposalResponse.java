package com.wpanther.multisigcoordinator.dto;

import com.wpanther.multisigcoordinator.entity.ProposalStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateProposalResponse {
    private String id;
    private String txId;
    private ProposalStatus status;
}
