package com.wpanther.multisigcoordinator.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignProposalResponse {
    private long signaturesCollected;
    private boolean readyToBroadcast;
}
