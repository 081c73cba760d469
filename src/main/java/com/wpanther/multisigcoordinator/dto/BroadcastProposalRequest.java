package com.wpanther.multisigcoordinator.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BroadcastProposalRequest {

    // Informational only
    private String broadcaster;

    // Transaction id after the client merged the signatures; defaults to the proposal's tx_id
    private String finalTxId;
}
