package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.movement.transfer.TransferHistory;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TransferHistoryResponse {

    @JsonProperty("sent")
    List<TransferResponse> sent;

    @JsonProperty("received")
    List<TransferResponse> received;

    public static TransferHistoryResponse from(TransferHistory history) {
        return TransferHistoryResponse.builder()
            .sent(history.getSent().stream().map(TransferResponse::from).toList())
            .received(history.getReceived().stream().map(TransferResponse::from).toList())
            .build();
    }
}
