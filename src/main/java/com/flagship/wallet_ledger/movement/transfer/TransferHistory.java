package com.flagship.wallet_ledger.movement.transfer;

import lombok.Value;

import java.util.List;

/**
 * A user's transfers, split by direction, newest first.
 */
@Value
public class TransferHistory {
    List<Transfer> sent;
    List<Transfer> received;
}
