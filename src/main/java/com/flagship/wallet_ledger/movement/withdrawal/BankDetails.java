package com.flagship.wallet_ledger.movement.withdrawal;

import lombok.Value;

/**
 * Destination bank account of a withdrawal.
 */
@Value
public class BankDetails {
    String bankName;
    String accountNumber;
    String accountName;
}
