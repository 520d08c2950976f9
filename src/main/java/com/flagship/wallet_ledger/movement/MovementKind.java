package com.flagship.wallet_ledger.movement;

/**
 * The five kinds of balance-affecting records.
 */
public enum MovementKind {
    PURCHASE("Purchase"),
    DEPOSIT("Deposit"),
    TRANSFER("Transfer"),
    WITHDRAWAL("Withdrawal"),
    COIN_EXCHANGE("CoinExchange");

    private final String aggregateType;

    MovementKind(String aggregateType) {
        this.aggregateType = aggregateType;
    }

    /**
     * Aggregate type used for outbox events and metric tags.
     */
    public String aggregateType() {
        return aggregateType;
    }
}
