package com.flagship.wallet_ledger.catalog;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Catalog entry as the purchase flow sees it.
 */
@Value
public class Product {
    UUID id;
    String name;
    ProductType type;
    BigDecimal price;
    String providerCode;
    boolean active;
}
