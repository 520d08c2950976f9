package com.flagship.wallet_ledger.catalog;

import com.flagship.wallet_ledger.error.LedgerErrorCode;
import com.flagship.wallet_ledger.error.LedgerException;
import com.flagship.wallet_ledger.ledger.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only view of the {@code products} table. Catalog maintenance lives elsewhere.
 */
@Repository
@Slf4j
public class ProductCatalog {

    private static final RowMapper<Product> PRODUCT_ROW_MAPPER = (rs, rowNum) -> new Product(
        rs.getObject("id", UUID.class),
        rs.getString("name"),
        ProductType.valueOf(rs.getString("type")),
        Money.of(rs.getBigDecimal("price")),
        rs.getString("provider_code"),
        rs.getBoolean("is_active")
    );

    private final JdbcTemplate jdbcTemplate;

    public ProductCatalog(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<Product> findById(UUID productId) {
        List<Product> rows = jdbcTemplate.query(
            "SELECT id, name, type, price, provider_code, is_active FROM products WHERE id = ?",
            PRODUCT_ROW_MAPPER, productId);
        return rows.stream().findFirst();
    }

    /**
     * @throws LedgerException PRODUCT_NOT_FOUND if there is no such product,
     *                         PRODUCT_INACTIVE if it exists but is not on sale
     */
    public Product getActiveProduct(UUID productId) {
        Product product = findById(productId)
            .orElseThrow(() -> LedgerException.of(LedgerErrorCode.PRODUCT_NOT_FOUND, "Product not found: %s", productId));
        if (!product.isActive()) {
            log.debug("Product {} requested but inactive", productId);
            throw LedgerException.of(LedgerErrorCode.PRODUCT_INACTIVE, "Product is not active: %s", productId);
        }
        return product;
    }

    public List<Product> findActiveByType(ProductType type) {
        return jdbcTemplate.query(
            "SELECT id, name, type, price, provider_code, is_active FROM products " +
            "WHERE is_active = TRUE AND type = ? ORDER BY price ASC",
            PRODUCT_ROW_MAPPER, type.name());
    }
}
