package com.flagship.wallet_ledger.movement.exchange;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CoinExchangeRepository extends JpaRepository<CoinExchangeEntity, UUID> {

    List<CoinExchangeEntity> findByUserIdOrderByCreatedAtDesc(UUID userId);
}
