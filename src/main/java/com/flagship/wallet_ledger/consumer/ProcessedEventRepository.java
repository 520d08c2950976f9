package com.flagship.wallet_ledger.consumer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Processed-event records keyed by (event id, consumer group). Each group keeps
 * its own history, so a new consumer of the wallet-events topic starts clean.
 */
@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, ProcessedEventEntity.Key> {

    boolean existsByEventIdAndConsumerGroup(UUID eventId, String consumerGroup);

    List<ProcessedEventEntity> findByConsumerGroupAndAggregateIdOrderByProcessedAtAsc(String consumerGroup,
                                                                                      UUID aggregateId);

    long countByConsumerGroupAndProcessingResult(String consumerGroup, ProcessedEvent.ProcessingResult result);
}
