package com.flagship.wallet_ledger.consumer;

import com.flagship.wallet_ledger.observability.WalletMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Runs a wallet-event handler at most once per consumer group.
 *
 * The handler's writes (a referral coin credit, say) and the processed-event
 * row commit together or not at all. A failing handler leaves no row, so the
 * broker's redelivery runs it again. Two deliveries racing past the existence
 * check both try to insert the same (event id, consumer group) key; the loser
 * fails on flush and its transaction, credit included, rolls back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final WalletMetrics walletMetrics;

    /**
     * @return true if the handler ran, false if this group had already handled the event
     */
    @Transactional
    public boolean processEvent(UUID eventId, String eventType, String aggregateType, UUID aggregateId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            walletMetrics.recordEventReplay(consumerGroup, eventType);
            log.info("Replayed {} {} ignored by {}", eventType, eventId, consumerGroup);
            return false;
        }

        try {
            handler.run();
        } catch (RuntimeException e) {
            log.error("Handler for {} {} failed in {}, leaving it for redelivery: {}",
                eventType, eventId, consumerGroup, e.getMessage());
            throw e;
        }

        record(ProcessedEvent.success(eventId, consumerGroup, eventType, aggregateType, aggregateId));
        return true;
    }

    /**
     * Records an event this group looked at and had nothing to do for, such as a
     * registration without a referral code.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType, String aggregateType, UUID aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            walletMetrics.recordEventReplay(consumerGroup, eventType);
            return;
        }
        record(ProcessedEvent.skipped(eventId, consumerGroup, eventType, aggregateType, aggregateId, reason));
    }

    @Transactional(readOnly = true)
    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    private void record(ProcessedEvent event) {
        repository.saveAndFlush(ProcessedEventEntity.fromDomain(event));
        log.debug("{} {} recorded as {} for {}", event.getEventType(), event.getEventId(),
            event.getResult(), event.getConsumerGroup());
    }
}
