package com.flagship.wallet_ledger.outbox;

import com.flagship.wallet_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Ships outbox rows to Kafka, keyed by ledger entry ID so every event of one
 * entry lands on the same partition in order.
 *
 * Delivery is at-least-once. A failed send bumps the row's retry count;
 * rows at {@code outbox.publisher.max-retries} are no longer claimed and
 * show up in the dead-letter gauge instead.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.ledger:ledger-transactions}")
    private String ledgerTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> events;
        try {
            events = outboxService.claimUnpublished(maxRetries, batchSize);
        } catch (Exception e) {
            log.error("Failed to claim outbox events", e);
            return;
        }
        if (events.isEmpty()) {
            return;
        }
        log.debug("Publishing {} outbox events", events.size());
        for (int i = 0; i < events.size(); i++) {
            if (!publishEvent(events.get(i))) {
                log.warn("Publisher interrupted, {} outbox events left for the next run", events.size() - i);
                return;
            }
        }
    }

    /**
     * @return false when the thread was interrupted and the batch must stop
     */
    private boolean publishEvent(OutboxEvent event) {
        try {
            SendResult<String, String> result = kafkaTemplate
                    .send(ledgerTopic, event.getAggregateId().toString(), event.getPayload())
                    .get();

            log.debug("Published event: eventId={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while publishing event: eventId={}, eventType={}", event.getId(), event.getEventType());
            return false;
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} reached max retries ({}), dead-lettered. eventType={}, aggregateId={}",
                        event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
        return true;
    }
}
