package com.e_com.rating.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Forwards review lifecycle events to Kafka once the originating transaction has committed.
 * A rolled-back review mutation never reaches the topic.
 */
@Slf4j
@Component
public class ReviewEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String topic;

    public ReviewEventPublisher(KafkaTemplate<String, Object> kafkaTemplate,
                                @Value("${rating.events.topic:review-events}") String topic) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = topic;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onReviewAdded(ReviewAddedEvent event) {
        send(event.getProductSlug(), event);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onReviewRetracted(ReviewRetractedEvent event) {
        send(event.getProductSlug(), event);
    }

    // The mutation is already committed here, so a broker failure is only logged.
    private void send(String key, Object event) {
        try {
            kafkaTemplate.send(topic, key, event).whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish {} for product {}: {}", event.getClass().getSimpleName(), key, ex.getMessage(), ex);
                } else {
                    log.debug("Published {} for product {}", event.getClass().getSimpleName(), key);
                }
            });
        } catch (RuntimeException ex) {
            log.error("Failed to publish {} for product {}: {}", event.getClass().getSimpleName(), key, ex.getMessage(), ex);
        }
    }
}
