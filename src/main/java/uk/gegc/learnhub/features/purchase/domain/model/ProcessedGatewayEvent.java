package uk.gegc.learnhub.features.purchase.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Webhook delivery that has already been applied, keyed by the gateway's event id.
 * New instances are always inserted, so a second delivery of the same id fails on the
 * primary key instead of merging over the first.
 */
@Entity
@Table(name = "processed_gateway_events")
@Getter
@Setter
@NoArgsConstructor
public class ProcessedGatewayEvent implements Persistable<String> {

    @Id
    @Column(name = "event_id", length = 255, nullable = false, updatable = false)
    private String eventId;

    @Column(name = "event_type", length = 64)
    private String eventType;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false, nullable = false)
    private Instant createdAt;

    @Transient
    private boolean newEntity = true;

    public ProcessedGatewayEvent(String eventId, String eventType) {
        this.eventId = eventId;
        this.eventType = eventType;
    }

    @Override
    public String getId() {
        return eventId;
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    @PostPersist
    @PostLoad
    void markNotNew() {
        this.newEntity = false;
    }
}
