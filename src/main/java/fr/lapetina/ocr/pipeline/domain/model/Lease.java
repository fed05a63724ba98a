package fr.lapetina.ocr.pipeline.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Time-bounded exclusive claim on a work item.
 * An expired lease is not authoritative and is treated as absent.
 *
 * @param attempt 1-based number of times the item has been delivered
 */
public record Lease(
        String workItemId,
        String ownerId,
        Instant acquiredAt,
        Instant expiresAt,
        int attempt
) {
    public Lease {
        Objects.requireNonNull(workItemId, "Work item id is required");
        Objects.requireNonNull(ownerId, "Owner id is required");
        Objects.requireNonNull(acquiredAt, "acquiredAt is required");
        Objects.requireNonNull(expiresAt, "expiresAt is required");
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isHeldBy(String owner, Instant now) {
        return ownerId.equals(owner) && !isExpired(now);
    }

    public Lease renewedUntil(Instant newExpiry) {
        return new Lease(workItemId, ownerId, acquiredAt, newExpiry, attempt);
    }

    /**
     * Returns this lease with its expiry moved to {@code now}, which makes the item available again.
     */
    public Lease releasedAt(Instant now) {
        return new Lease(workItemId, ownerId, acquiredAt, now, attempt);
    }

    public Duration remaining(Instant now) {
        return isExpired(now) ? Duration.ZERO : Duration.between(now, expiresAt);
    }
}
