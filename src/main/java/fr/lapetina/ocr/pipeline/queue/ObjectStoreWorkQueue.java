package fr.lapetina.ocr.pipeline.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.ocr.pipeline.domain.model.Lease;
import fr.lapetina.ocr.pipeline.domain.model.WorkItem;
import fr.lapetina.ocr.pipeline.infrastructure.storage.ObjectStore;
import fr.lapetina.ocr.pipeline.infrastructure.storage.ObjectStoreException;
import fr.lapetina.ocr.pipeline.infrastructure.storage.StoredObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Work queue persisted in an {@link ObjectStore}.
 *
 * <p>Layout under the queue prefix:
 * <pre>
 *   items/{id}.json    immutable work item definition
 *   leases/{id}.json   current (possibly expired) lease record
 *   done/{id}          completion marker
 *   failed/{id}.json   dead-letter marker with the last failure reason
 * </pre>
 *
 * <p>Claiming is one conditional write on the lease key: {@code putIfAbsent}
 * for an item never leased before, {@code compareAndSet} against the version
 * of an expired lease otherwise. Whoever wins that write owns the item; no other
 * coordination exists.
 */
public final class ObjectStoreWorkQueue implements WorkQueue {

    private static final Logger log = LoggerFactory.getLogger(ObjectStoreWorkQueue.class);

    private static final String ITEMS = "items/";
    private static final String LEASES = "leases/";
    private static final String DONE = "done/";
    private static final String FAILED = "failed/";
    private static final String JSON = ".json";

    private final ObjectStore store;
    private final String prefix;
    private final Clock clock;
    private final Random random;
    private final ObjectMapper objectMapper;

    public ObjectStoreWorkQueue(ObjectStore store, String prefix, Clock clock, Random random) {
        this.store = store;
        this.prefix = prefix.endsWith("/") || prefix.isEmpty() ? prefix : prefix + "/";
        this.clock = clock;
        this.random = random;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public ObjectStoreWorkQueue(ObjectStore store) {
        this(store, "queue", Clock.systemUTC(), new Random());
    }

    @Override
    public int populate(List<List<String>> batches) {
        int created = 0;
        for (List<String> batch : batches) {
            if (batch.isEmpty()) {
                continue;
            }
            WorkItem item = WorkItem.of(batch);
            if (store.putIfAbsent(itemKey(item.id()), write(item))) {
                created++;
                log.debug("Work item created: workItemId={}, documents={}", item.id(), item.size());
            }
        }
        log.info("Queue populated: batches={}, created={}, alreadyPresent={}",
                batches.size(), created, batches.size() - created);
        return created;
    }

    @Override
    public Optional<LeasedWork> lease(String ownerId, Duration visibilityTimeout) {
        requirePositive(visibilityTimeout);

        Set<String> closed = new HashSet<>(ids(DONE, ""));
        closed.addAll(ids(FAILED, JSON));
        List<String> candidates = new ArrayList<>(ids(ITEMS, JSON));
        candidates.removeAll(closed);
        Collections.shuffle(candidates, random);

        for (String id : candidates) {
            Optional<Lease> claimed = tryClaim(id, ownerId, visibilityTimeout);
            if (claimed.isEmpty()) {
                continue;
            }
            if (store.exists(doneKey(id))) {
                // Completed by another worker between listing and claiming
                continue;
            }
            Optional<WorkItem> item = readItem(id);
            if (item.isEmpty()) {
                log.warn("Leased item has no definition, releasing: workItemId={}", id);
                release(id, ownerId);
                continue;
            }
            Lease lease = claimed.get();
            log.info("Work item leased: workItemId={}, ownerId={}, attempt={}, expiresAt={}",
                    id, ownerId, lease.attempt(), lease.expiresAt());
            return Optional.of(new LeasedWork(item.get(), lease));
        }
        return Optional.empty();
    }

    private Optional<Lease> tryClaim(String id, String ownerId, Duration visibilityTimeout) {
        Instant now = clock.instant();
        String key = leaseKey(id);
        Optional<StoredObject> current = store.get(key);

        if (current.isEmpty()) {
            Lease fresh = new Lease(id, ownerId, now, now.plus(visibilityTimeout), 1);
            return store.putIfAbsent(key, write(fresh)) ? Optional.of(fresh) : Optional.empty();
        }

        Lease existing = read(current.get(), Lease.class);
        if (!existing.isExpired(now)) {
            return Optional.empty();
        }
        Lease next = new Lease(id, ownerId, now, now.plus(visibilityTimeout), existing.attempt() + 1);
        if (store.compareAndSet(key, current.get().version(), write(next))) {
            if (!existing.ownerId().equals(ownerId)) {
                log.info("Reclaimed expired lease: workItemId={}, previousOwner={}, expiredAt={}",
                        id, existing.ownerId(), existing.expiresAt());
            }
            return Optional.of(next);
        }
        return Optional.empty();
    }

    @Override
    public void renew(String workItemId, String ownerId, Duration visibilityTimeout) {
        requirePositive(visibilityTimeout);
        Instant now = clock.instant();
        String key = leaseKey(workItemId);

        StoredObject current = store.get(key)
                .orElseThrow(() -> new LeaseLostException(workItemId, ownerId, "no lease record"));
        Lease lease = read(current, Lease.class);
        if (!lease.isHeldBy(ownerId, now)) {
            throw new LeaseLostException(workItemId, ownerId,
                    "held by " + lease.ownerId() + ", expiresAt=" + lease.expiresAt());
        }

        Lease renewed = lease.renewedUntil(now.plus(visibilityTimeout));
        if (!store.compareAndSet(key, current.version(), write(renewed))) {
            throw new LeaseLostException(workItemId, ownerId, "lease modified concurrently");
        }
        log.debug("Lease renewed: workItemId={}, ownerId={}, expiresAt={}",
                workItemId, ownerId, renewed.expiresAt());
    }

    @Override
    public void complete(String workItemId, String ownerId) {
        String doneKey = doneKey(workItemId);
        if (store.exists(doneKey)) {
            log.debug("Work item already completed: workItemId={}, ownerId={}", workItemId, ownerId);
            return;
        }

        Optional<Lease> lease = currentLease(workItemId);
        if (lease.isEmpty() || !lease.get().isHeldBy(ownerId, clock.instant())) {
            log.warn("Completing work item without a valid lease: workItemId={}, ownerId={}, lease={}",
                    workItemId, ownerId, lease.orElse(null));
        }

        Map<String, Object> marker = new LinkedHashMap<>();
        marker.put("ownerId", ownerId);
        marker.put("completedAt", clock.instant().toString());
        store.put(doneKey, write(marker));
        log.info("Work item completed: workItemId={}, ownerId={}", workItemId, ownerId);
    }

    @Override
    public void release(String workItemId, String ownerId) {
        String key = leaseKey(workItemId);
        Optional<StoredObject> current = store.get(key);
        if (current.isEmpty()) {
            return;
        }
        Instant now = clock.instant();
        Lease lease = read(current.get(), Lease.class);
        if (!lease.isHeldBy(ownerId, now)) {
            log.warn("Release ignored, lease not held: workItemId={}, ownerId={}, holder={}",
                    workItemId, ownerId, lease.ownerId());
            return;
        }
        if (store.compareAndSet(key, current.get().version(), write(lease.releasedAt(now)))) {
            log.info("Work item released: workItemId={}, ownerId={}, attempt={}",
                    workItemId, ownerId, lease.attempt());
        } else {
            log.warn("Release lost a race, lease modified concurrently: workItemId={}, ownerId={}",
                    workItemId, ownerId);
        }
    }

    @Override
    public void fail(String workItemId, String ownerId, String reason) {
        Map<String, Object> marker = new LinkedHashMap<>();
        marker.put("ownerId", ownerId);
        marker.put("reason", reason);
        marker.put("failedAt", clock.instant().toString());
        currentLease(workItemId).ifPresent(l -> marker.put("attempts", l.attempt()));
        store.put(failedKey(workItemId), write(marker));
        release(workItemId, ownerId);
        log.error("Work item failed permanently: workItemId={}, ownerId={}, reason={}",
                workItemId, ownerId, reason);
    }

    @Override
    public QueueStats stats() {
        Set<String> items = new HashSet<>(ids(ITEMS, JSON));
        Set<String> done = new HashSet<>(ids(DONE, ""));
        Set<String> failed = new HashSet<>(ids(FAILED, JSON));
        done.retainAll(items);
        failed.retainAll(items);
        failed.removeAll(done);

        Instant now = clock.instant();
        int leased = 0;
        for (String id : ids(LEASES, JSON)) {
            if (!items.contains(id) || done.contains(id) || failed.contains(id)) {
                continue;
            }
            Optional<Lease> lease = currentLease(id);
            if (lease.isPresent() && !lease.get().isExpired(now)) {
                leased++;
            }
        }
        return new QueueStats(items.size(), done.size(), failed.size(), leased);
    }

    /**
     * Returns the current lease record of an item, expired or not.
     */
    public Optional<Lease> currentLease(String workItemId) {
        return store.get(leaseKey(workItemId)).map(o -> read(o, Lease.class));
    }

    private Optional<WorkItem> readItem(String id) {
        return store.get(itemKey(id)).map(o -> read(o, WorkItem.class));
    }

    private List<String> ids(String folder, String suffix) {
        String folderPrefix = prefix + folder;
        List<String> ids = new ArrayList<>();
        for (String key : store.list(folderPrefix)) {
            String name = key.substring(folderPrefix.length());
            if (name.contains("/") || !name.endsWith(suffix)) {
                continue;
            }
            ids.add(name.substring(0, name.length() - suffix.length()));
        }
        return ids;
    }

    private String itemKey(String id) {
        return prefix + ITEMS + id + JSON;
    }

    private String leaseKey(String id) {
        return prefix + LEASES + id + JSON;
    }

    private String doneKey(String id) {
        return prefix + DONE + id;
    }

    private String failedKey(String id) {
        return prefix + FAILED + id + JSON;
    }

    private byte[] write(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new ObjectStoreException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(StoredObject object, Class<T> type) {
        try {
            return objectMapper.readValue(object.data(), type);
        } catch (IOException e) {
            throw new ObjectStoreException("Corrupt queue record: " + object.key(), e);
        }
    }

    private static void requirePositive(Duration visibilityTimeout) {
        if (visibilityTimeout.isZero() || visibilityTimeout.isNegative()) {
            throw new IllegalArgumentException("Visibility timeout must be positive");
        }
    }
}
