package com.checkmate.pos_sync.sync;

import com.checkmate.pos_sync.observability.SyncMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Ledger of accepted sync keys, one key space per {@link RecordKind}.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable or stale-empty)
 * 2. Fall back to the record table, whose unique sync_key constraint is the
 *    real guard
 * 3. Inserts go through {@code ON CONFLICT (sync_key) DO NOTHING}, so when two
 *    stations race on one key exactly one insert wins and the other reads the
 *    winner's id as a duplicate
 *
 * Redis mappings are written only after the surrounding transaction commits, so
 * a rolled-back batch never leaves a key pointing at a record that does not exist.
 */
@Service
@Slf4j
public class SyncLedgerService {

    private static final String REDIS_KEY_PREFIX = "pos-sync:";

    private final JdbcTemplate jdbcTemplate;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final SyncMetrics syncMetrics;
    private final boolean cacheEnabled;
    private final Duration cacheTtl;

    public SyncLedgerService(JdbcTemplate jdbcTemplate,
                             Optional<StringRedisTemplate> redisTemplate,
                             SyncMetrics syncMetrics,
                             @Value("${pos.sync.cache.enabled:true}") boolean cacheEnabled,
                             @Value("${pos.sync.cache.ttl:P7D}") Duration cacheTtl) {
        this.jdbcTemplate = jdbcTemplate;
        this.redisTemplate = redisTemplate;
        this.syncMetrics = syncMetrics;
        this.cacheEnabled = cacheEnabled;
        this.cacheTtl = cacheTtl;
    }

    /**
     * Looks up the server id previously assigned to a sync key.
     *
     * @return the existing server id, or empty if the key has never been accepted
     */
    public Optional<Long> findAccepted(RecordKind kind, String syncKey) {
        requireKey(syncKey);

        Optional<Long> cached = readCache(kind, syncKey);
        if (cached.isPresent()) {
            syncMetrics.recordLedgerLookup(kind, "cache_hit");
            return cached;
        }

        Optional<Long> stored = findInTable(kind, syncKey);
        if (stored.isPresent()) {
            syncMetrics.recordLedgerLookup(kind, "db_hit");
            rememberAfterCommit(kind, syncKey, stored.get());
        } else {
            syncMetrics.recordLedgerLookup(kind, "miss");
        }
        return stored;
    }

    /**
     * Runs an insert guarded by the sync key's unique constraint.
     *
     * @param insert performs {@code INSERT ... ON CONFLICT (sync_key) DO NOTHING RETURNING id};
     *               empty means another writer holds the key
     * @return created with the new id, or duplicate with the winner's id
     */
    public LedgerOutcome record(RecordKind kind, String syncKey, Supplier<Optional<Long>> insert) {
        requireKey(syncKey);

        Optional<Long> inserted = insert.get();
        if (inserted.isPresent()) {
            rememberAfterCommit(kind, syncKey, inserted.get());
            return LedgerOutcome.created(inserted.get());
        }

        long existingId = findInTable(kind, syncKey)
            .orElseThrow(() -> new SyncFaultException(
                "Insert for sync key " + syncKey + " conflicted but no " + kind.tag() + " record holds it"));
        log.info("Concurrent upload of {} sync key {} lost the race, reporting duplicate", kind.tag(), syncKey);
        return LedgerOutcome.duplicate(existingId);
    }

    /**
     * Drops the cached mapping for a key whose record was deleted. Applied after commit.
     */
    public void forget(RecordKind kind, String syncKey) {
        if (!cacheActive()) {
            return;
        }
        runAfterCommit(() -> {
            try {
                redisTemplate.get().delete(redisKey(kind, syncKey));
            } catch (Exception e) {
                log.warn("Failed to evict {} sync key {} from Redis: {}", kind.tag(), syncKey, e.getMessage());
            }
        });
    }

    private Optional<Long> findInTable(RecordKind kind, String syncKey) {
        return jdbcTemplate.queryForList(
                "SELECT id FROM " + kind.table() + " WHERE sync_key = ?",
                Long.class,
                syncKey)
            .stream()
            .findFirst();
    }

    private Optional<Long> readCache(RecordKind kind, String syncKey) {
        if (!cacheActive()) {
            return Optional.empty();
        }
        try {
            String value = redisTemplate.get().opsForValue().get(redisKey(kind, syncKey));
            return value == null ? Optional.empty() : Optional.of(Long.parseLong(value));
        } catch (Exception e) {
            log.warn("Redis lookup failed for {} sync key {}, falling back to database: {}",
                    kind.tag(), syncKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void rememberAfterCommit(RecordKind kind, String syncKey, long serverId) {
        if (!cacheActive()) {
            return;
        }
        runAfterCommit(() -> {
            try {
                redisTemplate.get().opsForValue().set(redisKey(kind, syncKey), Long.toString(serverId), cacheTtl);
            } catch (Exception e) {
                log.debug("Failed to cache {} sync key {} in Redis: {}", kind.tag(), syncKey, e.getMessage());
            }
        });
    }

    private void runAfterCommit(Runnable action) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    action.run();
                }
            });
        } else {
            action.run();
        }
    }

    private boolean cacheActive() {
        return cacheEnabled && redisTemplate.isPresent();
    }

    private static String redisKey(RecordKind kind, String syncKey) {
        return REDIS_KEY_PREFIX + kind.tag() + ":" + syncKey;
    }

    private static void requireKey(String syncKey) {
        if (syncKey == null || syncKey.isBlank()) {
            throw new IllegalArgumentException("Sync key cannot be null or blank");
        }
    }
}
