package com.checkmate.pos_sync.observability;

import com.checkmate.pos_sync.sync.RecordKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for the sync endpoints.
 *
 * Metrics exposed:
 * - sync.items: Counter of processed items, tagged by kind and outcome
 *   (created, duplicate, not_found, failed)
 * - sync.batches: Counter of batches, tagged by kind and status
 * - sync.batch.latency: Timer per kind
 * - sync.ledger.lookup: Ledger lookups by result (cache_hit, db_hit, miss)
 * - sync.cash.not_configured: Cash items failed because the placeholder account is missing
 * - sync.auth.rejected: Requests rejected by session or line checks
 */
@Component
public class SyncMetrics {

    private final MeterRegistry registry;
    private final Counter cashNotConfigured;

    public SyncMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.cashNotConfigured = Counter.builder("sync.cash.not_configured")
                .description("Cash items failed because the cash placeholder account is missing")
                .register(registry);
    }

    public void recordItem(RecordKind kind, String outcome) {
        registry.counter("sync.items",
                "kind", kind.tag(),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordBatch(RecordKind kind, String status, long durationMs) {
        registry.counter("sync.batches",
                "kind", kind.tag(),
                "status", sanitizeTag(status)
        ).increment();
        registry.timer("sync.batch.latency",
                "kind", kind.tag()
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordLedgerLookup(RecordKind kind, String result) {
        registry.counter("sync.ledger.lookup",
                "kind", kind.tag(),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordCashNotConfigured() {
        cashNotConfigured.increment();
    }

    public void recordAuthRejected(String reason) {
        registry.counter("sync.auth.rejected", "reason", sanitizeTag(reason)).increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
