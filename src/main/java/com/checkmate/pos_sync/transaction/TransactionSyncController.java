package com.checkmate.pos_sync.transaction;

import com.checkmate.pos_sync.observability.SyncMetrics;
import com.checkmate.pos_sync.session.SessionInterceptor;
import com.checkmate.pos_sync.session.StationSession;
import com.checkmate.pos_sync.sync.RecordKind;
import com.checkmate.pos_sync.sync.SyncBatchResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Upload endpoint for sales recorded offline.
 *
 * Safe to retry: items whose sync key was already accepted come back as
 * duplicates with their original server id.
 */
@RestController
@RequestMapping("/api/pos/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionSyncController {

    private final TransactionSyncService transactionSyncService;
    private final SyncMetrics syncMetrics;

    @PostMapping
    public ResponseEntity<SyncBatchResponse> upload(
            @Valid @RequestBody TransactionBatchRequest request,
            @RequestAttribute(SessionInterceptor.SESSION_ATTRIBUTE) StationSession session) {

        long startTime = System.currentTimeMillis();

        log.info("Received transaction batch: items={}, user={}",
                request.getTransactions().size(), session.getUsername());

        try {
            SyncBatchResponse response = transactionSyncService.submitBatch(session, request.getTransactions());

            long duration = System.currentTimeMillis() - startTime;
            syncMetrics.recordBatch(RecordKind.TRANSACTION,
                    response.getWarning() != null ? "partial" : "success", duration);
            log.info("Transaction batch stored: items={}, duration={}ms", response.getResults().size(), duration);

            return ResponseEntity.ok(response);

        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            syncMetrics.recordBatch(RecordKind.TRANSACTION, "error", duration);
            log.error("Transaction batch failed: error={}, duration={}ms", e.getMessage(), duration);
            throw e;
        }
    }
}
