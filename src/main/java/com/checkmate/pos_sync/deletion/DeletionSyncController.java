package com.checkmate.pos_sync.deletion;

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
 * Upload endpoint for deletions of previously uploaded sales and payments.
 *
 * Safe to retry: deletions whose own sync key was already applied come back as
 * duplicates with the id of their audit row.
 */
@RestController
@RequestMapping("/api/pos/deletions")
@RequiredArgsConstructor
@Slf4j
public class DeletionSyncController {

    private final DeletionSyncService deletionSyncService;
    private final SyncMetrics syncMetrics;

    @PostMapping
    public ResponseEntity<SyncBatchResponse> upload(
            @Valid @RequestBody DeletionBatchRequest request,
            @RequestAttribute(SessionInterceptor.SESSION_ATTRIBUTE) StationSession session) {

        long startTime = System.currentTimeMillis();

        log.info("Received deletion batch: items={}, user={}",
                request.getDeletions().size(), session.getUsername());

        try {
            SyncBatchResponse response = deletionSyncService.submitBatch(session, request.getDeletions());

            long duration = System.currentTimeMillis() - startTime;
            syncMetrics.recordBatch(RecordKind.DELETION, "success", duration);
            log.info("Deletion batch stored: items={}, duration={}ms", response.getResults().size(), duration);

            return ResponseEntity.ok(response);

        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            syncMetrics.recordBatch(RecordKind.DELETION, "error", duration);
            log.error("Deletion batch failed: error={}, duration={}ms", e.getMessage(), duration);
            throw e;
        }
    }
}
