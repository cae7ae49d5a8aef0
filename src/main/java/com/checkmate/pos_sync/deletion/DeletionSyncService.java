package com.checkmate.pos_sync.deletion;

import com.checkmate.pos_sync.observability.SyncMetrics;
import com.checkmate.pos_sync.outbox.OutboxService;
import com.checkmate.pos_sync.payment.PaymentRecordRepository;
import com.checkmate.pos_sync.session.SessionService;
import com.checkmate.pos_sync.session.StationSession;
import com.checkmate.pos_sync.sync.LedgerOutcome;
import com.checkmate.pos_sync.sync.RecordKind;
import com.checkmate.pos_sync.sync.SyncBatchResponse;
import com.checkmate.pos_sync.sync.SyncItemResult;
import com.checkmate.pos_sync.sync.SyncLedgerService;
import com.checkmate.pos_sync.sync.event.RecordDeletedEvent;
import com.checkmate.pos_sync.transaction.SaleRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Applies deletions uploaded by stations.
 *
 * Each deletion copies the original into deletion_log with the deleting user
 * and time, then removes the original, in the batch transaction. Deleting
 * something that is already gone is a success with {@code notFound}, and
 * writes no audit row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeletionSyncService {

    private final SyncLedgerService ledger;
    private final SaleRecordRepository saleRecordRepository;
    private final PaymentRecordRepository paymentRecordRepository;
    private final DeletionLogRepository deletionLogRepository;
    private final SessionService sessionService;
    private final OutboxService outboxService;
    private final SyncMetrics syncMetrics;

    @Transactional
    public SyncBatchResponse submitBatch(StationSession session, List<DeletionUpload> uploads) {
        Set<String> lineCodes = new LinkedHashSet<>();
        for (DeletionUpload upload : uploads) {
            locate(upload).ifPresent(original -> lineCodes.add(original.lineCode()));
        }
        sessionService.requireLines(session, lineCodes);

        List<SyncItemResult> results = new ArrayList<>(uploads.size());
        for (DeletionUpload upload : uploads) {
            results.add(deleteOne(session, upload));
        }

        log.info("Deletion batch processed: items={}, deleted={}, duplicates={}, notFound={}",
                results.size(),
                results.stream().filter(r -> r.getServerId() != null && !r.isDuplicateResult()).count(),
                results.stream().filter(SyncItemResult::isDuplicateResult).count(),
                results.stream().filter(r -> Boolean.TRUE.equals(r.getNotFound())).count());

        return SyncBatchResponse.of(results);
    }

    private SyncItemResult deleteOne(StationSession session, DeletionUpload upload) {
        String syncKey = upload.getSyncKey();

        Optional<Long> accepted = ledger.findAccepted(RecordKind.DELETION, syncKey);
        if (accepted.isPresent()) {
            log.debug("Deletion {} already applied as audit row {}", syncKey, accepted.get());
            syncMetrics.recordItem(RecordKind.DELETION, "duplicate");
            return SyncItemResult.duplicate(upload.getLocalId(), syncKey, accepted.get());
        }

        Optional<DeletedRecord> found = locate(upload);
        if (found.isEmpty()) {
            // A concurrent replay of this deletion may have held the row lock and committed first.
            Optional<Long> appliedMeanwhile = ledger.findAccepted(RecordKind.DELETION, syncKey);
            if (appliedMeanwhile.isPresent()) {
                log.info("Deletion {} was applied concurrently as audit row {}", syncKey, appliedMeanwhile.get());
                syncMetrics.recordItem(RecordKind.DELETION, "duplicate");
                return SyncItemResult.duplicate(upload.getLocalId(), syncKey, appliedMeanwhile.get());
            }
            log.debug("Deletion {}: original {} not found", syncKey, upload.getOriginalSyncKey());
            syncMetrics.recordItem(RecordKind.DELETION, "not_found");
            return SyncItemResult.notFound(upload.getLocalId(), syncKey);
        }

        DeletedRecord original = found.get();
        LedgerOutcome outcome = ledger.record(RecordKind.DELETION, syncKey,
                () -> deletionLogRepository.insertIfAbsent(syncKey, original, session.getUserId(), Instant.now()));

        if (outcome.isDuplicate()) {
            syncMetrics.recordItem(RecordKind.DELETION, "duplicate");
            return SyncItemResult.of(upload.getLocalId(), syncKey, outcome);
        }

        if (original.getKind() == RecordKind.TRANSACTION) {
            saleRecordRepository.deleteById(original.getId());
        } else {
            paymentRecordRepository.deleteById(original.getId());
        }
        ledger.forget(original.getKind(), original.getSyncKey());
        outboxService.saveEvent(RecordDeletedEvent.of(outcome.getServerId(), syncKey, original, session.getUserId()));
        syncMetrics.recordItem(RecordKind.DELETION, "created");

        log.info("Deleted {} {} (id={}) by user {}, audit row {}",
                original.getKind().tag(), original.getSyncKey(), original.getId(),
                session.getUsername(), outcome.getServerId());
        return SyncItemResult.of(upload.getLocalId(), syncKey, outcome);
    }

    /**
     * Finds and row-locks the original a deletion names.
     */
    private Optional<DeletedRecord> locate(DeletionUpload upload) {
        Optional<DeletionTarget> target = DeletionTarget.parse(upload.getTableName());
        String originalKey = upload.getOriginalSyncKey();

        if (target.isEmpty() || target.get() == DeletionTarget.TRANSACTIONS) {
            Optional<DeletedRecord> sale = saleRecordRepository.findBySyncKeyForUpdate(originalKey)
                .map(DeletedRecord::ofSale);
            if (sale.isPresent() || target.isPresent()) {
                return sale;
            }
        }
        return paymentRecordRepository.findBySyncKeyForUpdate(originalKey)
            .map(DeletedRecord::ofPayment);
    }
}
