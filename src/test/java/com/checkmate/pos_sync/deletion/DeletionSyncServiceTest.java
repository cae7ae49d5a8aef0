package com.checkmate.pos_sync.deletion;

import com.checkmate.pos_sync.observability.SyncMetrics;
import com.checkmate.pos_sync.outbox.OutboxService;
import com.checkmate.pos_sync.payment.PaymentRecordRepository;
import com.checkmate.pos_sync.session.Abilities;
import com.checkmate.pos_sync.session.SessionService;
import com.checkmate.pos_sync.session.SessionStatus;
import com.checkmate.pos_sync.session.StationSession;
import com.checkmate.pos_sync.sync.RecordKind;
import com.checkmate.pos_sync.sync.SyncBatchResponse;
import com.checkmate.pos_sync.sync.SyncItemResult;
import com.checkmate.pos_sync.sync.SyncLedgerService;
import com.checkmate.pos_sync.transaction.SaleRecordRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Deletion outcomes when the original is already gone, with the database mocked out.
 */
@ExtendWith(MockitoExtension.class)
class DeletionSyncServiceTest {

    private static final String DELETION_KEY = "10-20-9";
    private static final String ORIGINAL_KEY = "10-20-1";

    @Mock
    private SyncLedgerService ledger;

    @Mock
    private SaleRecordRepository saleRecordRepository;

    @Mock
    private PaymentRecordRepository paymentRecordRepository;

    @Mock
    private DeletionLogRepository deletionLogRepository;

    @Mock
    private SessionService sessionService;

    @Mock
    private OutboxService outboxService;

    private DeletionSyncService service;
    private StationSession session;

    @BeforeEach
    void setUp() {
        service = new DeletionSyncService(
                ledger,
                saleRecordRepository,
                paymentRecordRepository,
                deletionLogRepository,
                sessionService,
                outboxService,
                new SyncMetrics(new SimpleMeterRegistry()));

        session = new StationSession(20L, 3L, 42L, "cashier1", 10L,
                Abilities.of(List.of("line:L1")), SessionStatus.ACTIVE, Instant.now(), Instant.now(), null);
    }

    private static DeletionUpload deletion() {
        return DeletionUpload.builder()
                .syncKey(DELETION_KEY)
                .localId(9L)
                .originalSyncKey(ORIGINAL_KEY)
                .tableName("transactions")
                .build();
    }

    @Test
    @DisplayName("Replay that waited on a concurrent deletion reports the first audit row")
    void concurrentReplayIsDuplicate() {
        when(ledger.findAccepted(RecordKind.DELETION, DELETION_KEY))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(88L));
        when(saleRecordRepository.findBySyncKeyForUpdate(ORIGINAL_KEY)).thenReturn(Optional.empty());

        SyncBatchResponse response = service.submitBatch(session, List.of(deletion()));

        SyncItemResult result = response.getResults().get(0);
        assertTrue(result.isSuccess());
        assertEquals(Boolean.TRUE, result.getDuplicate());
        assertEquals(88L, result.getServerId());
        assertNull(result.getNotFound());
        verify(ledger, never()).record(any(), any(), any());
        verify(saleRecordRepository, never()).deleteById(anyLong());
        verifyNoInteractions(deletionLogRepository, outboxService);
    }

    @Test
    @DisplayName("Original that never existed is not found and leaves no audit row")
    void missingOriginalIsNotFound() {
        when(ledger.findAccepted(RecordKind.DELETION, DELETION_KEY)).thenReturn(Optional.empty());
        when(saleRecordRepository.findBySyncKeyForUpdate(ORIGINAL_KEY)).thenReturn(Optional.empty());

        SyncBatchResponse response = service.submitBatch(session, List.of(deletion()));

        SyncItemResult result = response.getResults().get(0);
        assertTrue(result.isSuccess());
        assertEquals(Boolean.TRUE, result.getNotFound());
        assertNull(result.getServerId());
        verifyNoInteractions(deletionLogRepository, outboxService);
    }
}
