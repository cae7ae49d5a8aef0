package com.checkmate.pos_sync.validation;

import com.checkmate.pos_sync.payment.PaymentRecordRepository;
import com.checkmate.pos_sync.roster.AccountDirectory;
import com.checkmate.pos_sync.transaction.SaleRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SyncValidationServiceTest {

    private static final LocalDate DAY = LocalDate.of(2026, 3, 2);

    @Mock
    private AccountDirectory accountDirectory;

    @Mock
    private SaleRecordRepository saleRecordRepository;

    @Mock
    private PaymentRecordRepository paymentRecordRepository;

    @InjectMocks
    private SyncValidationService service;

    @BeforeEach
    void setUp() {
        when(accountDirectory.resolveExternalId(777L)).thenReturn(Optional.of(12345L));
        when(saleRecordRepository.findSyncKeys(12345L, DAY, "L")).thenReturn(List.of("10-20-1", "10-21-1"));
        when(paymentRecordRepository.findSyncKeys(12345L, DAY, "L")).thenReturn(List.of("10-20-2"));
    }

    private static SyncValidationRequest.SyncValidationRequestBuilder request(String mode) {
        return SyncValidationRequest.builder()
                .studentId(777L)
                .lineDate(DAY)
                .mealType("l")
                .mode(mode);
    }

    @Nested
    @DisplayName("Count mode")
    class CountMode {

        @Test
        @DisplayName("Station with nothing recorded is in sync")
        void emptyStation() {
            SyncValidationResponse response = service.validate(request(null).build());

            assertEquals("count", response.getMode());
            assertTrue(response.isInSync());
            assertEquals(2, response.getTransactions().getServerCount());
            assertEquals(1, response.getPayments().getServerCount());
        }

        @Test
        @DisplayName("Matching non-zero counts are not proof of sync")
        void matchingCounts() {
            SyncValidationResponse response = service.validate(request("count")
                    .transactionCount(2).paymentCount(1).build());

            assertFalse(response.isInSync());
            assertEquals(2, response.getTransactions().getClientCount());
        }
    }

    @Nested
    @DisplayName("Full mode")
    class FullMode {

        @Test
        @DisplayName("Server records from other stations do not break sync")
        void extraServerRecords() {
            SyncValidationResponse response = service.validate(request("full")
                    .transactionSyncKeys(List.of("10-20-1"))
                    .paymentSyncKeys(List.of("10-20-2"))
                    .build());

            assertTrue(response.isInSync());
            assertEquals(List.of("10-21-1"), response.getTransactions().getMissingFromClient());
            assertEquals(List.of(), response.getTransactions().getMissingFromServer());
        }

        @Test
        @DisplayName("A local record missing on the server breaks sync")
        void missingOnServer() {
            SyncValidationResponse response = service.validate(request("FULL")
                    .transactionSyncKeys(List.of("10-20-1"))
                    .paymentSyncKeys(List.of("10-20-2", "10-20-3"))
                    .build());

            assertFalse(response.isInSync());
            assertEquals(List.of("10-20-3"), response.getPayments().getMissingFromServer());
        }

        @Test
        @DisplayName("Missing key lists count as empty")
        void missingLists() {
            SyncValidationResponse response = service.validate(request("full").build());

            assertTrue(response.isInSync());
            assertEquals(0, response.getTransactions().getClientCount());
        }
    }
}
