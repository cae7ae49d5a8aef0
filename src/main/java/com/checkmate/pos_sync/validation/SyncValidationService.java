package com.checkmate.pos_sync.validation;

import com.checkmate.pos_sync.payment.PaymentRecordRepository;
import com.checkmate.pos_sync.roster.AccountDirectory;
import com.checkmate.pos_sync.transaction.SaleRecordRepository;
import com.checkmate.pos_sync.validation.SyncValidationResponse.KeyComparison;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;

/**
 * Tells a station whether everything it recorded for an account, day and meal
 * has reached the server.
 *
 * "In sync" means no local record is missing on the server. Records the
 * server has and the station does not were usually made at other stations
 * and never affect the verdict.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SyncValidationService {

    private final AccountDirectory accountDirectory;
    private final SaleRecordRepository saleRecordRepository;
    private final PaymentRecordRepository paymentRecordRepository;

    @Transactional(readOnly = true)
    public SyncValidationResponse validate(SyncValidationRequest request) {
        ValidationMode mode = ValidationMode.parse(request.getMode());
        String lineType = request.getMealType().trim().toUpperCase(Locale.ROOT);

        // Records of accounts missing from the roster are stored under the id the station sent.
        long accountId = accountDirectory.resolveExternalId(request.getStudentId())
            .orElse(request.getStudentId());

        List<String> serverSales = saleRecordRepository.findSyncKeys(accountId, request.getLineDate(), lineType);
        List<String> serverPayments = paymentRecordRepository.findSyncKeys(accountId, request.getLineDate(), lineType);

        SyncValidationResponse response = mode == ValidationMode.COUNT
            ? countMode(request, serverSales.size(), serverPayments.size())
            : fullMode(request, serverSales, serverPayments);

        log.info("Sync validation for account {} on {} {}: mode={}, inSync={}",
                accountId, request.getLineDate(), lineType, mode.tag(), response.isInSync());
        return response;
    }

    private SyncValidationResponse countMode(SyncValidationRequest request, int serverSales, int serverPayments) {
        int clientSales = request.getTransactionCount() != null ? request.getTransactionCount() : 0;
        int clientPayments = request.getPaymentCount() != null ? request.getPaymentCount() : 0;

        // Equal counts prove nothing; only an empty station is known to be in sync.
        boolean inSync = clientSales == 0 && clientPayments == 0;

        return new SyncValidationResponse(true, ValidationMode.COUNT.tag(), inSync,
                KeyComparison.counts(clientSales, serverSales),
                KeyComparison.counts(clientPayments, serverPayments));
    }

    private SyncValidationResponse fullMode(SyncValidationRequest request,
                                            List<String> serverSales, List<String> serverPayments) {
        KeyComparison sales = KeyComparison.keys(orEmpty(request.getTransactionSyncKeys()), serverSales);
        KeyComparison payments = KeyComparison.keys(orEmpty(request.getPaymentSyncKeys()), serverPayments);

        boolean inSync = sales.getMissingFromServer().isEmpty() && payments.getMissingFromServer().isEmpty();

        return new SyncValidationResponse(true, ValidationMode.FULL.tag(), inSync, sales, payments);
    }

    private static List<String> orEmpty(List<String> keys) {
        return keys != null ? keys : List.of();
    }
}
