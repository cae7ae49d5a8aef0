package com.checkmate.pos_sync.payment;

import com.checkmate.pos_sync.cash.CashAccountLookup;
import com.checkmate.pos_sync.cash.CashAccountNotConfiguredException;
import com.checkmate.pos_sync.cash.CashCustomerResolver;
import com.checkmate.pos_sync.observability.SyncMetrics;
import com.checkmate.pos_sync.outbox.OutboxService;
import com.checkmate.pos_sync.roster.AccountDirectory;
import com.checkmate.pos_sync.roster.BillingIdentity;
import com.checkmate.pos_sync.roster.ClientHints;
import com.checkmate.pos_sync.roster.RosterAccount;
import com.checkmate.pos_sync.session.StationSession;
import com.checkmate.pos_sync.sync.AccountRef;
import com.checkmate.pos_sync.sync.BatchPrecheck;
import com.checkmate.pos_sync.sync.LedgerOutcome;
import com.checkmate.pos_sync.sync.RecordKind;
import com.checkmate.pos_sync.sync.SyncBatchResponse;
import com.checkmate.pos_sync.sync.SyncItemResult;
import com.checkmate.pos_sync.sync.SyncLedgerService;
import com.checkmate.pos_sync.sync.event.PaymentRecordedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Records uploaded cash and check payments.
 *
 * Same batch semantics as sales. A cash customer's payment is billed to the
 * cash placeholder account under the synthetic family id of that customer's
 * latest sale on the same day and meal, so the two settle against each other.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentSyncService {

    static final String CASH_WARNING_MESSAGE =
        "Some cash payments were not saved because the Cash Student account is not configured.";

    private final SyncLedgerService ledger;
    private final PaymentRecordRepository paymentRecordRepository;
    private final AccountDirectory accountDirectory;
    private final CashCustomerResolver cashCustomerResolver;
    private final BatchPrecheck precheck;
    private final OutboxService outboxService;
    private final SyncMetrics syncMetrics;

    @Transactional
    public SyncBatchResponse submitBatch(StationSession session, List<PaymentUpload> uploads) {
        List<AccountRef> accounts = precheck.parseAccounts("payments", uploads, PaymentUpload::getStudentId);
        precheck.requireLines(session, uploads, PaymentUpload::getMealType, PaymentUpload::getLineNum);

        CashAccountLookup cashAccount = cashCustomerResolver.resolveCashAccount();
        List<SyncItemResult> results = new ArrayList<>(uploads.size());
        for (int i = 0; i < uploads.size(); i++) {
            results.add(syncOne(session, uploads.get(i), accounts.get(i), cashAccount));
        }

        log.info("Payment batch processed: items={}, created={}, duplicates={}, failed={}",
                results.size(),
                results.stream().filter(r -> r.isSuccess() && !r.isDuplicateResult()).count(),
                results.stream().filter(SyncItemResult::isDuplicateResult).count(),
                results.stream().filter(r -> !r.isSuccess()).count());

        if (cashAccount.isKnownMissing()) {
            return SyncBatchResponse.withCashWarning(results,
                    CashAccountNotConfiguredException.ERROR_CODE, CASH_WARNING_MESSAGE);
        }
        return SyncBatchResponse.of(results);
    }

    private SyncItemResult syncOne(StationSession session, PaymentUpload upload,
                                   AccountRef account, CashAccountLookup cashAccount) {
        String syncKey = upload.getSyncKey();

        Optional<Long> accepted = ledger.findAccepted(RecordKind.PAYMENT, syncKey);
        if (accepted.isPresent()) {
            log.debug("Payment {} already recorded as {}", syncKey, accepted.get());
            syncMetrics.recordItem(RecordKind.PAYMENT, "duplicate");
            return SyncItemResult.duplicate(upload.getLocalId(), syncKey, accepted.get());
        }

        String lineType = upload.getMealType().trim().toUpperCase(Locale.ROOT);
        BillingIdentity billing;
        try {
            billing = account.fold(
                real -> BillingIdentity.resolve(
                    accountDirectory.findByExternalId(real.getId()),
                    new ClientHints(real.getId(), upload.getFamilyId(), upload.getSchoolCode())),
                cash -> cashBilling(cash, cashAccount, upload.getLineDate(), lineType));
        } catch (CashAccountNotConfiguredException e) {
            syncMetrics.recordCashNotConfigured();
            syncMetrics.recordItem(RecordKind.PAYMENT, "failed");
            log.warn("Cash payment {} not saved: {}", syncKey, e.getMessage());
            return SyncItemResult.failed(upload.getLocalId(), syncKey, e.getErrorCode(), e.getMessage());
        }

        PaymentMethod method = PaymentMethod.parse(upload.getPaymentType());
        PaymentRecord payment = PaymentRecord.builder()
            .syncKey(syncKey)
            .userId(upload.getUserId() != null ? upload.getUserId() : session.getUserId())
            .accountId(billing.getAccountId())
            .familyId(billing.getFamilyId())
            .school(billing.getSchool())
            .method(method)
            .amount(upload.getAmount())
            .memo(PaymentMemo.of(method, upload.getMemo(), upload.getCheckNumber(), lineType, upload.getLineNum()))
            .checkNumber(method == PaymentMethod.CHECK ? blankToNull(upload.getCheckNumber()) : null)
            .lineType(lineType)
            .lineNum(upload.getLineNum())
            .lineDate(upload.getLineDate())
            .stationAccountToken(account.rawToken())
            .lineLogId(upload.getLineLogId())
            .stationSessionId(upload.getStationSessionId())
            .build();

        LedgerOutcome outcome = ledger.record(RecordKind.PAYMENT, syncKey,
                () -> paymentRecordRepository.insertIfAbsent(payment));

        if (outcome.isDuplicate()) {
            syncMetrics.recordItem(RecordKind.PAYMENT, "duplicate");
        } else {
            outboxService.saveEvent(PaymentRecordedEvent.of(outcome.getServerId(), payment));
            syncMetrics.recordItem(RecordKind.PAYMENT, "created");
            log.debug("Payment {} recorded as {}: account={}, family={}, memo={}",
                    syncKey, outcome.getServerId(), payment.getAccountId(), payment.getFamilyId(), payment.getMemo());
        }
        return SyncItemResult.of(upload.getLocalId(), syncKey, outcome);
    }

    private BillingIdentity cashBilling(AccountRef.Cash cash, CashAccountLookup cashAccount,
                                        LocalDate lineDate, String lineType) {
        RosterAccount placeholder = cashAccount.require();
        Long familyId = cashCustomerResolver.findSaleFamilyId(cash.getToken(), lineDate, lineType).orElse(null);
        if (familyId == null) {
            log.debug("No sale found for cash customer {} on {} {}, payment has no family", cash.getToken(), lineDate, lineType);
        }
        return BillingIdentity.forCash(placeholder, familyId);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
