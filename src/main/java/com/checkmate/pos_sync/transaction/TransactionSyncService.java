package com.checkmate.pos_sync.transaction;

import com.checkmate.pos_sync.cash.CashAccountLookup;
import com.checkmate.pos_sync.cash.CashAccountNotConfiguredException;
import com.checkmate.pos_sync.cash.CashCustomerResolver;
import com.checkmate.pos_sync.observability.SyncMetrics;
import com.checkmate.pos_sync.outbox.OutboxService;
import com.checkmate.pos_sync.roster.AccountDirectory;
import com.checkmate.pos_sync.roster.BillingIdentity;
import com.checkmate.pos_sync.roster.ClientHints;
import com.checkmate.pos_sync.roster.MenuCatalog;
import com.checkmate.pos_sync.roster.RosterAccount;
import com.checkmate.pos_sync.session.StationSession;
import com.checkmate.pos_sync.sync.AccountRef;
import com.checkmate.pos_sync.sync.BatchPrecheck;
import com.checkmate.pos_sync.sync.LedgerOutcome;
import com.checkmate.pos_sync.sync.RecordKind;
import com.checkmate.pos_sync.sync.SyncBatchResponse;
import com.checkmate.pos_sync.sync.SyncItemResult;
import com.checkmate.pos_sync.sync.SyncLedgerService;
import com.checkmate.pos_sync.sync.event.SaleRecordedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Records uploaded sales.
 *
 * A batch is one database transaction. Items are processed in order and each
 * gets its own result: created, duplicate (its sync key was already accepted),
 * or failed because the cash placeholder account is missing. Any other error
 * rolls the whole batch back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionSyncService {

    static final String CASH_WARNING_MESSAGE =
        "Some cash transactions were not saved because the Cash Student account is not configured.";

    private final SyncLedgerService ledger;
    private final SaleRecordRepository saleRecordRepository;
    private final AccountDirectory accountDirectory;
    private final MenuCatalog menuCatalog;
    private final CashCustomerResolver cashCustomerResolver;
    private final BatchPrecheck precheck;
    private final OutboxService outboxService;
    private final SyncMetrics syncMetrics;

    @Transactional
    public SyncBatchResponse submitBatch(StationSession session, List<TransactionUpload> uploads) {
        List<AccountRef> accounts = precheck.parseAccounts("transactions", uploads, TransactionUpload::getStudentId);
        precheck.requireLines(session, uploads, TransactionUpload::getMealType, TransactionUpload::getLineNum);

        CashAccountLookup cashAccount = cashCustomerResolver.resolveCashAccount();
        List<SyncItemResult> results = new ArrayList<>(uploads.size());
        for (int i = 0; i < uploads.size(); i++) {
            results.add(syncOne(session, uploads.get(i), accounts.get(i), cashAccount));
        }

        log.info("Transaction batch processed: items={}, created={}, duplicates={}, failed={}",
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

    private SyncItemResult syncOne(StationSession session, TransactionUpload upload,
                                   AccountRef account, CashAccountLookup cashAccount) {
        String syncKey = upload.getSyncKey();

        Optional<Long> accepted = ledger.findAccepted(RecordKind.TRANSACTION, syncKey);
        if (accepted.isPresent()) {
            log.debug("Transaction {} already recorded as {}", syncKey, accepted.get());
            syncMetrics.recordItem(RecordKind.TRANSACTION, "duplicate");
            return SyncItemResult.duplicate(upload.getLocalId(), syncKey, accepted.get());
        }

        String lineType = upload.getMealType().trim().toUpperCase(Locale.ROOT);
        BillingIdentity billing;
        try {
            billing = account.fold(
                real -> billingFor(real, upload),
                cash -> BillingIdentity.forCash(
                    cashAccount.require(),
                    cashCustomerResolver.nextSyntheticFamilyId(cashAccount, upload.getLineDate(), lineType)));
        } catch (CashAccountNotConfiguredException e) {
            syncMetrics.recordCashNotConfigured();
            syncMetrics.recordItem(RecordKind.TRANSACTION, "failed");
            log.warn("Cash transaction {} not saved: {}", syncKey, e.getMessage());
            return SyncItemResult.failed(upload.getLocalId(), syncKey, e.getErrorCode(), e.getMessage());
        }

        ItemClassification classification = ItemClassification.resolve(
                upload.getItemType(),
                menuCatalog.findItemType(upload.getItemId()),
                upload.getTransactionCode(),
                account.isCash());
        if (!classification.approvalApplies()) {
            billing = billing.withoutApproval();
        }

        SaleRecord sale = SaleRecord.builder()
            .syncKey(syncKey)
            .userId(upload.getUserId() != null ? upload.getUserId() : session.getUserId())
            .accountId(billing.getAccountId())
            .familyId(billing.getFamilyId())
            .school(billing.getSchool())
            .itemId(upload.getItemId().trim())
            .itemType(classification.getItemType())
            .transactionCode(classification.getTransactionCode())
            .approvalMethod(billing.getApprovalMethod())
            .approvalCode(billing.getApprovalCode())
            .lineType(lineType)
            .lineNum(upload.getLineNum())
            .lineDate(upload.getLineDate())
            .price(upload.getPrice())
            .stationAccountToken(account.rawToken())
            .lineLogId(upload.getLineLogId())
            .stationSessionId(upload.getStationSessionId())
            .transactionAt(upload.getTimestampUTC() != null ? upload.getTimestampUTC() : Instant.now())
            .build();

        LedgerOutcome outcome = ledger.record(RecordKind.TRANSACTION, syncKey,
                () -> saleRecordRepository.insertIfAbsent(sale));

        if (outcome.isDuplicate()) {
            syncMetrics.recordItem(RecordKind.TRANSACTION, "duplicate");
        } else {
            outboxService.saveEvent(SaleRecordedEvent.of(outcome.getServerId(), sale, account.isCash()));
            syncMetrics.recordItem(RecordKind.TRANSACTION, "created");
            log.debug("Transaction {} recorded as {}: account={}, family={}, item={}/{}",
                    syncKey, outcome.getServerId(), sale.getAccountId(), sale.getFamilyId(),
                    sale.getItemType(), sale.getTransactionCode());
        }
        return SyncItemResult.of(upload.getLocalId(), syncKey, outcome);
    }

    private BillingIdentity billingFor(AccountRef.Real account, TransactionUpload upload) {
        Optional<RosterAccount> rosterAccount = accountDirectory.findByExternalId(account.getId());
        if (rosterAccount.isEmpty()) {
            log.debug("Account {} not in roster, recording with station-supplied identity", account.getId());
        }
        return BillingIdentity.resolve(rosterAccount,
                new ClientHints(account.getId(), upload.getFamilyId(), upload.getSchoolCode()));
    }
}
