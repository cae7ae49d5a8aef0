package com.checkmate.pos_sync.activity;

import com.checkmate.pos_sync.activity.AccountActivity.PaymentView;
import com.checkmate.pos_sync.activity.AccountActivity.SaleView;
import com.checkmate.pos_sync.payment.PaymentRecord;
import com.checkmate.pos_sync.payment.PaymentRecordRepository;
import com.checkmate.pos_sync.roster.AccountDirectory;
import com.checkmate.pos_sync.roster.MenuCatalog;
import com.checkmate.pos_sync.session.SessionService;
import com.checkmate.pos_sync.session.StationSession;
import com.checkmate.pos_sync.sync.SyncKey;
import com.checkmate.pos_sync.transaction.SaleRecord;
import com.checkmate.pos_sync.transaction.SaleRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Cross-station view of one account, so a station can show what the student
 * already bought or paid at other registers today.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountActivityService {

    private final AccountDirectory accountDirectory;
    private final SaleRecordRepository saleRecordRepository;
    private final PaymentRecordRepository paymentRecordRepository;
    private final MenuCatalog menuCatalog;
    private final SessionService sessionService;

    @Transactional(readOnly = true)
    public AccountActivity activityFor(StationSession caller, long studentId, LocalDate lineDate, String mealType) {
        String lineType = mealType.trim().toUpperCase(Locale.ROOT);
        long accountId = accountDirectory.resolveExternalId(studentId).orElse(studentId);

        List<SaleRecord> sales = saleRecordRepository.findInScope(accountId, lineDate, lineType);
        List<PaymentRecord> payments = paymentRecordRepository.findInScope(accountId, lineDate, lineType);

        Set<Long> sessionIds = new HashSet<>();
        sales.forEach(s -> sessionOf(s.getSyncKey()).ifPresent(sessionIds::add));
        payments.forEach(p -> sessionOf(p.getSyncKey()).ifPresent(sessionIds::add));
        Map<Long, Long> stationsBySession = sessionService.stationIdsBySession(sessionIds);

        Map<String, String> itemNames = menuCatalog.findDescriptions(
                sales.stream().map(SaleRecord::getItemId).collect(Collectors.toSet()));

        List<SaleView> saleViews = sales.stream()
            .map(sale -> toView(sale, itemNames, StationAttribution.of(sale.getSyncKey(), caller.getStationId(), stationsBySession)))
            .toList();
        List<PaymentView> paymentViews = payments.stream()
            .map(payment -> toView(payment, StationAttribution.of(payment.getSyncKey(), caller.getStationId(), stationsBySession)))
            .toList();

        log.debug("Activity for account {} on {} {}: sales={}, payments={}",
                accountId, lineDate, lineType, saleViews.size(), paymentViews.size());
        return new AccountActivity(true, saleViews, paymentViews, caller.getId());
    }

    private static SaleView toView(SaleRecord sale, Map<String, String> itemNames, StationAttribution station) {
        String itemName = itemNames.get(sale.getItemId());
        return new SaleView(
            sale.getId(),
            sale.getSyncKey(),
            sale.getAccountId(),
            sale.getItemId(),
            itemName != null ? itemName : "Item " + sale.getItemId(),
            sale.getItemType(),
            sale.getPrice(),
            sale.getTransactionAt(),
            sale.getCreatedAt(),
            sale.getLineNum(),
            station.getStationSessionId(),
            station.getStationName(),
            station.getStationId(),
            station.isOtherStation());
    }

    private static PaymentView toView(PaymentRecord payment, StationAttribution station) {
        return new PaymentView(
            payment.getId(),
            payment.getSyncKey(),
            payment.getAccountId(),
            payment.getMethod().name(),
            payment.getAmount(),
            payment.getMemo(),
            payment.getCreatedAt(),
            station.getStationSessionId(),
            station.getStationName(),
            station.getStationId(),
            station.isOtherStation());
    }

    private static Optional<Long> sessionOf(String syncKey) {
        return SyncKey.tryParse(syncKey).map(SyncKey::getSessionId);
    }
}
