package com.checkmate.pos_sync.deletion;

import com.checkmate.pos_sync.payment.PaymentRecord;
import com.checkmate.pos_sync.session.Abilities;
import com.checkmate.pos_sync.sync.RecordKind;
import com.checkmate.pos_sync.transaction.SaleRecord;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Snapshot of a sale or payment about to be deleted, as copied into deletion_log.
 * Sale-only and payment-only fields are null for the other kind.
 */
@Value
@Builder
public class DeletedRecord {
    RecordKind kind;
    long id;
    String syncKey;
    Long userId;
    Long accountId;
    Long familyId;
    String school;
    String itemId;
    String itemType;
    String transactionCode;
    String approvalMethod;
    String approvalCode;
    String paymentMethod;
    String memo;
    String checkNumber;
    BigDecimal amount;
    String lineType;
    int lineNum;
    LocalDate lineDate;
    String stationAccountToken;
    Instant createdAt;

    public static DeletedRecord ofSale(SaleRecord sale) {
        return DeletedRecord.builder()
            .kind(RecordKind.TRANSACTION)
            .id(sale.getId())
            .syncKey(sale.getSyncKey())
            .userId(sale.getUserId())
            .accountId(sale.getAccountId())
            .familyId(sale.getFamilyId())
            .school(sale.getSchool())
            .itemId(sale.getItemId())
            .itemType(sale.getItemType())
            .transactionCode(sale.getTransactionCode())
            .approvalMethod(sale.getApprovalMethod())
            .approvalCode(sale.getApprovalCode())
            .amount(sale.getPrice())
            .lineType(sale.getLineType())
            .lineNum(sale.getLineNum())
            .lineDate(sale.getLineDate())
            .stationAccountToken(sale.getStationAccountToken())
            .createdAt(sale.getCreatedAt())
            .build();
    }

    public static DeletedRecord ofPayment(PaymentRecord payment) {
        return DeletedRecord.builder()
            .kind(RecordKind.PAYMENT)
            .id(payment.getId())
            .syncKey(payment.getSyncKey())
            .userId(payment.getUserId())
            .accountId(payment.getAccountId())
            .familyId(payment.getFamilyId())
            .school(payment.getSchool())
            .paymentMethod(payment.getMethod().name())
            .memo(payment.getMemo())
            .checkNumber(payment.getCheckNumber())
            .amount(payment.getAmount())
            .lineType(payment.getLineType())
            .lineNum(payment.getLineNum())
            .lineDate(payment.getLineDate())
            .stationAccountToken(payment.getStationAccountToken())
            .createdAt(payment.getCreatedAt())
            .build();
    }

    public String lineCode() {
        return Abilities.lineCode(lineType, lineNum);
    }
}
