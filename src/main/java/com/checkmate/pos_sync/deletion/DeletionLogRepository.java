package com.checkmate.pos_sync.deletion;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/**
 * deletion_log access. Rows are written once and never changed.
 */
@Repository
public class DeletionLogRepository {

    private final JdbcTemplate jdbcTemplate;

    public DeletionLogRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @return the audit row id, or empty if a deletion with the same sync key already exists
     */
    public Optional<Long> insertIfAbsent(String syncKey, DeletedRecord original, long deletingUserId, Instant deletedAt) {
        return jdbcTemplate.query(
                "INSERT INTO deletion_log (sync_key, record_kind, original_id, original_sync_key, user_id, " +
                "account_id, family_id, school, item_id, item_type, transaction_code, approval_method, " +
                "approval_code, payment_method, memo, check_number, amount, line_type, line_num, line_date, " +
                "station_account_token, original_created_at, deleting_user_id, deleted_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
                "ON CONFLICT (sync_key) DO NOTHING RETURNING id",
                (rs, rowNum) -> rs.getLong("id"),
                syncKey,
                original.getKind().tag(),
                original.getId(),
                original.getSyncKey(),
                original.getUserId(),
                original.getAccountId(),
                original.getFamilyId(),
                original.getSchool(),
                original.getItemId(),
                original.getItemType(),
                original.getTransactionCode(),
                original.getApprovalMethod(),
                original.getApprovalCode(),
                original.getPaymentMethod(),
                original.getMemo(),
                original.getCheckNumber(),
                original.getAmount(),
                original.getLineType(),
                original.getLineNum(),
                original.getLineDate(),
                original.getStationAccountToken(),
                original.getCreatedAt() == null ? null : Timestamp.from(original.getCreatedAt()),
                deletingUserId,
                Timestamp.from(deletedAt))
            .stream()
            .findFirst();
    }
}
