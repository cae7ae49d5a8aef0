package com.checkmate.pos_sync.payment;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * payment_records access. Inserts are keyed on sync_key and never overwrite.
 */
@Repository
public class PaymentRecordRepository {

    private static final String COLUMNS =
        "id, sync_key, user_id, account_id, family_id, school, method, amount, memo, check_number, " +
        "line_type, line_num, line_date, station_account_token, line_log_id, station_session_id, created_at";

    private final JdbcTemplate jdbcTemplate;

    public PaymentRecordRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @return the new id, or empty if a record with the same sync key already exists
     */
    public Optional<Long> insertIfAbsent(PaymentRecord payment) {
        return jdbcTemplate.query(
                "INSERT INTO payment_records (sync_key, user_id, account_id, family_id, school, method, amount, " +
                "memo, check_number, line_type, line_num, line_date, station_account_token, line_log_id, " +
                "station_session_id) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
                "ON CONFLICT (sync_key) DO NOTHING RETURNING id",
                (rs, rowNum) -> rs.getLong("id"),
                payment.getSyncKey(),
                payment.getUserId(),
                payment.getAccountId(),
                payment.getFamilyId(),
                payment.getSchool(),
                payment.getMethod().name(),
                payment.getAmount(),
                payment.getMemo(),
                payment.getCheckNumber(),
                payment.getLineType(),
                payment.getLineNum(),
                payment.getLineDate(),
                payment.getStationAccountToken(),
                payment.getLineLogId(),
                payment.getStationSessionId())
            .stream()
            .findFirst();
    }

    /**
     * Reads and row-locks a payment until the end of the current transaction.
     */
    public Optional<PaymentRecord> findBySyncKeyForUpdate(String syncKey) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM payment_records WHERE sync_key = ? FOR UPDATE",
                paymentRowMapper(),
                syncKey)
            .stream()
            .findFirst();
    }

    public int deleteById(long id) {
        return jdbcTemplate.update("DELETE FROM payment_records WHERE id = ?", id);
    }

    public List<String> findSyncKeys(long accountId, LocalDate lineDate, String lineType) {
        return jdbcTemplate.queryForList(
                "SELECT sync_key FROM payment_records " +
                "WHERE account_id = ? AND line_date = ? AND line_type = ? ORDER BY id",
                String.class,
                accountId, lineDate, lineType);
    }

    public List<PaymentRecord> findInScope(long accountId, LocalDate lineDate, String lineType) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM payment_records " +
                "WHERE account_id = ? AND line_date = ? AND line_type = ? ORDER BY id",
                paymentRowMapper(),
                accountId, lineDate, lineType);
    }

    private RowMapper<PaymentRecord> paymentRowMapper() {
        return (rs, rowNum) -> {
            String method = rs.getString("method");
            String memo = rs.getString("memo");
            Timestamp createdAt = rs.getTimestamp("created_at");
            return PaymentRecord.builder()
                .id(rs.getLong("id"))
                .syncKey(rs.getString("sync_key"))
                .userId(rs.getObject("user_id", Long.class))
                .accountId(rs.getObject("account_id", Long.class))
                .familyId(rs.getObject("family_id", Long.class))
                .school(rs.getString("school"))
                .method(method != null && !method.isBlank() ? PaymentMethod.parse(method) : PaymentMemo.methodOf(memo))
                .amount(rs.getBigDecimal("amount"))
                .memo(memo)
                .checkNumber(rs.getString("check_number"))
                .lineType(rs.getString("line_type"))
                .lineNum(rs.getInt("line_num"))
                .lineDate(rs.getObject("line_date", LocalDate.class))
                .stationAccountToken(rs.getString("station_account_token"))
                .lineLogId(rs.getObject("line_log_id", Long.class))
                .stationSessionId(rs.getObject("station_session_id", Long.class))
                .createdAt(createdAt == null ? null : createdAt.toInstant())
                .build();
        };
    }
}
