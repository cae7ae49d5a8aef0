package com.checkmate.pos_sync.transaction;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * sale_records access. Inserts are keyed on sync_key and never overwrite.
 */
@Repository
public class SaleRecordRepository {

    private static final String COLUMNS =
        "id, sync_key, user_id, account_id, family_id, school, item_id, item_type, transaction_code, " +
        "approval_method, approval_code, line_type, line_num, line_date, price, station_account_token, " +
        "line_log_id, station_session_id, transaction_at, created_at";

    private final JdbcTemplate jdbcTemplate;

    public SaleRecordRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @return the new id, or empty if a record with the same sync key already exists
     */
    public Optional<Long> insertIfAbsent(SaleRecord sale) {
        return jdbcTemplate.query(
                "INSERT INTO sale_records (sync_key, user_id, account_id, family_id, school, item_id, item_type, " +
                "transaction_code, approval_method, approval_code, line_type, line_num, line_date, price, " +
                "station_account_token, line_log_id, station_session_id, transaction_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
                "ON CONFLICT (sync_key) DO NOTHING RETURNING id",
                (rs, rowNum) -> rs.getLong("id"),
                sale.getSyncKey(),
                sale.getUserId(),
                sale.getAccountId(),
                sale.getFamilyId(),
                sale.getSchool(),
                sale.getItemId(),
                sale.getItemType(),
                sale.getTransactionCode(),
                sale.getApprovalMethod(),
                sale.getApprovalCode(),
                sale.getLineType(),
                sale.getLineNum(),
                sale.getLineDate(),
                sale.getPrice(),
                sale.getStationAccountToken(),
                sale.getLineLogId(),
                sale.getStationSessionId(),
                Timestamp.from(sale.getTransactionAt()))
            .stream()
            .findFirst();
    }

    /**
     * Reads and row-locks a sale until the end of the current transaction.
     */
    public Optional<SaleRecord> findBySyncKeyForUpdate(String syncKey) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM sale_records WHERE sync_key = ? FOR UPDATE",
                saleRowMapper(),
                syncKey)
            .stream()
            .findFirst();
    }

    public int deleteById(long id) {
        return jdbcTemplate.update("DELETE FROM sale_records WHERE id = ?", id);
    }

    /**
     * Sync keys of an account's sales for one meal on one day, oldest first.
     */
    public List<String> findSyncKeys(long accountId, LocalDate lineDate, String lineType) {
        return jdbcTemplate.queryForList(
                "SELECT sync_key FROM sale_records " +
                "WHERE account_id = ? AND line_date = ? AND line_type = ? ORDER BY id",
                String.class,
                accountId, lineDate, lineType);
    }

    public List<SaleRecord> findInScope(long accountId, LocalDate lineDate, String lineType) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM sale_records " +
                "WHERE account_id = ? AND line_date = ? AND line_type = ? ORDER BY id",
                saleRowMapper(),
                accountId, lineDate, lineType);
    }

    private RowMapper<SaleRecord> saleRowMapper() {
        return (rs, rowNum) -> SaleRecord.builder()
            .id(rs.getLong("id"))
            .syncKey(rs.getString("sync_key"))
            .userId(rs.getObject("user_id", Long.class))
            .accountId(rs.getObject("account_id", Long.class))
            .familyId(rs.getObject("family_id", Long.class))
            .school(rs.getString("school"))
            .itemId(rs.getString("item_id"))
            .itemType(rs.getString("item_type"))
            .transactionCode(rs.getString("transaction_code"))
            .approvalMethod(rs.getString("approval_method"))
            .approvalCode(rs.getString("approval_code"))
            .lineType(rs.getString("line_type"))
            .lineNum(rs.getInt("line_num"))
            .lineDate(rs.getObject("line_date", LocalDate.class))
            .price(rs.getBigDecimal("price"))
            .stationAccountToken(rs.getString("station_account_token"))
            .lineLogId(rs.getObject("line_log_id", Long.class))
            .stationSessionId(rs.getObject("station_session_id", Long.class))
            .transactionAt(instant(rs, "transaction_at"))
            .createdAt(instant(rs, "created_at"))
            .build();
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp == null ? null : timestamp.toInstant();
    }
}
