package com.checkmate.pos_sync.roster;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Read-only lookups over the roster tables. The roster system owns them; this
 * service never writes there.
 */
@Service
public class AccountDirectory {

    private static final String ACCOUNT_SELECT =
        "SELECT a.id, a.external_id, a.billing_group_id, a.school, s.approval_method, s.approval_code " +
        "FROM accounts a " +
        "LEFT JOIN account_statuses s ON s.id = a.status_id ";

    private final JdbcTemplate jdbcTemplate;

    public AccountDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Finds a billable account by the durable id stations send.
     * Accounts without a billing group are not billable and are not returned.
     */
    public Optional<RosterAccount> findByExternalId(long externalId) {
        return jdbcTemplate.query(
                ACCOUNT_SELECT +
                "JOIN billing_groups g ON g.group_id = a.billing_group_id " +
                "WHERE a.external_id = ?",
                accountRowMapper(),
                externalId)
            .stream()
            .findFirst();
    }

    /**
     * Finds an account by its legacy id. Used for the cash placeholder, which has no billing group.
     */
    public Optional<RosterAccount> findByLegacyId(long legacyId) {
        return jdbcTemplate.query(
                ACCOUNT_SELECT + "WHERE a.legacy_id = ? ORDER BY a.id",
                accountRowMapper(),
                legacyId)
            .stream()
            .findFirst();
    }

    /**
     * External id of the account a station token names, matching either the
     * external or the legacy id. An external id match wins.
     */
    public Optional<Long> resolveExternalId(long token) {
        return jdbcTemplate.queryForList(
                "SELECT external_id FROM accounts WHERE external_id = ? OR legacy_id = ? " +
                "ORDER BY (external_id = ?) DESC, id",
                Long.class,
                token, token, token)
            .stream()
            .findFirst();
    }

    private RowMapper<RosterAccount> accountRowMapper() {
        return (rs, rowNum) -> new RosterAccount(
            rs.getLong("id"),
            rs.getLong("external_id"),
            rs.getObject("billing_group_id", Long.class),
            rs.getString("school"),
            rs.getString("approval_method"),
            rs.getString("approval_code")
        );
    }
}
