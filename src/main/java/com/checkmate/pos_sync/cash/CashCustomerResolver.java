package com.checkmate.pos_sync.cash;

import com.checkmate.pos_sync.roster.AccountDirectory;
import com.checkmate.pos_sync.roster.RosterAccount;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps anonymous cash-code buyers onto the single cash placeholder account and
 * gives each cash sale its own synthetic family id.
 *
 * Synthetic family ids come from a reserved range starting at the configured
 * floor, counted separately per (date, line type). Allocation takes a
 * transaction-scoped advisory lock on that scope before reading the current
 * maximum, and the lock is held until the batch commits, so two stations
 * selling to cash customers on the same line at the same moment are handed
 * consecutive ids rather than the same one.
 */
@Service
@Slf4j
public class CashCustomerResolver {

    private final AccountDirectory accountDirectory;
    private final JdbcTemplate jdbcTemplate;
    private final String cashCodePrefix;
    private final long placeholderLegacyId;
    private final long familyIdFloor;

    public CashCustomerResolver(AccountDirectory accountDirectory,
                                JdbcTemplate jdbcTemplate,
                                @Value("${pos.cash.code-prefix:C}") String cashCodePrefix,
                                @Value("${pos.cash.placeholder-legacy-id:999999999}") long placeholderLegacyId,
                                @Value("${pos.cash.family-id-floor:9500000}") long familyIdFloor) {
        this.accountDirectory = accountDirectory;
        this.jdbcTemplate = jdbcTemplate;
        this.cashCodePrefix = cashCodePrefix.toUpperCase(Locale.ROOT);
        this.placeholderLegacyId = placeholderLegacyId;
        this.familyIdFloor = familyIdFloor;
    }

    public boolean isCashToken(String rawAccountToken) {
        return rawAccountToken != null
            && rawAccountToken.trim().toUpperCase(Locale.ROOT).startsWith(cashCodePrefix);
    }

    /**
     * A fresh, not yet performed lookup of the placeholder account for one batch.
     */
    public CashAccountLookup resolveCashAccount() {
        return CashAccountLookup.deferred(this::findPlaceholder);
    }

    /**
     * Immediate lookup, for health checks.
     */
    public Optional<RosterAccount> findPlaceholder() {
        Optional<RosterAccount> placeholder = accountDirectory.findByLegacyId(placeholderLegacyId);
        if (placeholder.isEmpty()) {
            log.error("Cash placeholder account (legacy id {}) is not configured; cash items will fail",
                    placeholderLegacyId);
        }
        return placeholder;
    }

    /**
     * Allocates the next synthetic family id in the (date, line type) scope:
     * the floor if none has been allocated yet, else the current maximum plus one.
     *
     * Must run inside the batch transaction; the scope stays locked until it ends.
     *
     * @throws CashAccountNotConfiguredException if the placeholder account is missing
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public long nextSyntheticFamilyId(CashAccountLookup lookup, LocalDate lineDate, String lineType) {
        RosterAccount placeholder = lookup.require();

        jdbcTemplate.query(
            "SELECT pg_advisory_xact_lock(hashtext(?))",
            (ResultSetExtractor<Void>) rs -> null,
            "cash-family:" + lineDate + ":" + lineType);

        Long current = jdbcTemplate.queryForObject(
            "SELECT MAX(family_id) FROM sale_records " +
            "WHERE account_id = ? AND line_date = ? AND line_type = ? AND family_id >= ?",
            Long.class,
            placeholder.getExternalId(),
            lineDate,
            lineType,
            familyIdFloor);

        long next = current == null ? familyIdFloor : current + 1;
        log.debug("Allocated synthetic family id {} for {} {}", next, lineDate, lineType);
        return next;
    }

    /**
     * Family id of the latest cash sale to the same cash customer in the same
     * (date, line type) scope, so a cash payment settles against that sale.
     *
     * @return empty if the customer has no sale in scope
     */
    public Optional<Long> findSaleFamilyId(String rawToken, LocalDate lineDate, String lineType) {
        return jdbcTemplate.queryForList(
                "SELECT family_id FROM sale_records " +
                "WHERE station_account_token = ? AND line_date = ? AND line_type = ? AND family_id IS NOT NULL " +
                "ORDER BY id DESC LIMIT 1",
                Long.class,
                rawToken,
                lineDate,
                lineType)
            .stream()
            .findFirst();
    }
}
