package com.checkmate.pos_sync;

import com.checkmate.pos_sync.line.LineLogService;
import com.checkmate.pos_sync.session.SessionService;
import com.checkmate.pos_sync.session.StationEntity;
import com.checkmate.pos_sync.session.StationFingerprint;
import com.checkmate.pos_sync.session.StationRegistry;
import com.checkmate.pos_sync.session.StationSession;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;

/**
 * Shared setup for tests running the whole application against PostgreSQL.
 *
 * One container serves every test class so the cached application context
 * always points at a live database. Each test starts from empty tables.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractIntegrationTest {

    protected static final LocalDate DAY = LocalDate.of(2026, 3, 2);

    protected static final long STUDENT_ID = 12345L;
    protected static final long STUDENT_LEGACY_ID = 777L;
    protected static final long STUDENT_FAMILY_ID = 5001L;
    protected static final long CASH_PLACEHOLDER_ID = 999999999L;
    protected static final long CASH_FAMILY_FLOOR = 9500000L;

    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("pos_sync_test")
            .withUsername("test")
            .withPassword("test");

    static {
        postgres.start();
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // Disable Kafka, the outbox publisher and the Redis fast path for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("pos.sync.cache.enabled", () -> "false");
    }

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected StationRegistry stationRegistry;

    @Autowired
    protected SessionService sessionService;

    @Autowired
    protected LineLogService lineLogService;

    @BeforeEach
    void cleanDatabase() {
        jdbcTemplate.execute("TRUNCATE deletion_log, sale_records, payment_records, outbox_events, " +
                "station_sessions, line_logs, stations, accounts, account_statuses, billing_groups, menu_items " +
                "RESTART IDENTITY CASCADE");
    }

    // ========================================================================
    // FIXTURES
    // ========================================================================

    /**
     * A student on free meals in family 5001, known to stations by external id
     * 12345 or legacy id 777, plus a lunch item and a snack.
     */
    protected void seedRoster() {
        jdbcTemplate.update("INSERT INTO billing_groups (group_id, name) VALUES (?, ?)", STUDENT_FAMILY_ID, "Rivera");
        Long statusId = jdbcTemplate.queryForObject(
                "INSERT INTO account_statuses (status, approval_method, approval_code) VALUES ('A', 'F', 'FREE') RETURNING id",
                Long.class);
        jdbcTemplate.update(
                "INSERT INTO accounts (external_id, legacy_id, billing_group_id, school, status_id, first_name, last_name) " +
                "VALUES (?, ?, ?, 'HS', ?, 'Ana', 'Rivera')",
                STUDENT_ID, STUDENT_LEGACY_ID, STUDENT_FAMILY_ID, statusId);
        jdbcTemplate.update("INSERT INTO menu_items (item_id, description, item_type, price) VALUES ('01', 'Pizza', 'L', 3.25)");
        jdbcTemplate.update("INSERT INTO menu_items (item_id, description, item_type, price) VALUES ('02', 'Chips', 'C', 1.00)");
    }

    protected void seedCashPlaceholder() {
        jdbcTemplate.update(
                "INSERT INTO accounts (external_id, legacy_id, school, first_name, last_name) " +
                "VALUES (?, ?, 'HS', 'Cash', 'Student')",
                CASH_PLACEHOLDER_ID, CASH_PLACEHOLDER_ID);
    }

    /**
     * Registers a station and logs a user in on it.
     */
    protected Login login(String deviceId, long userId, String username, String... abilities) {
        StationEntity station = stationRegistry.findOrCreateByDevice(
                StationFingerprint.of(deviceId, "Chrome", false), null, "10.0.0.1");
        SessionService.IssuedSession issued = sessionService.issue(station, userId, username, List.of(abilities));
        return new Login(issued.token(), issued.session());
    }

    /**
     * Opens a line for {@link #DAY} and binds the login's session to its log.
     */
    protected long openLine(Login login, String mealType, int lineNum) {
        return lineLogService.openForSession(login.session(), mealType, lineNum, DAY, null).lineLogId();
    }

    protected static String syncKey(long lineLogId, Login login, long localId) {
        return lineLogId + "-" + login.session().getId() + "-" + localId;
    }

    protected JsonNode postJson(String path, Login login, Object body, int expectedStatus) throws Exception {
        MvcResult result = mockMvc.perform(post(path)
                        .header("Authorization", "Bearer " + login.token())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andReturn();
        return readResponse(path, result, expectedStatus);
    }

    protected JsonNode getJson(String path, Login login, int expectedStatus) throws Exception {
        MvcResult result = mockMvc.perform(get(path)
                        .header("Authorization", "Bearer " + login.token()))
                .andReturn();
        return readResponse(path, result, expectedStatus);
    }

    private JsonNode readResponse(String path, MvcResult result, int expectedStatus) throws Exception {
        String content = result.getResponse().getContentAsString();
        if (result.getResponse().getStatus() != expectedStatus) {
            throw new AssertionError("Expected HTTP " + expectedStatus + " from " + path + " but got "
                    + result.getResponse().getStatus() + ": " + content);
        }
        return objectMapper.readTree(content);
    }

    protected long count(String table) {
        Long rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return rows == null ? 0 : rows;
    }

    protected static Map<String, Object> batch(String collection, Object items) {
        return Map.of(collection, items);
    }

    // ========================================================================
    // OUTPUT
    // ========================================================================

    protected void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    protected void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    protected void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    public record Login(String token, StationSession session) {
    }
}
