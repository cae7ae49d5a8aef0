package com.checkmate.pos_sync.line;

import com.checkmate.pos_sync.AbstractIntegrationTest;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Line lifecycle over HTTP:
 * - Stations opening the same line share one log for the day
 * - A line closes only once every bound session has drained
 * - A closed line cannot be reopened
 */
class LineLogControllerTest extends AbstractIntegrationTest {

    private static final String LINE = "/api/pos/lines/L/1";

    private Login cashier;
    private Login manager;

    @BeforeEach
    void setUp() {
        cashier = login("station-a", 42L, "cashier1", "line:L1");
        manager = login("station-m", 7L, "manager", "line:*");
    }

    private JsonNode open(Login login) throws Exception {
        return postJson(LINE + "/open", login,
                Map.of("lineDate", DAY.toString(), "till", Map.of("twenties", 3, "ones", 12)), 200);
    }

    private JsonNode syncInfo(Login login) throws Exception {
        return getJson(LINE + "/sync-info?lineDate=" + DAY, login, 200);
    }

    private JsonNode move(Login login, long sessionId, String status) throws Exception {
        return postJson(LINE + "/sessions/" + sessionId + "/status", login,
                Map.of("status", status, "lineDate", DAY.toString()), 200);
    }

    @Nested
    @DisplayName("Opening")
    class Opening {

        @Test
        @DisplayName("Open binds the session and stores the starting till")
        void openBindsSession() throws Exception {
            printTestHeader("Open a line");

            JsonNode opened = open(cashier);
            printOutput("Opened", opened);

            assertEquals("L1", opened.get("lineCode").asText());
            assertEquals("OPEN", opened.get("status").asText());
            assertEquals(DAY.toString(), opened.get("lineDate").asText());
            assertEquals(cashier.session().getId(), opened.get("sessionId").asLong());

            long lineLogId = opened.get("lineLogId").asLong();
            Long boundTo = jdbcTemplate.queryForObject(
                    "SELECT line_log_id FROM station_sessions WHERE id = ?", Long.class, cashier.session().getId());
            assertEquals(lineLogId, boundTo);

            String till = jdbcTemplate.queryForObject(
                    "SELECT start_till::text FROM line_logs WHERE id = ?", String.class, lineLogId);
            assertTrue(till.contains("twenties"));

            printSuccess("Session bound to line log " + lineLogId);
        }

        @Test
        @DisplayName("Second station on the same line joins the existing log")
        void stationsShareLog() throws Exception {
            Login second = login("station-b", 43L, "cashier2", "line:L1");

            long first = open(cashier).get("lineLogId").asLong();
            long other = open(second).get("lineLogId").asLong();

            assertEquals(first, other);
            assertEquals(1, count("line_logs"));
        }

        @Test
        @DisplayName("Line outside the session's abilities is forbidden")
        void otherLineForbidden() throws Exception {
            JsonNode error = postJson("/api/pos/lines/L/2/open", cashier, Map.of("lineDate", DAY.toString()), 403);

            assertEquals("FORBIDDEN", error.get("error").asText());
            assertEquals(0, count("line_logs"));
        }
    }

    @Nested
    @DisplayName("Drain and close")
    class DrainAndClose {

        @Test
        @DisplayName("Never-opened line reports NOT_OPENED and is not ready")
        void notOpened() throws Exception {
            JsonNode info = syncInfo(manager);

            assertEquals("NOT_OPENED", info.get("status").asText());
            assertTrue(info.get("lineLogId").isNull());
            assertFalse(info.get("readyToClose").asBoolean());
        }

        @Test
        @DisplayName("Active session blocks close with 409")
        void activeSessionBlocksClose() throws Exception {
            open(cashier);

            JsonNode info = syncInfo(manager);
            assertEquals(1, info.get("activeSessions").asLong());
            assertFalse(info.get("readyToClose").asBoolean());

            JsonNode error = postJson(LINE + "/close", manager, Map.of("lineDate", DAY.toString()), 409);
            assertEquals("INVALID_STATE", error.get("error").asText());
        }

        @Test
        @DisplayName("Line closes once its sessions are synced or abandoned")
        void closesAfterDrain() throws Exception {
            printTestHeader("Drain two stations, then close");

            Login second = login("station-b", 43L, "cashier2", "line:L1");
            open(cashier);
            open(second);

            move(manager, cashier.session().getId(), "syncing");
            JsonNode draining = syncInfo(manager);
            assertEquals(1, draining.get("syncingSessions").asLong());
            assertFalse(draining.get("readyToClose").asBoolean());

            JsonNode synced = move(manager, cashier.session().getId(), "synced");
            assertEquals("SYNCED", synced.get("status").asText());
            move(manager, second.session().getId(), "abandoned");

            JsonNode ready = syncInfo(manager);
            printOutput("Ready", ready);
            assertTrue(ready.get("readyToClose").asBoolean());
            assertEquals(1, ready.get("syncedSessions").asLong());
            assertEquals(1, ready.get("abandonedSessions").asLong());
            assertEquals(2, ready.get("totalSessions").asLong());

            JsonNode closed = postJson(LINE + "/close", manager,
                    Map.of("lineDate", DAY.toString(), "till", Map.of("twenties", 5)), 200);
            assertEquals("CLOSED", closed.get("status").asText());
            assertFalse(closed.get("readyToClose").asBoolean());

            Long closedBy = jdbcTemplate.queryForObject(
                    "SELECT closed_by FROM line_logs WHERE id = ?", Long.class, closed.get("lineLogId").asLong());
            assertEquals(7L, closedBy);

            printSuccess("Line closed after drain");
        }

        @Test
        @DisplayName("Closed line cannot be reopened")
        void closedLineStaysClosed() throws Exception {
            open(cashier);
            move(manager, cashier.session().getId(), "synced");
            postJson(LINE + "/close", manager, Map.of("lineDate", DAY.toString()), 200);

            JsonNode error = postJson(LINE + "/open", manager, Map.of("lineDate", DAY.toString()), 409);
            assertEquals("INVALID_STATE", error.get("error").asText());
        }

        @Test
        @DisplayName("Synced session cannot go back to syncing")
        void terminalSessionStaysTerminal() throws Exception {
            open(cashier);
            move(manager, cashier.session().getId(), "synced");

            JsonNode error = postJson(LINE + "/sessions/" + cashier.session().getId() + "/status", manager,
                    Map.of("status", "syncing", "lineDate", DAY.toString()), 409);
            assertEquals("INVALID_STATE", error.get("error").asText());
        }

        @Test
        @DisplayName("Session bound elsewhere is rejected with 400")
        void sessionNotOnLine() throws Exception {
            open(cashier);

            JsonNode error = postJson(LINE + "/sessions/" + manager.session().getId() + "/status", manager,
                    Map.of("status", "synced", "lineDate", DAY.toString()), 400);
            assertEquals("INVALID_REQUEST", error.get("error").asText());
        }

        @Test
        @DisplayName("Synced session can no longer upload")
        void syncedSessionLosesToken() throws Exception {
            open(cashier);
            move(manager, cashier.session().getId(), "synced");

            getJson("/api/pos/session", cashier, 401);
        }
    }
}
