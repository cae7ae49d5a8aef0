package com.checkmate.pos_sync.activity;

import com.checkmate.pos_sync.AbstractIntegrationTest;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cross-station account view: records from every station, labelled from the
 * point of view of the station asking.
 */
class AccountActivityControllerTest extends AbstractIntegrationTest {

    private Login stationA;
    private Login stationB;
    private long lineLogId;

    @BeforeEach
    void setUp() throws Exception {
        seedRoster();
        stationA = login("station-a", 42L, "cashier1", "line:L1");
        stationB = login("station-b", 43L, "cashier2", "line:L1");
        lineLogId = openLine(stationA, "L", 1);
        openLine(stationB, "L", 1);

        uploadSale(stationA, 1, "01");
        uploadSale(stationB, 1, "99");
        uploadPayment(stationB, 2);
    }

    private void uploadSale(Login login, long localId, String itemId) throws Exception {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("syncKey", syncKey(lineLogId, login, localId));
        item.put("localId", localId);
        item.put("studentId", "12345");
        item.put("itemId", itemId);
        item.put("price", 2.50);
        item.put("lineDate", DAY.toString());
        item.put("lineLogId", lineLogId);
        item.put("stationSessionId", login.session().getId());
        item.put("mealType", "L");
        item.put("lineNum", 1);
        postJson("/api/pos/transactions", login, batch("transactions", List.of(item)), 200);
    }

    private void uploadPayment(Login login, long localId) throws Exception {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("syncKey", syncKey(lineLogId, login, localId));
        item.put("localId", localId);
        item.put("studentId", "12345");
        item.put("paymentType", "check");
        item.put("amount", 10.00);
        item.put("memo", "March lunches");
        item.put("lineDate", DAY.toString());
        item.put("mealType", "L");
        item.put("lineNum", 1);
        postJson("/api/pos/payments", login, batch("payments", List.of(item)), 200);
    }

    private JsonNode records(Login login, long studentId, String mealType) throws Exception {
        return getJson("/api/pos/accounts/" + studentId + "/records?lineDate=" + DAY + "&mealType=" + mealType,
                login, 200);
    }

    @Test
    @DisplayName("Records are labelled by the station that made them")
    void labelsStations() throws Exception {
        printTestHeader("Account view from station A");

        JsonNode response = records(stationA, STUDENT_ID, "L");
        printOutput("Records", response);

        assertTrue(response.get("success").asBoolean());
        assertEquals(stationA.session().getId(), response.get("currentStationSessionId").asLong());

        JsonNode own = response.at("/transactions/0");
        assertEquals("This Station", own.get("stationName").asText());
        assertFalse(own.get("isOtherStation").asBoolean());
        assertEquals(stationA.session().getStationId(), own.get("stationId").asLong());

        JsonNode other = response.at("/transactions/1");
        assertEquals("St" + stationB.session().getStationId(), other.get("stationName").asText());
        assertTrue(other.get("isOtherStation").asBoolean());
        assertEquals(stationB.session().getId(), other.get("stationSessionId").asLong());

        JsonNode payment = response.at("/payments/0");
        assertEquals("CHECK", payment.get("paymentType").asText());
        assertEquals("CHK March lunches", payment.get("memo").asText());
        assertTrue(payment.get("isOtherStation").asBoolean());

        printSuccess("Own and foreign records told apart");
    }

    @Test
    @DisplayName("Item names come from the menu, with a fallback for unknown items")
    void itemNames() throws Exception {
        JsonNode response = records(stationB, STUDENT_ID, "L");

        assertEquals("Pizza", response.at("/transactions/0/itemName").asText());
        assertEquals("Item 99", response.at("/transactions/1/itemName").asText());
        assertEquals("This Station", response.at("/transactions/1/stationName").asText());
    }

    @Test
    @DisplayName("Legacy id shows the same records")
    void legacyId() throws Exception {
        JsonNode response = records(stationA, STUDENT_LEGACY_ID, "L");

        assertEquals(2, response.get("transactions").size());
        assertEquals(1, response.get("payments").size());
        assertEquals(STUDENT_ID, response.at("/transactions/0/studentId").asLong());
    }

    @Test
    @DisplayName("Other meals are out of scope")
    void otherMealEmpty() throws Exception {
        JsonNode response = records(stationA, STUDENT_ID, "B");

        assertEquals(0, response.get("transactions").size());
        assertEquals(0, response.get("payments").size());
    }

    @Test
    @DisplayName("Anonymous callers are rejected")
    void requiresSession() throws Exception {
        getJson("/api/pos/accounts/" + STUDENT_ID + "/records", new Login("not-a-token", stationA.session()), 401);
    }
}
