package com.checkmate.pos_sync.validation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncValidationResponse {

    @JsonProperty("success")
    boolean success;

    @JsonProperty("mode")
    String mode;

    @JsonProperty("isInSync")
    boolean inSync;

    @JsonProperty("transactions")
    KeyComparison transactions;

    @JsonProperty("payments")
    KeyComparison payments;

    /**
     * Client and server view of one record kind. The missing lists are only
     * present in full mode, in the order the client or server listed the keys.
     */
    @Value
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class KeyComparison {

        @JsonProperty("clientCount")
        int clientCount;

        @JsonProperty("serverCount")
        int serverCount;

        @JsonProperty("missingFromServer")
        List<String> missingFromServer;

        @JsonProperty("missingFromClient")
        List<String> missingFromClient;

        public static KeyComparison counts(int clientCount, int serverCount) {
            return new KeyComparison(clientCount, serverCount, null, null);
        }

        /**
         * Set difference in both directions, keeping first-seen order.
         */
        public static KeyComparison keys(List<String> clientKeys, List<String> serverKeys) {
            Set<String> server = new HashSet<>(serverKeys);
            Set<String> client = new HashSet<>(clientKeys);
            List<String> missingFromServer = clientKeys.stream().filter(k -> !server.contains(k)).distinct().toList();
            List<String> missingFromClient = serverKeys.stream().filter(k -> !client.contains(k)).distinct().toList();
            return new KeyComparison(clientKeys.size(), serverKeys.size(), missingFromServer, missingFromClient);
        }
    }
}
