package com.checkmate.pos_sync.transaction;

import lombok.Value;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Item type and transaction code of a sale.
 *
 * The item type comes from the station if it sent one, else from the menu,
 * else defaults to "C". The transaction code comes from the station if sent;
 * otherwise cash sales are always "C" and other sales take the menu's item type.
 */
@Value
public class ItemClassification {

    public static final String DEFAULT_CODE = "C";

    /**
     * Item types eligible for subsidy: lunch, breakfast, a la carte eligible and extra.
     */
    private static final Set<String> APPROVAL_ITEM_TYPES = Set.of("L", "B", "A", "X");

    String itemType;
    String transactionCode;

    public static ItemClassification resolve(String clientItemType,
                                             Optional<String> catalogItemType,
                                             String clientTransactionCode,
                                             boolean cash) {
        Optional<String> catalog = catalogItemType.map(ItemClassification::normalize).filter(s -> !s.isEmpty());

        String itemType = present(clientItemType)
            .orElseGet(() -> catalog.orElse(DEFAULT_CODE));

        String transactionCode = present(clientTransactionCode)
            .orElseGet(() -> cash ? DEFAULT_CODE : catalog.orElse(DEFAULT_CODE));

        return new ItemClassification(itemType, transactionCode);
    }

    /**
     * Whether the account's approval method and code are recorded with the sale.
     */
    public boolean approvalApplies() {
        return APPROVAL_ITEM_TYPES.contains(itemType);
    }

    private static Optional<String> present(String value) {
        return Optional.ofNullable(value).map(ItemClassification::normalize).filter(s -> !s.isEmpty());
    }

    private static String normalize(String value) {
        return value.trim().toUpperCase(Locale.ROOT);
    }
}
