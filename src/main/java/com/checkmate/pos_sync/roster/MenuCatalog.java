package com.checkmate.pos_sync.roster;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only menu lookups. Item ids are strings; "01" and "1" are different items.
 */
@Service
public class MenuCatalog {

    private final JdbcTemplate jdbcTemplate;

    public MenuCatalog(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<String> findItemType(String itemId) {
        if (itemId == null || itemId.isBlank()) {
            return Optional.empty();
        }
        return jdbcTemplate.queryForList(
                "SELECT item_type FROM menu_items WHERE item_id = ?",
                String.class,
                itemId.trim())
            .stream()
            .filter(type -> type != null && !type.isBlank())
            .findFirst();
    }

    /**
     * Menu descriptions of the given items. Unknown items are absent from the map.
     */
    public Map<String, String> findDescriptions(Collection<String> itemIds) {
        Map<String, String> descriptions = new HashMap<>();
        if (itemIds.isEmpty()) {
            return descriptions;
        }
        String placeholders = String.join(", ", itemIds.stream().map(id -> "?").toList());
        jdbcTemplate.query(
                "SELECT item_id, description FROM menu_items WHERE item_id IN (" + placeholders + ")",
                rs -> {
                    descriptions.put(rs.getString("item_id"), rs.getString("description"));
                },
                itemIds.toArray());
        return descriptions;
    }
}
