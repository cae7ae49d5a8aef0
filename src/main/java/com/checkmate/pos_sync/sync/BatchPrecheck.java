package com.checkmate.pos_sync.sync;

import com.checkmate.pos_sync.cash.CashCustomerResolver;
import com.checkmate.pos_sync.session.Abilities;
import com.checkmate.pos_sync.session.SessionService;
import com.checkmate.pos_sync.session.StationSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Checks run over a whole upload before any item is written. A failure here
 * rejects the batch; nothing has been recorded yet.
 */
@Component
@RequiredArgsConstructor
public class BatchPrecheck {

    private final SessionService sessionService;
    private final CashCustomerResolver cashCustomerResolver;

    /**
     * Parses every item's account token, in item order.
     *
     * @throws InvalidBatchException listing every unparseable token by item index
     */
    public <T> List<AccountRef> parseAccounts(String collection, List<T> items, Function<T, String> tokenOf) {
        List<AccountRef> refs = new ArrayList<>(items.size());
        Map<String, String> errors = new LinkedHashMap<>();
        for (int i = 0; i < items.size(); i++) {
            try {
                refs.add(AccountRef.parse(tokenOf.apply(items.get(i)), cashCustomerResolver::isCashToken));
            } catch (IllegalArgumentException e) {
                errors.put(collection + "[" + i + "].studentId", e.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            throw new InvalidBatchException("Batch contains invalid account tokens", errors);
        }
        return refs;
    }

    /**
     * Requires the session to cover every distinct line the items were recorded on.
     */
    public <T> void requireLines(StationSession session, List<T> items,
                                 Function<T, String> mealTypeOf, Function<T, Integer> lineNumOf) {
        Set<String> lineCodes = new LinkedHashSet<>();
        for (T item : items) {
            lineCodes.add(Abilities.lineCode(mealTypeOf.apply(item), lineNumOf.apply(item)));
        }
        sessionService.requireLines(session, lineCodes);
    }
}
