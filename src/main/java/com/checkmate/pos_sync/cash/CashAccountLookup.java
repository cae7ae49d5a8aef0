package com.checkmate.pos_sync.cash;

import com.checkmate.pos_sync.roster.RosterAccount;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * The cash placeholder account as seen by one batch.
 *
 * Created per batch and passed through the item loop. The roster is queried the
 * first time a cash item needs the account; the result, found or missing, is
 * kept for the rest of the batch, so every later cash item gets the same answer
 * without another query.
 */
public final class CashAccountLookup {

    private final Supplier<Optional<RosterAccount>> loader;
    private Optional<RosterAccount> placeholder;

    private CashAccountLookup(Supplier<Optional<RosterAccount>> loader) {
        this.loader = loader;
    }

    static CashAccountLookup deferred(Supplier<Optional<RosterAccount>> loader) {
        return new CashAccountLookup(loader);
    }

    public static CashAccountLookup of(RosterAccount placeholder) {
        CashAccountLookup lookup = new CashAccountLookup(Optional::empty);
        lookup.placeholder = Optional.of(placeholder);
        return lookup;
    }

    public static CashAccountLookup missing() {
        CashAccountLookup lookup = new CashAccountLookup(Optional::empty);
        lookup.placeholder = Optional.empty();
        return lookup;
    }

    /**
     * @throws CashAccountNotConfiguredException if the placeholder account does not exist
     */
    public RosterAccount require() {
        return placeholder().orElseThrow(CashAccountNotConfiguredException::new);
    }

    public boolean isConfigured() {
        return placeholder().isPresent();
    }

    /**
     * True once a lookup has been made and came back empty.
     */
    public boolean isKnownMissing() {
        return placeholder != null && placeholder.isEmpty();
    }

    private Optional<RosterAccount> placeholder() {
        if (placeholder == null) {
            placeholder = loader.get();
        }
        return placeholder;
    }
}
