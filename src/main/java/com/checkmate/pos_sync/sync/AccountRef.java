package com.checkmate.pos_sync.sync;

import lombok.Value;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * The account a station attached to a record.
 *
 * Stations send either a roster account id ("12345") or a cash code ("C100")
 * for an anonymous walk-up buyer. The variant is decided once, when the upload
 * is parsed, and every later step matches on it with {@link #fold}.
 */
public sealed interface AccountRef permits AccountRef.Real, AccountRef.Cash {

    /**
     * Raw token as the station sent it. Stored on every record so cash payments
     * can be matched back to the sale they settle.
     */
    String rawToken();

    <T> T fold(Function<Real, T> onReal, Function<Cash, T> onCash);

    default boolean isCash() {
        return fold(real -> false, cash -> true);
    }

    /**
     * @throws IllegalArgumentException if the token is blank, or neither a cash code nor a numeric id
     */
    static AccountRef parse(String rawToken, Predicate<String> isCashToken) {
        if (rawToken == null || rawToken.isBlank()) {
            throw new IllegalArgumentException("Account token is required");
        }
        String token = rawToken.trim();
        if (isCashToken.test(token)) {
            return new Cash(token);
        }
        try {
            return new Real(Long.parseLong(token));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Account token must be numeric or a cash code: " + token);
        }
    }

    @Value
    class Real implements AccountRef {
        long id;

        @Override
        public String rawToken() {
            return Long.toString(id);
        }

        @Override
        public <T> T fold(Function<Real, T> onReal, Function<Cash, T> onCash) {
            return onReal.apply(this);
        }
    }

    @Value
    class Cash implements AccountRef {
        String token;

        @Override
        public String rawToken() {
            return token;
        }

        @Override
        public <T> T fold(Function<Real, T> onReal, Function<Cash, T> onCash) {
            return onCash.apply(this);
        }
    }
}
