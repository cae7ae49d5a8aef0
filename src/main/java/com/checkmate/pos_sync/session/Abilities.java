package com.checkmate.pos_sync.session;

import lombok.Value;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Capability strings granted to a session, such as {@code line:L10} or {@code line:*}.
 *
 * An ability is held when it is present verbatim, or when a wildcard ability
 * ending in {@code :*} covers it by prefix ({@code line:*} covers {@code line:B5}).
 */
@Value
public class Abilities {

    public static final String LINE = "line";

    private static final String WILDCARD_SUFFIX = ":*";

    List<String> values;

    public static Abilities of(Collection<String> values) {
        return new Abilities(values == null ? List.of() : List.copyOf(values));
    }

    public boolean has(String ability) {
        for (String granted : values) {
            if (granted.equals(ability)) {
                return true;
            }
            if (granted.endsWith(WILDCARD_SUFFIX)) {
                String prefix = granted.substring(0, granted.length() - 1);
                if (ability.startsWith(prefix)) {
                    return true;
                }
            }
        }
        return false;
    }

    public boolean permitsLine(String lineCode) {
        return has(LINE + ":" + lineCode);
    }

    /**
     * Value of the first ability named {@code name}, e.g. "L10" for {@code line:L10}.
     */
    public Optional<String> valueOf(String name) {
        String prefix = name + ":";
        return values.stream()
            .filter(v -> v.startsWith(prefix))
            .map(v -> v.substring(prefix.length()))
            .findFirst();
    }

    /**
     * Line code as used in abilities: meal type letter followed by line number.
     */
    public static String lineCode(String mealType, int lineNum) {
        return mealType.trim().toUpperCase(Locale.ROOT) + lineNum;
    }
}
