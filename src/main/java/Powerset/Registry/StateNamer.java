package Powerset.Registry;

import java.util.Objects;

/**
 * Sequential names for composite states: prefix followed by the discovery index (q0, q1, ...).
 * Distinct indices always give distinct names.
 */
public class StateNamer {
    public static final String DEFAULT_PREFIX = "q";

    private final String prefix;

    public StateNamer() {
        this(DEFAULT_PREFIX);
    }

    public StateNamer(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        if (prefix.isEmpty() || prefix.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("Not a valid state name prefix: '" + prefix + "'");
        }
        this.prefix = prefix;
    }

    public String name(int discoveryIndex) {
        if (discoveryIndex < 0) {
            throw new IllegalArgumentException("Negative discovery index: " + discoveryIndex);
        }
        return prefix + discoveryIndex;
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public String toString() {
        return prefix + "<n>";
    }
}
