package Powerset.Config;

/**
 * What the NFA table reader does with a transition whose symbol is neither expected nor the epsilon token.
 */
public enum UnknownSymbolPolicy {
    /** Read it as an epsilon move and warn. */
    EPSILON,
    /** Drop the transition line and warn. */
    SKIP;

    public static UnknownSymbolPolicy parse(String value) {
        for (UnknownSymbolPolicy p : values()) {
            if (p.name().equalsIgnoreCase(value.trim())) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown symbol policy: " + value + " (expected epsilon or skip)");
    }
}
