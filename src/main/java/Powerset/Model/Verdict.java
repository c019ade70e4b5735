package Powerset.Model;

/**
 * Outcome of running a word through a deterministic automaton.
 */
public enum Verdict {
    ACCEPTED,
    /** Ended in a non-final state, or hit an undefined transition (implicit sink). */
    REJECTED,
    /** The word contains a symbol outside the automaton's alphabet. */
    REJECTED_UNKNOWN_SYMBOL;

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
