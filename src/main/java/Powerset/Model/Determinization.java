package Powerset.Model;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Result of the subset construction: the DFA and, for each of its states, the NFA states it stands for.
 */
public final class Determinization {
    private final DeterministicAutomaton automaton;
    private final Map<String, Set<String>> compositeStates;

    public Determinization(DeterministicAutomaton automaton, Map<String, Set<String>> compositeStates) {
        this.automaton = automaton;
        this.compositeStates = Collections.unmodifiableMap(compositeStates);
    }

    public DeterministicAutomaton getAutomaton() {
        return automaton;
    }

    /**
     * DFA state name to sorted NFA member names, in discovery order.
     */
    public Map<String, Set<String>> getCompositeStates() {
        return compositeStates;
    }

    public Set<String> getMembers(String dfaState) {
        Set<String> members = compositeStates.get(dfaState);
        if (members == null) {
            throw new IllegalArgumentException("Unknown state: " + dfaState);
        }
        return members;
    }
}
