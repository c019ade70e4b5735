package Powerset.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * Immutable, possibly partial DFA with named states.
 * <p>
 * Transitions are stored in a {@link CompactDFA}, so each (state, symbol) pair has at most one successor.
 * A missing transition stands for the implicit sink state, which is never part of the state set.
 */
public final class DeterministicAutomaton {
    public static final int MISSING_STATE = -1;

    private final CompactDFA<Character> dfa;
    private final List<String> stateNames;
    private final Object2IntMap<String> stateIds;

    private DeterministicAutomaton(CompactDFA<Character> dfa, List<String> stateNames, Object2IntMap<String> stateIds) {
        this.dfa = dfa;
        this.stateNames = Collections.unmodifiableList(stateNames);
        this.stateIds = stateIds;
    }

    public static Builder builder(Alphabet<Character> alphabet) {
        return new Builder(alphabet);
    }

    public int size() {
        return stateNames.size();
    }

    /** State names in insertion order (discovery order for a constructed automaton). */
    public List<String> getStates() {
        return stateNames;
    }

    public boolean containsState(String name) {
        return stateIds.containsKey(name);
    }

    public Alphabet<Character> getInputAlphabet() {
        return dfa.getInputAlphabet();
    }

    public boolean containsSymbol(char symbol) {
        return dfa.getInputAlphabet().containsSymbol(symbol);
    }

    public String getInitialState() {
        return stateNames.get(dfa.getInitialState());
    }

    public Set<String> getFinalStates() {
        Set<String> finals = new LinkedHashSet<>();
        for (int i = 0; i < stateNames.size(); i++) {
            if (dfa.isAccepting(i)) {
                finals.add(stateNames.get(i));
            }
        }
        return Collections.unmodifiableSet(finals);
    }

    public boolean isFinal(String state) {
        return dfa.isAccepting(requireState(state));
    }

    /**
     * @return successor name, or null if the transition is undefined or the symbol is not in the alphabet
     */
    public String getSuccessor(String state, char symbol) {
        int id = requireState(state);
        if (!containsSymbol(symbol)) {
            return null;
        }
        Integer succ = dfa.getSuccessor(Integer.valueOf(id), Character.valueOf(symbol));
        return succ == null ? null : stateNames.get(succ);
    }

    /** Number of defined transitions. */
    public int getTransitionCount() {
        int count = 0;
        for (String state : stateNames) {
            for (Character symbol : getInputAlphabet()) {
                if (getSuccessor(state, symbol) != null) {
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * Copy of the underlying automaton for use with AutomataLib utilities. State ids follow {@link #getStates()}.
     */
    public CompactDFA<Character> toCompactDFA() {
        Alphabet<Character> alphabet = dfa.getInputAlphabet();
        CompactDFA<Character> copy = new CompactDFA<>(alphabet, size());
        for (int i = 0; i < size(); i++) {
            copy.addState(dfa.isAccepting(i));
        }
        copy.setInitialState(dfa.getInitialState());
        for (int i = 0; i < size(); i++) {
            for (Character symbol : alphabet) {
                Integer succ = dfa.getSuccessor(Integer.valueOf(i), symbol);
                if (succ != null) {
                    copy.setTransition(i, alphabet.getSymbolIndex(symbol), succ.intValue());
                }
            }
        }
        return copy;
    }

    private int requireState(String name) {
        int id = stateIds.getInt(name);
        if (id == MISSING_STATE) {
            throw new IllegalArgumentException("Unknown state: " + name);
        }
        return id;
    }

    @Override
    public String toString() {
        return "DFA[" + size() + " states, alphabet " + getInputAlphabet() + ", initial " + getInitialState()
            + ", final " + getFinalStates() + "]";
    }

    /**
     * Incrementally builds a DFA over a fixed alphabet. Single use: {@link #build()} hands the automaton off.
     */
    public static final class Builder {
        private final Alphabet<Character> alphabet;
        private CompactDFA<Character> dfa;
        private final List<String> stateNames = new ArrayList<>();
        private final Object2IntMap<String> stateIds = new Object2IntOpenHashMap<>();
        private boolean hasInitial;

        private Builder(Alphabet<Character> alphabet) {
            this.alphabet = Objects.requireNonNull(alphabet, "alphabet");
            this.dfa = new CompactDFA<>(alphabet);
            this.stateIds.defaultReturnValue(MISSING_STATE);
        }

        public Builder addState(String name, boolean accepting) {
            checkOpen();
            Objects.requireNonNull(name, "state name");
            if (name.isEmpty() || name.chars().anyMatch(Character::isWhitespace)) {
                throw new IllegalArgumentException("Not a valid state name: '" + name + "'");
            }
            if (stateIds.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate state: " + name);
            }
            int id = dfa.addState(accepting);
            stateIds.put(name, id);
            stateNames.add(name);
            return this;
        }

        public boolean hasState(String name) {
            return stateIds.containsKey(name);
        }

        public Builder setAccepting(String name, boolean accepting) {
            checkOpen();
            dfa.setAccepting(requireState(name), accepting);
            return this;
        }

        public Builder setInitial(String name) {
            checkOpen();
            dfa.setInitialState(requireState(name));
            hasInitial = true;
            return this;
        }

        /**
         * @throws IllegalStateException if the pair already leads to a different state
         */
        public Builder setTransition(String origin, char symbol, String destination) {
            checkOpen();
            int from = requireState(origin);
            int to = requireState(destination);
            if (!alphabet.containsSymbol(symbol)) {
                throw new IllegalArgumentException("Symbol not in alphabet: '" + symbol + "'");
            }
            String existing = getSuccessor(origin, symbol);
            if (existing != null && !existing.equals(destination)) {
                throw new IllegalStateException(
                    "Transition (" + origin + ", " + symbol + ") already leads to " + existing);
            }
            dfa.setTransition(from, alphabet.getSymbolIndex(symbol), to);
            return this;
        }

        /** @return the current successor, or null if none was set */
        public String getSuccessor(String origin, char symbol) {
            checkOpen();
            if (!alphabet.containsSymbol(symbol)) {
                return null;
            }
            Integer succ = dfa.getSuccessor(Integer.valueOf(requireState(origin)), Character.valueOf(symbol));
            return succ == null ? null : stateNames.get(succ);
        }

        public DeterministicAutomaton build() {
            checkOpen();
            if (!hasInitial) {
                throw new IllegalStateException("No initial state");
            }
            DeterministicAutomaton result = new DeterministicAutomaton(dfa, stateNames, stateIds);
            dfa = null;
            return result;
        }

        private int requireState(String name) {
            int id = stateIds.getInt(name);
            if (id == MISSING_STATE) {
                throw new IllegalArgumentException("Unknown state: " + name);
            }
            return id;
        }

        private void checkOpen() {
            if (dfa == null) {
                throw new IllegalStateException("Builder already used");
            }
        }
    }
}
