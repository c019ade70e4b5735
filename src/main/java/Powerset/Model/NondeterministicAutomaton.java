package Powerset.Model;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;

/**
 * Immutable NFA with epsilon moves.
 * <p>
 * State names are interned to dense ids in sorted name order, so that a set of states can be held in a
 * {@link BitSet} and iterating a BitSet visits names in sorted order. Epsilon moves are kept in their own
 * relation and never appear in the input alphabet.
 */
public final class NondeterministicAutomaton {
    public static final int MISSING_STATE = -1;

    private final List<String> states;
    private final Object2IntMap<String> stateIds;
    private final Alphabet<Character> alphabet;
    private final BitSet[][] successors; // [state][symbol index]
    private final BitSet[] epsilonSuccessors;
    private final int initialState;
    private final BitSet finalStates;
    private final int transitionCount;

    private NondeterministicAutomaton(Builder builder) {
        this.states = List.copyOf(builder.states);
        this.stateIds = new Object2IntOpenHashMap<>(states.size());
        this.stateIds.defaultReturnValue(MISSING_STATE);
        for (int i = 0; i < states.size(); i++) {
            stateIds.put(states.get(i), i);
        }

        Set<Character> symbols = new TreeSet<>();
        for (Edge e : builder.edges) {
            if (e.symbol() != null) {
                symbols.add(e.symbol());
            }
        }
        this.alphabet = Alphabets.fromCollection(symbols);

        this.successors = new BitSet[states.size()][alphabet.size()];
        this.epsilonSuccessors = new BitSet[states.size()];
        for (int s = 0; s < states.size(); s++) {
            epsilonSuccessors[s] = new BitSet();
            for (int a = 0; a < alphabet.size(); a++) {
                successors[s][a] = new BitSet();
            }
        }

        int count = 0;
        for (Edge e : builder.edges) {
            int origin = stateIds.getInt(e.origin());
            int destination = stateIds.getInt(e.destination());
            BitSet target = e.symbol() == null
                ? epsilonSuccessors[origin]
                : successors[origin][alphabet.getSymbolIndex(e.symbol())];
            if (!target.get(destination)) {
                target.set(destination);
                count++;
            }
        }
        this.transitionCount = count;

        this.initialState = stateIds.getInt(builder.initialState);
        this.finalStates = new BitSet(states.size());
        for (String f : builder.finalStates) {
            finalStates.set(stateIds.getInt(f));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return states.size();
    }

    /** State names in sorted order; the position of a name is its id. */
    public List<String> getStates() {
        return states;
    }

    public Alphabet<Character> getInputAlphabet() {
        return alphabet;
    }

    public boolean containsSymbol(char symbol) {
        return alphabet.containsSymbol(symbol);
    }

    public String getInitialState() {
        return states.get(initialState);
    }

    public int getInitialStateId() {
        return initialState;
    }

    public Set<String> getFinalStates() {
        return toNames(finalStates);
    }

    public boolean isFinal(int state) {
        return finalStates.get(state);
    }

    /**
     * Whether the set contains at least one final state.
     */
    public boolean containsFinal(BitSet stateSet) {
        return finalStates.intersects(stateSet);
    }

    public int getStateId(String name) {
        return stateIds.getInt(name);
    }

    public String getStateName(int state) {
        return states.get(state);
    }

    /**
     * Direct successors on a symbol. The returned set is shared and must not be modified.
     * @param state - state id
     * @param symbolIndex - index into the input alphabet
     */
    public BitSet getSuccessors(int state, int symbolIndex) {
        return successors[state][symbolIndex];
    }

    /**
     * Successors over epsilon moves. The returned set is shared and must not be modified.
     */
    public BitSet getEpsilonSuccessors(int state) {
        return epsilonSuccessors[state];
    }

    public Set<String> getSuccessors(String state, char symbol) {
        int id = requireState(state);
        if (!containsSymbol(symbol)) {
            return Collections.emptySet();
        }
        return toNames(successors[id][alphabet.getSymbolIndex(symbol)]);
    }

    public Set<String> getEpsilonSuccessors(String state) {
        return toNames(epsilonSuccessors[requireState(state)]);
    }

    public boolean hasEpsilonTransitions() {
        for (BitSet eps : epsilonSuccessors) {
            if (!eps.isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /** Number of distinct (origin, symbol-or-epsilon, destination) triples. */
    public int getTransitionCount() {
        return transitionCount;
    }

    /**
     * Names of the states in the set, in sorted order.
     */
    public Set<String> toNames(BitSet stateSet) {
        Set<String> names = new LinkedHashSet<>();
        for (int i = stateSet.nextSetBit(0); i >= 0; i = stateSet.nextSetBit(i + 1)) {
            names.add(states.get(i));
        }
        return Collections.unmodifiableSet(names);
    }

    public BitSet toIds(Collection<String> names) {
        BitSet ids = new BitSet(states.size());
        for (String name : names) {
            ids.set(requireState(name));
        }
        return ids;
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
        return "NFA[" + size() + " states, alphabet " + alphabet + ", initial " + getInitialState()
            + ", final " + getFinalStates() + "]";
    }

    private record Edge(String origin, Character symbol, String destination) { }

    /**
     * Collects states and transitions; {@link #build()} checks that everything refers to declared states.
     */
    public static final class Builder {
        private final Set<String> states = new TreeSet<>();
        private final Set<String> finalStates = new LinkedHashSet<>();
        private final List<Edge> edges = new ArrayList<>();
        private String initialState;

        private Builder() {
        }

        public Builder addState(String name) {
            states.add(requireToken(name));
            return this;
        }

        public Builder addStates(Collection<String> names) {
            for (String name : names) {
                addState(name);
            }
            return this;
        }

        public Builder setInitial(String name) {
            this.initialState = requireToken(name);
            return this;
        }

        public Builder addFinal(String name) {
            finalStates.add(requireToken(name));
            return this;
        }

        public Builder addTransition(String origin, char symbol, String destination) {
            edges.add(new Edge(requireToken(origin), symbol, requireToken(destination)));
            return this;
        }

        public Builder addEpsilonTransition(String origin, String destination) {
            edges.add(new Edge(requireToken(origin), null, requireToken(destination)));
            return this;
        }

        public boolean hasState(String name) {
            return states.contains(name);
        }

        public NondeterministicAutomaton build() {
            if (initialState == null) {
                throw new IllegalArgumentException("No initial state");
            }
            checkDeclared(initialState, "initial state");
            for (String f : finalStates) {
                checkDeclared(f, "final state");
            }
            for (Edge e : edges) {
                checkDeclared(e.origin(), "transition origin");
                checkDeclared(e.destination(), "transition destination");
            }
            return new NondeterministicAutomaton(this);
        }

        private void checkDeclared(String name, String role) {
            if (!states.contains(name)) {
                throw new IllegalArgumentException("Undeclared " + role + ": " + name);
            }
        }

        private static String requireToken(String name) {
            Objects.requireNonNull(name, "state name");
            if (name.isEmpty() || name.chars().anyMatch(Character::isWhitespace)) {
                throw new IllegalArgumentException("Not a valid state name: '" + name + "'");
            }
            return name;
        }
    }
}
