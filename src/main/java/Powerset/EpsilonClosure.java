package Powerset;

import java.util.BitSet;
import java.util.Collection;
import java.util.List;
import java.util.Set;

import Powerset.Model.NondeterministicAutomaton;
import it.unimi.dsi.fastutil.ints.IntArrayList;

public class EpsilonClosure {
    private EpsilonClosure() {
    }

    /**
     * Smallest superset of the seed closed under epsilon moves.
     * Depth-first with an explicit stack; a state is pushed only when first added, so epsilon cycles terminate.
     * @param seed - NFA state ids; not modified
     * @param nfa - NFA
     * @return new set containing the closure
     */
    public static BitSet closure(BitSet seed, NondeterministicAutomaton nfa) {
        BitSet result = (BitSet) seed.clone();
        IntArrayList stack = new IntArrayList();
        for (int i = seed.nextSetBit(0); i >= 0; i = seed.nextSetBit(i + 1)) {
            stack.push(i);
        }

        while (!stack.isEmpty()) {
            int state = stack.popInt();
            BitSet eps = nfa.getEpsilonSuccessors(state);
            for (int t = eps.nextSetBit(0); t >= 0; t = eps.nextSetBit(t + 1)) {
                if (!result.get(t)) {
                    result.set(t);
                    stack.push(t);
                }
            }
        }
        return result;
    }

    public static BitSet closure(int state, NondeterministicAutomaton nfa) {
        BitSet seed = new BitSet(nfa.size());
        seed.set(state);
        return closure(seed, nfa);
    }

    public static Set<String> closure(String state, NondeterministicAutomaton nfa) {
        return closure(List.of(state), nfa);
    }

    public static Set<String> closure(Collection<String> states, NondeterministicAutomaton nfa) {
        return nfa.toNames(closure(nfa.toIds(states), nfa));
    }
}
