package Powerset;

import java.util.BitSet;
import java.util.Collection;
import java.util.Set;

import Powerset.Model.NondeterministicAutomaton;

public class Move {
    private Move() {
    }

    /**
     * Union of the direct successors of the given states on one symbol. Epsilon moves are not followed.
     * @return new set; empty if no state has a transition on the symbol, or the symbol is not in the alphabet
     */
    public static BitSet move(BitSet states, char symbol, NondeterministicAutomaton nfa) {
        BitSet result = new BitSet(nfa.size());
        if (!nfa.containsSymbol(symbol)) {
            return result;
        }
        int symbolIndex = nfa.getInputAlphabet().getSymbolIndex(symbol);
        for (int s = states.nextSetBit(0); s >= 0; s = states.nextSetBit(s + 1)) {
            result.or(nfa.getSuccessors(s, symbolIndex));
        }
        return result;
    }

    public static Set<String> move(Collection<String> states, char symbol, NondeterministicAutomaton nfa) {
        return nfa.toNames(move(nfa.toIds(states), symbol, nfa));
    }
}
