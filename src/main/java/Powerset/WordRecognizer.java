package Powerset;

import java.util.BitSet;

import Powerset.Model.DeterministicAutomaton;
import Powerset.Model.NondeterministicAutomaton;
import Powerset.Model.Verdict;

/**
 * Membership tests for words, one symbol per character.
 */
public class WordRecognizer {
    private WordRecognizer() {
    }

    public static boolean accepts(DeterministicAutomaton dfa, CharSequence word) {
        return evaluate(dfa, word).isAccepted();
    }

    /**
     * Run the DFA over the word. Takes exactly one step per symbol and stops at the first symbol outside the
     * alphabet or the first undefined transition.
     */
    public static Verdict evaluate(DeterministicAutomaton dfa, CharSequence word) {
        String state = dfa.getInitialState();
        for (int i = 0; i < word.length(); i++) {
            char symbol = word.charAt(i);
            if (!dfa.containsSymbol(symbol)) {
                return Verdict.REJECTED_UNKNOWN_SYMBOL;
            }
            state = dfa.getSuccessor(state, symbol);
            if (state == null) {
                return Verdict.REJECTED;
            }
        }
        return dfa.isFinal(state) ? Verdict.ACCEPTED : Verdict.REJECTED;
    }

    /**
     * @return index of the first symbol outside the alphabet, or -1
     */
    public static int firstUnknownSymbol(DeterministicAutomaton dfa, CharSequence word) {
        for (int i = 0; i < word.length(); i++) {
            if (!dfa.containsSymbol(word.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Simulate the NFA directly, tracking the epsilon-closed set of current states.
     */
    public static boolean acceptsNondeterministic(NondeterministicAutomaton nfa, CharSequence word) {
        BitSet current = EpsilonClosure.closure(nfa.getInitialStateId(), nfa);
        for (int i = 0; i < word.length() && !current.isEmpty(); i++) {
            current = EpsilonClosure.closure(Move.move(current, word.charAt(i), nfa), nfa);
        }
        return nfa.containsFinal(current);
    }
}
