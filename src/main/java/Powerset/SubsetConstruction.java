package Powerset;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

import Powerset.Model.DeterminizeRecord;
import Powerset.Model.Determinization;
import Powerset.Model.DeterministicAutomaton;
import Powerset.Model.NondeterministicAutomaton;
import Powerset.Registry.CompositeStateRegistry;
import Powerset.Registry.StateNamer;
import net.automatalib.alphabet.Alphabet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subset construction for NFAs with epsilon moves.
 * <p>
 * Explores reachable sets of NFA states breadth-first from the epsilon closure of the initial state. Each
 * distinct set becomes one DFA state, named once at first discovery. Empty successor sets are dropped, so the
 * result is partial: the sink state is left implicit.
 */
public class SubsetConstruction {
    private static final Logger LOG = LoggerFactory.getLogger(SubsetConstruction.class);

    private final StateNamer namer;

    public SubsetConstruction() {
        this(new StateNamer());
    }

    public SubsetConstruction(StateNamer namer) {
        this.namer = namer;
    }

    public static Determinization determinize(NondeterministicAutomaton nfa) {
        return new SubsetConstruction().build(nfa);
    }

    /**
     * Build the DFA.
     * @param nfa - source NFA, not modified
     * @return DFA over the same alphabet, plus the NFA members of each DFA state
     */
    public Determinization build(NondeterministicAutomaton nfa) {
        final Alphabet<Character> alphabet = nfa.getInputAlphabet();
        final CompositeStateRegistry registry = new CompositeStateRegistry(namer);
        final DeterministicAutomaton.Builder out = DeterministicAutomaton.builder(alphabet);
        final Queue<DeterminizeRecord> queue = new ArrayDeque<>();

        BitSet init = EpsilonClosure.closure(nfa.getInitialStateId(), nfa);
        int initOut = registry.put(init);
        out.addState(registry.getName(initOut), false);
        out.setInitial(registry.getName(initOut));
        queue.add(new DeterminizeRecord(init, initOut));

        while (!queue.isEmpty()) {
            DeterminizeRecord curr = queue.poll();
            BitSet inState = curr.members();
            String outName = registry.getName(curr.compositeId());

            if (nfa.containsFinal(inState)) {
                out.setAccepting(outName, true);
            }

            for (Character sym : alphabet) {
                BitSet succ = EpsilonClosure.closure(Move.move(inState, sym, nfa), nfa);
                if (succ.isEmpty()) {
                    continue; // implicit sink
                }
                int outSucc = registry.get(succ);
                if (outSucc == CompositeStateRegistry.MISSING_ELEMENT) {
                    // add new state to DFA and to queue
                    outSucc = registry.put(succ);
                    out.addState(registry.getName(outSucc), false);
                    queue.add(new DeterminizeRecord(registry.getMembers(outSucc), outSucc));
                }
                out.setTransition(outName, sym, registry.getName(outSucc));
            }
        }

        Map<String, Set<String>> composites = new LinkedHashMap<>();
        for (int id = 0; id < registry.size(); id++) {
            composites.put(registry.getName(id), nfa.toNames(registry.getMembers(id)));
        }
        LOG.debug("Subset construction: {} NFA states -> {} DFA states", nfa.size(), registry.size());
        return new Determinization(out.build(), composites);
    }
}
