package Powerset.Format;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.BitSet;
import java.util.Set;

import Powerset.Model.DeterministicAutomaton;
import Powerset.Model.NondeterministicAutomaton;

/**
 * Graphviz DOT rendering of both automaton forms. An anonymous point node marks the initial state and final
 * states are drawn as double circles. Edges are emitted sorted by origin, then symbol
 * (epsilon moves last), then destination.
 */
public class DotRenderer {
    public static final String EPSILON_LABEL = "ε";

    private DotRenderer() {
    }

    public static String render(NondeterministicAutomaton nfa, String graphName) {
        StringBuilder sb = header(graphName, nfa.getFinalStates(), nfa.getInitialState());
        for (int s = 0; s < nfa.size(); s++) {
            String origin = nfa.getStateName(s);
            for (int a = 0; a < nfa.getInputAlphabet().size(); a++) {
                String label = String.valueOf(nfa.getInputAlphabet().getSymbol(a));
                edges(sb, nfa, origin, nfa.getSuccessors(s, a), label);
            }
            edges(sb, nfa, origin, nfa.getEpsilonSuccessors(s), EPSILON_LABEL);
        }
        return sb.append("}\n").toString();
    }

    public static String render(DeterministicAutomaton dfa, String graphName) {
        StringBuilder sb = header(graphName, dfa.getFinalStates(), dfa.getInitialState());
        dfa.getStates().stream().sorted().forEach(origin -> {
            for (Character symbol : dfa.getInputAlphabet()) {
                String destination = dfa.getSuccessor(origin, symbol);
                if (destination != null) {
                    edge(sb, origin, destination, String.valueOf(symbol));
                }
            }
        });
        return sb.append("}\n").toString();
    }

    public static void write(String dot, Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Files.writeString(path, dot, StandardCharsets.UTF_8);
    }

    private static StringBuilder header(String graphName, Set<String> finals, String initial) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph ").append(graphName).append(" {\n");
        sb.append("    rankdir=LR;\n");
        sb.append("    node [shape = circle];\n");
        finals.stream().sorted().forEach(f -> sb.append("    node [shape = doublecircle]; ").append(quote(f)).append(";\n"));
        sb.append("    node [shape = circle];\n");
        sb.append("    \"\" [shape=point];\n");
        sb.append("    \"\" -> ").append(quote(initial)).append(";\n\n");
        return sb;
    }

    // ids are in sorted name order, so destinations come out sorted
    private static void edges(StringBuilder sb, NondeterministicAutomaton nfa, String origin, BitSet destinations,
                              String label) {
        for (int t = destinations.nextSetBit(0); t >= 0; t = destinations.nextSetBit(t + 1)) {
            edge(sb, origin, nfa.getStateName(t), label);
        }
    }

    private static void edge(StringBuilder sb, String origin, String destination, String label) {
        sb.append("    ").append(quote(origin)).append(" -> ").append(quote(destination))
            .append(" [label = ").append(quote(label)).append("];\n");
    }

    private static String quote(String s) {
        return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
