package Powerset.Format;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import Powerset.Model.DeterministicAutomaton;

/**
 * Writes a DFA as a transition table readable by {@link AutomatonTableReader#readDeterministic}.
 * States, final states and transitions are sorted so equal automata give equal files.
 */
public class AutomatonTableWriter {
    private AutomatonTableWriter() {
    }

    public static void write(DeterministicAutomaton dfa, Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(dfa, w);
        }
    }

    public static void write(DeterministicAutomaton dfa, Writer w) throws IOException {
        for (String line : toLines(dfa)) {
            w.write(line);
            w.write('\n');
        }
    }

    public static List<String> toLines(DeterministicAutomaton dfa) {
        List<String> states = new ArrayList<>(dfa.getStates());
        states.sort(null);
        List<String> finals = new ArrayList<>(dfa.getFinalStates());
        finals.sort(null);

        List<String> lines = new ArrayList<>();
        lines.add(String.join(" ", states));
        lines.add(dfa.getInitialState());
        lines.add(String.join(" ", finals));
        for (String origin : states) {
            for (Character symbol : dfa.getInputAlphabet()) {
                String destination = dfa.getSuccessor(origin, symbol);
                if (destination != null) {
                    lines.add(origin + " " + symbol + " " + destination);
                }
            }
        }
        return lines;
    }
}
