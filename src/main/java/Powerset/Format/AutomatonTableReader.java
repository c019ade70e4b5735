package Powerset.Format;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import Powerset.Config.PowersetConfig;
import Powerset.Config.UnknownSymbolPolicy;
import Powerset.Model.DeterministicAutomaton;
import Powerset.Model.Diagnostics;
import Powerset.Model.NondeterministicAutomaton;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.exception.FormatException;

/**
 * Reads automata from transition tables.
 * <pre>
 * A B C          all states
 * A              initial state
 * C              final states
 * A h B          one transition per line: origin symbol destination
 * B 0 C
 * </pre>
 * The first three lines are the header; the final states line may be empty. Blank lines between transitions are
 * ignored. Problems with single transition lines are reported as warnings and the line is
 * skipped; a missing header or an undeclared initial state is fatal.
 */
public class AutomatonTableReader {
    private final char epsilon;
    private final String expectedSymbols;
    private final UnknownSymbolPolicy unknownSymbolPolicy;

    public AutomatonTableReader(PowersetConfig config) {
        this(config.getEpsilon(), config.getSymbols(), config.getUnknownSymbolPolicy());
    }

    /**
     * @param epsilon - token for epsilon moves in NFA tables
     * @param expectedSymbols - expected NFA symbols; empty accepts any single character
     * @param unknownSymbolPolicy - handling of other symbol tokens in NFA tables
     */
    public AutomatonTableReader(char epsilon, String expectedSymbols, UnknownSymbolPolicy unknownSymbolPolicy) {
        this.epsilon = epsilon;
        this.expectedSymbols = expectedSymbols;
        this.unknownSymbolPolicy = unknownSymbolPolicy;
    }

    public NondeterministicAutomaton readNondeterministic(Path path, Diagnostics diagnostics)
        throws IOException, FormatException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readNondeterministic(reader, diagnostics);
        }
    }

    public NondeterministicAutomaton readNondeterministic(Reader reader, Diagnostics diagnostics)
        throws IOException, FormatException {
        final Header header = readHeader(reader, diagnostics);
        final NondeterministicAutomaton.Builder builder = NondeterministicAutomaton.builder()
            .addStates(header.states)
            .setInitial(header.initial);
        for (String f : header.finals) {
            builder.addFinal(f);
        }

        for (Line line : header.transitions) {
            String[] parts = transitionParts(line, diagnostics);
            if (parts == null || !declared(parts, header, line, diagnostics)) {
                continue;
            }
            String token = parts[1];
            if (token.length() == 1 && token.charAt(0) == epsilon) {
                builder.addEpsilonTransition(parts[0], parts[2]);
            } else if (isExpectedSymbol(token)) {
                builder.addTransition(parts[0], token.charAt(0), parts[2]);
            } else if (unknownSymbolPolicy == UnknownSymbolPolicy.EPSILON) {
                diagnostics.warn(line.number, "Symbol '" + token + "' in '" + line.text
                    + "' is not an expected symbol or '" + epsilon + "'; read as an epsilon move");
                builder.addEpsilonTransition(parts[0], parts[2]);
            } else {
                diagnostics.warn(line.number, "Symbol '" + token + "' in '" + line.text
                    + "' is not an expected symbol or '" + epsilon + "'; line skipped");
            }
        }
        return builder.build();
    }

    public DeterministicAutomaton readDeterministic(Path path, Diagnostics diagnostics)
        throws IOException, FormatException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readDeterministic(reader, diagnostics);
        }
    }

    public DeterministicAutomaton readDeterministic(Reader reader, Diagnostics diagnostics)
        throws IOException, FormatException {
        final Header header = readHeader(reader, diagnostics);

        List<Line> accepted = new ArrayList<>();
        Set<Character> symbols = new TreeSet<>();
        for (Line line : header.transitions) {
            String[] parts = transitionParts(line, diagnostics);
            if (parts == null || !declared(parts, header, line, diagnostics)) {
                continue;
            }
            if (parts[1].length() != 1) {
                diagnostics.warn(line.number, "Symbol '" + parts[1] + "' is not a single character; line skipped");
                continue;
            }
            if (parts[1].charAt(0) == epsilon) {
                diagnostics.warn(line.number, "Epsilon move in a deterministic table: '" + line.text + "'; line skipped");
                continue;
            }
            symbols.add(parts[1].charAt(0));
            accepted.add(line);
        }
        // the table has no alphabet line; expected symbols without a transition lead to the sink
        for (char c : expectedSymbols.toCharArray()) {
            if (c != epsilon) {
                symbols.add(c);
            }
        }

        final DeterministicAutomaton.Builder builder = DeterministicAutomaton.builder(Alphabets.fromCollection(symbols));
        for (String s : header.states) {
            builder.addState(s, header.finals.contains(s));
        }
        builder.setInitial(header.initial);
        for (Line line : accepted) {
            String[] parts = line.text.split("\\s+");
            char symbol = parts[1].charAt(0);
            String existing = builder.getSuccessor(parts[0], symbol);
            if (existing == null) {
                builder.setTransition(parts[0], symbol, parts[2]);
            } else if (!existing.equals(parts[2])) {
                diagnostics.warn(line.number, "Conflicting transition '" + line.text + "'; keeping "
                    + parts[0] + " " + symbol + " " + existing);
            }
        }
        return builder.build();
    }

    private boolean isExpectedSymbol(String token) {
        return token.length() == 1 && (expectedSymbols.isEmpty() || expectedSymbols.indexOf(token.charAt(0)) >= 0);
    }

    private static String[] transitionParts(Line line, Diagnostics diagnostics) {
        String[] parts = line.text.split("\\s+");
        if (parts.length != 3) {
            diagnostics.warn(line.number, "Ignoring malformed transition line: '" + line.text + "'");
            return null;
        }
        return parts;
    }

    private static boolean declared(String[] parts, Header header, Line line, Diagnostics diagnostics) {
        for (String state : new String[]{parts[0], parts[2]}) {
            if (!header.states.contains(state)) {
                diagnostics.warn(line.number, "Undeclared state '" + state + "' in '" + line.text + "'; line skipped");
                return false;
            }
        }
        return true;
    }

    /*
    The header is the first three physical lines, so an empty third line means no final states.
    Blank lines are only skipped among the transitions.
     */
    private static Header readHeader(Reader reader, Diagnostics diagnostics) throws IOException, FormatException {
        List<Line> header = new ArrayList<>(3);
        List<Line> transitions = new ArrayList<>();
        BufferedReader br = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        String text;
        int number = 0;
        while ((text = br.readLine()) != null) {
            number++;
            String trimmed = text.trim();
            if (header.size() < 3) {
                header.add(new Line(number, trimmed));
            } else if (!trimmed.isEmpty()) {
                transitions.add(new Line(number, trimmed));
            }
        }
        if (header.size() < 3) {
            throw new FormatException("Expected states, initial state and final states lines, found "
                + header.size() + " lines");
        }

        Header result = new Header();
        Line states = header.get(0);
        if (states.text.isEmpty()) {
            throw new FormatException("Line " + states.number + ": expected the list of states, found an empty line");
        }
        result.states.addAll(Arrays.asList(states.text.split("\\s+")));

        Line initial = header.get(1);
        if (initial.text.isEmpty() || initial.text.split("\\s+").length != 1) {
            throw new FormatException("Line " + initial.number + ": expected a single initial state, found '"
                + initial.text + "'");
        }
        if (!result.states.contains(initial.text)) {
            throw new FormatException("Line " + initial.number + ": initial state '" + initial.text
                + "' is not a declared state");
        }
        result.initial = initial.text;

        Line finals = header.get(2);
        if (!finals.text.isEmpty()) {
            for (String f : finals.text.split("\\s+")) {
                if (result.states.contains(f)) {
                    result.finals.add(f);
                } else {
                    diagnostics.warn(finals.number, "Final state '" + f + "' is not a declared state; ignored");
                }
            }
        }

        result.transitions = transitions;
        return result;
    }

    private record Line(int number, String text) { }

    private static final class Header {
        final Set<String> states = new TreeSet<>();
        final Set<String> finals = new TreeSet<>();
        String initial;
        List<Line> transitions;
    }
}
