package Powerset.Batch;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import Powerset.Config.PowersetConfig;
import Powerset.Format.AutomatonTableReader;
import Powerset.Format.AutomatonTableWriter;
import Powerset.Format.BAFormat;
import Powerset.Format.DotRenderer;
import Powerset.Model.Determinization;
import Powerset.Model.DeterministicAutomaton;
import Powerset.Model.Diagnostics;
import Powerset.Model.NondeterministicAutomaton;
import Powerset.Registry.StateNamer;
import Powerset.SubsetConstruction;
import net.automatalib.exception.FormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stage 1: read an NFA table, render it, convert it and write the DFA table and rendering.
 */
public class ConversionStage {
    private static final Logger LOG = LoggerFactory.getLogger(ConversionStage.class);

    public static final String NAME = "conversion";
    public static final String NFA_DOT = "nfa.dot";
    public static final String DFA_TABLE = "dfa.txt";
    public static final String DFA_DOT = "dfa.dot";

    private final PowersetConfig config;
    private final PrintStream out;

    public ConversionStage(PowersetConfig config, PrintStream out) {
        this.config = config;
        this.out = out;
    }

    public Path getOutputDir() {
        return config.getOutputDir().resolve("stage1");
    }

    /** Where this stage writes the DFA table, which the recognition stage reads. */
    public Path getDfaTablePath() {
        return getOutputDir().resolve(DFA_TABLE);
    }

    public StageResult run(Path nfaTable) {
        Diagnostics diagnostics = new Diagnostics();
        List<Path> outputs = new ArrayList<>();
        try {
            // drop the table of an earlier run
            Files.deleteIfExists(getDfaTablePath());
            convert(nfaTable, diagnostics, outputs);
            return new StageResult(NAME, true, outputs, diagnostics);
        } catch (NoSuchFileException e) {
            diagnostics.error("Input file '" + nfaTable + "' not found");
        } catch (FormatException e) {
            diagnostics.error("Cannot read NFA table '" + nfaTable + "': " + e.getMessage());
        } catch (IOException e) {
            diagnostics.error("I/O error in " + NAME + " stage: " + e);
        }
        return new StageResult(NAME, false, outputs, diagnostics);
    }

    Determinization convert(Path nfaTable, Diagnostics diagnostics, List<Path> outputs)
        throws IOException, FormatException {
        final NondeterministicAutomaton nfa = new AutomatonTableReader(config).readNondeterministic(nfaTable, diagnostics);
        out.println("NFA read: " + nfa.size() + " states, " + nfa.getTransitionCount() + " transitions, alphabet "
            + nfa.getInputAlphabet());
        LOG.debug("{}", nfa);

        Path nfaDot = getOutputDir().resolve(NFA_DOT);
        DotRenderer.write(DotRenderer.render(nfa, "NFA"), nfaDot);
        outputs.add(nfaDot);

        long before = System.currentTimeMillis();
        final Determinization result = new SubsetConstruction(new StateNamer(config.getStatePrefix())).build(nfa);
        long after = System.currentTimeMillis();
        final DeterministicAutomaton dfa = result.getAutomaton();
        out.println("DFA built: " + dfa.size() + " states, " + dfa.getTransitionCount() + " transitions");
        if (config.isDebug()) {
            out.println("subset construction time: " + ((after - before) / 1000f) + "s");
        }

        Path table = getDfaTablePath();
        AutomatonTableWriter.write(dfa, table);
        outputs.add(table);
        out.println("DFA table written to: " + table);

        Path dfaDot = getOutputDir().resolve(DFA_DOT);
        DotRenderer.write(DotRenderer.render(dfa, "DFA"), dfaDot);
        outputs.add(dfaDot);

        if (config.getBaOutput() != null) {
            out.println("Writing to file: " + config.getBaOutput());
            BAFormat.writeBA(dfa, config.getBaOutput());
            outputs.add(config.getBaOutput());
        }

        out.println();
        out.println("DFA states and the NFA states they stand for:");
        for (Map.Entry<String, Set<String>> e : result.getCompositeStates().entrySet()) {
            out.println(e.getKey() + " -> " + e.getValue());
        }
        return result;
    }
}
