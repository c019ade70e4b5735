package Powerset.Batch;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import Powerset.Config.PowersetConfig;
import Powerset.Format.AutomatonTableReader;
import Powerset.Format.RecognitionReport;
import Powerset.Format.WordList;
import Powerset.Model.DeterministicAutomaton;
import Powerset.Model.Diagnostics;
import Powerset.Model.Verdict;
import Powerset.WordRecognizer;
import net.automatalib.exception.FormatException;

/**
 * Stage 2: read a DFA table and a word list, and write one verdict per word.
 */
public class RecognitionStage {
    public static final String NAME = "recognition";
    public static final String RESULTS = "results.txt";

    private final PowersetConfig config;
    private final PrintStream out;

    public RecognitionStage(PowersetConfig config, PrintStream out) {
        this.config = config;
        this.out = out;
    }

    public Path getOutputDir() {
        return config.getOutputDir().resolve("stage2");
    }

    public StageResult run(Path dfaTable, Path wordList) {
        Diagnostics diagnostics = new Diagnostics();
        List<Path> outputs = new ArrayList<>();
        Path current = dfaTable;
        try {
            final DeterministicAutomaton dfa = new AutomatonTableReader(config).readDeterministic(dfaTable, diagnostics);
            out.println("DFA read from: " + dfaTable);
            current = wordList;
            final List<String> words = WordList.read(wordList);

            RecognitionReport report = recognize(dfa, words, diagnostics);
            Path results = getOutputDir().resolve(RESULTS);
            report.write(results);
            outputs.add(results);
            out.println(report.acceptedCount() + " of " + words.size() + " words accepted; results written to: "
                + results);
            return new StageResult(NAME, true, outputs, diagnostics);
        } catch (NoSuchFileException e) {
            diagnostics.error("Input file '" + current + "' not found");
        } catch (FormatException e) {
            diagnostics.error("Cannot read DFA table '" + dfaTable + "': " + e.getMessage());
        } catch (IOException e) {
            diagnostics.error("I/O error in " + NAME + " stage: " + e);
        }
        return new StageResult(NAME, false, outputs, diagnostics);
    }

    RecognitionReport recognize(DeterministicAutomaton dfa, List<String> words, Diagnostics diagnostics) {
        RecognitionReport report = new RecognitionReport(config);
        for (String word : words) {
            Verdict verdict = WordRecognizer.evaluate(dfa, word);
            if (verdict == Verdict.REJECTED_UNKNOWN_SYMBOL) {
                char symbol = word.charAt(WordRecognizer.firstUnknownSymbol(dfa, word));
                diagnostics.warn("Word '" + word + "' contains '" + symbol + "', which is not in the alphabet "
                    + dfa.getInputAlphabet() + "; rejected");
            }
            report.add(word, verdict);
        }
        return report;
    }
}
