package Powerset.Format;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import Powerset.Config.PowersetConfig;
import Powerset.Model.Verdict;

/**
 * Verdicts for a word list, kept in input order. One output line per word: the word (or the empty word marker)
 * followed by the accepted or rejected label.
 */
public class RecognitionReport {
    private final String emptyWordMarker;
    private final String acceptedLabel;
    private final String rejectedLabel;
    private final List<Entry> entries = new ArrayList<>();

    public record Entry(String word, Verdict verdict) { }

    public RecognitionReport(PowersetConfig config) {
        this(config.getEmptyWordMarker(), config.getAcceptedLabel(), config.getRejectedLabel());
    }

    public RecognitionReport(String emptyWordMarker, String acceptedLabel, String rejectedLabel) {
        this.emptyWordMarker = emptyWordMarker;
        this.acceptedLabel = acceptedLabel;
        this.rejectedLabel = rejectedLabel;
    }

    public void add(String word, Verdict verdict) {
        entries.add(new Entry(word, verdict));
    }

    public List<Entry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public int acceptedCount() {
        int count = 0;
        for (Entry e : entries) {
            if (e.verdict().isAccepted()) {
                count++;
            }
        }
        return count;
    }

    public String format(Entry entry) {
        String word = entry.word().isEmpty() ? emptyWordMarker : entry.word();
        return word + " " + (entry.verdict().isAccepted() ? acceptedLabel : rejectedLabel);
    }

    public List<String> toLines() {
        List<String> lines = new ArrayList<>(entries.size());
        for (Entry e : entries) {
            lines.add(format(e));
        }
        return lines;
    }

    public void write(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Files.write(path, toLines(), StandardCharsets.UTF_8);
    }
}
