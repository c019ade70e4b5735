package Powerset.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Warnings and errors raised while reading input or running a stage.
 * Owned by the caller; every entry is also logged.
 */
public class Diagnostics {
    private static final Logger LOG = LoggerFactory.getLogger(Diagnostics.class);

    private final List<Diagnostic> entries = new ArrayList<>();

    public void warn(String message) {
        warn(Diagnostic.NO_LINE, message);
    }

    public void warn(int line, String message) {
        Diagnostic d = new Diagnostic(Diagnostic.Severity.WARNING, line, message);
        entries.add(d);
        LOG.warn("{}", d);
    }

    public void error(String message) {
        Diagnostic d = new Diagnostic(Diagnostic.Severity.ERROR, Diagnostic.NO_LINE, message);
        entries.add(d);
        LOG.error("{}", d);
    }

    public List<Diagnostic> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public List<Diagnostic> getWarnings() {
        return filter(Diagnostic.Severity.WARNING);
    }

    public List<Diagnostic> getErrors() {
        return filter(Diagnostic.Severity.ERROR);
    }

    public boolean hasErrors() {
        return entries.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    private List<Diagnostic> filter(Diagnostic.Severity severity) {
        List<Diagnostic> result = new ArrayList<>();
        for (Diagnostic d : entries) {
            if (d.severity() == severity) {
                result.add(d);
            }
        }
        return result;
    }
}
