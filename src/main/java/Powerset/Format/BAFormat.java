package Powerset.Format;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import Powerset.Model.DeterministicAutomaton;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.serialization.ba.BAWriter;

public class BAFormat {
    private BAFormat() {
    }

    /*
    We just use the Automatalib writer on a CompactDFA copy. State names are not kept: BA states are numbered in
    the order of DeterministicAutomaton.getStates().
     */
    public static void writeBA(DeterministicAutomaton dfa, OutputStream os) throws IOException {
        final CompactDFA<Character> compact = dfa.toCompactDFA();
        BAWriter<Character> baWriter = new BAWriter<>();
        baWriter.writeModel(os, compact, compact.getInputAlphabet());
    }

    public static void writeBA(DeterministicAutomaton dfa, Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        try (OutputStream os = Files.newOutputStream(path)) {
            writeBA(dfa, os);
        }
    }
}
