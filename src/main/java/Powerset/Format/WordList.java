package Powerset.Format;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Words to recognize, one per line. Lines are trimmed; a blank line is the empty word.
 */
public class WordList {
    private WordList() {
    }

    public static List<String> read(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public static List<String> read(Reader reader) throws IOException {
        BufferedReader br = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        List<String> words = new ArrayList<>();
        String line;
        while ((line = br.readLine()) != null) {
            words.add(line.trim());
        }
        return words;
    }
}
