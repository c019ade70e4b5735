package Powerset.Batch;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import Powerset.Config.PowersetConfig;
import Powerset.Model.Determinization;
import Powerset.Model.Diagnostics;
import Powerset.TestAutomata;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class StageTest {
  private static final List<String> EXPECTED_RESULTS = List.of(
      "0 accepted",
      "1 rejected",
      "01 accepted",
      "(empty word) rejected",
      "0a rejected",
      "011 accepted");

  private static PowersetConfig config(Path dir) {
    PowersetConfig config = new PowersetConfig();
    config.setOutputDir(dir);
    return config;
  }

  @Test
  void testConversion(@TempDir Path dir) throws URISyntaxException, IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    ConversionStage stage = new ConversionStage(config(dir), new PrintStream(bytes, true, StandardCharsets.UTF_8));
    StageResult result = stage.run(TestAutomata.getFilePath("example_nfa.txt"));

    Assertions.assertTrue(result.succeeded());
    Assertions.assertEquals(3, result.diagnostics().getWarnings().size());
    Path stage1 = dir.resolve("stage1");
    Assertions.assertEquals(List.of(stage1.resolve("nfa.dot"), stage1.resolve("dfa.txt"), stage1.resolve("dfa.dot")),
        result.outputs());
    Assertions.assertEquals(List.of("q0 q1", "q0", "q1", "q0 0 q1", "q1 1 q1"),
        Files.readAllLines(stage.getDfaTablePath(), StandardCharsets.UTF_8));

    String printed = bytes.toString(StandardCharsets.UTF_8);
    Assertions.assertTrue(printed.contains("q0 -> [A, B]"));
    Assertions.assertTrue(printed.contains("q1 -> [C, D]"));
    Assertions.assertEquals("conversion succeeded: 3 files written, 3 warnings, 0 errors", result.toString());
  }

  @Test
  void testConvertMapping(@TempDir Path dir) throws Exception {
    ConversionStage stage = new ConversionStage(config(dir), new PrintStream(new ByteArrayOutputStream()));
    Determinization d = stage.convert(TestAutomata.getFilePath("example_nfa.txt"), new Diagnostics(),
        new ArrayList<>());
    Assertions.assertEquals(Map.of("q0", Set.of("A", "B"), "q1", Set.of("C", "D")), d.getCompositeStates());
  }

  @Test
  void testWriteBA(@TempDir Path dir) throws URISyntaxException {
    PowersetConfig config = config(dir);
    config.setBaOutput(dir.resolve("ba").resolve("dfa.ba"));
    StageResult result = new ConversionStage(config, new PrintStream(new ByteArrayOutputStream()))
        .run(TestAutomata.getFilePath("example_nfa.txt"));
    Assertions.assertTrue(result.succeeded());
    Assertions.assertTrue(Files.exists(config.getBaOutput()));
    Assertions.assertEquals(4, result.outputs().size());
  }

  @Test
  void testConversionMissingFile(@TempDir Path dir) {
    StageResult result = new ConversionStage(config(dir), new PrintStream(new ByteArrayOutputStream()))
        .run(dir.resolve("missing.txt"));
    Assertions.assertFalse(result.succeeded());
    Assertions.assertTrue(result.outputs().isEmpty());
    Assertions.assertEquals(1, result.diagnostics().getErrors().size());
    Assertions.assertTrue(result.diagnostics().getErrors().get(0).message().contains("not found"));
  }

  @Test
  void testConversionBadHeader(@TempDir Path dir) throws IOException {
    Path table = dir.resolve("nfa.txt");
    Files.writeString(table, "A B\nZ\nB\n", StandardCharsets.UTF_8);
    StageResult result = new ConversionStage(config(dir), new PrintStream(new ByteArrayOutputStream())).run(table);
    Assertions.assertFalse(result.succeeded());
    Assertions.assertTrue(result.diagnostics().hasErrors());
  }

  @Test
  void testRecognition(@TempDir Path dir) throws URISyntaxException, IOException {
    PowersetConfig config = config(dir);
    PrintStream out = new PrintStream(new ByteArrayOutputStream());
    ConversionStage conversion = new ConversionStage(config, out);
    Assertions.assertTrue(conversion.run(TestAutomata.getFilePath("example_nfa.txt")).succeeded());

    RecognitionStage recognition = new RecognitionStage(config, out);
    StageResult result = recognition.run(conversion.getDfaTablePath(), TestAutomata.getFilePath("example_words.txt"));
    Assertions.assertTrue(result.succeeded());
    // "0a" contains a symbol outside the alphabet
    Assertions.assertEquals(1, result.diagnostics().getWarnings().size());
    Path results = dir.resolve("stage2").resolve("results.txt");
    Assertions.assertEquals(List.of(results), result.outputs());
    Assertions.assertEquals(EXPECTED_RESULTS, Files.readAllLines(results, StandardCharsets.UTF_8));
  }

  @Test
  void testRecognitionMissingWordList(@TempDir Path dir) throws URISyntaxException {
    PowersetConfig config = config(dir);
    PrintStream out = new PrintStream(new ByteArrayOutputStream());
    ConversionStage conversion = new ConversionStage(config, out);
    conversion.run(TestAutomata.getFilePath("example_nfa.txt"));

    Path words = dir.resolve("no_words.txt");
    StageResult result = new RecognitionStage(config, out).run(conversion.getDfaTablePath(), words);
    Assertions.assertFalse(result.succeeded());
    Assertions.assertEquals("Input file '" + words + "' not found",
        result.diagnostics().getErrors().get(0).message());
  }

  @Test
  void testStaleTableRemoved(@TempDir Path dir) throws URISyntaxException, IOException {
    PowersetConfig config = config(dir);
    ConversionStage conversion = new ConversionStage(config, new PrintStream(new ByteArrayOutputStream()));
    Assertions.assertTrue(conversion.run(TestAutomata.getFilePath("example_nfa.txt")).succeeded());
    Assertions.assertTrue(Files.exists(conversion.getDfaTablePath()));

    Assertions.assertFalse(conversion.run(dir.resolve("missing.txt")).succeeded());
    Assertions.assertFalse(Files.exists(conversion.getDfaTablePath()));
  }

  @Test
  void testUnreachableFinalState(@TempDir Path dir) throws IOException {
    Path table = dir.resolve("nfa.txt");
    Files.writeString(table, "A B C\nA\nC\nA 0 B\nB 0 A\n", StandardCharsets.UTF_8);
    Path words = dir.resolve("words.txt");
    Files.writeString(words, "\n0\n00\n", StandardCharsets.UTF_8);

    PowersetConfig config = config(dir);
    PrintStream out = new PrintStream(new ByteArrayOutputStream());
    ConversionStage conversion = new ConversionStage(config, out);
    Assertions.assertTrue(conversion.run(table).succeeded());
    StageResult result = new RecognitionStage(config, out).run(conversion.getDfaTablePath(), words);

    Assertions.assertTrue(result.succeeded());
    Assertions.assertTrue(result.diagnostics().isEmpty());
    Assertions.assertEquals(List.of("(empty word) rejected", "0 rejected", "00 rejected"),
        Files.readAllLines(dir.resolve("stage2").resolve("results.txt"), StandardCharsets.UTF_8));
  }
}
