package Powerset;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import Powerset.Batch.ConversionStage;
import Powerset.Batch.RecognitionStage;
import Powerset.Batch.StageResult;
import Powerset.Config.PowersetConfig;
import Powerset.Config.UnknownSymbolPolicy;
import Powerset.Model.Diagnostic;

public class PowersetCommandLine {
  static final int EXIT_OK = 0;
  static final int EXIT_FAILED = 1;
  static final int EXIT_USAGE = 2;

  public static void main(String[] args) {
    System.exit(run(args, System.out));
  }

  /**
   * Parse arguments and run the requested stages.
   * @return exit code: 0 if every stage succeeded, 1 if one failed, 2 on bad usage
   */
  static int run(String[] args, PrintStream out) {
    final PowersetConfig config = PowersetConfig.load();
    List<String> positional = new ArrayList<>(3);

    try {
      for (int i = 0; i < args.length; i++) {
        String arg = args[i];
        if ("--debug".equalsIgnoreCase(arg)) {
          config.setDebug(true);
          // read by slf4j-simple when the first logger is created
          System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
        } else if ("--writeBA".equalsIgnoreCase(arg)) {
          config.setBaOutput(Paths.get(requireValue(args, i++)));
        } else if ("--out".equalsIgnoreCase(arg)) {
          config.setOutputDir(Paths.get(requireValue(args, i++)));
        } else if ("--epsilon".equalsIgnoreCase(arg)) {
          config.setEpsilon(requireValue(args, i++));
        } else if ("--symbols".equalsIgnoreCase(arg)) {
          config.setSymbols(requireValue(args, i++));
        } else if ("--unknown-symbols".equalsIgnoreCase(arg)) {
          config.setUnknownSymbolPolicy(UnknownSymbolPolicy.parse(requireValue(args, i++)));
        } else if (arg.startsWith("-")) {
          // Unknown flag
          return printUsage(out);
        } else {
          positional.add(arg);
        }
      }
    } catch (IllegalArgumentException e) {
      out.println(e.getMessage());
      return printUsage(out);
    }

    if (positional.isEmpty()) {
      return printUsage(out);
    }
    String command = positional.get(0).toLowerCase();
    List<String> files = positional.subList(1, positional.size());
    boolean validInvocation = switch (command) {
      case "convert" -> files.size() == 1;
      case "recognize", "run" -> files.size() == 2;
      default -> false;
    };
    if (!validInvocation) {
      return printUsage(out);
    }

    List<StageResult> results = runCommand(command, files, config, out);
    boolean succeeded = true;
    for (StageResult result : results) {
      report(result, out);
      succeeded &= result.succeeded();
    }
    return succeeded ? EXIT_OK : EXIT_FAILED;
  }

  /**
   * Run the stages of a command.
   * @param command - convert, recognize or run
   * @param files - input files of the command
   * @return one result per stage, in execution order
   */
  static List<StageResult> runCommand(String command, List<String> files, PowersetConfig config, PrintStream out) {
    final ConversionStage conversion = new ConversionStage(config, out);
    final RecognitionStage recognition = new RecognitionStage(config, out);
    List<StageResult> results = new ArrayList<>(2);
    switch (command) {
      case "convert" -> {
        out.println("--- Stage 1: NFA to DFA conversion ---");
        results.add(conversion.run(Paths.get(files.get(0))));
      }
      case "recognize" -> {
        out.println("--- Stage 2: word recognition ---");
        results.add(recognition.run(Paths.get(files.get(0)), Paths.get(files.get(1))));
      }
      case "run" -> {
        out.println("--- Stage 1: NFA to DFA conversion ---");
        results.add(conversion.run(Paths.get(files.get(0))));
        out.println();
        out.println("--- Stage 2: word recognition ---");
        // stage 2 reads whatever stage 1 left behind, and reports a missing table itself
        Path dfaTable = conversion.getDfaTablePath();
        results.add(recognition.run(dfaTable, Paths.get(files.get(1))));
      }
      default -> throw new IllegalStateException("Unexpected command: " + command);
    }
    return results;
  }

  private static void report(StageResult result, PrintStream out) {
    out.println(result);
    for (Diagnostic d : result.diagnostics().getEntries()) {
      out.println("  " + d);
    }
  }

  private static String requireValue(String[] args, int i) {
    // Require a value that isn't another flag
    if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
      throw new IllegalArgumentException("Missing value for " + args[i]);
    }
    return args[i + 1];
  }

  private static int printUsage(PrintStream out) {
    out.println(
        "Powerset [--debug] [--out <dir>] [--writeBA <BA output file>] [--epsilon <c>] [--symbols <chars>]"
            + " [--unknown-symbols epsilon|skip] <command> <files>");
    out.println("[--debug] : Additional debug/progress output");
    out.println("[--out <dir>] : Output directory (stage1/ and stage2/ are created below it)");
    out.println("[--writeBA <BA output file>] : Also write the converted DFA in BA format");
    out.println("[--epsilon <c>] : Token for epsilon moves in NFA tables");
    out.println("[--symbols <chars>] : Expected NFA symbols; empty string accepts any single character");
    out.println("[--unknown-symbols epsilon|skip] : Read other symbols as epsilon moves, or skip their lines");
    out.println();
    out.println("<command> : one of the choices below:");
    out.println("  convert <NFA table> : Subset construction; writes the DFA table and DOT renderings.");
    out.println("  recognize <DFA table> <word list> : Decide membership of each word.");
    out.println("  run <NFA table> <word list> : convert, then recognize with the converted DFA.");
    return EXIT_USAGE;
  }
}
