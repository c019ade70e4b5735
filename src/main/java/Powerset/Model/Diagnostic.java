package Powerset.Model;

/**
 * One entry of the diagnostics channel.
 * @param severity - WARNING for recoverable problems, ERROR for ones that aborted a stage
 * @param line - 1-based input line, or NO_LINE
 * @param message - human-readable description
 */
public record Diagnostic(Severity severity, int line, String message) {
  public static final int NO_LINE = -1;

  public enum Severity { WARNING, ERROR }

  @Override
  public String toString() {
    return line == NO_LINE ? severity + ": " + message : severity + " (line " + line + "): " + message;
  }
}
