package Powerset.Batch;

import java.nio.file.Path;
import java.util.List;

import Powerset.Model.Diagnostics;

/**
 * Outcome of one batch stage: whether it completed, the files it wrote and what it reported on the way.
 */
public record StageResult(String stage, boolean succeeded, List<Path> outputs, Diagnostics diagnostics) {

  public StageResult {
    outputs = List.copyOf(outputs);
  }

  @Override
  public String toString() {
    return stage + (succeeded ? " succeeded" : " failed") + ": " + outputs.size() + " files written, "
        + diagnostics.getWarnings().size() + " warnings, " + diagnostics.getErrors().size() + " errors";
  }
}
