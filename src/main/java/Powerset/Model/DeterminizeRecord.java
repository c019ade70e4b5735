package Powerset.Model;

import java.util.BitSet;

/**
 * Queue entry of the subset construction: an epsilon-closed set of NFA state ids and the registry id of the
 * DFA state standing for it.
 */
public record DeterminizeRecord(BitSet members, int compositeId) {

  @Override
  public String toString() {
    return compositeId + ": " + members;
  }
}
