package mtnclgen.synth;

import mtnclgen.circuit.CircuitGraph;

/** Receives candidate circuits as the search produces them. */
@FunctionalInterface
public interface CandidateSink {
  /** @return false to stop the search */
  boolean accept(CircuitGraph candidate);
}
