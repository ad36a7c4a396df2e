package mtnclgen;

import mtnclgen.drc.Constraints;
import mtnclgen.rank.Optimization;
import mtnclgen.synth.SynthesisOptions;

/** Immutable settings of one generation run. */
public final class GenerationOptions {
  public static final int DEFAULT_NUM_CIRCUITS = 1;
  public static final GenerationOptions DEFAULT =
      new GenerationOptions(DEFAULT_NUM_CIRCUITS, Constraints.NONE, Optimization.DEFAULT, SynthesisOptions.DEFAULT);

  private final int numCircuits;
  private final Constraints constraints;
  private final Optimization optimization;
  private final SynthesisOptions synthesis;

  public GenerationOptions(int numCircuits, Constraints constraints, Optimization optimization, SynthesisOptions synthesis) {
    if (numCircuits < 1)
      throw new IllegalArgumentException("num_circuits must be at least 1");
    this.numCircuits = numCircuits;
    this.constraints = constraints;
    this.optimization = optimization;
    this.synthesis = synthesis;
  }

  public int getNumCircuits() { return numCircuits; }
  public Constraints getConstraints() { return constraints; }
  public Optimization getOptimization() { return optimization; }
  public SynthesisOptions getSynthesis() { return synthesis; }

  public GenerationOptions withNumCircuits(int numCircuits) { return new GenerationOptions(numCircuits, constraints, optimization, synthesis); }
}
