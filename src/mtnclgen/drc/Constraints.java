package mtnclgen.drc;

import java.util.OptionalInt;

/** Structural bounds on accepted circuits. Absent upper bounds are unbounded. */
public final class Constraints {
  public static final Constraints NONE = new Constraints(0, null, null, null);

  private final int minGates;
  private final Integer maxGates;
  private final Integer maxFanout;
  private final Integer maxDepth;

  public Constraints(int minGates, Integer maxGates, Integer maxFanout, Integer maxDepth) {
    if (minGates < 0)
      throw new IllegalArgumentException("min_gates must not be negative");
    if (maxGates != null && maxGates < minGates)
      throw new IllegalArgumentException("max_gates " + maxGates + " is below min_gates " + minGates);
    if (maxFanout != null && maxFanout < 1)
      throw new IllegalArgumentException("max_fanout must be at least 1");
    if (maxDepth != null && maxDepth < 0)
      throw new IllegalArgumentException("max_depth must not be negative");
    this.minGates = minGates;
    this.maxGates = maxGates;
    this.maxFanout = maxFanout;
    this.maxDepth = maxDepth;
  }

  public int getMinGates() { return minGates; }
  public OptionalInt getMaxGates() { return maxGates == null ? OptionalInt.empty() : OptionalInt.of(maxGates); }
  public OptionalInt getMaxFanout() { return maxFanout == null ? OptionalInt.empty() : OptionalInt.of(maxFanout); }
  public OptionalInt getMaxDepth() { return maxDepth == null ? OptionalInt.empty() : OptionalInt.of(maxDepth); }

  @Override
  public String toString() {
    return String.format("min_gates=%d max_gates=%s max_fanout=%s max_depth=%s", minGates, maxGates, maxFanout, maxDepth);
  }
}
