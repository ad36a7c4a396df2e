package mtnclgen.gatelib;

import java.util.function.IntPredicate;

/**
 * Complete truth table of a boolean function with up to {@link #MAX_ARITY} inputs.
 * Row r assigns input i the value of bit i of r; row r's output is bit r of {@link #getBits()}.
 */
public final class TruthTable {
  public static final int MAX_ARITY = 6;

  private final int arity;
  private final long bits;

  public TruthTable(int arity, long bits) {
    if (arity < 0 || arity > MAX_ARITY)
      throw new IllegalArgumentException("Unsupported truth table arity " + arity);
    this.arity = arity;
    this.bits = bits & mask(arity);
  }

  private static long mask(int arity) {
    int rows = 1 << arity;
    return rows == 64 ? -1L : (1L << rows) - 1;
  }

  /** Builds a table from a predicate over row indices. */
  public static TruthTable of(int arity, IntPredicate function) {
    long bits = 0;
    for (int row = 0; row < (1 << arity); ++row)
      if (function.test(row))
        bits |= 1L << row;
    return new TruthTable(arity, bits);
  }

  /**
   * Builds the table of a threshold gate: the output is 1 iff the weighted count of true inputs reaches the threshold.
   * @param threshold the threshold
   * @param weights one positive weight per input
   */
  public static TruthTable threshold(int threshold, int... weights) {
    return of(weights.length, row -> {
      int sum = 0;
      for (int i = 0; i < weights.length; ++i)
        if (((row >> i) & 1) != 0)
          sum += weights[i];
      return sum >= threshold;
    });
  }

  /** Builds a table from the list of rows with output 1. */
  public static TruthTable fromMinterms(int arity, Iterable<Integer> minterms) {
    long bits = 0;
    for (int row : minterms) {
      if (row < 0 || row >= (1 << arity))
        throw new IllegalArgumentException("Minterm " + row + " out of range for arity " + arity);
      bits |= 1L << row;
    }
    return new TruthTable(arity, bits);
  }

  public int getArity() { return arity; }
  public long getBits() { return bits; }
  public int rows() { return 1 << arity; }

  public boolean get(int row) { return ((bits >> row) & 1) != 0; }

  /** Evaluates the function for the given input values (index = input). */
  public boolean evaluate(boolean[] inputs) {
    if (inputs.length != arity)
      throw new IllegalArgumentException("Expected " + arity + " inputs, got " + inputs.length);
    int row = 0;
    for (int i = 0; i < inputs.length; ++i)
      if (inputs[i])
        row |= 1 << i;
    return get(row);
  }

  /**
   * Returns the function seen when gate pin j is driven by signal pinToSignal[j].
   * The result is a function over the signals: out(signals) = this(pins), pins[j] = signals[pinToSignal[j]].
   */
  public TruthTable permute(int[] pinToSignal) {
    if (pinToSignal.length != arity)
      throw new IllegalArgumentException("Permutation length " + pinToSignal.length + " does not match arity " + arity);
    return of(arity, signalRow -> {
      int pinRow = 0;
      for (int pin = 0; pin < arity; ++pin)
        if (((signalRow >> pinToSignal[pin]) & 1) != 0)
          pinRow |= 1 << pin;
      return get(pinRow);
    });
  }

  /** True if no input assignment yields 1 while a superset assignment yields 0. */
  public boolean isMonotone() {
    for (int row = 0; row < rows(); ++row)
      for (int i = 0; i < arity; ++i)
        if (((row >> i) & 1) == 0 && get(row) && !get(row | (1 << i)))
          return false;
    return true;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(bits) * 31 + arity;
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof TruthTable))
      return false;
    TruthTable other = (TruthTable)obj;
    return arity == other.arity && bits == other.bits;
  }
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (int row = rows() - 1; row >= 0; --row)
      sb.append(get(row) ? '1' : '0');
    return arity + "'b" + sb;
  }
}
