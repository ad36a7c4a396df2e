package mtnclgen.frontend;

/**
 * Two expressions of identical shape: node i of the HVDD tree and node i of the LVDD tree are realized by the same gate.
 */
public final class AlignedPair {
  private final Expression hvdd;
  private final Expression lvdd;
  private final boolean rewritten;

  public AlignedPair(Expression hvdd, Expression lvdd, boolean rewritten) {
    if (!hvdd.shape().equals(lvdd.shape()))
      throw new IllegalArgumentException("Expressions are not aligned: " + hvdd.shape() + " vs. " + lvdd.shape());
    this.hvdd = hvdd;
    this.lvdd = lvdd;
    this.rewritten = rewritten;
  }

  public Expression getHvdd() { return hvdd; }
  public Expression getLvdd() { return lvdd; }
  /** True if either expression had to be rewritten to reach the common shape. */
  public boolean isRewritten() { return rewritten; }

  @Override
  public String toString() {
    return "HVDD: " + hvdd + " | LVDD: " + lvdd;
  }
}
