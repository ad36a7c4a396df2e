package mtnclgen.synth;

/**
 * Bounds one synthesis run.
 * maxBranches limits the number of complete covers built, timeLimitMs the wall clock time (0 for none).
 */
public final class SearchBudget {
  public static final int DEFAULT_MAX_BRANCHES = 20000;
  public static final SearchBudget DEFAULT = new SearchBudget(DEFAULT_MAX_BRANCHES, 0);

  private final int maxBranches;
  private final long timeLimitMs;

  public SearchBudget(int maxBranches, long timeLimitMs) {
    if (maxBranches <= 0)
      throw new IllegalArgumentException("max_branches must be positive");
    if (timeLimitMs < 0)
      throw new IllegalArgumentException("time_limit_ms must not be negative");
    this.maxBranches = maxBranches;
    this.timeLimitMs = timeLimitMs;
  }

  public int getMaxBranches() { return maxBranches; }
  public long getTimeLimitMs() { return timeLimitMs; }

  /** Wall clock deadline of a run started at startMillis, {@link Long#MAX_VALUE} without a time limit. */
  public long deadlineFrom(long startMillis) { return timeLimitMs > 0 ? startMillis + timeLimitMs : Long.MAX_VALUE; }

  @Override
  public String toString() {
    return "SearchBudget[" + maxBranches + " branches" + (timeLimitMs > 0 ? ", " + timeLimitMs + " ms" : "") + "]";
  }
}
