package mtnclgen.synth;

import java.util.List;

/** Summary of one synthesis run. */
public final class SynthesisReport {
  private final int variants;
  private final int branches;
  private final boolean truncated;
  private final boolean stoppedBySink;
  private final List<NoGateAvailableException> failures;

  public SynthesisReport(int variants, int branches, boolean truncated, boolean stoppedBySink, List<NoGateAvailableException> failures) {
    this.variants = variants;
    this.branches = branches;
    this.truncated = truncated;
    this.stoppedBySink = stoppedBySink;
    this.failures = List.copyOf(failures);
  }

  /** Number of regrouping variants searched. */
  public int getVariants() { return variants; }
  /** Number of complete covers built. */
  public int getBranches() { return branches; }
  /** True if the search budget ended the run before the search space was exhausted. */
  public boolean isTruncated() { return truncated; }
  public boolean isStoppedBySink() { return stoppedBySink; }
  /** One entry per regrouping variant that could not be covered. */
  public List<NoGateAvailableException> getFailures() { return failures; }

  @Override
  public String toString() {
    return String.format("%d variants, %d covers%s%s, %d failed variants", variants, branches, truncated ? ", truncated" : "",
                         stoppedBySink ? ", stopped" : "", failures.size());
  }
}
