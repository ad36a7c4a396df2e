package mtnclgen;

import java.util.List;
import mtnclgen.rank.CandidateResult;
import mtnclgen.synth.NoGateAvailableException;
import mtnclgen.synth.SynthesisReport;

/** Outcome of one generation run. */
public final class GenerationResult {
  private final List<String> equations;
  private final boolean polymorphic;
  private final List<CandidateResult> selected;
  private final List<CandidateResult> rejected;
  private final SynthesisReport report;
  private final int requested;
  private final int found;

  public GenerationResult(List<String> equations, boolean polymorphic, List<CandidateResult> selected, List<CandidateResult> rejected,
                          SynthesisReport report, int requested, int found) {
    this.equations = List.copyOf(equations);
    this.polymorphic = polymorphic;
    this.selected = List.copyOf(selected);
    this.rejected = List.copyOf(rejected);
    this.report = report;
    this.requested = requested;
    this.found = found;
  }

  /** The input equation, or the HVDD and LVDD equations as mapped after alignment. */
  public List<String> getEquations() { return equations; }
  public boolean isPolymorphic() { return polymorphic; }
  /** Accepted candidates in rank order, at most the requested number. */
  public List<CandidateResult> getSelected() { return selected; }
  /** Distinct candidates that violated a constraint, in discovery order. */
  public List<CandidateResult> getRejected() { return rejected; }
  public List<NoGateAvailableException> getFailures() { return report.getFailures(); }
  public SynthesisReport getReport() { return report; }
  public boolean isTruncated() { return report.isTruncated(); }
  public int getRequested() { return requested; }
  /** Number of distinct accepted candidates found. */
  public int getFound() { return found; }
  public boolean isEmpty() { return selected.isEmpty(); }

  @Override
  public String toString() {
    return String.format("%d of %d circuits (%d rejected, %s)", selected.size(), requested, rejected.size(), report);
  }
}
