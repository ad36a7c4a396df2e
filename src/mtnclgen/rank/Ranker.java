package mtnclgen.rank;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Orders accepted candidates by cost. The order is total, so equal inputs always rank identically. */
public class Ranker {
  public static final Comparator<CandidateResult> ORDER = Comparator.comparingDouble(CandidateResult::getWeightedCost)
                                                              .thenComparingInt(CandidateResult::getGateCount)
                                                              .thenComparingInt(CandidateResult::getDepth)
                                                              .thenComparing(CandidateResult::getStructuralKey);

  /** Drops structural duplicates (first one seen is kept) and sorts the rest. */
  public List<CandidateResult> rank(List<CandidateResult> candidates) {
    Set<String> seen = new HashSet<>();
    List<CandidateResult> out = new ArrayList<>();
    for (CandidateResult candidate : candidates)
      if (seen.add(candidate.getStructuralKey()))
        out.add(candidate);
    out.sort(ORDER);
    return out;
  }

  /** The first n ranked candidates. */
  public List<CandidateResult> select(List<CandidateResult> ranked, int n) {
    return new ArrayList<>(ranked.subList(0, Math.min(n, ranked.size())));
  }
}
