package mtnclgen.util;

import java.util.List;
import java.util.Map;
import mtnclgen.GenerationOptions;
import mtnclgen.GenerationResult;
import mtnclgen.drc.ConstraintViolation;
import mtnclgen.rank.CandidateResult;
import mtnclgen.synth.NoGateAvailableException;

/** Markdown summary of a generation run. */
public class ReportWriter {
  public String report(GenerationResult result, GenerationOptions options) {
    StringBuilder text = new StringBuilder();
    text.append(result.isPolymorphic() ? "# Polymorphic MTNCL Circuit Generation Results\n\n" : "# MTNCL Circuit Generation Results\n\n");

    text.append("## Configuration\n\n");
    List<String> equations = result.getEquations();
    if (result.isPolymorphic()) {
      text.append("- HVDD function: `").append(equations.get(0)).append("`\n");
      text.append("- LVDD function: `").append(equations.get(1)).append("`\n");
    } else {
      text.append("- Boolean equation: `").append(equations.get(0)).append("`\n");
    }
    text.append("- Requested circuits: ").append(result.getRequested()).append("\n");
    text.append("- Constraints: ").append(options.getConstraints()).append("\n");
    text.append("- Optimization: ").append(options.getOptimization()).append("\n");
    text.append("- Search: ").append(result.getReport()).append("\n\n");

    text.append("## Generated Circuits\n\n");
    if (result.isEmpty())
      text.append("No circuit satisfies the constraints.\n\n");
    int index = 0;
    for (CandidateResult candidate : result.getSelected()) {
      text.append("### Circuit ").append(index++).append("\n\n");
      text.append("| Metric | Value |\n|---|---|\n");
      text.append("| Gate count | ").append(candidate.getGateCount()).append(" |\n");
      text.append("| Depth | ").append(candidate.getDepth()).append(" |\n");
      text.append("| Max fanout | ").append(candidate.getMaxFanout()).append(" |\n");
      text.append(String.format("| Area | %.3f |\n", candidate.getAreaCost()));
      text.append(String.format("| Delay | %.3f |\n", candidate.getDelayCost()));
      text.append(String.format("| Power | %.3f |\n", candidate.getPowerCost()));
      text.append(String.format("| Weighted cost | %.3f |\n\n", candidate.getWeightedCost()));
      text.append(result.isPolymorphic() ? "Polymorphic gates used:\n\n" : "Gates used:\n\n");
      for (Map.Entry<String, Integer> usage : candidate.getGraph().gateUsage().entrySet())
        text.append("- ").append(usage.getKey()).append(": ").append(usage.getValue()).append("\n");
      text.append("\n");
    }

    if (!result.getRejected().isEmpty()) {
      text.append("## Rejected Candidates\n\n");
      for (CandidateResult candidate : result.getRejected()) {
        text.append("- `").append(candidate.getStructuralKey()).append("`");
        for (ConstraintViolation violation : candidate.getViolations())
          text.append("; ").append(violation.getMessage());
        text.append("\n");
      }
      text.append("\n");
    }
    if (!result.getFailures().isEmpty()) {
      text.append("## Unmapped Variants\n\n");
      for (NoGateAvailableException failure : result.getFailures())
        text.append("- ").append(failure.getMessage()).append("\n");
      text.append("\n");
    }
    return text.toString();
  }
}
