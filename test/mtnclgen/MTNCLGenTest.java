package mtnclgen;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import mtnclgen.drc.ConstraintViolation;
import mtnclgen.drc.Constraints;
import mtnclgen.frontend.AlignmentException;
import mtnclgen.frontend.EquationSyntaxException;
import mtnclgen.frontend.Expression;
import mtnclgen.gatelib.Domain;
import mtnclgen.gatelib.StandardGates;
import mtnclgen.rank.CandidateResult;
import mtnclgen.rank.Optimization;
import mtnclgen.synth.GatePreferences;
import mtnclgen.synth.PolymorphicOptions;
import mtnclgen.synth.SearchBudget;
import mtnclgen.synth.SynthesisOptions;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class MTNCLGenTest {

  private static GenerationOptions options(int numCircuits, Constraints constraints) {
    return new GenerationOptions(numCircuits, constraints, Optimization.DEFAULT, SynthesisOptions.DEFAULT);
  }

  @Test
  void testSingleAnd() throws Exception {
    GenerationResult result = new MTNCLGen(StandardGates.basicCatalog(), options(5, Constraints.NONE)).generate("A & B");
    Assertions.assertEquals(1, result.getSelected().size());
    CandidateResult best = result.getSelected().get(0);
    Assertions.assertEquals(Map.of("TH22", 1), best.getGraph().gateUsage());
    Assertions.assertEquals(1, best.getDepth());
    Assertions.assertEquals(5, result.getRequested());
    Assertions.assertEquals(1, result.getFound());
    Assertions.assertFalse(result.isTruncated());
  }

  @Test
  void testThreeInputOr() throws Exception {
    GenerationResult result = new MTNCLGen(StandardGates.basicCatalog(), options(3, Constraints.NONE)).generate("A + B + C");
    List<CandidateResult> selected = result.getSelected();
    Assertions.assertEquals(3, selected.size());
    Assertions.assertEquals(Map.of("TH13", 1), selected.get(0).getGraph().gateUsage());
    Assertions.assertEquals(1.0, selected.get(0).getWeightedCost());
    for (CandidateResult other : selected.subList(1, 3)) {
      Assertions.assertEquals(Map.of("TH12", 2), other.getGraph().gateUsage());
      Assertions.assertEquals(2, other.getDepth());
    }
    Assertions.assertNotEquals(selected.get(1).getStructuralKey(), selected.get(2).getStructuralKey());
  }

  @Test
  void testStopsAtRequestedCount() throws Exception {
    GenerationResult result = new MTNCLGen(StandardGates.basicCatalog(), options(1, Constraints.NONE)).generate("A + B + C");
    Assertions.assertEquals(1, result.getSelected().size());
    Assertions.assertTrue(result.getReport().isStoppedBySink());
  }

  @Test
  void testPolymorphic() throws Exception {
    GenerationOptions opts = new GenerationOptions(
        3, Constraints.NONE, Optimization.DEFAULT,
        new SynthesisOptions(GatePreferences.NONE, new PolymorphicOptions(true, true, List.of("TH12m_TH22m"), List.of()),
                             SearchBudget.DEFAULT));
    GenerationResult result = new MTNCLGen(StandardGates.catalog(), opts).generatePolymorphic("A + B", "A & B");
    Assertions.assertTrue(result.isPolymorphic());
    Assertions.assertEquals(1, result.getSelected().size());
    CandidateResult best = result.getSelected().get(0);
    Assertions.assertEquals(Map.of("TH12m_TH22m", 1), best.getGraph().gateUsage());
    for (int row = 0; row < 4; ++row) {
      Map<String, Boolean> in = Expression.assignmentForRow(List.of("A", "B"), row);
      Assertions.assertEquals(in.get("A") || in.get("B"), best.getGraph().evaluate(Domain.HVDD, in));
      Assertions.assertEquals(in.get("A") && in.get("B"), best.getGraph().evaluate(Domain.LVDD, in));
    }
  }

  @Test
  void testPolymorphicAlignment() throws Exception {
    GenerationResult result =
        new MTNCLGen(StandardGates.catalog(), options(2, Constraints.NONE)).generatePolymorphic("(A + B) + C", "A & B & C");
    Assertions.assertEquals(List.of("(A + B) + C", "(A & B) & C"), result.getEquations());
    Assertions.assertFalse(result.isEmpty());
  }

  @Test
  void testSyntaxErrorPropagates() {
    MTNCLGen gen = new MTNCLGen(StandardGates.catalog(), GenerationOptions.DEFAULT);
    Assertions.assertThrows(EquationSyntaxException.class, () -> gen.generate("A & !B"));
    Assertions.assertThrows(EquationSyntaxException.class, () -> gen.generatePolymorphic("A + B", "A & ~B"));
    Assertions.assertThrows(AlignmentException.class, () -> gen.generatePolymorphic("A + B", "A & C"));
  }

  @Test
  void testFanoutRejectsEverything() throws Exception {
    GenerationResult result =
        new MTNCLGen(StandardGates.catalog(), options(3, new Constraints(0, null, 1, null))).generate("(A ^ B) & (A ^ C) & (A ^ D)");
    Assertions.assertTrue(result.isEmpty());
    Assertions.assertEquals(0, result.getFound());
    Assertions.assertFalse(result.getRejected().isEmpty());
    for (CandidateResult rejected : result.getRejected())
      Assertions.assertTrue(rejected.getViolations().stream().anyMatch(v -> v.getKind() == ConstraintViolation.Kind.FANOUT_EXCEEDED));
  }

  @Test
  void testGateBounds() throws Exception {
    GenerationResult result = new MTNCLGen(StandardGates.basicCatalog(), options(3, new Constraints(2, null, null, null))).generate("A + B + C");
    Assertions.assertEquals(2, result.getSelected().size());
    result.getSelected().forEach(candidate -> Assertions.assertEquals(2, candidate.getGateCount()));
    Assertions.assertEquals(1, result.getRejected().size());
  }

  @Test
  void testDeterministic() throws Exception {
    MTNCLGen gen = new MTNCLGen(StandardGates.catalog(), options(5, Constraints.NONE));
    GenerationResult first = gen.generate("(A + B) & (C + D) + A & C");
    GenerationResult second = gen.generate("(A + B) & (C + D) + A & C");
    Assertions.assertEquals(first.getSelected().size(), second.getSelected().size());
    for (int i = 0; i < first.getSelected().size(); ++i)
      Assertions.assertEquals(first.getSelected().get(i).getStructuralKey(), second.getSelected().get(i).getStructuralKey());
  }

  @Test
  void testLongChainRespectsTimeLimit() {
    GenerationOptions opts = new GenerationOptions(1, Constraints.NONE, Optimization.DEFAULT,
                                                   new SynthesisOptions(GatePreferences.NONE, PolymorphicOptions.DEFAULT, new SearchBudget(100, 2000)));
    MTNCLGen gen = new MTNCLGen(StandardGates.catalog(), opts);
    GenerationResult result = Assertions.assertTimeoutPreemptively(
        Duration.ofSeconds(30), () -> gen.generate("((A+B+C)+(D+E+F)+(G+H+I))+((J+K+L)+(M+N+O)+(P+Q+R))"));
    Assertions.assertTrue(result.getFound() == 1 || result.isTruncated());
    result.getSelected().forEach(candidate -> Assertions.assertEquals(18, candidate.getGraph().getPrimaryInputs().size()));
  }
}
