package mtnclgen.rank;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import mtnclgen.circuit.CircuitGraph;
import mtnclgen.circuit.CircuitGraphBuilder;
import mtnclgen.gatelib.GateAttributes;
import mtnclgen.gatelib.GateTemplate;
import mtnclgen.gatelib.StandardGates;
import mtnclgen.gatelib.TruthTable;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

class RankerTest {

  static final GateTemplate TH12 = StandardGates.basicCatalog().get("TH12").orElseThrow();
  static final GateTemplate TH13 = StandardGates.basicCatalog().get("TH13").orElseThrow();

  static CircuitGraph single() {
    CircuitGraphBuilder builder = new CircuitGraphBuilder(List.of("A", "B", "C"), false);
    return builder.setOutput(builder.addNode(TH13, new int[] {0, 1, 2})).build();
  }
  static CircuitGraph leftNested() {
    CircuitGraphBuilder builder = new CircuitGraphBuilder(List.of("A", "B", "C"), false);
    int ab = builder.addNode(TH12, new int[] {0, 1});
    return builder.setOutput(builder.addNode(TH12, new int[] {ab, 2})).build();
  }
  static CircuitGraph rightNested() {
    CircuitGraphBuilder builder = new CircuitGraphBuilder(List.of("A", "B", "C"), false);
    int bc = builder.addNode(TH12, new int[] {1, 2});
    return builder.setOutput(builder.addNode(TH12, new int[] {0, bc})).build();
  }

  private static List<CandidateResult> evaluate(List<CircuitGraph> graphs, Optimization optimization) {
    CostEvaluator evaluator = new CostEvaluator(optimization);
    return graphs.stream().map(graph -> evaluator.evaluate(graph, List.of())).collect(Collectors.toList());
  }

  @Test
  void testRankAndDeduplicate() {
    List<CandidateResult> candidates = evaluate(List.of(rightNested(), single(), leftNested(), single()), Optimization.DEFAULT);
    Ranker ranker = new Ranker();
    List<CandidateResult> ranked = ranker.rank(candidates);
    Assertions.assertEquals(3, ranked.size());
    Assertions.assertEquals(1, ranked.get(0).getGateCount());
    Assertions.assertSame(candidates.get(1), ranked.get(0));
    Assertions.assertTrue(ranked.get(1).getStructuralKey().compareTo(ranked.get(2).getStructuralKey()) < 0);
    Assertions.assertEquals(2, ranker.select(ranked, 2).size());
    Assertions.assertEquals(3, ranker.select(ranked, 10).size());
  }

  @RepeatedTest(8)
  void testOrderIsDeterministic() {
    List<CandidateResult> candidates = evaluate(List.of(single(), leftNested(), rightNested()), Optimization.DEFAULT);
    List<String> expected = new Ranker().rank(candidates).stream().map(CandidateResult::getStructuralKey).collect(Collectors.toList());
    List<CandidateResult> shuffled = new ArrayList<>(candidates);
    Collections.shuffle(shuffled, new Random());
    Assertions.assertEquals(expected, new Ranker().rank(shuffled).stream().map(CandidateResult::getStructuralKey).collect(Collectors.toList()));
  }

  @Test
  void testDelayWeight() {
    // a slow single gate loses against two fast gates once delay counts
    GateTemplate slow = GateTemplate.plain("TH13", TruthTable.threshold(1, 1, 1, 1), new GateAttributes(1.0, 10.0, 1.0));
    CircuitGraphBuilder builder = new CircuitGraphBuilder(List.of("A", "B", "C"), false);
    CircuitGraph slowGraph = builder.setOutput(builder.addNode(slow, new int[] {0, 1, 2})).build();
    Optimization delay = new Optimization(Optimization.Target.DELAY, 0.0, 1.0, 0.0);
    List<CandidateResult> ranked = new Ranker().rank(evaluate(List.of(slowGraph, leftNested()), delay));
    Assertions.assertEquals(2, ranked.get(0).getGateCount());
    Assertions.assertEquals(2.0, ranked.get(0).getPrimaryMetric());
    Assertions.assertEquals(10.0, ranked.get(1).getDelayCost());
  }

  @Test
  void testTarget() {
    Assertions.assertEquals(Optimization.Target.POWER, Optimization.Target.fromString("Power"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> Optimization.Target.fromString("speed"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new Optimization(Optimization.Target.AREA, -1, 0, 0));
  }
}
