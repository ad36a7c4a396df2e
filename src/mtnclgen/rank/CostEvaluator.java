package mtnclgen.rank;

import java.util.List;
import java.util.OptionalDouble;
import java.util.function.Function;
import mtnclgen.circuit.CircuitGraph;
import mtnclgen.circuit.CircuitNode;
import mtnclgen.drc.ConstraintViolation;
import mtnclgen.gatelib.Domain;
import mtnclgen.gatelib.GateAttributes;

/**
 * Computes area, delay and power of a circuit from the gate attributes. Missing attributes count as 1.
 * Area and power are summed over all gates, delay is the largest sum of gate delays along a path to the output.
 * A polymorphic circuit is charged the worse of its two domains per metric.
 */
public class CostEvaluator {
  private final Optimization optimization;

  public CostEvaluator(Optimization optimization) { this.optimization = optimization; }

  public CandidateResult evaluate(CircuitGraph graph, List<ConstraintViolation> violations) {
    double area = 0;
    double delay = 0;
    double power = 0;
    for (Domain domain : domains(graph)) {
      area = Math.max(area, sum(graph, domain, GateAttributes::getArea));
      delay = Math.max(delay, criticalPath(graph, domain));
      power = Math.max(power, sum(graph, domain, GateAttributes::getPower));
    }
    return new CandidateResult(graph, area, delay, power, optimization, violations);
  }

  private static List<Domain> domains(CircuitGraph graph) {
    return graph.isPolymorphic() ? List.of(Domain.HVDD, Domain.LVDD) : List.of(Domain.HVDD);
  }

  private static double sum(CircuitGraph graph, Domain domain, Function<GateAttributes, OptionalDouble> attribute) {
    double total = 0;
    for (CircuitNode node : graph.getNodes())
      total += attribute.apply(node.getTemplate().getAttributes(domain)).orElse(1.0);
    return total;
  }

  private static double criticalPath(CircuitGraph graph, Domain domain) {
    double[] arrival = new double[graph.getNets().size()];
    for (CircuitNode node : graph.topologicalOrder().orElseThrow(() -> new IllegalStateException("Circuit graph is not acyclic"))) {
      double latest = 0;
      for (int in : node.getInputs())
        latest = Math.max(latest, arrival[in]);
      arrival[node.getOutput()] = latest + node.getTemplate().getAttributes(domain).getDelay().orElse(1.0);
    }
    return arrival[graph.getOutputNet()];
  }
}
