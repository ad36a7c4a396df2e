package mtnclgen.rank;

import java.util.List;
import mtnclgen.circuit.CircuitGraph;
import mtnclgen.drc.ConstraintViolation;

/** A candidate circuit with its metrics and validation verdict. */
public final class CandidateResult {
  private final CircuitGraph graph;
  private final int gateCount;
  private final int maxFanout;
  private final int depth;
  private final double areaCost;
  private final double delayCost;
  private final double powerCost;
  private final double weightedCost;
  private final Optimization.Target target;
  private final List<ConstraintViolation> violations;

  public CandidateResult(CircuitGraph graph, double areaCost, double delayCost, double powerCost, Optimization optimization,
                         List<ConstraintViolation> violations) {
    this.graph = graph;
    this.gateCount = graph.getGateCount();
    this.maxFanout = graph.maxFanout();
    this.depth = graph.depth();
    this.areaCost = areaCost;
    this.delayCost = delayCost;
    this.powerCost = powerCost;
    this.weightedCost = optimization.weigh(areaCost, delayCost, powerCost);
    this.target = optimization.getTarget();
    this.violations = List.copyOf(violations);
  }

  public CircuitGraph getGraph() { return graph; }
  public int getGateCount() { return gateCount; }
  public int getMaxFanout() { return maxFanout; }
  public int getDepth() { return depth; }
  public double getAreaCost() { return areaCost; }
  public double getDelayCost() { return delayCost; }
  public double getPowerCost() { return powerCost; }
  public double getWeightedCost() { return weightedCost; }
  public Optimization.Target getTarget() { return target; }
  public String getStructuralKey() { return graph.structuralKey(); }

  /** The metric named by the optimization target. */
  public double getPrimaryMetric() {
    switch (target) {
    case DELAY:
      return delayCost;
    case POWER:
      return powerCost;
    default:
      return areaCost;
    }
  }

  public boolean isValid() { return violations.isEmpty(); }
  public List<ConstraintViolation> getViolations() { return violations; }

  @Override
  public String toString() {
    return String.format("%d gates, depth %d, cost %.3f: %s", gateCount, depth, weightedCost, graph.structuralKey());
  }
}
