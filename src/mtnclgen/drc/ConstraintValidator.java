package mtnclgen.drc;

import java.util.ArrayList;
import java.util.List;
import mtnclgen.circuit.CircuitGraph;
import mtnclgen.circuit.CircuitNode;
import mtnclgen.circuit.Net;
import mtnclgen.synth.InternalSynthesisError;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Checks candidate circuits against {@link Constraints}. All violations of a candidate are collected, not just the first.
 */
public class ConstraintValidator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Constraints constraints;

  public ConstraintValidator(Constraints constraints) { this.constraints = constraints; }

  public Constraints getConstraints() { return constraints; }

  /**
   * Validates one candidate.
   * @return the violated bounds; empty if the candidate is accepted
   * @throws InternalSynthesisError if the graph is cyclic or not fully connected
   */
  public List<ConstraintViolation> validate(CircuitGraph graph) {
    checkWellFormed(graph);
    List<ConstraintViolation> violations = new ArrayList<>();
    int gates = graph.getGateCount();
    if (gates < constraints.getMinGates())
      violations.add(new ConstraintViolation(ConstraintViolation.Kind.TOO_FEW_GATES,
                                             String.format("%d gates, at least %d required", gates, constraints.getMinGates())));
    constraints.getMaxGates().ifPresent(max -> {
      if (gates > max)
        violations.add(
            new ConstraintViolation(ConstraintViolation.Kind.TOO_MANY_GATES, String.format("%d gates, at most %d allowed", gates, max)));
    });
    constraints.getMaxFanout().ifPresent(max -> {
      for (Net net : graph.getNets()) {
        if (net.isControl())
          continue;
        int fanout = graph.fanout(net.getId());
        if (fanout > max)
          violations.add(new ConstraintViolation(ConstraintViolation.Kind.FANOUT_EXCEEDED,
                                                 String.format("net %s drives %d inputs, at most %d allowed", net.getName(), fanout, max)));
      }
    });
    constraints.getMaxDepth().ifPresent(max -> {
      int depth = graph.depth();
      if (depth > max)
        violations.add(
            new ConstraintViolation(ConstraintViolation.Kind.DEPTH_EXCEEDED, String.format("depth %d, at most %d allowed", depth, max)));
    });
    if (!violations.isEmpty())
      logger.debug("Rejected {}: {}", graph.structuralKey(), violations);
    return violations;
  }

  private static void checkWellFormed(CircuitGraph graph) {
    int netCount = graph.getNets().size();
    int output = graph.getOutputNet();
    if (output < 0 || output >= netCount)
      throw new InternalSynthesisError("Output net " + output + " does not exist");
    if (graph.getNet(output).isControl())
      throw new InternalSynthesisError("Output is driven by the control net " + graph.getNet(output).getName());
    int[] drivers = new int[netCount];
    for (CircuitNode node : graph.getNodes()) {
      if (node.getInputCount() != node.getTemplate().getArity())
        throw new InternalSynthesisError("Gate " + node.getInstanceName() + " has " + node.getInputCount() + " of " +
                                         node.getTemplate().getArity() + " inputs bound");
      for (int in : node.getInputs())
        if (in < 0 || in >= netCount)
          throw new InternalSynthesisError("Gate " + node.getInstanceName() + " reads unknown net " + in);
      if (node.getOutput() < 0 || node.getOutput() >= netCount)
        throw new InternalSynthesisError("Gate " + node.getInstanceName() + " drives unknown net " + node.getOutput());
      ++drivers[node.getOutput()];
    }
    for (Net net : graph.getNets()) {
      int expected = net.getSource() == Net.Source.NODE ? 1 : 0;
      if (drivers[net.getId()] != expected)
        throw new InternalSynthesisError("Net " + net.getName() + " has " + drivers[net.getId()] + " drivers");
    }
    if (!graph.hasReset() && graph.getNodes().stream().anyMatch(node -> node.getTemplate().hasReset()))
      throw new InternalSynthesisError("Gate with reset input but no reset net");
    if (!graph.hasSleep() && graph.getNodes().stream().anyMatch(node -> node.getTemplate().hasSleep()))
      throw new InternalSynthesisError("Gate with sleep input but no sleep net");
    if (!graph.hasSupplySelect() && graph.getNodes().stream().anyMatch(node -> node.getTemplate().hasSupplySelect()))
      throw new InternalSynthesisError("Gate with vdd_sel input but no supply select net");
    if (graph.topologicalOrder().isEmpty())
      throw new InternalSynthesisError("Circuit graph has a cycle");
  }
}
