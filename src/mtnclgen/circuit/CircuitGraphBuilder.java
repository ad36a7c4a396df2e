package mtnclgen.circuit;

import java.util.ArrayList;
import java.util.List;
import mtnclgen.gatelib.GateTemplate;

/**
 * Incrementally builds a {@link CircuitGraph}. Inputs of a new node must refer to existing nets, so every built graph is acyclic.
 */
public class CircuitGraphBuilder {
  public static final String RESET_NET = "rst";
  public static final String SLEEP_NET = "sleep";
  public static final String SUPPLY_SELECT_NET = "vdd_sel";

  private final List<String> primaryInputs;
  private final List<Net> nets = new ArrayList<>();
  private final List<CircuitNode> nodes = new ArrayList<>();
  private final boolean polymorphic;
  private int resetNet = -1;
  private int sleepNet = -1;
  private int supplySelectNet = -1;
  private int outputNet = -1;

  /** @param primaryInputs variable names in sorted order */
  public CircuitGraphBuilder(List<String> primaryInputs, boolean polymorphic) {
    this.primaryInputs = List.copyOf(primaryInputs);
    this.polymorphic = polymorphic;
    for (String var : this.primaryInputs)
      nets.add(Net.primaryInput(nets.size(), var));
  }

  public int inputNet(String variable) {
    int idx = primaryInputs.indexOf(variable);
    if (idx < 0)
      throw new IllegalArgumentException("No primary input " + variable);
    return idx;
  }

  /**
   * Instantiates a gate.
   * @param inputs net id per input pin
   * @return the id of the new output net
   */
  public int addNode(GateTemplate template, int[] inputs) {
    if (inputs.length != template.getArity())
      throw new IllegalArgumentException("Gate " + template.getName() + " needs " + template.getArity() + " inputs");
    for (int in : inputs)
      if (in < 0 || in >= nets.size())
        throw new IllegalArgumentException("Unknown net " + in);
    if (template.hasReset() && resetNet < 0) {
      resetNet = nets.size();
      nets.add(Net.reset(resetNet, RESET_NET));
    }
    if (template.hasSleep() && sleepNet < 0) {
      sleepNet = nets.size();
      nets.add(Net.sleep(sleepNet, SLEEP_NET));
    }
    if (template.hasSupplySelect() && supplySelectNet < 0) {
      supplySelectNet = nets.size();
      nets.add(Net.supplySelect(supplySelectNet, SUPPLY_SELECT_NET));
    }
    int nodeId = nodes.size();
    int out = nets.size();
    nets.add(Net.nodeOutput(out, "n" + nodeId, nodeId));
    nodes.add(new CircuitNode(nodeId, template.getName().toLowerCase() + "_" + nodeId, template, inputs, out));
    return out;
  }

  public CircuitGraphBuilder setOutput(int net) {
    if (net < 0 || net >= nets.size())
      throw new IllegalArgumentException("Unknown net " + net);
    this.outputNet = net;
    return this;
  }

  public CircuitGraph build() {
    if (outputNet < 0)
      throw new IllegalStateException("Output net not set");
    return new CircuitGraph(primaryInputs, nets, nodes, outputNet, resetNet, sleepNet, supplySelectNet, polymorphic);
  }
}
