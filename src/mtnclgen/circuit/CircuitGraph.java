package mtnclgen.circuit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import mtnclgen.gatelib.Domain;

/**
 * Directed graph of gate instances. Nets and nodes are held in arrays and referenced by integer id.
 * Primary input nets come first (sorted variable order), then node outputs in creation order. The shared control nets (reset,
 * sleep, supply select), if any, are inserted when the first gate with the matching pin is added.
 */
public class CircuitGraph {
  private final List<String> primaryInputs;
  private final List<Net> nets;
  private final List<CircuitNode> nodes;
  private final int outputNet;
  private final int resetNet;
  private final int sleepNet;
  private final int supplySelectNet;
  private final boolean polymorphic;

  private final int[] fanout;
  private String structuralKey = null;

  public CircuitGraph(List<String> primaryInputs, List<Net> nets, List<CircuitNode> nodes, int outputNet, int resetNet,
                      boolean polymorphic) {
    this(primaryInputs, nets, nodes, outputNet, resetNet, -1, -1, polymorphic);
  }

  public CircuitGraph(List<String> primaryInputs, List<Net> nets, List<CircuitNode> nodes, int outputNet, int resetNet, int sleepNet,
                      int supplySelectNet, boolean polymorphic) {
    this.primaryInputs = List.copyOf(primaryInputs);
    this.nets = List.copyOf(nets);
    this.nodes = List.copyOf(nodes);
    this.outputNet = outputNet;
    this.resetNet = resetNet;
    this.sleepNet = sleepNet;
    this.supplySelectNet = supplySelectNet;
    this.polymorphic = polymorphic;
    this.fanout = new int[nets.size()];
    for (CircuitNode node : nodes)
      for (int in : node.getInputs())
        if (in >= 0 && in < fanout.length)
          ++fanout[in];
  }

  public List<String> getPrimaryInputs() { return primaryInputs; }
  public List<Net> getNets() { return nets; }
  public Net getNet(int id) { return nets.get(id); }
  public List<CircuitNode> getNodes() { return nodes; }
  public CircuitNode getNode(int id) { return nodes.get(id); }
  public int getGateCount() { return nodes.size(); }
  public int getOutputNet() { return outputNet; }
  /** The shared reset net, or -1 if no gate has a reset input. */
  public int getResetNet() { return resetNet; }
  public boolean hasReset() { return resetNet >= 0; }
  /** The shared sleep net, or -1 if no gate has a sleep input. */
  public int getSleepNet() { return sleepNet; }
  public boolean hasSleep() { return sleepNet >= 0; }
  /** The shared supply select net, or -1 if no gate has a vdd_sel input. */
  public int getSupplySelectNet() { return supplySelectNet; }
  public boolean hasSupplySelect() { return supplySelectNet >= 0; }
  public boolean isPolymorphic() { return polymorphic; }
  /** Net id of the primary input for the given variable. */
  public int getInputNet(String variable) {
    int idx = primaryInputs.indexOf(variable);
    if (idx < 0)
      throw new IllegalArgumentException("No primary input " + variable);
    return idx;
  }

  /** Number of gate input pins the net drives. Control pins are not counted. */
  public int fanout(int net) { return fanout[net]; }

  /** Largest fanout over all nets except the control nets. */
  public int maxFanout() {
    int max = 0;
    for (int net = 0; net < fanout.length; ++net)
      if (!nets.get(net).isControl())
        max = Math.max(max, fanout[net]);
    return max;
  }

  /**
   * Nodes ordered so that each node comes after the producers of its inputs.
   * @return empty if the graph has a cycle or a pin is bound to a net that does not exist
   */
  public Optional<List<CircuitNode>> topologicalOrder() {
    int[] pending = new int[nodes.size()];
    List<List<Integer>> consumers = new ArrayList<>();
    for (int i = 0; i < nets.size(); ++i)
      consumers.add(new ArrayList<>());
    for (CircuitNode node : nodes) {
      for (int in : node.getInputs()) {
        if (in < 0 || in >= nets.size())
          return Optional.empty();
        if (nets.get(in).getSource() == Net.Source.NODE) {
          ++pending[node.getId()];
          consumers.get(in).add(node.getId());
        }
      }
    }
    Deque<Integer> ready = new ArrayDeque<>();
    for (CircuitNode node : nodes)
      if (pending[node.getId()] == 0)
        ready.add(node.getId());
    List<CircuitNode> order = new ArrayList<>();
    while (!ready.isEmpty()) {
      CircuitNode node = nodes.get(ready.poll());
      order.add(node);
      for (int consumer : consumers.get(node.getOutput()))
        if (--pending[consumer] == 0)
          ready.add(consumer);
    }
    if (order.size() != nodes.size())
      return Optional.empty();
    return Optional.of(order);
  }

  private List<CircuitNode> orderOrFail() {
    return topologicalOrder().orElseThrow(() -> new IllegalStateException("Circuit graph is not acyclic"));
  }

  /** Number of gates on the longest path from any primary input to the output. */
  public int depth() {
    int[] level = new int[nets.size()];
    for (CircuitNode node : orderOrFail()) {
      int max = 0;
      for (int in : node.getInputs())
        max = Math.max(max, level[in]);
      level[node.getOutput()] = max + 1;
    }
    return level[outputNet];
  }

  /**
   * Evaluates the circuit in a domain with reset and sleep released.
   * @param inputs value per primary input variable
   */
  public boolean evaluate(Domain domain, Map<String, Boolean> inputs) { return evaluate(domain, inputs, false, false); }

  public boolean evaluate(Domain domain, Map<String, Boolean> inputs, boolean reset) { return evaluate(domain, inputs, reset, false); }

  /**
   * Evaluates the circuit in a domain. The supply select net carries 1 in HVDD and 0 in LVDD.
   * @param reset value of the reset net
   * @param sleep value of the sleep net; gates with a sleep input output 0 while it is asserted
   */
  public boolean evaluate(Domain domain, Map<String, Boolean> inputs, boolean reset, boolean sleep) {
    boolean[] value = new boolean[nets.size()];
    for (int i = 0; i < primaryInputs.size(); ++i) {
      Boolean v = inputs.get(primaryInputs.get(i));
      if (v == null)
        throw new IllegalArgumentException("No value for input " + primaryInputs.get(i));
      value[i] = v;
    }
    if (resetNet >= 0)
      value[resetNet] = reset;
    if (sleepNet >= 0)
      value[sleepNet] = sleep;
    if (supplySelectNet >= 0)
      value[supplySelectNet] = domain == Domain.HVDD;
    for (CircuitNode node : orderOrFail()) {
      boolean[] pins = new boolean[node.getInputCount()];
      for (int pin = 0; pin < pins.length; ++pin)
        pins[pin] = value[node.getInput(pin)];
      value[node.getOutput()] = node.getTemplate().evaluate(domain, pins, reset, sleep);
    }
    return value[outputNet];
  }

  /**
   * Canonical text that is equal for structurally identical circuits regardless of node creation order.
   * A net is labelled by its variable or by the gate driving it applied to the labels of its inputs.
   */
  public String structuralKey() {
    if (structuralKey != null)
      return structuralKey;
    String[] label = new String[nets.size()];
    for (Net net : nets)
      if (net.getSource() != Net.Source.NODE)
        label[net.getId()] = (net.isPrimaryInput() ? "var:" : "ctl:") + net.getName();
    List<String> nodeLabels = new ArrayList<>();
    for (CircuitNode node : orderOrFail()) {
      StringBuilder sb = new StringBuilder(node.getTemplate().getName()).append('(');
      int[] inputs = node.getInputs();
      for (int pin = 0; pin < inputs.length; ++pin)
        sb.append(pin == 0 ? "" : ",").append(label[inputs[pin]]);
      label[node.getOutput()] = sb.append(')').toString();
      nodeLabels.add(label[node.getOutput()]);
    }
    Collections.sort(nodeLabels);
    structuralKey = String.join(";", nodeLabels) + "=>" + label[outputNet];
    return structuralKey;
  }

  /** Number of instances per template name. */
  public Map<String, Integer> gateUsage() {
    Map<String, Integer> usage = new TreeMap<>();
    for (CircuitNode node : nodes)
      usage.merge(node.getTemplate().getName(), 1, Integer::sum);
    return usage;
  }

  @Override
  public String toString() {
    return "CircuitGraph[" + nodes.size() + " gates, out " + nets.get(outputNet).getName() + "]";
  }
}
