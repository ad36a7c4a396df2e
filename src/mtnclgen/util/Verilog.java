package mtnclgen.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import mtnclgen.circuit.CircuitGraph;
import mtnclgen.circuit.CircuitGraphBuilder;
import mtnclgen.circuit.CircuitNode;
import mtnclgen.circuit.Net;
import mtnclgen.frontend.Expression;
import mtnclgen.gatelib.Domain;
import mtnclgen.gatelib.GateTemplate;

/**
 * Emits structural Verilog for circuit graphs: one instance per gate, pins named after the gate template pins.
 */
public class Verilog {
  public String tab = "    ";
  public String timescale = "`timescale 1ns/1ps";

  /** Name of the output port; Z unless an input already uses that name. */
  public static String outputPort(CircuitGraph graph) {
    String name = GateTemplate.OUTPUT_PIN;
    while (graph.getPrimaryInputs().contains(name))
      name += "_o";
    return name;
  }

  /** Global MTNCL control inputs of the module: sleep always, rst and vdd_sel where a gate uses them. */
  public static List<String> controlPorts(CircuitGraph graph) {
    List<String> ports = new ArrayList<>();
    ports.add(graph.hasSleep() ? graph.getNet(graph.getSleepNet()).getName() : CircuitGraphBuilder.SLEEP_NET);
    if (graph.hasReset())
      ports.add(graph.getNet(graph.getResetNet()).getName());
    if (graph.hasSupplySelect())
      ports.add(graph.getNet(graph.getSupplySelectNet()).getName());
    return ports;
  }

  /** Structural netlist module. */
  public String netlist(CircuitGraph graph, String moduleName) {
    StringBuilder text = new StringBuilder();
    text.append(timescale).append("\n\n");
    text.append("module ").append(moduleName).append(" (\n");
    List<String> ports = new ArrayList<>();
    for (String control : controlPorts(graph))
      ports.add(tab + "input wire " + control);
    for (String input : graph.getPrimaryInputs())
      ports.add(tab + "input wire " + input);
    ports.add(tab + "output wire " + outputPort(graph));
    text.append(String.join(",\n", ports)).append("\n);\n\n");

    List<String> wires = new ArrayList<>();
    for (Net net : graph.getNets())
      if (net.getSource() == Net.Source.NODE)
        wires.add(net.getName());
    if (!wires.isEmpty()) {
      text.append(tab).append("// Internal wires\n");
      for (String wire : wires)
        text.append(tab).append("wire ").append(wire).append(";\n");
      text.append("\n");
    }

    if (graph.getGateCount() > 0)
      text.append(tab).append("// Gate instantiations\n");
    for (CircuitNode node : graph.getNodes())
      text.append(CreateInstance(graph, node));
    text.append(CreateAssign(outputPort(graph), graph.getNet(graph.getOutputNet()).getName()));
    text.append("endmodule\n");
    return text.toString();
  }

  private String CreateInstance(CircuitGraph graph, CircuitNode node) {
    GateTemplate template = node.getTemplate();
    List<String> connections = new ArrayList<>();
    if (template.hasSupplySelect())
      connections.add(CreateConnection(GateTemplate.SUPPLY_SELECT_PIN, graph.getNet(graph.getSupplySelectNet()).getName()));
    if (template.hasSleep())
      connections.add(CreateConnection(GateTemplate.SLEEP_PIN, graph.getNet(graph.getSleepNet()).getName()));
    for (int pin = 0; pin < node.getInputCount(); ++pin)
      connections.add(CreateConnection(GateTemplate.inputPinName(pin), graph.getNet(node.getInput(pin)).getName()));
    if (template.hasReset())
      connections.add(CreateConnection(GateTemplate.RESET_PIN, graph.getNet(graph.getResetNet()).getName()));
    connections.add(CreateConnection(GateTemplate.OUTPUT_PIN, graph.getNet(node.getOutput()).getName()));
    return tab + template.getName() + " " + node.getInstanceName() + " (\n" + String.join(",\n", connections) + "\n" + tab + ");\n\n";
  }

  private String CreateConnection(String pin, String net) { return tab + tab + "." + pin + "(" + net + ")"; }

  public String CreateAssign(String assigSig, String toAssign) { return tab + "assign " + assigSig + " = " + toAssign + ";\n"; }

  /**
   * Self-checking testbench that applies every input vector and compares the output against the graph's function.
   * With two domains, the parameter LVDD selects the domain: it drives vdd_sel and chooses the expected values.
   * Circuits with sleep gates are also checked to output NULL (0) while sleep is asserted.
   */
  public String testbench(CircuitGraph graph, String moduleName, List<Domain> domains) {
    List<String> inputs = graph.getPrimaryInputs();
    List<String> controls = controlPorts(graph);
    String out = outputPort(graph);
    String sleep = controls.get(0);
    String reset = graph.hasReset() ? graph.getNet(graph.getResetNet()).getName() : null;
    String supplySelect = graph.hasSupplySelect() ? graph.getNet(graph.getSupplySelectNet()).getName() : null;
    StringBuilder text = new StringBuilder();
    text.append(timescale).append("\n\n");
    text.append("module ").append(moduleName).append("_tb;\n");
    if (domains.size() > 1)
      text.append(tab).append("// 0: HVDD operation, 1: LVDD operation\n").append(tab).append("parameter LVDD = 0;\n\n");
    for (String control : controls)
      text.append(tab).append("reg ").append(control).append(";\n");
    for (String input : inputs)
      text.append(tab).append("reg ").append(input).append(";\n");
    text.append(tab).append("wire ").append(out).append(";\n");
    text.append(tab).append("integer errors;\n\n");

    List<String> connections = new ArrayList<>();
    for (String control : controls)
      connections.add(CreateConnection(control, control));
    for (String input : inputs)
      connections.add(CreateConnection(input, input));
    connections.add(CreateConnection(out, out));
    text.append(tab).append(moduleName).append(" uut (\n").append(String.join(",\n", connections)).append("\n").append(tab).append(");\n\n");

    StringBuilder formats = new StringBuilder();
    StringBuilder args = new StringBuilder();
    for (String input : inputs) {
      formats.append(input).append("=%b ");
      args.append(", ").append(input);
    }
    text.append(tab).append("task check;\n");
    text.append(tab).append(tab).append("input expected;\n");
    text.append(tab).append(tab).append("begin\n");
    text.append(tab).append(tab).append(tab).append("#10;\n");
    text.append(tab).append(tab).append(tab).append("if (").append(out).append(" !== expected) begin\n");
    text.append(tab).append(tab).append(tab).append(tab).append("$display(\"MISMATCH: ").append(formats).append(out)
        .append("=%b expected %b\"").append(args).append(", ").append(out).append(", expected);\n");
    text.append(tab).append(tab).append(tab).append(tab).append("errors = errors + 1;\n");
    text.append(tab).append(tab).append(tab).append("end\n");
    text.append(tab).append(tab).append("end\n");
    text.append(tab).append("endtask\n\n");

    text.append(tab).append("initial begin\n");
    text.append(tab).append(tab).append("errors = 0;\n");
    text.append(tab).append(tab).append(sleep).append(" = 1;\n");
    if (reset != null)
      text.append(tab).append(tab).append(reset).append(" = 1;\n");
    text.append(tab).append(tab).append("#10;\n");
    if (reset != null)
      text.append(tab).append(tab).append(reset).append(" = 0;\n");
    text.append(tab).append(tab).append(sleep).append(" = 0;\n");
    String vector = "{" + String.join(", ", reversed(inputs)) + "}";
    String indent = tab + tab;
    for (int d = 0; d < domains.size(); ++d) {
      Domain domain = domains.get(d);
      if (domains.size() > 1) {
        text.append(tab).append(tab).append(d == 0 ? "if (LVDD == 0) begin\n" : "else begin\n");
        indent = tab + tab + tab;
      }
      if (supplySelect != null)
        text.append(indent).append(supplySelect).append(" = 1'b").append(domain == Domain.HVDD ? 1 : 0).append(";\n");
      Map<String, Boolean> assignment = null;
      for (int row = 0; row < (1 << inputs.size()); ++row) {
        assignment = Expression.assignmentForRow(inputs, row);
        boolean expected = graph.evaluate(domain, assignment);
        text.append(indent).append(vector).append(" = ").append(inputs.size()).append("'b").append(bits(row, inputs.size()))
            .append("; check(1'b").append(expected ? 1 : 0).append(");\n");
      }
      if (graph.hasSleep()) {
        text.append(indent).append(sleep).append(" = 1; check(1'b").append(graph.evaluate(domain, assignment, false, true) ? 1 : 0)
            .append(");\n");
        text.append(indent).append(sleep).append(" = 0;\n");
      }
      if (domains.size() > 1)
        text.append(tab).append(tab).append("end\n");
    }
    text.append(tab).append(tab).append("if (errors == 0)\n");
    text.append(tab).append(tab).append(tab).append("$display(\"PASS\");\n");
    text.append(tab).append(tab).append("else\n");
    text.append(tab).append(tab).append(tab).append("$display(\"FAIL: %0d mismatches\", errors);\n");
    text.append(tab).append(tab).append("$finish;\n");
    text.append(tab).append("end\n");
    text.append("endmodule\n");
    return text.toString();
  }

  private static List<String> reversed(List<String> list) {
    List<String> out = new ArrayList<>(list);
    Collections.reverse(out);
    return out;
  }

  private static String bits(int row, int width) {
    StringBuilder sb = new StringBuilder();
    for (int i = width - 1; i >= 0; --i)
      sb.append((row >> i) & 1);
    return sb.toString();
  }
}
