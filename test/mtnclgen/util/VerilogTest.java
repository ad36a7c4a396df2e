package mtnclgen.util;

import java.util.List;
import mtnclgen.circuit.CircuitGraph;
import mtnclgen.circuit.CircuitGraphBuilder;
import mtnclgen.gatelib.Domain;
import mtnclgen.gatelib.GateTemplate;
import mtnclgen.gatelib.StandardGates;
import mtnclgen.gatelib.TruthTable;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class VerilogTest {

  static final GateTemplate TH12 = StandardGates.basicCatalog().get("TH12").orElseThrow();
  static final GateTemplate TH22 = StandardGates.basicCatalog().get("TH22").orElseThrow();

  private static int count(String text, String part) {
    int n = 0;
    for (int idx = text.indexOf(part); idx >= 0; idx = text.indexOf(part, idx + 1))
      ++n;
    return n;
  }

  static CircuitGraph andOr() {
    CircuitGraphBuilder builder = new CircuitGraphBuilder(List.of("A", "B", "C"), false);
    int and = builder.addNode(TH22, new int[] {0, 1});
    return builder.setOutput(builder.addNode(TH12, new int[] {and, 2})).build();
  }

  @Test
  void testNetlist() {
    String text = new Verilog().netlist(andOr(), "mtncl_circuit");
    Assertions.assertTrue(text.startsWith("`timescale 1ns/1ps"));
    Assertions.assertTrue(text.contains("module mtncl_circuit ("));
    Assertions.assertTrue(text.contains("input wire A,"));
    Assertions.assertTrue(text.contains("output wire Z\n);"));
    Assertions.assertTrue(text.contains("wire n0;"));
    Assertions.assertEquals(1, count(text, "TH22 th22_0 ("));
    Assertions.assertEquals(1, count(text, "TH12 th12_1 ("));
    Assertions.assertTrue(text.contains(".A(n0),"));
    Assertions.assertTrue(text.contains(".Z(n1)"));
    Assertions.assertTrue(text.contains("assign Z = n1;"));
    Assertions.assertTrue(text.trim().endsWith("endmodule"));
    Assertions.assertTrue(text.contains("module mtncl_circuit (\n    input wire sleep,\n    input wire A,"));
    Assertions.assertFalse(text.contains("rst"));
    Assertions.assertFalse(text.contains("vdd_sel"));
    Assertions.assertFalse(text.contains(".s("));
  }

  @Test
  void testWireAndPortClash() {
    CircuitGraphBuilder builder = new CircuitGraphBuilder(List.of("Z"), false);
    CircuitGraph graph = builder.setOutput(builder.inputNet("Z")).build();
    String text = new Verilog().netlist(graph, "wire_only");
    Assertions.assertTrue(text.contains("output wire Z_o"));
    Assertions.assertTrue(text.contains("assign Z_o = Z;"));
    Assertions.assertFalse(text.contains("// Gate instantiations"));
  }

  @Test
  void testResetPort() {
    GateTemplate poly = GateTemplate.polymorphic("TH12m_TH22m", TruthTable.threshold(1, 1, 1), TruthTable.threshold(2, 1, 1), true);
    CircuitGraphBuilder builder = new CircuitGraphBuilder(List.of("A", "B"), true);
    CircuitGraph graph = builder.setOutput(builder.addNode(poly, new int[] {0, 1})).build();
    String text = new Verilog().netlist(graph, "poly");
    Assertions.assertTrue(text.contains("input wire sleep,\n    input wire rst,\n    input wire vdd_sel,\n    input wire A,"));
    Assertions.assertTrue(text.contains(".rst(rst),"));
  }

  @Test
  void testPolymorphicControlPins() {
    GateTemplate poly = StandardGates.catalog().get("TH12m_TH22m").orElseThrow();
    CircuitGraphBuilder builder = new CircuitGraphBuilder(List.of("A", "B", "C"), true);
    int ab = builder.addNode(poly, new int[] {0, 1});
    CircuitGraph graph = builder.setOutput(builder.addNode(poly, new int[] {ab, 2})).build();
    String text = new Verilog().netlist(graph, "poly");
    Assertions.assertTrue(text.contains("input wire sleep,\n    input wire vdd_sel,\n    input wire A,"));
    Assertions.assertFalse(text.contains("rst"));
    Assertions.assertEquals(2, count(text, ".vdd_sel(vdd_sel),"));
    Assertions.assertEquals(2, count(text, ".s(sleep),"));
    Assertions.assertTrue(text.contains("TH12m_TH22m th12m_th22m_0 (\n        .vdd_sel(vdd_sel),\n        .s(sleep),\n        .A(A),"));
    Assertions.assertFalse(text.contains("wire sleep;"));
  }

  @Test
  void testTestbench() {
    String text = new Verilog().testbench(andOr(), "mtncl_circuit", List.of(Domain.HVDD));
    Assertions.assertTrue(text.contains("module mtncl_circuit_tb;"));
    Assertions.assertTrue(text.contains("mtncl_circuit uut ("));
    Assertions.assertEquals(8, count(text, "; check(1'b"));
    // row 3: A = B = 1, C = 0
    Assertions.assertTrue(text.contains("{C, B, A} = 3'b011; check(1'b1);"));
    Assertions.assertTrue(text.contains("{C, B, A} = 3'b010; check(1'b0);"));
    Assertions.assertFalse(text.contains("parameter LVDD"));
  }

  @Test
  void testPolymorphicTestbench() {
    GateTemplate poly = StandardGates.catalog().get("TH12m_TH22m").orElseThrow();
    CircuitGraphBuilder builder = new CircuitGraphBuilder(List.of("A", "B"), true);
    CircuitGraph graph = builder.setOutput(builder.addNode(poly, new int[] {0, 1})).build();
    String text = new Verilog().testbench(graph, "poly", List.of(Domain.HVDD, Domain.LVDD));
    Assertions.assertTrue(text.contains("parameter LVDD = 0;"));
    // 4 vectors and one sleep check per domain
    Assertions.assertEquals(10, count(text, "; check(1'b"));
    Assertions.assertEquals(2, count(text, "{B, A} = 2'b01; check(1'b"));
    Assertions.assertTrue(text.contains("{B, A} = 2'b01; check(1'b1);"));
    Assertions.assertTrue(text.contains("{B, A} = 2'b01; check(1'b0);"));
    // the domain parameter drives the selector of the circuit
    Assertions.assertTrue(text.contains("reg vdd_sel;"));
    Assertions.assertTrue(text.contains(".vdd_sel(vdd_sel),"));
    Assertions.assertTrue(text.contains("if (LVDD == 0) begin\n            vdd_sel = 1'b1;\n"));
    Assertions.assertTrue(text.contains("else begin\n            vdd_sel = 1'b0;\n"));
    Assertions.assertEquals(2, count(text, "sleep = 1; check(1'b0);"));
    Assertions.assertTrue(text.indexOf("sleep = 1;") < text.indexOf("sleep = 0;"));
  }

  @Test
  void testRegularTestbenchDrivesSleep() {
    String text = new Verilog().testbench(andOr(), "mtncl_circuit", List.of(Domain.HVDD));
    Assertions.assertTrue(text.contains("reg sleep;"));
    Assertions.assertTrue(text.contains(".sleep(sleep),"));
    Assertions.assertTrue(text.contains("sleep = 1;\n        #10;\n        sleep = 0;\n"));
    Assertions.assertFalse(text.contains("vdd_sel"));
    // plain gates have no sleep input, so there is no sleep check
    Assertions.assertEquals(0, count(text, "sleep = 1; check"));
  }
}
