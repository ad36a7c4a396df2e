package mtnclgen.gatelib;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class TruthTableTest {

  private static boolean in(int row, int input) { return ((row >> input) & 1) != 0; }

  @Test
  void testThreshold() {
    TruthTable th23 = TruthTable.threshold(2, 1, 1, 1);
    Assertions.assertEquals(TruthTable.of(3, row -> Integer.bitCount(row) >= 2), th23);
    TruthTable th23w2 = TruthTable.threshold(2, 2, 1, 1);
    Assertions.assertEquals(TruthTable.of(3, row -> in(row, 0) || (in(row, 1) && in(row, 2))), th23w2);
    Assertions.assertEquals("2'b1000", TruthTable.threshold(2, 1, 1).toString());
  }

  @Test
  void testEvaluate() {
    TruthTable table = TruthTable.threshold(2, 2, 1, 1);
    Assertions.assertTrue(table.evaluate(new boolean[] {true, false, false}));
    Assertions.assertFalse(table.evaluate(new boolean[] {false, true, false}));
    Assertions.assertThrows(IllegalArgumentException.class, () -> table.evaluate(new boolean[] {true}));
  }

  @Test
  void testPermute() {
    // A + BC with the heavy pin driven by signal 1 computes s1 + s0 s2
    TruthTable table = TruthTable.threshold(2, 2, 1, 1);
    TruthTable permuted = table.permute(new int[] {1, 0, 2});
    Assertions.assertEquals(TruthTable.of(3, row -> in(row, 1) || (in(row, 0) && in(row, 2))), permuted);
    Assertions.assertEquals(table, table.permute(new int[] {0, 1, 2}));
  }

  @Test
  void testMinterms() {
    Assertions.assertEquals(StandardGates.XOR2, TruthTable.fromMinterms(2, List.of(1, 2)));
    Assertions.assertThrows(IllegalArgumentException.class, () -> TruthTable.fromMinterms(2, List.of(4)));
  }

  @Test
  void testMonotone() {
    Assertions.assertTrue(TruthTable.threshold(3, 2, 1, 1).isMonotone());
    Assertions.assertTrue(StandardGates.COMP24.isMonotone());
    Assertions.assertFalse(StandardGates.XOR2.isMonotone());
  }
}
