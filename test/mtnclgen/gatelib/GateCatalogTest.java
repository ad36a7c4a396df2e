package mtnclgen.gatelib;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class GateCatalogTest {

  private static boolean in(int row, int input) { return ((row >> input) & 1) != 0; }

  private static List<String> names(List<GateMatch> matches) {
    return matches.stream().map(match -> match.getTemplate().getName()).collect(Collectors.toList());
  }

  @Test
  void testPlainMatch() {
    GateCatalog catalog = StandardGates.basicCatalog();
    List<GateMatch> and2 = catalog.match(List.of(TruthTable.of(2, row -> row == 3)));
    Assertions.assertEquals(List.of("TH22"), names(and2));
    Assertions.assertArrayEquals(new int[] {0, 1}, and2.get(0).getPinToSignal());
    Assertions.assertEquals(List.of("TH13"), names(catalog.match(List.of(TruthTable.of(3, row -> row != 0)))));
    Assertions.assertTrue(catalog.match(List.of(TruthTable.of(2, row -> row == 1))).isEmpty());
  }

  @Test
  void testMatchFindsPinPermutation() {
    TruthTable required = TruthTable.of(3, row -> in(row, 1) || (in(row, 0) && in(row, 2)));
    List<GateMatch> matches = StandardGates.catalog().match(List.of(required));
    Assertions.assertEquals(List.of("TH23w2"), names(matches));
    GateMatch match = matches.get(0);
    Assertions.assertArrayEquals(new int[] {1, 0, 2}, match.getPinToSignal());
    Assertions.assertEquals(1, match.getSignalForPin(0));
    Assertions.assertEquals(required, match.getTemplate().getFunction().permute(match.getPinToSignal()));
  }

  @Test
  void testPolymorphicMatch() {
    GateCatalog catalog = StandardGates.catalog();
    TruthTable or2 = TruthTable.threshold(1, 1, 1);
    TruthTable and2 = TruthTable.threshold(2, 1, 1);
    Assertions.assertEquals(List.of("TH12m_TH22m"), names(catalog.match(List.of(or2, and2))));
    // plain requests never return polymorphic gates
    Assertions.assertEquals(List.of("TH12"), names(catalog.match(List.of(or2))));
    Assertions.assertTrue(catalog.match(List.of(and2, or2)).isEmpty());
  }

  @Test
  void testMatchKeepsCandidateOrder() {
    TruthTable and2 = TruthTable.threshold(2, 1, 1);
    GateTemplate th22 = GateTemplate.plain("TH22", and2);
    GateTemplate alt = GateTemplate.plain("AND2X", and2);
    Assertions.assertEquals(List.of("AND2X", "TH22"), names(new GateCatalog(List.of(th22, alt)).match(List.of(and2))));
    Assertions.assertEquals(List.of("TH22", "AND2X"), names(GateCatalog.match(List.of(and2), List.of(th22, alt))));
  }

  @Test
  void testMerge() {
    GateTemplate a = GateTemplate.plain("G", TruthTable.threshold(1, 1, 1));
    GateTemplate b = GateTemplate.plain("G", TruthTable.threshold(2, 1, 1));
    GateCatalog merged = GateCatalog.merge(List.of(new GateCatalog(List.of(a)), new GateCatalog(List.of(b))));
    Assertions.assertEquals(1, merged.size());
    Assertions.assertEquals(b, merged.get("G").orElseThrow());
  }

  @Test
  void testNextPermutation() {
    int[] perm = {0, 1, 2};
    int count = 1;
    while (GateCatalog.nextPermutation(perm))
      ++count;
    Assertions.assertEquals(6, count);
    Assertions.assertArrayEquals(new int[] {2, 1, 0}, perm);
  }

  @Test
  void testStandardLibrary() {
    GateCatalog catalog = StandardGates.catalog();
    Assertions.assertEquals(28, catalog.getPlain().size());
    Assertions.assertEquals(9, catalog.getPolymorphic().size());
    for (GateTemplate template : catalog.getAll()) {
      Assertions.assertFalse(template.hasReset());
      if (!template.getName().equals("THXOR"))
        template.getFunctions().forEach(function -> Assertions.assertTrue(function.isMonotone(), template.getName()));
    }
    GateTemplate poly = catalog.get("TH12m_TH22m").orElseThrow();
    Assertions.assertTrue(poly.evaluate(Domain.HVDD, new boolean[] {true, false}, false));
    Assertions.assertFalse(poly.evaluate(Domain.LVDD, new boolean[] {true, false}, false));
  }
}
