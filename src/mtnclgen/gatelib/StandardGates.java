package mtnclgen.gatelib;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in MTNCL gate library.
 * THmn gates with weights wA..wD output 1 iff the weighted count of true inputs is at least m.
 */
public final class StandardGates {
  private StandardGates() {}

  private static boolean in(int row, int input) { return ((row >> input) & 1) != 0; }

  public static final TruthTable XOR2 = TruthTable.of(2, row -> in(row, 0) ^ in(row, 1));
  // AB + CD
  public static final TruthTable XOR0 = TruthTable.of(4, row -> (in(row, 0) && in(row, 1)) || (in(row, 2) && in(row, 3)));
  // AB + BC + AD
  public static final TruthTable AND0 =
      TruthTable.of(4, row -> (in(row, 0) && in(row, 1)) || (in(row, 1) && in(row, 2)) || (in(row, 0) && in(row, 3)));
  // AC + BC + AD + BD
  public static final TruthTable COMP24 = TruthTable.of(4, row -> (in(row, 0) || in(row, 1)) && (in(row, 2) || in(row, 3)));

  /** Two and three input threshold gates plus the exclusive or gate. */
  public static List<GateTemplate> basicGates() {
    List<GateTemplate> out = new ArrayList<>();
    out.add(GateTemplate.plain("TH12", TruthTable.threshold(1, 1, 1)));
    out.add(GateTemplate.plain("TH22", TruthTable.threshold(2, 1, 1)));
    out.add(GateTemplate.plain("TH13", TruthTable.threshold(1, 1, 1, 1)));
    out.add(GateTemplate.plain("TH23", TruthTable.threshold(2, 1, 1, 1)));
    out.add(GateTemplate.plain("TH33", TruthTable.threshold(3, 1, 1, 1)));
    out.add(GateTemplate.plain("THXOR", XOR2));
    return out;
  }

  /** The full set of plain MTNCL gates. */
  public static List<GateTemplate> plainGates() {
    List<GateTemplate> out = basicGates();
    out.add(GateTemplate.plain("TH23w2", TruthTable.threshold(2, 2, 1, 1)));
    out.add(GateTemplate.plain("TH33w2", TruthTable.threshold(3, 2, 1, 1)));
    out.add(GateTemplate.plain("TH14", TruthTable.threshold(1, 1, 1, 1, 1)));
    out.add(GateTemplate.plain("TH24", TruthTable.threshold(2, 1, 1, 1, 1)));
    out.add(GateTemplate.plain("TH34", TruthTable.threshold(3, 1, 1, 1, 1)));
    out.add(GateTemplate.plain("TH44", TruthTable.threshold(4, 1, 1, 1, 1)));
    out.add(GateTemplate.plain("TH24w2", TruthTable.threshold(2, 2, 1, 1, 1)));
    out.add(GateTemplate.plain("TH34w2", TruthTable.threshold(3, 2, 1, 1, 1)));
    out.add(GateTemplate.plain("TH44w2", TruthTable.threshold(4, 2, 1, 1, 1)));
    out.add(GateTemplate.plain("TH34w3", TruthTable.threshold(3, 3, 1, 1, 1)));
    out.add(GateTemplate.plain("TH44w3", TruthTable.threshold(4, 3, 1, 1, 1)));
    out.add(GateTemplate.plain("TH24w22", TruthTable.threshold(2, 2, 2, 1, 1)));
    out.add(GateTemplate.plain("TH34w22", TruthTable.threshold(3, 2, 2, 1, 1)));
    out.add(GateTemplate.plain("TH44w22", TruthTable.threshold(4, 2, 2, 1, 1)));
    out.add(GateTemplate.plain("TH54w22", TruthTable.threshold(5, 2, 2, 1, 1)));
    out.add(GateTemplate.plain("TH34w32", TruthTable.threshold(3, 3, 2, 1, 1)));
    out.add(GateTemplate.plain("TH54w32", TruthTable.threshold(5, 3, 2, 1, 1)));
    out.add(GateTemplate.plain("TH44w322", TruthTable.threshold(4, 3, 2, 2, 1)));
    out.add(GateTemplate.plain("TH54w322", TruthTable.threshold(5, 3, 2, 2, 1)));
    out.add(GateTemplate.plain("THxor0", XOR0));
    out.add(GateTemplate.plain("THand0", AND0));
    out.add(GateTemplate.plain("TH24comp", COMP24));
    return out;
  }

  /** Dual-function gates: first table at HVDD, second at LVDD. */
  public static List<GateTemplate> polymorphicGates() {
    List<GateTemplate> out = new ArrayList<>();
    out.add(GateTemplate.polymorphic("TH12m_TH22m", TruthTable.threshold(1, 1, 1), TruthTable.threshold(2, 1, 1), false));
    out.add(GateTemplate.polymorphic("TH13m_TH23m", TruthTable.threshold(1, 1, 1, 1), TruthTable.threshold(2, 1, 1, 1), false));
    out.add(GateTemplate.polymorphic("TH13m_TH33m", TruthTable.threshold(1, 1, 1, 1), TruthTable.threshold(3, 1, 1, 1), false));
    out.add(GateTemplate.polymorphic("TH23m_TH33m", TruthTable.threshold(2, 1, 1, 1), TruthTable.threshold(3, 1, 1, 1), false));
    out.add(GateTemplate.polymorphic("TH33w2m_TH33m", TruthTable.threshold(3, 2, 1, 1), TruthTable.threshold(3, 1, 1, 1), false));
    out.add(GateTemplate.polymorphic("TH34m_TH44m", TruthTable.threshold(3, 1, 1, 1, 1), TruthTable.threshold(4, 1, 1, 1, 1), false));
    out.add(
        GateTemplate.polymorphic("TH24w22m_TH24w2m", TruthTable.threshold(2, 2, 2, 1, 1), TruthTable.threshold(2, 2, 1, 1, 1), false));
    out.add(GateTemplate.polymorphic("THxor0m_TH34w3m", XOR0, TruthTable.threshold(3, 3, 1, 1, 1), false));
    out.add(GateTemplate.polymorphic("TH54w322m_TH44w22m", TruthTable.threshold(5, 3, 2, 2, 1), TruthTable.threshold(4, 2, 2, 1, 1),
                                     false));
    return out;
  }

  /** Basic gates only. */
  public static GateCatalog basicCatalog() { return new GateCatalog(basicGates()); }

  /** All plain and polymorphic gates. */
  public static GateCatalog catalog() {
    List<GateTemplate> all = plainGates();
    all.addAll(polymorphicGates());
    return new GateCatalog(all);
  }
}
