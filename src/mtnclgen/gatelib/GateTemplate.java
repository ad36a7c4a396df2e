package mtnclgen.gatelib;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Gate description as data: a plain gate carries one truth table, a polymorphic gate one per {@link Domain}.
 * Input pins are named A, B, C, D in table input order; the output pin is Z.
 * Polymorphic gates also have the sleep input s and the supply selector vdd_sel (1 selects the HVDD function).
 */
public final class GateTemplate {
  public enum Kind { PLAIN, POLYMORPHIC }

  public static final int MIN_ARITY = 2;
  public static final int MAX_ARITY = 4;
  public static final String OUTPUT_PIN = "Z";
  public static final String RESET_PIN = "rst";
  public static final String SLEEP_PIN = "s";
  public static final String SUPPLY_SELECT_PIN = "vdd_sel";

  private final Kind kind;
  private final String name;
  private final int arity;
  private final EnumMap<Domain, TruthTable> functions = new EnumMap<>(Domain.class);
  private final boolean hasReset;
  private final EnumMap<Domain, GateAttributes> attributes = new EnumMap<>(Domain.class);

  private GateTemplate(Kind kind, String name, TruthTable hvdd, TruthTable lvdd, boolean hasReset, GateAttributes hvddAttributes,
                       GateAttributes lvddAttributes) {
    if (name == null || name.isEmpty())
      throw new IllegalArgumentException("Gate name must not be empty");
    int arity = hvdd.getArity();
    if (arity < MIN_ARITY || arity > MAX_ARITY)
      throw new IllegalArgumentException(String.format("Gate %s: arity %d outside %d..%d", name, arity, MIN_ARITY, MAX_ARITY));
    if (lvdd.getArity() != arity)
      throw new IllegalArgumentException("Gate " + name + ": HVDD and LVDD functions differ in arity");
    this.kind = kind;
    this.name = name;
    this.arity = arity;
    this.functions.put(Domain.HVDD, hvdd);
    this.functions.put(Domain.LVDD, lvdd);
    this.hasReset = hasReset;
    this.attributes.put(Domain.HVDD, hvddAttributes);
    this.attributes.put(Domain.LVDD, lvddAttributes);
  }

  public static GateTemplate plain(String name, TruthTable function) { return plain(name, function, GateAttributes.NONE); }
  public static GateTemplate plain(String name, TruthTable function, GateAttributes attributes) {
    return new GateTemplate(Kind.PLAIN, name, function, function, false, attributes, attributes);
  }

  public static GateTemplate polymorphic(String name, TruthTable hvdd, TruthTable lvdd, boolean hasReset) {
    return polymorphic(name, hvdd, lvdd, hasReset, GateAttributes.NONE, GateAttributes.NONE);
  }
  public static GateTemplate polymorphic(String name, TruthTable hvdd, TruthTable lvdd, boolean hasReset, GateAttributes hvddAttributes,
                                         GateAttributes lvddAttributes) {
    return new GateTemplate(Kind.POLYMORPHIC, name, hvdd, lvdd, hasReset, hvddAttributes, lvddAttributes);
  }

  public Kind getKind() { return kind; }
  public boolean isPolymorphic() { return kind == Kind.POLYMORPHIC; }
  public String getName() { return name; }
  public int getArity() { return arity; }
  public boolean hasReset() { return hasReset; }
  public boolean hasSleep() { return kind == Kind.POLYMORPHIC; }
  public boolean hasSupplySelect() { return kind == Kind.POLYMORPHIC; }

  /** The function realized in the given domain; plain gates realize the same function in both. */
  public TruthTable getFunction(Domain domain) { return functions.get(domain); }
  /** The plain function; for polymorphic gates the HVDD function. */
  public TruthTable getFunction() { return functions.get(Domain.HVDD); }
  /** One table for plain gates, HVDD then LVDD for polymorphic gates. */
  public List<TruthTable> getFunctions() {
    if (kind == Kind.PLAIN)
      return List.of(getFunction());
    return List.of(functions.get(Domain.HVDD), functions.get(Domain.LVDD));
  }
  public GateAttributes getAttributes(Domain domain) { return attributes.get(domain); }
  public Map<Domain, GateAttributes> getAttributes() { return attributes; }

  /** Pin name of input i: A, B, C, D. */
  public static String inputPinName(int i) { return String.valueOf((char)('A' + i)); }

  /** Evaluates the gate in a domain; an asserted reset forces 0. */
  public boolean evaluate(Domain domain, boolean[] inputs, boolean reset) { return evaluate(domain, inputs, reset, false); }

  /** Evaluates the gate in a domain; an asserted reset or sleep forces 0 (NULL). */
  public boolean evaluate(Domain domain, boolean[] inputs, boolean reset, boolean sleep) {
    if ((hasReset && reset) || (hasSleep() && sleep))
      return false;
    return functions.get(domain).evaluate(inputs);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, name, functions, hasReset);
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof GateTemplate))
      return false;
    GateTemplate other = (GateTemplate)obj;
    return kind == other.kind && name.equals(other.name) && functions.equals(other.functions) && hasReset == other.hasReset;
  }
  @Override
  public String toString() {
    if (kind == Kind.PLAIN)
      return name + "[" + getFunction() + "]";
    return name + "[hvdd " + functions.get(Domain.HVDD) + ", lvdd " + functions.get(Domain.LVDD) + (hasReset ? ", rst" : "") + "]";
  }
}
