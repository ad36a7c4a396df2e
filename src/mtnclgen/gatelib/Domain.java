package mtnclgen.gatelib;

/** Supply voltage domain that selects the function of a polymorphic gate. */
public enum Domain {
  HVDD("hvdd"),
  LVDD("lvdd");

  public final String serialName;
  Domain(String serialName) { this.serialName = serialName; }
}
