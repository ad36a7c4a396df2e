package mtnclgen.gatelib;

import java.util.OptionalDouble;

/**
 * Optional physical attributes of a gate in one supply domain. Absent values count as 1 in cost evaluation.
 */
public final class GateAttributes {
  public static final GateAttributes NONE = new GateAttributes(null, null, null);

  private final Double area;
  private final Double delay;
  private final Double power;

  public GateAttributes(Double area, Double delay, Double power) {
    this.area = area;
    this.delay = delay;
    this.power = power;
  }

  public OptionalDouble getArea() { return area == null ? OptionalDouble.empty() : OptionalDouble.of(area); }
  public OptionalDouble getDelay() { return delay == null ? OptionalDouble.empty() : OptionalDouble.of(delay); }
  public OptionalDouble getPower() { return power == null ? OptionalDouble.empty() : OptionalDouble.of(power); }

  /** Fills the values absent here from other. */
  public GateAttributes withDefaults(GateAttributes other) {
    return new GateAttributes(area != null ? area : other.area, delay != null ? delay : other.delay, power != null ? power : other.power);
  }

  @Override
  public String toString() {
    return String.format("area=%s delay=%s power=%s", area, delay, power);
  }
}
