package mtnclgen.rank;

/** Cost weights and the metric reported as primary. */
public final class Optimization {
  public enum Target {
    AREA("area"),
    DELAY("delay"),
    POWER("power");

    public final String serialName;
    Target(String serialName) { this.serialName = serialName; }

    public static Target fromString(String name) {
      for (Target target : values())
        if (target.serialName.equalsIgnoreCase(name))
          return target;
      throw new IllegalArgumentException("Unknown optimization target '" + name + "' (expected area, delay or power)");
    }
  }

  public static final Optimization DEFAULT = new Optimization(Target.AREA, 1.0, 0.0, 0.0);

  private final Target target;
  private final double areaWeight;
  private final double delayWeight;
  private final double powerWeight;

  public Optimization(Target target, double areaWeight, double delayWeight, double powerWeight) {
    if (areaWeight < 0 || delayWeight < 0 || powerWeight < 0)
      throw new IllegalArgumentException("Cost weights must not be negative");
    this.target = target;
    this.areaWeight = areaWeight;
    this.delayWeight = delayWeight;
    this.powerWeight = powerWeight;
  }

  public Target getTarget() { return target; }
  public double getAreaWeight() { return areaWeight; }
  public double getDelayWeight() { return delayWeight; }
  public double getPowerWeight() { return powerWeight; }

  public double weigh(double area, double delay, double power) { return areaWeight * area + delayWeight * delay + powerWeight * power; }

  @Override
  public String toString() {
    return String.format("target=%s weights(area=%s, delay=%s, power=%s)", target.serialName, areaWeight, delayWeight, powerWeight);
  }
}
