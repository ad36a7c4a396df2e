package mtnclgen.gatelib;

import java.util.Arrays;

/**
 * A template whose function equals a requested function once gate pin j is driven by requested input {@code pinToSignal[j]}.
 */
public final class GateMatch {
  private final GateTemplate template;
  private final int[] pinToSignal;

  public GateMatch(GateTemplate template, int[] pinToSignal) {
    this.template = template;
    this.pinToSignal = pinToSignal.clone();
  }

  public GateTemplate getTemplate() { return template; }
  public int getSignalForPin(int pin) { return pinToSignal[pin]; }
  public int[] getPinToSignal() { return pinToSignal.clone(); }

  @Override
  public String toString() {
    return template.getName() + Arrays.toString(pinToSignal);
  }
}
