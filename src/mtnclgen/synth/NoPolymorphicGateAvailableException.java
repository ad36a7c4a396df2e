package mtnclgen.synth;

/** No polymorphic template realizes the HVDD/LVDD function pair required by one search branch. */
public class NoPolymorphicGateAvailableException extends NoGateAvailableException {
  private static final long serialVersionUID = 1L;

  public NoPolymorphicGateAvailableException(String message) { super(message); }
}
