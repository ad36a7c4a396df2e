package mtnclgen.synth;

/** No gate template realizes a function required to cover one search branch. */
public class NoGateAvailableException extends Exception {
  private static final long serialVersionUID = 1L;

  public NoGateAvailableException(String message) { super(message); }
}
