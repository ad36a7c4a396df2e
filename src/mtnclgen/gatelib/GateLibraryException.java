package mtnclgen.gatelib;

/** Thrown when a gate library cannot be read or describes an invalid gate. */
public class GateLibraryException extends Exception {
  private static final long serialVersionUID = 1L;

  public GateLibraryException(String message) { super(message); }
  public GateLibraryException(String message, Throwable cause) { super(message, cause); }
}
