package mtnclgen.frontend;

/** Thrown when the HVDD and LVDD equations cannot be brought into a common tree shape. */
public class AlignmentException extends Exception {
  private static final long serialVersionUID = 1L;

  public AlignmentException(String message) { super(message); }
}
