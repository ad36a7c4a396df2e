package mtnclgen.frontend;

/** Thrown for malformed equation text. */
public class EquationSyntaxException extends Exception {
  private static final long serialVersionUID = 1L;

  private final int position;

  public EquationSyntaxException(String message, int position) {
    super(position >= 0 ? message + " at position " + position : message);
    this.position = position;
  }
  public EquationSyntaxException(String message) { this(message, -1); }

  /** Character offset in the equation text, or -1 if not tied to a position. */
  public int getPosition() { return position; }
}
