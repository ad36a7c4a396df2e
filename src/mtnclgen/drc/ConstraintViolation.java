package mtnclgen.drc;

/** One violated bound of one candidate circuit. */
public final class ConstraintViolation {
  public enum Kind { TOO_FEW_GATES, TOO_MANY_GATES, FANOUT_EXCEEDED, DEPTH_EXCEEDED }

  private final Kind kind;
  private final String message;

  public ConstraintViolation(Kind kind, String message) {
    this.kind = kind;
    this.message = message;
  }

  public Kind getKind() { return kind; }
  public String getMessage() { return message; }

  @Override
  public String toString() {
    return kind + ": " + message;
  }
}
