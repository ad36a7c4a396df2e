package mtnclgen.synth;

/** A constructed circuit graph is malformed (cyclic, unbound pin, bad output). Indicates a defect, aborts the run. */
public class InternalSynthesisError extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public InternalSynthesisError(String message) { super(message); }
}
